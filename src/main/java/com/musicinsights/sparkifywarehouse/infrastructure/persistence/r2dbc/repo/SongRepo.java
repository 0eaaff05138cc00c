package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * songs 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 * <p>
 * song_id가 이미 있으면 기존 행을 유지합니다(first-write-wins).
 */
@Component
public class SongRepo extends BatchSqlSupport {

    /** 곡 배치 처리 시 한 번에 처리할 최대 행 수 */
    private static final int CHUNK = 300;

    public SongRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 곡 목록을 배치로 저장합니다(중복 시 무시).
     *
     * @param rows 저장할 곡 목록
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> insertIgnore(List<SongRow> rows) {
        return chunkedSum(rows, CHUNK, this::insertOnce);
    }

    private Mono<Long> insertOnce(List<SongRow> rows) {
        List<SongRow> safe = rows.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.songId() != null)
                .toList();
        if (safe.isEmpty()) return Mono.just(0L);

        String sql = """
            INSERT INTO songs (song_id, title, artist_id, year, duration) VALUES
            """ + valuesClause(safe.size(), "s", "t", "a", "y", "d") + """

            ON DUPLICATE KEY UPDATE
              title = title
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < safe.size(); i++) {
            SongRow r = safe.get(i);
            spec = spec.bind("s" + i, r.songId())
                    .bind("t" + i, r.title())
                    .bind("a" + i, r.artistId());
            spec = bindOrNull(spec, "y" + i, r.year(), Integer.class);
            spec = bindOrNull(spec, "d" + i, r.duration(), Double.class);
        }

        return spec.fetch().rowsUpdated();
    }
}
