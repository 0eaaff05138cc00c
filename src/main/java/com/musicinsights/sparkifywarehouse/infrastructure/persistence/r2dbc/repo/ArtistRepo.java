package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.ArtistRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * artists 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 * <p>
 * 여러 곡 파일이 같은 아티스트를 담고 있으므로 artist_id 충돌은 정상 경로이며, 처음 저장된 행을 유지합니다.
 */
@Component
public class ArtistRepo extends BatchSqlSupport {

    /** 아티스트 배치 처리 시 한 번에 처리할 최대 건수 */
    private static final int CHUNK = 500;

    public ArtistRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 아티스트 목록을 배치로 저장합니다(중복 시 무시).
     *
     * @param rows 저장할 아티스트 목록
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> insertIgnore(List<ArtistRow> rows) {
        return chunkedSum(rows, CHUNK, this::insertOnce);
    }

    /**
     * 주어진 rows를 단일 INSERT 문으로 실행합니다.
     * <p>
     * 위치/위경도는 값이 없으면 NULL로 바인딩합니다.
     *
     * @param rows 저장할 아티스트 목록
     * @return 영향을 받은 행 수
     */
    private Mono<Long> insertOnce(List<ArtistRow> rows) {
        List<ArtistRow> safe = rows.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.artistId() != null && r.name() != null)
                .toList();
        if (safe.isEmpty()) return Mono.just(0L);

        String sql = """
            INSERT INTO artists (artist_id, name, location, latitude, longitude) VALUES
            """ + valuesClause(safe.size(), "a", "n", "loc", "lat", "lon") + """

            ON DUPLICATE KEY UPDATE
              name = name
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < safe.size(); i++) {
            ArtistRow r = safe.get(i);
            spec = spec.bind("a" + i, r.artistId())
                    .bind("n" + i, r.name());
            spec = bindOrNull(spec, "loc" + i, r.location(), String.class);
            spec = bindOrNull(spec, "lat" + i, r.latitude(), Double.class);
            spec = bindOrNull(spec, "lon" + i, r.longitude(), Double.class);
        }

        return spec.fetch().rowsUpdated();
    }
}
