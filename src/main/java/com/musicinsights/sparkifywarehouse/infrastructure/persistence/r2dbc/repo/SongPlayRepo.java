package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongPlayRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * songplays 팩트 테이블 Repository.
 * <p>
 * 자연키 (start_time, user_id, song_id)가 이미 있으면 삽입하지 않습니다.
 * UNIQUE 인덱스는 NULL song_id끼리 서로 다르게 취급하므로, 존재 여부를 먼저 조회할 때
 * song_id가 NULL이면 {@code IS NULL}로 비교합니다.
 * 제약 조건 위반(중복/FK)은 실행 중단이 아닌 "이미 적재된 행"으로 처리합니다.
 */
@Component
public class SongPlayRepo extends BatchSqlSupport {

    private static final Logger log = LoggerFactory.getLogger(SongPlayRepo.class);

    public SongPlayRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 자연키가 없을 때만 재생 기록을 삽입합니다.
     *
     * @param row 재생 기록
     * @return 삽입했으면 true, 중복이라 건너뛰었으면 false
     */
    public Mono<Boolean> insertIfAbsent(SongPlayRow row) {
        return exists(row.startTime(), row.userId(), row.songId())
                .flatMap(found -> found ? Mono.just(false) : insertOnce(row).map(n -> n > 0))
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.debug("songplay skipped by constraint: start_time={}, user_id={}, song_id={} ({})",
                            row.startTime(), row.userId(), row.songId(), e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * 자연키에 해당하는 재생 기록이 있는지 조회합니다.
     *
     * @param startTime 재생 시각
     * @param userId    사용자 식별자
     * @param songId    곡 식별자(nullable)
     * @return 존재 여부
     */
    public Mono<Boolean> exists(LocalDateTime startTime, Integer userId, String songId) {
        String sql = """
            SELECT 1
            FROM songplays
            WHERE start_time = :st
              AND user_id = :u
              AND """ + (songId == null ? " song_id IS NULL" : " song_id = :s") + """

            LIMIT 1
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("st", startTime)
                .bind("u", userId);
        if (songId != null) spec = spec.bind("s", songId);

        return spec.map((r, meta) -> 1)
                .first()
                .hasElement();
    }

    private Mono<Long> insertOnce(SongPlayRow row) {
        DatabaseClient.GenericExecuteSpec spec = db.sql("""
            INSERT INTO songplays (
              start_time, user_id, level, song_id, artist_id,
              session_id, location, user_agent
            ) VALUES (:st, :u, :lv, :s, :a, :sid, :loc, :ua)
            """)
                .bind("st", row.startTime())
                .bind("u", row.userId());

        spec = bindOrNull(spec, "lv", row.level(), String.class);
        spec = bindOrNull(spec, "s", row.songId(), String.class);
        spec = bindOrNull(spec, "a", row.artistId(), String.class);
        spec = bindOrNull(spec, "sid", row.sessionId(), Integer.class);
        spec = bindOrNull(spec, "loc", row.location(), String.class);
        spec = bindOrNull(spec, "ua", row.userAgent(), String.class);

        return spec.fetch().rowsUpdated();
    }
}
