package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 적재 후 텍스트 컬럼에 남은 결측 토큰('', 'NULL', 'NaN', 'None')을 실제 NULL로 되돌리는 후처리 Repository.
 * <p>
 * 위경도는 DOUBLE 컬럼이라 토큰이 저장될 수 없으므로 대상에서 제외합니다.
 */
@Component
public class SentinelCleanupRepo extends BatchSqlSupport {

    /** 정리 대상 (테이블, 컬럼) */
    static final List<String[]> TARGETS = List.of(
            new String[]{"artists", "location"},
            new String[]{"songplays", "song_id"},
            new String[]{"songplays", "artist_id"}
    );

    public SentinelCleanupRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 대상 컬럼을 순서대로 정리합니다.
     *
     * @return NULL로 바뀐 행 수 합계
     */
    public Mono<Long> nullifySentinels() {
        return Flux.fromIterable(TARGETS)
                .concatMap(t -> nullify(t[0], t[1]))
                .reduce(0L, Long::sum);
    }

    private Mono<Long> nullify(String table, String column) {
        return db.sql("""
                UPDATE %s
                SET %s = NULL
                WHERE TRIM(%s) IN ('', 'NULL', 'NaN', 'None')
                """.formatted(table, column, column))
                .fetch()
                .rowsUpdated();
    }
}
