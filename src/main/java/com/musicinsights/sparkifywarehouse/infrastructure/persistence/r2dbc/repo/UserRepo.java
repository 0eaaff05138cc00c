package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.UserRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * users 테이블에 대한 배치 upsert Repository입니다.
 * <p>
 * 처음 본 사용자는 새로 만들고, 이미 있는 사용자는 level만 최신 값으로 갱신합니다(last-write-wins).
 * 이름/성별은 최초 값을 유지합니다.
 */
@Component
public class UserRepo extends BatchSqlSupport {

    /** 사용자 배치 upsert 시 한 번에 처리할 최대 행 수 */
    private static final int CHUNK = 300;

    public UserRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 사용자 목록을 입력 순서대로 upsert 합니다.
     *
     * @param rows upsert할 사용자 목록
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> upsertLevel(List<UserRow> rows) {
        return chunkedSum(rows, CHUNK, this::upsertOnce);
    }

    private Mono<Long> upsertOnce(List<UserRow> rows) {
        List<UserRow> safe = rows.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.userId() != null)
                .toList();
        if (safe.isEmpty()) return Mono.just(0L);

        String sql = """
            INSERT INTO users (user_id, first_name, last_name, gender, level) VALUES
            """ + valuesClause(safe.size(), "u", "f", "l", "g", "lv") + """

            ON DUPLICATE KEY UPDATE
              level = VALUES(level)
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < safe.size(); i++) {
            UserRow r = safe.get(i);
            spec = spec.bind("u" + i, r.userId());
            spec = bindOrNull(spec, "f" + i, r.firstName(), String.class);
            spec = bindOrNull(spec, "l" + i, r.lastName(), String.class);
            spec = bindOrNull(spec, "g" + i, r.gender(), String.class);
            spec = bindOrNull(spec, "lv" + i, r.level(), String.class);
        }

        return spec.fetch().rowsUpdated();
    }
}
