package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.TimeRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * time 차원 테이블 Repository.
 * <p>
 * 파생 컬럼은 start_time의 순수 함수이므로 충돌 시 기존 행을 그대로 둡니다.
 */
@Component
public class TimeRepo extends BatchSqlSupport {

    private static final int CHUNK = 500;

    public TimeRepo(DatabaseClient db) {
        super(db);
    }

    public Mono<Long> insertIgnore(List<TimeRow> rows) {
        return chunkedSum(rows, CHUNK, this::insertOnce);
    }

    private Mono<Long> insertOnce(List<TimeRow> rows) {
        List<TimeRow> safe = rows.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.startTime() != null)
                .toList();
        if (safe.isEmpty()) return Mono.just(0L);

        // time은 예약어와 겹치므로 항상 backtick으로 감싼다
        String sql = """
            INSERT INTO `time` (start_time, hour, day, week, month, year, weekday) VALUES
            """ + valuesClause(safe.size(), "st", "h", "d", "w", "m", "y", "wd") + """

            ON DUPLICATE KEY UPDATE
              weekday = weekday
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < safe.size(); i++) {
            TimeRow r = safe.get(i);
            spec = spec.bind("st" + i, r.startTime())
                    .bind("h" + i, r.hour())
                    .bind("d" + i, r.day())
                    .bind("w" + i, r.week())
                    .bind("m" + i, r.month())
                    .bind("y" + i, r.year())
                    .bind("wd" + i, r.weekday());
        }

        return spec.fetch().rowsUpdated();
    }
}
