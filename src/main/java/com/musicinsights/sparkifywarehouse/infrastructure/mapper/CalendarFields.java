package com.musicinsights.sparkifywarehouse.infrastructure.mapper;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.TimeRow;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;

/**
 * 재생 시각에서 time 차원의 달력 속성을 파생한다.
 *
 * <p>모든 값은 시각만으로 결정되는 순수 함수다. week는 ISO-8601 주차라서
 * 연말/연초에는 year와 다른 주간 연도에 속할 수 있다(예: 2018-12-31 → week 1, year 2018).</p>
 */
public final class CalendarFields {

    private CalendarFields() {}

    /**
     * 시각을 밀리초로 자른 뒤 time row를 만든다.
     *
     * @param ts 재생 시각(UTC)
     * @return 파생 속성이 채워진 time row
     */
    public static TimeRow of(LocalDateTime ts) {
        LocalDateTime t = ts.truncatedTo(ChronoUnit.MILLIS);
        return new TimeRow(
                t,
                t.getHour(),
                t.getDayOfMonth(),
                t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                t.getMonthValue(),
                t.getYear(),
                t.getDayOfWeek().getValue() - 1 // 월요일=0
        );
    }
}
