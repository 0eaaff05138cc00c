package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

import java.time.LocalDateTime;

/**
 * time 차원 테이블 한 행. start_time을 제외한 모든 값은 start_time에서 파생된다.
 *
 * @param startTime 재생 시각(UTC, 밀리초 정밀도)
 * @param hour      시(0-23)
 * @param day       일(1-31)
 * @param week      ISO 주차
 * @param month     월(1-12)
 * @param year      연도
 * @param weekday   요일(월요일=0)
 */
public record TimeRow(
        LocalDateTime startTime,
        int hour,
        int day,
        int week,
        int month,
        int year,
        int weekday
) {}
