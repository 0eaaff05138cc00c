package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

/**
 * users 테이블 한 행을 표현하는 Row 객체입니다.
 *
 * @param userId    사용자 식별자(PK)
 * @param firstName 이름
 * @param lastName  성
 * @param gender    성별 코드(단일 문자, nullable)
 * @param level     요금제 등급. 재적재 시 마지막 값으로 갱신된다
 */
public record UserRow(
        Integer userId,
        String firstName,
        String lastName,
        String gender,
        String level
) {}
