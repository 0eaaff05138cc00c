package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

/**
 * songs 테이블 한 행을 표현하는 Row 객체입니다.
 *
 * @param songId   곡 식별자(PK)
 * @param title    곡 제목
 * @param artistId 아티스트 식별자
 * @param year     발매 연도(미상이면 0, 없으면 null)
 * @param duration 곡 길이(초)
 */
public record SongRow(
        String songId,
        String title,
        String artistId,
        Integer year,
        Double duration
) {}
