package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

/**
 * artists 테이블 한 행을 표현하는 Row 객체입니다.
 *
 * @param artistId  아티스트 식별자(PK)
 * @param name      아티스트 이름
 * @param location  활동 지역(nullable)
 * @param latitude  위도(nullable)
 * @param longitude 경도(nullable)
 */
public record ArtistRow(
        String artistId,
        String name,
        String location,
        Double latitude,
        Double longitude
) {}
