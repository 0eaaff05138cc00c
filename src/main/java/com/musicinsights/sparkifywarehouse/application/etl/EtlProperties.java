package com.musicinsights.sparkifywarehouse.application.etl;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * ETL 실행 설정({@code sparkify.etl.*}).
 *
 * <p>DB 접속 정보는 {@code spring.r2dbc.*}(적재)와 {@code spring.datasource.*}(Flyway)에서 읽는다.</p>
 *
 * @param songDataPath         song_data 루트 디렉터리
 * @param logDataPath          log_data 루트 디렉터리
 * @param fileExtension        적재 대상 파일 확장자
 * @param skipMalformedRecords true면 잘못된 레코드를 건너뛰고, false면 실행 전체를 롤백한다
 * @param postProcessEnabled   적재 후 결측 토큰 정리 단계 실행 여부
 */
@ConfigurationProperties("sparkify.etl")
public record EtlProperties(
        @DefaultValue("data/song_data") String songDataPath,
        @DefaultValue("data/log_data") String logDataPath,
        @DefaultValue(".json") String fileExtension,
        @DefaultValue("true") boolean skipMalformedRecords,
        @DefaultValue("true") boolean postProcessEnabled
) {

    public Path songDataRoot() {
        return Path.of(songDataPath);
    }

    public Path logDataRoot() {
        return Path.of(logDataPath);
    }
}
