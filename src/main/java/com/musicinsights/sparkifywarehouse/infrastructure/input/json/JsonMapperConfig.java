package com.musicinsights.sparkifywarehouse.infrastructure.input.json;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.core.json.JsonReadFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * 데이터 파일 파싱용 {@link JsonMapper} 설정.
 *
 * <p>song_data의 위경도 필드에는 {@code NaN} 리터럴이 들어올 수 있어 비수치 숫자 토큰을 허용한다.</p>
 */
@Configuration
public class JsonMapperConfig {

    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .build();
    }
}
