package com.musicinsights.sparkifywarehouse;

import com.musicinsights.sparkifywarehouse.application.etl.EtlProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Sparkify 곡/재생 로그 웨어하우스 적재 애플리케이션.
 *
 * <p>러너가 끝나면 컨텍스트를 닫고 종료 코드를 그대로 반환한다.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(EtlProperties.class)
public class SparkifyWarehouseApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(SparkifyWarehouseApplication.class, args)
        ));
    }
}
