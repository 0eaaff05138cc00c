package com.musicinsights.sparkifywarehouse.bootstrap;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

/**
 * 애플리케이션 시작 시점에 스타 스키마(songs, artists, time, users, songplays)를 만드는 설정 클래스입니다.
 *
 * <p>R2DBC에는 Flyway 자동 설정이 없으므로, JDBC datasource 설정으로 {@link Flyway#migrate()}를 직접 수행합니다.
 * ETL 러너보다 먼저 실행되도록 가장 높은 우선순위를 갖습니다.</p>
 *
 * <p>주요 설정값:
 * {@code spring.datasource.*}, {@code spring.flyway.locations},
 * {@code spring.flyway.baseline-on-migrate}</p>
 */
@Configuration
@Profile("local")
public class FlywayRunner {

    /** 기본 마이그레이션 위치 */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration";

    /**
     * 스키마 마이그레이션을 실행하는 Runner Bean을 생성합니다.
     *
     * @param env application.yml 및 profile 설정을 조회하기 위한 {@link Environment}
     * @return Flyway 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    ApplicationRunner runFlyway(Environment env) {
        return args -> migrate(
                env.getRequiredProperty("spring.datasource.url"),
                env.getProperty("spring.datasource.username"),
                env.getProperty("spring.datasource.password"),
                env.getProperty("spring.flyway.locations", DEFAULT_LOCATIONS),
                Boolean.parseBoolean(env.getProperty("spring.flyway.baseline-on-migrate", "false"))
        );
    }

    /**
     * 주어진 JDBC 접속 정보로 마이그레이션을 수행합니다.
     *
     * @param url               JDBC URL
     * @param user              사용자
     * @param password          비밀번호
     * @param locations         마이그레이션 스크립트 위치
     * @param baselineOnMigrate 기존 스키마가 있을 때 baseline 처리 여부
     * @return Flyway 실행 결과
     */
    public static MigrateResult migrate(
            String url, String user, String password, String locations, boolean baselineOnMigrate
    ) {
        return Flyway.configure()
                .dataSource(url, user, password)
                .locations(locations)
                .baselineOnMigrate(baselineOnMigrate)
                .load()
                .migrate();
    }
}
