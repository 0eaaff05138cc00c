package com.musicinsights.sparkifywarehouse.bootstrap;

import com.musicinsights.sparkifywarehouse.application.etl.EtlRunReport;
import com.musicinsights.sparkifywarehouse.application.etl.SparkifyEtlService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * song_data/log_data를 DB에 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code etl}일 때만 활성화된다.</p>
 * <p>실행 전체가 끝날 때까지 {@code block()}으로 대기하고, 실패하면 예외를 그대로 던져
 * 프로세스가 0이 아닌 코드로 종료되게 한다.</p>
 */
@Component
@Profile("etl")
@Order(10)
public class SparkifyEtlRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SparkifyEtlRunner.class);

    private final SparkifyEtlService etlService;

    public SparkifyEtlRunner(SparkifyEtlService etlService) {
        this.etlService = etlService;
    }

    @Override
    public void run(String... args) {
        EtlRunReport report = etlService.run()
                .doOnError(e -> log.error("ETL failed, transaction rolled back: {}", e.getMessage()))
                .block();

        if (report == null) return;
        log.info("Song files: {}, rows written: {}, malformed skipped: {}",
                report.songs().files(),
                report.songs().result().rowsWritten(),
                report.songs().result().malformedSkipped());
        log.info("Log files: {}, songplays inserted: {}, duplicates skipped: {}, unresolved: {}, malformed skipped: {}",
                report.logs().files(),
                report.logs().result().playsInserted(),
                report.logs().result().duplicatePlays(),
                report.logs().result().unresolvedPlays(),
                report.logs().result().malformedSkipped());
        log.info("Sentinel values cleaned: {}", report.sentinelsCleaned());
    }
}
