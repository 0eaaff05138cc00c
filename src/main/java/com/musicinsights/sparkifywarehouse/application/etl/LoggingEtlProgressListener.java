package com.musicinsights.sparkifywarehouse.application.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * 진행 상황을 로그로 남기는 기본 리스너.
 */
@Component
public class LoggingEtlProgressListener implements EtlProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEtlProgressListener.class);

    @Override
    public void onPhaseChanged(EtlPhase phase) {
        log.info("ETL phase -> {}", phase);
    }

    @Override
    public void onPhaseStarted(EtlPhase phase, Path root, int totalFiles) {
        log.info("{} files found in {}", totalFiles, root.toAbsolutePath());
    }

    @Override
    public void onFileProcessed(EtlPhase phase, Path file, int filesProcessed, int totalFiles) {
        log.info("{}/{} files processed. ({})", filesProcessed, totalFiles, file.getFileName());
    }
}
