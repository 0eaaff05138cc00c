package com.musicinsights.sparkifywarehouse.application.common.error;

import com.musicinsights.sparkifywarehouse.application.etl.EtlPhase;

import java.nio.file.Path;

/**
 * 적재 도중 실패한 단계와 파일 정보를 담아 호출자에게 전파하는 예외.
 *
 * <p>이 예외가 전파되면 트랜잭션은 이미 롤백된 상태다.</p>
 */
public class EtlFailureException extends RuntimeException {
    private final EtlPhase phase;
    private final Path file;

    public EtlFailureException(EtlPhase phase, Path file, Throwable cause) {
        super("ETL failed during " + phase + (file == null ? "" : " at " + file) + ": " + cause.getMessage(), cause);
        this.phase = phase;
        this.file = file;
    }

    public EtlPhase phase() {
        return phase;
    }

    /** 실패한 파일 또는 루트 경로. 특정 파일과 무관한 실패면 null */
    public Path file() {
        return file;
    }
}
