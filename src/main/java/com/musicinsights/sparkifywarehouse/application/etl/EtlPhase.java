package com.musicinsights.sparkifywarehouse.application.etl;

/**
 * ETL 실행 한 번의 상태.
 *
 * <p>{@code INIT → LOADING_SONGS → LOADING_LOGS → POST_PROCESS → COMMITTED},
 * 어느 단계에서든 실패하면 {@code ROLLED_BACK}.</p>
 */
public enum EtlPhase {
    INIT,
    LOADING_SONGS,
    LOADING_LOGS,
    POST_PROCESS,
    COMMITTED,
    ROLLED_BACK
}
