package com.musicinsights.sparkifywarehouse.application.etl;

/**
 * ETL 실행 한 번의 결과 요약.
 *
 * @param songs            song_data 단계 결과
 * @param logs             log_data 단계 결과
 * @param sentinelsCleaned 후처리에서 NULL로 바뀐 행 수
 */
public record EtlRunReport(
        PhaseReport songs,
        PhaseReport logs,
        long sentinelsCleaned
) {

    /**
     * 단계별 결과.
     *
     * @param phase  단계
     * @param files  처리한 파일 수
     * @param result 파일 결과 합계
     */
    public record PhaseReport(EtlPhase phase, int files, FileIngestResult result) {}
}
