package com.musicinsights.sparkifywarehouse.application.etl;

import java.nio.file.Path;

/**
 * ETL 진행 상황 콜백. 정합성과 무관한 부수 효과(로그, 모니터링)만 수행해야 한다.
 */
public interface EtlProgressListener {

    /**
     * 단계가 바뀔 때 호출된다.
     *
     * @param phase 새 단계
     */
    default void onPhaseChanged(EtlPhase phase) {}

    /**
     * 적재 단계의 파일 목록을 다 모은 뒤, 첫 파일을 처리하기 전에 호출된다.
     *
     * @param phase      적재 단계
     * @param root       데이터 루트
     * @param totalFiles 찾은 파일 수
     */
    default void onPhaseStarted(EtlPhase phase, Path root, int totalFiles) {}

    /**
     * 파일 하나의 처리가 끝날 때마다 호출된다.
     *
     * @param phase          현재 단계
     * @param file           처리한 파일
     * @param filesProcessed 지금까지 처리한 파일 수
     * @param totalFiles     단계의 전체 파일 수
     */
    default void onFileProcessed(EtlPhase phase, Path file, int filesProcessed, int totalFiles) {}
}
