package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

/**
 * 재생 이벤트로 곡을 찾기 위한 조회 키. 세 값 모두 정확히 일치해야 한다.
 *
 * @param title      곡 제목
 * @param artistName 아티스트 이름
 * @param duration   곡 길이(초)
 */
public record SongLookupKey(String title, String artistName, Double duration) {

    /** 하나라도 비어 있으면 조회할 수 없다 */
    public boolean complete() {
        return title != null && artistName != null && duration != null;
    }
}
