package com.musicinsights.sparkifywarehouse.infrastructure.input.json;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Set;

/**
 * ingest 과정에서 반복적으로 사용하는 "정규화/파싱" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리, 위치 필드의 결측 토큰 처리)
 * - 수치 결측값(NaN, 무한대) 처리
 * - epoch millis 타임스탬프 변환
 * - 필수 필드 검증
 */
public final class NormalizeUtils {

    /**
     * 결측값으로 취급하는 문자열 토큰.
     * <p>
     * 위치처럼 원본 데이터에 결측이 문자열로 기록되는 필드에만 적용합니다.
     * 저장소 후처리(sentinel cleanup)도 같은 토큰을 NULL로 되돌립니다.
     */
    public static final Set<String> MISSING_TOKENS = Set.of("", "NULL", "NaN", "None");

    private NormalizeUtils() {}

    /**
     * 문자열을 정규화합니다. trim 후 빈 문자열이면 null을 반환합니다.
     * <p>
     * "None", "NULL" 같은 값도 실제 제목/이름일 수 있으므로 그대로 둡니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * 결측 토큰("NULL", "NaN", "None")까지 null로 바꾸는 정규화입니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String normMissing(String s) {
        String t = norm(s);
        return t == null || MISSING_TOKENS.contains(t) ? null : t;
    }

    /**
     * 실수 값을 정규화합니다. NaN/무한대는 null로 바꿉니다.
     *
     * @param d 원본 값
     * @return 유한한 값 또는 null
     */
    public static Double finiteOrNull(Double d) {
        if (d == null || d.isNaN() || d.isInfinite()) return null;
        return d;
    }

    /**
     * 단일 문자 성별 코드로 정규화합니다. 비어 있으면 null.
     *
     * @param s 원본 성별 문자열
     * @return 첫 글자(대문자) 또는 null
     */
    public static String genderOrNull(String s) {
        String t = norm(s);
        return t == null ? null : t.substring(0, 1).toUpperCase();
    }

    /**
     * 숫자 문자열을 Integer로 파싱합니다.
     *
     * @param field 필드명(에러 메시지용)
     * @param s 원본 문자열
     * @return 파싱된 값
     * @throws MalformedRecordException 비어 있거나 정수가 아닌 경우
     */
    public static Integer requireInt(String field, String s) {
        String t = norm(s);
        if (t == null) {
            throw new MalformedRecordException(field, "missing required field '" + field + "'");
        }
        try {
            return Integer.valueOf(t);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(field, "field '" + field + "' is not an integer: " + t, e);
        }
    }

    /**
     * 필수 문자열 필드를 정규화하고, 없으면 예외를 던집니다.
     *
     * @param field 필드명
     * @param s 원본 문자열
     * @return 정규화된 문자열
     * @throws MalformedRecordException 값이 비어 있는 경우
     */
    public static String requireText(String field, String s) {
        String t = norm(s);
        if (t == null) {
            throw new MalformedRecordException(field, "missing required field '" + field + "'");
        }
        return t;
    }

    /**
     * 필수 실수 필드를 검증합니다.
     *
     * @param field 필드명
     * @param d 원본 값
     * @return 유한한 값
     * @throws MalformedRecordException 값이 없거나 NaN인 경우
     */
    public static Double requireFinite(String field, Double d) {
        Double v = finiteOrNull(d);
        if (v == null) {
            throw new MalformedRecordException(field, "missing required field '" + field + "'");
        }
        return v;
    }

    /**
     * epoch milliseconds를 UTC 기준 {@link LocalDateTime}(밀리초 정밀도)으로 변환합니다.
     *
     * @param field 필드명
     * @param epochMillis epoch milliseconds
     * @return UTC 기준 시각
     * @throws MalformedRecordException 값이 없거나 표현 범위를 벗어난 경우
     */
    public static LocalDateTime toUtcMillis(String field, Long epochMillis) {
        if (epochMillis == null) {
            throw new MalformedRecordException(field, "missing required field '" + field + "'");
        }
        try {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
        } catch (RuntimeException e) {
            throw new MalformedRecordException(field, "field '" + field + "' is not a valid epoch millis: " + epochMillis, e);
        }
    }
}
