package com.musicinsights.sparkifywarehouse.infrastructure.input.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * log_data 파일의 "한 줄(= 사용자 이벤트 1건)"을 매핑하기 위한 원본 DTO입니다.
 * <p>
 * 로그아웃 상태 이벤트는 {@code userId}가 빈 문자열이므로 문자열로 받고,
 * 숫자 변환은 매퍼에서 수행합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogEventRaw {

    /** 이벤트 종류(예: "NextSong", "Home") */
    @JsonProperty("page")
    public String page;

    /** 이벤트 시각(epoch milliseconds) */
    @JsonProperty("ts")
    public Long ts;

    @JsonProperty("userId")
    public String userId; // "39" 또는 ""

    @JsonProperty("firstName")
    public String firstName;

    @JsonProperty("lastName")
    public String lastName;

    /** "M"/"F" */
    @JsonProperty("gender")
    public String gender;

    /** 요금제 등급("free"/"paid") */
    @JsonProperty("level")
    public String level;

    /** 재생한 곡 제목 */
    @JsonProperty("song")
    public String song;

    /** 재생한 곡의 아티스트 이름 */
    @JsonProperty("artist")
    public String artist;

    /** 재생한 곡 길이(초) */
    @JsonProperty("length")
    public Double length;

    @JsonProperty("sessionId")
    public Integer sessionId;

    @JsonProperty("location")
    public String location;

    @JsonProperty("userAgent")
    public String userAgent;

    @JsonProperty("auth")
    public String auth;

    @JsonProperty("itemInSession")
    public Integer itemInSession;

    @JsonProperty("method")
    public String method;

    @JsonProperty("status")
    public Integer status;

    @JsonProperty("registration")
    public Double registration;
}
