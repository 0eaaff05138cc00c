package com.musicinsights.sparkifywarehouse.infrastructure.input.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * song_data 파일의 JSON 레코드 한 개(= 곡 1개 + 해당 아티스트)를 매핑하는 원본 DTO입니다.
 * <p>
 * 수치 필드는 {@code NaN}이나 {@code null}이 들어올 수 있으므로 박싱 타입으로 받습니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SongRaw {

    /** 파일에 담긴 곡 수(적재에는 사용하지 않음) */
    @JsonProperty("num_songs")
    public Integer numSongs;

    @JsonProperty("song_id")
    public String songId;

    @JsonProperty("title")
    public String title;

    @JsonProperty("artist_id")
    public String artistId;

    /** 발매 연도. 미상이면 0 */
    @JsonProperty("year")
    public Integer year;

    /** 곡 길이(초) */
    @JsonProperty("duration")
    public Double duration;

    @JsonProperty("artist_name")
    public String artistName;

    @JsonProperty("artist_location")
    public String artistLocation;

    @JsonProperty("artist_latitude")
    public Double artistLatitude; // NaN 가능

    @JsonProperty("artist_longitude")
    public Double artistLongitude; // NaN 가능
}
