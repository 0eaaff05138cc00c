package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

/**
 * 재생 이벤트에서 찾은 (song_id, artist_id) 쌍.
 *
 * @param songId   곡 식별자(미조회 시 null)
 * @param artistId 아티스트 식별자(미조회 시 null)
 */
public record SongArtistRef(String songId, String artistId) {

    /** 카탈로그에서 곡을 찾지 못한 경우 */
    public static final SongArtistRef UNRESOLVED = new SongArtistRef(null, null);

    public boolean resolved() {
        return songId != null;
    }
}
