package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.ArtistRow;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongArtistRef;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongLookupKey;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongRow;
import com.musicinsights.sparkifywarehouse.support.H2TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

/**
 * {@link SongLookupRepo} 통합 테스트(H2, MySQL 모드).
 */
@DisplayName("song lookup repo 테스트")
class SongLookupRepoTest {

    H2TestDatabase h2;
    SongLookupRepo repo;

    @BeforeEach
    void setUp() {
        h2 = H2TestDatabase.create();
        repo = new SongLookupRepo(h2.client());

        new SongRepo(h2.client()).insertIgnore(List.of(
                new SongRow("SOZCTXZ12AB0182364", "Setanta matins", "AR5KOSW1187FB35FF4", 0, 269.58322)
        )).block();
        new ArtistRepo(h2.client()).insertIgnore(List.of(
                new ArtistRow("AR5KOSW1187FB35FF4", "Elena", "Dubai UAE", 49.80388, 15.47491)
        )).block();
    }

    @Test
    @DisplayName("제목/아티스트/길이가 모두 일치하면 (song_id, artist_id)")
    void findSongAndArtist_hit() {
        StepVerifier.create(repo.findSongAndArtist(new SongLookupKey("Setanta matins", "Elena", 269.58322)))
                .expectNext(new SongArtistRef("SOZCTXZ12AB0182364", "AR5KOSW1187FB35FF4"))
                .verifyComplete();
    }

    @Test
    @DisplayName("길이가 조금이라도 다르면 미조회")
    void findSongAndArtist_durationMismatch_isUnresolved() {
        StepVerifier.create(repo.findSongAndArtist(new SongLookupKey("Setanta matins", "Elena", 269.58323)))
                .expectNext(SongArtistRef.UNRESOLVED)
                .verifyComplete();
    }

    @Test
    @DisplayName("카탈로그에 없는 곡은 에러 없이 미조회")
    void findSongAndArtist_miss_isUnresolved() {
        StepVerifier.create(repo.findSongAndArtist(new SongLookupKey("You Gotta Be", "Des'ree", 246.30812)))
                .expectNext(SongArtistRef.UNRESOLVED)
                .verifyComplete();
    }

    @Test
    @DisplayName("키가 불완전하면 조회하지 않고 미조회")
    void findSongAndArtist_incompleteKey_isUnresolved() {
        StepVerifier.create(repo.findSongAndArtist(new SongLookupKey("Setanta matins", null, 269.58322)))
                .expectNext(SongArtistRef.UNRESOLVED)
                .verifyComplete();
        StepVerifier.create(repo.findSongAndArtist(null))
                .expectNext(SongArtistRef.UNRESOLVED)
                .verifyComplete();
    }
}
