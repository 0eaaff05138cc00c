package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo.*;
import org.springframework.stereotype.Component;

/**
 * ETL 과정에서 사용하는 Repository들을 한 곳에 모아 제공하는 파사드(Facade) 컴포넌트입니다.
 * <p>
 * 서비스 레이어에서 다수의 Repo 의존성을 줄이고, 적재 흐름을 읽기 쉽게 구성하기 위한 용도입니다.
 */
@Component
public class EtlStoreFacade {

    /** songs 테이블 */
    public final SongRepo song;

    /** artists 테이블 */
    public final ArtistRepo artist;

    /** time 차원 테이블 */
    public final TimeRepo time;

    /** users 테이블 */
    public final UserRepo user;

    /** songplays 팩트 테이블 */
    public final SongPlayRepo songPlay;

    /** 재생 이벤트 → (song_id, artist_id) 조회 */
    public final SongLookupRepo songLookup;

    /** 적재 후 결측 토큰 정리 */
    public final SentinelCleanupRepo sentinelCleanup;

    public EtlStoreFacade(
            SongRepo song,
            ArtistRepo artist,
            TimeRepo time,
            UserRepo user,
            SongPlayRepo songPlay,
            SongLookupRepo songLookup,
            SentinelCleanupRepo sentinelCleanup
    ) {
        this.song = song;
        this.artist = artist;

        this.time = time;
        this.user = user;
        this.songPlay = songPlay;
        this.songLookup = songLookup;

        this.sentinelCleanup = sentinelCleanup;
    }
}
