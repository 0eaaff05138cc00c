package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongArtistRef;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongLookupKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 재생 로그의 (제목, 아티스트명, 길이)로 songs/artists에서 식별자 쌍을 찾는 Repository입니다.
 * <p>
 * 세 값 모두 정확히 일치해야 하며 길이(duration)도 DB의 DOUBLE 동등 비교를 그대로 씁니다.
 * 로그 대부분은 샘플 카탈로그 밖의 곡이므로 미조회는 에러가 아닙니다.
 */
@Component
public class SongLookupRepo extends BatchSqlSupport {

    private static final Logger log = LoggerFactory.getLogger(SongLookupRepo.class);

    public SongLookupRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 조회 키에 맞는 (song_id, artist_id)를 반환합니다.
     *
     * @param key 조회 키
     * @return 첫 번째 일치 결과, 없거나 키가 불완전하면 {@link SongArtistRef#UNRESOLVED}
     */
    public Mono<SongArtistRef> findSongAndArtist(SongLookupKey key) {
        if (key == null || !key.complete()) {
            return Mono.just(SongArtistRef.UNRESOLVED);
        }

        return db.sql("""
                SELECT s.song_id, s.artist_id
                FROM songs s
                JOIN artists a ON a.artist_id = s.artist_id
                WHERE s.title = :title
                  AND a.name = :artist
                  AND s.duration = :duration
                LIMIT 1
                """)
                .bind("title", key.title())
                .bind("artist", key.artistName())
                .bind("duration", key.duration())
                .map((row, meta) -> new SongArtistRef(
                        row.get(0, String.class),
                        row.get(1, String.class)
                ))
                .first()
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("song not in catalog: title={}, artist={}, duration={}",
                            key.title(), key.artistName(), key.duration());
                    return SongArtistRef.UNRESOLVED;
                }));
    }
}
