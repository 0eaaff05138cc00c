package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row;

import java.time.LocalDateTime;

/**
 * songplays 팩트 테이블 한 행을 표현하는 Row 객체입니다.
 * <p>
 * songId/artistId는 곡 조회에 실패하면 null로 남습니다.
 *
 * @param startTime 재생 시각(time.start_time 참조)
 * @param userId    사용자 식별자(users.user_id 참조)
 * @param level     재생 시점의 요금제 등급
 * @param songId    곡 식별자(nullable)
 * @param artistId  아티스트 식별자(nullable)
 * @param sessionId 세션 식별자
 * @param location  사용자 위치
 * @param userAgent 사용자 에이전트
 */
public record SongPlayRow(
        LocalDateTime startTime,
        Integer userId,
        String level,
        String songId,
        String artistId,
        Integer sessionId,
        String location,
        String userAgent
) {
    /**
     * 조회된 곡/아티스트 식별자를 채운 사본을 반환한다.
     *
     * @param ref 조회 결과
     * @return 식별자가 반영된 row
     */
    public SongPlayRow withRef(SongArtistRef ref) {
        return new SongPlayRow(startTime, userId, level, ref.songId(), ref.artistId(), sessionId, location, userAgent);
    }
}
