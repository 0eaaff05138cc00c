package com.musicinsights.sparkifywarehouse.infrastructure.mapper;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.LogEventRaw;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongLookupKey;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongPlayRow;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.TimeRow;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.UserRow;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.musicinsights.sparkifywarehouse.infrastructure.input.json.NormalizeUtils.*;

/**
 * log_data 파일 하나의 {@link LogEventRaw} 배치를 time/users/songplays 입력용 row로 변환한다.
 *
 * <p>"NextSong" 이벤트만 남기며, 파일 순서를 유지한다.</p>
 */
@Component
public class LogEventBatchMapper {

    /** 곡 재생으로 취급하는 page 값 */
    public static final String NEXT_SONG = "NextSong";

    /**
     * 재생 이벤트 한 건의 변환 결과.
     *
     * @param time   time 차원 row
     * @param user   users row
     * @param play   곡 조회 전 songplays row(song_id/artist_id null)
     * @param lookup 곡 조회 키
     */
    public record SongPlayEvent(
            TimeRow time,
            UserRow user,
            SongPlayRow play,
            SongLookupKey lookup
    ) {}

    /** 배치 변환 결과(재생 이벤트 + 실패 레코드 예외). */
    public record EventBatch(
            List<SongPlayEvent> events,
            List<MalformedRecordException> rejected
    ) {}

    /**
     * 배치를 변환한다. NextSong이 아닌 이벤트는 결과에도, 실패 목록에도 넣지 않는다.
     *
     * @param batch 파일 순서의 원본 이벤트
     * @return 재생 이벤트 + 실패 레코드
     */
    public EventBatch map(List<LogEventRaw> batch) {
        List<SongPlayEvent> events = new ArrayList<>();
        List<MalformedRecordException> rejected = new ArrayList<>();

        for (LogEventRaw r : batch) {
            if (!isSongPlay(r)) continue;
            try {
                events.add(toEvent(r));
            } catch (MalformedRecordException e) {
                rejected.add(e);
            }
        }
        return new EventBatch(events, rejected);
    }

    public static boolean isSongPlay(LogEventRaw r) {
        return r != null && NEXT_SONG.equals(r.page);
    }

    /**
     * 재생 이벤트 한 건을 변환한다.
     *
     * @param r NextSong 이벤트
     * @return 변환 결과
     * @throws MalformedRecordException ts 또는 userId가 없거나 잘못된 경우
     */
    public SongPlayEvent toEvent(LogEventRaw r) {
        LocalDateTime start = toUtcMillis("ts", r.ts);
        TimeRow time = CalendarFields.of(start);
        Integer userId = requireInt("userId", r.userId);
        String level = norm(r.level);

        UserRow user = new UserRow(
                userId,
                norm(r.firstName),
                norm(r.lastName),
                genderOrNull(r.gender),
                level
        );

        SongPlayRow play = new SongPlayRow(
                time.startTime(),
                userId,
                level,
                null,
                null,
                r.sessionId,
                norm(r.location),
                norm(r.userAgent)
        );

        SongLookupKey lookup = new SongLookupKey(norm(r.song), norm(r.artist), finiteOrNull(r.length));
        return new SongPlayEvent(time, user, play, lookup);
    }
}
