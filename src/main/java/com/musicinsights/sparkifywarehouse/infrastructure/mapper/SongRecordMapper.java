package com.musicinsights.sparkifywarehouse.infrastructure.mapper;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.SongRaw;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.ArtistRow;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.musicinsights.sparkifywarehouse.infrastructure.input.json.NormalizeUtils.*;

/**
 * {@link SongRaw} 레코드를 songs/artists 입력용 row로 변환한다.
 *
 * <p>텍스트는 trim 후 빈 값을 null로, artist_location은 결측 토큰까지 null로, 수치는 NaN/무한대를 null로 맞춘다.</p>
 */
@Component
public class SongRecordMapper {

    /** 레코드 한 개의 변환 결과(song + artist). */
    public record SongRecordRows(SongRow song, ArtistRow artist) {}

    /** 배치 변환 결과(성공 row + 실패 레코드 예외). */
    public record SongBatch(
            List<SongRecordRows> rows,
            List<MalformedRecordException> rejected
    ) {}

    /**
     * 레코드 하나를 song/artist row로 변환한다.
     *
     * @param r 원본 레코드
     * @return 변환 결과
     * @throws MalformedRecordException 필수 필드(song_id, title, artist_id, artist_name, duration)가 없을 때
     */
    public SongRecordRows map(SongRaw r) {
        return new SongRecordRows(toSongRow(r), toArtistRow(r));
    }

    public SongRow toSongRow(SongRaw r) {
        Integer year = r.year;
        if (year != null && year < 0) {
            throw new MalformedRecordException("year", "negative year: " + year);
        }
        Double duration = requireFinite("duration", r.duration);
        if (duration <= 0) {
            throw new MalformedRecordException("duration", "non-positive duration: " + duration);
        }
        return new SongRow(
                requireText("song_id", r.songId),
                requireText("title", r.title),
                requireText("artist_id", r.artistId),
                year,
                duration
        );
    }

    public ArtistRow toArtistRow(SongRaw r) {
        return new ArtistRow(
                requireText("artist_id", r.artistId),
                requireText("artist_name", r.artistName),
                normMissing(r.artistLocation),
                finiteOrNull(r.artistLatitude),
                finiteOrNull(r.artistLongitude)
        );
    }

    /**
     * 여러 레코드를 파일 순서대로 변환하고, 실패한 레코드는 따로 모은다.
     *
     * @param batch 원본 레코드 목록
     * @return 변환 결과
     */
    public SongBatch mapAll(List<SongRaw> batch) {
        List<SongRecordRows> rows = new ArrayList<>(batch.size());
        List<MalformedRecordException> rejected = new ArrayList<>();
        for (SongRaw r : batch) {
            try {
                rows.add(map(r));
            } catch (MalformedRecordException e) {
                rejected.add(e);
            }
        }
        return new SongBatch(rows, rejected);
    }
}
