package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonRecordReader;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.LogEventRaw;
import com.musicinsights.sparkifywarehouse.infrastructure.mapper.LogEventBatchMapper;
import com.musicinsights.sparkifywarehouse.infrastructure.mapper.LogEventBatchMapper.SongPlayEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * log_data 파일 하나를 time/users/songplays 테이블에 적재하는 서비스입니다.
 * <p>
 * 재생 이벤트마다 다음 순서로 처리합니다:
 * time → users(level upsert) → (song_id, artist_id) 조회 → songplays
 * <p>
 * 이벤트는 파일 순서대로 하나씩 처리하므로 같은 사용자의 level은 파일상 마지막 값이 남습니다.
 */
@Service
public class LogFileIngestService {

    private final JsonRecordReader reader;
    private final LogEventBatchMapper mapper;
    private final EtlStoreFacade store;
    private final MalformedRecordPolicy malformedPolicy;

    public LogFileIngestService(
            JsonRecordReader reader,
            LogEventBatchMapper mapper,
            EtlStoreFacade store,
            MalformedRecordPolicy malformedPolicy
    ) {
        this.reader = reader;
        this.mapper = mapper;
        this.store = store;
        this.malformedPolicy = malformedPolicy;
    }

    /**
     * 파일 하나를 적재합니다.
     *
     * @param file log_data JSON 파일
     * @return 파일 적재 결과
     */
    public Mono<FileIngestResult> ingestFile(Path file) {
        return reader.readFile(file, LogEventRaw.class)
                .flatMap(parsed -> {
                    LogEventBatchMapper.EventBatch batch = mapper.map(parsed.records());

                    List<MalformedRecordException> rejected = new ArrayList<>(parsed.rejected());
                    rejected.addAll(batch.rejected());

                    return malformedPolicy.apply(file, rejected)
                            .flatMap(skipped -> Flux.fromIterable(batch.events())
                                    .concatMap(this::ingestEvent)
                                    .reduce(FileIngestResult.malformed(skipped), FileIngestResult::plus));
                });
    }

    /**
     * 재생 이벤트 한 건을 적재합니다.
     *
     * @param e 재생 이벤트
     * @return 이벤트 적재 결과
     */
    private Mono<FileIngestResult> ingestEvent(SongPlayEvent e) {
        return store.time.insertIgnore(List.of(e.time()))
                .flatMap(t -> store.user.upsertLevel(List.of(e.user())).map(u -> t + u))
                .flatMap(written -> store.songLookup.findSongAndArtist(e.lookup())
                        .flatMap(ref -> store.songPlay.insertIfAbsent(e.play().withRef(ref))
                                .map(inserted -> FileIngestResult.play(written, inserted, ref.resolved()))));
    }
}
