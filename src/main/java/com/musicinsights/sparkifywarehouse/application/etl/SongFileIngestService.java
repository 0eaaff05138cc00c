package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonRecordReader;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.SongRaw;
import com.musicinsights.sparkifywarehouse.infrastructure.mapper.SongRecordMapper;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * song_data 파일 하나를 songs/artists 테이블에 적재하는 서비스입니다.
 * <p>
 * 레코드마다 song → artist 순서로 저장하며, 둘 다 first-write-wins라 같은 파일을 다시 적재해도 행이 늘지 않습니다.
 * 트랜잭션은 호출자({@link SparkifyEtlService})가 실행 전체에 한 번 적용합니다.
 */
@Service
public class SongFileIngestService {

    private final JsonRecordReader reader;
    private final SongRecordMapper mapper;
    private final EtlStoreFacade store;
    private final MalformedRecordPolicy malformedPolicy;

    public SongFileIngestService(
            JsonRecordReader reader,
            SongRecordMapper mapper,
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
     * @param file song_data JSON 파일
     * @return 파일 적재 결과
     */
    public Mono<FileIngestResult> ingestFile(Path file) {
        return reader.readFile(file, SongRaw.class)
                .flatMap(parsed -> {
                    SongRecordMapper.SongBatch batch = mapper.mapAll(parsed.records());

                    List<MalformedRecordException> rejected = new ArrayList<>(parsed.rejected());
                    rejected.addAll(batch.rejected());

                    return malformedPolicy.apply(file, rejected)
                            .flatMap(skipped -> Flux.fromIterable(batch.rows())
                                    .concatMap(this::ingestRecord)
                                    .reduce(FileIngestResult.malformed(skipped), FileIngestResult::plus));
                });
    }

    /**
     * 곡을 먼저, 아티스트를 다음에 저장합니다.
     *
     * @param rows 레코드 변환 결과
     * @return 영향받은 행 수
     */
    private Mono<FileIngestResult> ingestRecord(SongRecordMapper.SongRecordRows rows) {
        return store.song.insertIgnore(List.of(rows.song()))
                .flatMap(songs -> store.artist.insertIgnore(List.of(rows.artist()))
                        .map(artists -> FileIngestResult.rows(songs + artists)));
    }
}
