package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonMapperConfig;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonRecordReader;
import com.musicinsights.sparkifywarehouse.infrastructure.mapper.SongRecordMapper;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo.*;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.ArtistRow;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.row.SongRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * {@link SongFileIngestService} 단위 테스트.
 *
 * <p>실제 리더/매퍼로 파일을 읽고, 저장소는 mock으로 두어 레코드마다 song → artist 순서로
 * 저장하는지와 잘못된 레코드 정책을 검증한다.</p>
 */
@DisplayName("song 파일 적재 테스트")
class SongFileIngestServiceTest {

    private static final String CASUAL = """
            {"num_songs": 1, "artist_id": "ARD7TVE1187B99BFB1", "artist_latitude": NaN, "artist_longitude": NaN, \
            "artist_location": "", "artist_name": "Casual", "song_id": "SOMZWCG12A8C13C480", \
            "title": "I Didn't Mean To", "duration": 218.93179, "year": 0}""";

    private static final String ELENA = """
            {"num_songs": 1, "artist_id": "AR5KOSW1187FB35FF4", "artist_latitude": 49.80388, "artist_longitude": 15.47491, \
            "artist_location": "Dubai UAE", "artist_name": "Elena", "song_id": "SOZCTXZ12AB0182364", \
            "title": "Setanta matins", "duration": 269.58322, "year": 0}""";

    private static final String NO_SONG_ID = """
            {"num_songs": 1, "artist_id": "AR1", "artist_name": "x", "title": "t", "duration": 1.0}""";

    @TempDir
    Path dir;

    SongRepo songRepo;
    ArtistRepo artistRepo;
    EtlStoreFacade store;
    JsonRecordReader reader;

    @BeforeEach
    void setUp() {
        songRepo = mock(SongRepo.class);
        artistRepo = mock(ArtistRepo.class);
        store = new EtlStoreFacade(
                songRepo, artistRepo,
                mock(TimeRepo.class), mock(UserRepo.class), mock(SongPlayRepo.class),
                mock(SongLookupRepo.class), mock(SentinelCleanupRepo.class)
        );
        reader = new JsonRecordReader(new JsonMapperConfig().jsonMapper());

        when(songRepo.insertIgnore(anyList())).thenReturn(Mono.just(1L));
        when(artistRepo.insertIgnore(anyList())).thenReturn(Mono.just(1L));
    }

    /**
     * 레코드 순서대로 song → artist를 저장하고, 깨진 레코드는 건너뛴 수로 집계하는지 검증한다.
     */
    @Test
    @DisplayName("레코드마다 song → artist 순서로 저장, 잘못된 레코드는 skip")
    void ingestFile_savesSongThenArtist_perRecord() throws IOException {
        // given
        Path file = Files.writeString(dir.resolve("songs.json"), CASUAL + "\n" + NO_SONG_ID + "\n" + ELENA + "\n");
        SongFileIngestService service = service(true);

        // when / then
        StepVerifier.create(service.ingestFile(file))
                .assertNext(r -> {
                    assertEquals(4L, r.rowsWritten());
                    assertEquals(1L, r.malformedSkipped());
                })
                .verifyComplete();

        InOrder inOrder = inOrder(songRepo, artistRepo);
        inOrder.verify(songRepo).insertIgnore(List.of(
                new SongRow("SOMZWCG12A8C13C480", "I Didn't Mean To", "ARD7TVE1187B99BFB1", 0, 218.93179)));
        inOrder.verify(artistRepo).insertIgnore(List.of(
                new ArtistRow("ARD7TVE1187B99BFB1", "Casual", null, null, null)));
        inOrder.verify(songRepo).insertIgnore(List.of(
                new SongRow("SOZCTXZ12AB0182364", "Setanta matins", "AR5KOSW1187FB35FF4", 0, 269.58322)));
        inOrder.verify(artistRepo).insertIgnore(List.of(
                new ArtistRow("AR5KOSW1187FB35FF4", "Elena", "Dubai UAE", 49.80388, 15.47491)));
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    @DisplayName("abort 정책이면 저장 전에 MalformedRecordException으로 실패")
    void ingestFile_abortPolicy_failsBeforeWriting() throws IOException {
        Path file = Files.writeString(dir.resolve("songs.json"), CASUAL + "\n" + NO_SONG_ID + "\n");

        StepVerifier.create(service(false).ingestFile(file))
                .expectError(MalformedRecordException.class)
                .verify();

        verifyNoInteractions(songRepo, artistRepo);
    }

    @Test
    @DisplayName("저장 실패는 그대로 전파")
    void ingestFile_storeError_propagates() throws IOException {
        Path file = Files.writeString(dir.resolve("songs.json"), CASUAL + "\n");
        when(artistRepo.insertIgnore(anyList())).thenReturn(Mono.error(new IllegalStateException("db down")));

        StepVerifier.create(service(true).ingestFile(file))
                .expectErrorMessage("db down")
                .verify();
    }

    private SongFileIngestService service(boolean skip) {
        EtlProperties props = new EtlProperties("s", "l", ".json", skip, true);
        return new SongFileIngestService(reader, new SongRecordMapper(), store, new MalformedRecordPolicy(props));
    }
}
