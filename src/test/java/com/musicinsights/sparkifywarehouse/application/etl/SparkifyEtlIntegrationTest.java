package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.application.common.error.EtlFailureException;
import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonFileEnumerator;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonMapperConfig;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonRecordReader;
import com.musicinsights.sparkifywarehouse.infrastructure.mapper.LogEventBatchMapper;
import com.musicinsights.sparkifywarehouse.infrastructure.mapper.SongRecordMapper;
import com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.repo.*;
import com.musicinsights.sparkifywarehouse.support.H2TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 파일 트리 → H2(MySQL 모드) 스타 스키마까지의 ETL 전체 흐름 통합 테스트.
 *
 * <p>Spring 컨텍스트 없이 운영과 같은 컴포넌트를 직접 조립하고, Flyway 마이그레이션으로 만든 스키마에 적재한다.</p>
 */
@DisplayName("ETL 통합 테스트")
class SparkifyEtlIntegrationTest {

    private static final String CASUAL = """
            {"num_songs": 1, "artist_id": "ARD7TVE1187B99BFB1", "artist_latitude": NaN, "artist_longitude": NaN, \
            "artist_location": "", "artist_name": "Casual", "song_id": "SOMZWCG12A8C13C480", \
            "title": "I Didn't Mean To", "duration": 218.93179, "year": 0}""";

    private static final String ELENA = """
            {"num_songs": 1, "artist_id": "AR5KOSW1187FB35FF4", "artist_latitude": 49.80388, "artist_longitude": 15.47491, \
            "artist_location": "Dubai UAE", "artist_name": "Elena", "song_id": "SOZCTXZ12AB0182364", \
            "title": "Setanta matins", "duration": 269.58322, "year": 0}""";

    private static final String HOME = """
            {"artist":null,"auth":"Logged Out","firstName":null,"gender":null,"itemInSession":0,"lastName":null,\
            "length":null,"level":"free","location":null,"method":"PUT","page":"Home","registration":null,\
            "sessionId":52,"song":null,"status":200,"ts":1541105830796,"userAgent":null,"userId":""}""";

    private static final String PLAY_FREE = """
            {"artist":"Elena","auth":"Logged In","firstName":"Walter","gender":"M","itemInSession":0,\
            "lastName":"Frye","length":269.58322,"level":"free","location":"San Francisco-Oakland-Hayward, CA",\
            "method":"PUT","page":"NextSong","registration":1540919166796.0,"sessionId":38,\
            "song":"Setanta matins","status":200,"ts":1541105830796,"userAgent":"Mozilla/5.0","userId":"39"}""";

    private static final String PLAY_PAID = """
            {"artist":"Des'ree","auth":"Logged In","firstName":"Walter","gender":"M","itemInSession":1,\
            "lastName":"Frye","length":246.30812,"level":"paid","location":"San Francisco-Oakland-Hayward, CA",\
            "method":"PUT","page":"NextSong","registration":1540919166796.0,"sessionId":38,\
            "song":"You Gotta Be","status":200,"ts":1541106106796,"userAgent":"Mozilla/5.0","userId":"39"}""";

    @TempDir
    Path dataDir;

    H2TestDatabase h2;
    Path songRoot;
    Path logRoot;

    @BeforeEach
    void setUp() throws IOException {
        h2 = H2TestDatabase.create();
        songRoot = dataDir.resolve("song_data");
        logRoot = dataDir.resolve("log_data");

        write(songRoot.resolve("A/A/A/TRAAAAW128F429D538.json"), CASUAL);
        write(songRoot.resolve("A/B/C/TRABCEI128F424C983.json"), ELENA);
        write(logRoot.resolve("2018/11/2018-11-01-events.json"), HOME + "\n" + PLAY_FREE + "\n" + PLAY_PAID + "\n");
    }

    /**
     * song 파일 2개와 재생 이벤트 2건(조회 성공 1, 실패 1)이 스타 스키마에 적재되는지 검증한다.
     */
    @Test
    @DisplayName("song/log 파일이 스타 스키마에 적재된다")
    void run_loadsStarSchema() {
        StepVerifier.create(etl(true).run())
                .assertNext(report -> {
                    assertThat(report.songs().files()).isEqualTo(2);
                    assertThat(report.logs().files()).isEqualTo(1);
                    assertThat(report.logs().result().playsInserted()).isEqualTo(2L);
                    assertThat(report.logs().result().unresolvedPlays()).isEqualTo(1L);
                })
                .verifyComplete();

        assertThat(h2.count("songs")).isEqualTo(2L);
        assertThat(h2.count("artists")).isEqualTo(2L);
        assertThat(h2.countWhere("artists",
                "artist_id = 'ARD7TVE1187B99BFB1' AND location IS NULL AND latitude IS NULL AND longitude IS NULL"))
                .isEqualTo(1L);

        assertThat(h2.count("`time`")).isEqualTo(2L);
        assertThat(h2.count("users")).isEqualTo(1L);
        assertThat(h2.strings("SELECT level FROM users WHERE user_id = 39")).containsExactly("paid");

        assertThat(h2.count("songplays")).isEqualTo(2L);
        assertThat(h2.countWhere("songplays",
                "song_id = 'SOZCTXZ12AB0182364' AND artist_id = 'AR5KOSW1187FB35FF4' AND level = 'free'"))
                .isEqualTo(1L);
        assertThat(h2.countWhere("songplays", "song_id IS NULL AND artist_id IS NULL AND level = 'paid'"))
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("같은 데이터로 다시 실행해도 모든 테이블 행 수가 같다")
    void run_twice_leavesIdenticalState() {
        etl(true).run().block();
        List<Long> first = counts();

        StepVerifier.create(etl(true).run())
                .assertNext(report -> {
                    assertThat(report.logs().result().playsInserted()).isZero();
                    assertThat(report.logs().result().duplicatePlays()).isEqualTo(2L);
                })
                .verifyComplete();

        assertThat(counts()).isEqualTo(first).containsExactly(2L, 2L, 2L, 1L, 2L);
        assertThat(h2.strings("SELECT level FROM users WHERE user_id = 39")).containsExactly("paid");
    }

    /**
     * abort 정책에서 log 파일의 잘못된 레코드가 발견되면 앞서 적재한 songs까지 모두 롤백되는지 검증한다.
     */
    @Test
    @DisplayName("abort 정책에서 잘못된 레코드가 있으면 실행 전체가 롤백")
    void run_malformedWithAbortPolicy_rollsBackEverything() throws IOException {
        write(logRoot.resolve("2018/11/2018-11-02-events.json"),
                "{\"page\":\"NextSong\",\"userId\":\"39\",\"level\":\"free\"}");

        StepVerifier.create(etl(false).run())
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(EtlFailureException.class);
                    assertThat(((EtlFailureException) e).phase()).isEqualTo(EtlPhase.LOADING_LOGS);
                    assertThat(e.getCause()).isInstanceOf(MalformedRecordException.class);
                })
                .verify();

        assertThat(counts()).containsOnly(0L);
    }

    @Test
    @DisplayName("skip 정책에서는 잘못된 레코드만 건너뛰고 commit")
    void run_malformedWithSkipPolicy_skipsRecord() throws IOException {
        write(logRoot.resolve("2018/11/2018-11-02-events.json"), "{not json\n");

        StepVerifier.create(etl(true).run())
                .assertNext(report -> assertThat(report.logs().result().malformedSkipped()).isEqualTo(1L))
                .verifyComplete();

        assertThat(h2.count("songplays")).isEqualTo(2L);
    }

    /**
     * 여러 줄로 들여쓴 song 파일과, 결측 토큰과 같은 철자의 제목/아티스트 이름이 그대로 적재되는지 검증한다.
     */
    @Test
    @DisplayName("pretty-printed song 파일도 적재되고 제목 None, 아티스트 NULL은 값 그대로 저장")
    void run_prettyPrintedSongWithTokenLikeTitle_isLoaded() throws IOException {
        write(songRoot.resolve("A/A/B/TRAABJL12903CDCF1A.json"), """
                {
                  "num_songs": 1,
                  "artist_id": "ARNULL11187B9A7F0B",
                  "artist_latitude": null,
                  "artist_longitude": null,
                  "artist_location": "None",
                  "artist_name": "NULL",
                  "song_id": "SONONE12AB0187A2E",
                  "title": "None",
                  "duration": 201.5,
                  "year": 2004
                }
                """);

        StepVerifier.create(etl(false).run())
                .assertNext(report -> {
                    assertThat(report.songs().files()).isEqualTo(3);
                    assertThat(report.songs().result().malformedSkipped()).isZero();
                })
                .verifyComplete();

        assertThat(h2.strings("SELECT title FROM songs WHERE song_id = 'SONONE12AB0187A2E'")).containsExactly("None");
        assertThat(h2.strings("SELECT name FROM artists WHERE artist_id = 'ARNULL11187B9A7F0B'")).containsExactly("NULL");
        assertThat(h2.countWhere("artists", "artist_id = 'ARNULL11187B9A7F0B' AND location IS NULL")).isEqualTo(1L);
    }

    @Test
    @DisplayName("skip 정책에서 JSON 배열의 깨진 원소는 건너뛰고 앞 원소는 적재")
    void run_jsonArrayWithBrokenElement_skipsOnlyBrokenPart() throws IOException {
        String laterPlay = PLAY_FREE.replace("1541105830796", "1541107053796");
        write(logRoot.resolve("2018/11/2018-11-02-events.json"), "[\n" + laterPlay + ",\n{not json}\n]\n");

        StepVerifier.create(etl(true).run())
                .assertNext(report -> {
                    assertThat(report.logs().files()).isEqualTo(2);
                    assertThat(report.logs().result().playsInserted()).isEqualTo(3L);
                    assertThat(report.logs().result().malformedSkipped()).isEqualTo(1L);
                })
                .verifyComplete();

        assertThat(h2.count("songplays")).isEqualTo(3L);
    }

    @Test
    @DisplayName("log_data 루트가 디렉터리가 아니면 songs 적재 전에 INIT 단계에서 실패")
    void run_logRootIsFile_failsBeforeAnyLoad() throws IOException {
        logRoot = dataDir.resolve("log_data.json");
        write(logRoot, HOME);

        StepVerifier.create(etl(true).run())
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(EtlFailureException.class);
                    assertThat(((EtlFailureException) e).phase()).isEqualTo(EtlPhase.INIT);
                    assertThat(((EtlFailureException) e).file()).isEqualTo(logRoot);
                })
                .verify();

        assertThat(counts()).containsOnly(0L);
    }

    private List<Long> counts() {
        return List.of(
                h2.count("songs"), h2.count("artists"), h2.count("`time`"),
                h2.count("users"), h2.count("songplays")
        );
    }

    private SparkifyEtlService etl(boolean skipMalformed) {
        DatabaseClient db = h2.client();
        EtlProperties props = new EtlProperties(songRoot.toString(), logRoot.toString(), ".json", skipMalformed, true);

        EtlStoreFacade store = new EtlStoreFacade(
                new SongRepo(db), new ArtistRepo(db), new TimeRepo(db), new UserRepo(db),
                new SongPlayRepo(db), new SongLookupRepo(db), new SentinelCleanupRepo(db)
        );
        JsonRecordReader reader = new JsonRecordReader(new JsonMapperConfig().jsonMapper());
        MalformedRecordPolicy policy = new MalformedRecordPolicy(props);

        return new SparkifyEtlService(
                props,
                new JsonFileEnumerator(),
                new SongFileIngestService(reader, new SongRecordMapper(), store, policy),
                new LogFileIngestService(reader, new LogEventBatchMapper(), store, policy),
                store,
                h2.transactionalOperator(),
                List.of(new LoggingEtlProgressListener())
        );
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
