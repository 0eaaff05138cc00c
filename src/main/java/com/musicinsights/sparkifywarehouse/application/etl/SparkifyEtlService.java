package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.application.common.error.EtlFailureException;
import com.musicinsights.sparkifywarehouse.infrastructure.input.json.JsonFileEnumerator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * song_data/log_data를 순서대로 적재하는 ETL 오케스트레이터입니다.
 * <p>
 * 실행 한 번의 흐름:
 * <ol>
 *     <li>INIT: song_data/log_data 루트를 모두 검사(적재 시작 전 실패)</li>
 *     <li>LOADING_SONGS: song_data 파일마다 songs → artists</li>
 *     <li>LOADING_LOGS: log_data 파일마다 time → users → 곡 조회 → songplays</li>
 *     <li>POST_PROCESS: 결측 토큰을 NULL로 정리(설정으로 끌 수 있음)</li>
 * </ol>
 * 세 단계 전체를 {@link TransactionalOperator} 하나로 감싸므로, 모두 성공해야 한 번 commit 되고
 * 어느 단계에서든 실패하면 전체가 rollback 됩니다.
 * 파일은 단계 안에서도, 단계 사이에서도 하나씩 순차 처리합니다.
 */
@Service
public class SparkifyEtlService {

    private final EtlProperties props;
    private final JsonFileEnumerator enumerator;
    private final SongFileIngestService songIngest;
    private final LogFileIngestService logIngest;
    private final EtlStoreFacade store;
    private final TransactionalOperator tx;
    private final List<EtlProgressListener> listeners;

    public SparkifyEtlService(
            EtlProperties props,
            JsonFileEnumerator enumerator,
            SongFileIngestService songIngest,
            LogFileIngestService logIngest,
            EtlStoreFacade store,
            TransactionalOperator tx,
            List<EtlProgressListener> listeners
    ) {
        this.props = props;
        this.enumerator = enumerator;
        this.songIngest = songIngest;
        this.logIngest = logIngest;
        this.store = store;
        this.tx = tx;
        this.listeners = listeners;
    }

    /**
     * ETL을 한 번 실행합니다. 구독할 때마다 처음부터 다시 실행합니다.
     *
     * @return commit 된 실행 결과. 실패 시 {@link EtlFailureException}
     */
    public Mono<EtlRunReport> run() {
        return Mono.defer(() -> {
            AtomicReference<EtlPhase> phase = new AtomicReference<>(EtlPhase.INIT);
            enter(phase, EtlPhase.INIT);

            Mono<EtlRunReport> work = verifyRoots()
                    .then(loadPhase(phase, EtlPhase.LOADING_SONGS, props.songDataRoot(), songIngest::ingestFile)
                            .flatMap(songs ->
                                    loadPhase(phase, EtlPhase.LOADING_LOGS, props.logDataRoot(), logIngest::ingestFile)
                                            .flatMap(logs -> postProcess(phase)
                                                    .map(cleaned -> new EtlRunReport(songs, logs, cleaned)))
                            ));

            return tx.transactional(work)
                    .doOnSuccess(report -> enter(phase, EtlPhase.COMMITTED))
                    .onErrorMap(e -> !(e instanceof EtlFailureException),
                            e -> new EtlFailureException(phase.get(), null, e))
                    .doOnError(e -> enter(phase, EtlPhase.ROLLED_BACK));
        });
    }

    /**
     * 루트 아래 파일을 모두 나열한 뒤 하나씩 적재합니다.
     *
     * @param phase  현재 상태
     * @param next   진입할 단계
     * @param root   데이터 루트
     * @param ingest 파일 하나를 적재하는 함수
     * @return 단계 결과
     */
    private Mono<EtlRunReport.PhaseReport> loadPhase(
            AtomicReference<EtlPhase> phase,
            EtlPhase next,
            Path root,
            Function<Path, Mono<FileIngestResult>> ingest
    ) {
        return Mono.fromRunnable(() -> enter(phase, next))
                .then(enumerator.listFiles(root, props.fileExtension()).collectList())
                .onErrorMap(e -> !(e instanceof EtlFailureException), e -> new EtlFailureException(next, root, e))
                .flatMap(files -> {
                    int total = files.size();
                    listeners.forEach(l -> l.onPhaseStarted(next, root, total));
                    AtomicInteger processed = new AtomicInteger();

                    return Flux.fromIterable(files)
                            .concatMap(file -> ingest.apply(file)
                                    .onErrorMap(e -> !(e instanceof EtlFailureException),
                                            e -> new EtlFailureException(next, file, e))
                                    .doOnSuccess(r -> fileProcessed(next, file, processed.incrementAndGet(), total)))
                            .reduce(FileIngestResult.EMPTY, FileIngestResult::plus)
                            .map(sum -> new EtlRunReport.PhaseReport(next, total, sum));
                });
    }

    /**
     * 두 데이터 루트를 적재 시작 전에 모두 검사합니다.
     *
     * @return 정상이면 완료, 아니면 INIT 단계의 {@link EtlFailureException}
     */
    private Mono<Void> verifyRoots() {
        return Flux.just(props.songDataRoot(), props.logDataRoot())
                .concatMap(root -> enumerator.verifyRoot(root)
                        .onErrorMap(e -> new EtlFailureException(EtlPhase.INIT, root, e)))
                .then();
    }

    private Mono<Long> postProcess(AtomicReference<EtlPhase> phase) {
        return Mono.fromRunnable(() -> enter(phase, EtlPhase.POST_PROCESS))
                .then(props.postProcessEnabled()
                        ? store.sentinelCleanup.nullifySentinels()
                        : Mono.just(0L));
    }

    private void enter(AtomicReference<EtlPhase> phase, EtlPhase next) {
        phase.set(next);
        listeners.forEach(l -> l.onPhaseChanged(next));
    }

    private void fileProcessed(EtlPhase phase, Path file, int processed, int total) {
        listeners.forEach(l -> l.onFileProcessed(phase, file, processed, total));
    }
}
