package com.musicinsights.sparkifywarehouse.infrastructure.input.json;

import com.musicinsights.sparkifywarehouse.application.common.error.DataDirectoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * 루트 디렉터리 아래의 데이터 파일을 재귀적으로 나열하는 컴포넌트입니다.
 * <p>
 * {@link Files#walk(Path, java.nio.file.FileVisitOption...)}의 lazy 스트림을 {@link Flux#using}으로 감싸
 * 구독이 끝나면 디렉터리 핸들을 닫습니다. 순서는 디렉터리 탐색 순서이며 정렬하지 않습니다.
 */
@Component
public class JsonFileEnumerator {

    private static final Logger log = LoggerFactory.getLogger(JsonFileEnumerator.class);

    /**
     * 루트 아래에서 확장자가 일치하는 파일의 절대 경로를 방출합니다.
     *
     * <ul>
     *     <li>루트가 없으면 경고만 남기고 빈 Flux</li>
     *     <li>루트가 디렉터리가 아니거나 읽을 수 없으면 {@link DataDirectoryException}</li>
     *     <li>숨김 파일(이름이 '.'으로 시작)은 제외</li>
     * </ul>
     *
     * @param root      탐색 시작 디렉터리
     * @param extension 파일 확장자 (예: {@code .json})
     * @return 절대 경로 Flux (한 번만 구독 가능한 단일 탐색)
     */
    public Flux<Path> listFiles(Path root, String extension) {
        return Flux.defer(() -> {
                    if (Files.notExists(root)) {
                        log.warn("Data directory does not exist, nothing to load: {}", root.toAbsolutePath());
                        return Flux.<Path>empty();
                    }
                    if (!readableDirectory(root)) {
                        return Flux.<Path>error(new DataDirectoryException(root, "not a readable directory"));
                    }
                    return Flux.using(
                            () -> Files.walk(root),
                            paths -> Flux.fromStream(paths
                                    .filter(Files::isRegularFile)
                                    .filter(p -> matches(p, extension))
                                    .map(p -> p.toAbsolutePath().normalize())),
                            Stream::close
                    );
                })
                .onErrorMap(UncheckedIOException.class,
                        e -> new DataDirectoryException(root, "failed to walk directory", e.getCause()))
                .subscribeOn(Schedulers.boundedElastic()); // 디렉터리 탐색은 blocking
    }

    /**
     * 적재를 시작하기 전에 루트를 검사합니다. 없는 루트는 통과시킵니다(빈 결과로 처리).
     *
     * @param root 탐색 시작 디렉터리
     * @return 정상이면 완료, 디렉터리가 아니거나 읽을 수 없으면 {@link DataDirectoryException}
     */
    public Mono<Void> verifyRoot(Path root) {
        return Mono.<Void>fromRunnable(() -> {
                    if (Files.exists(root) && !readableDirectory(root)) {
                        throw new DataDirectoryException(root, "not a readable directory");
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static boolean readableDirectory(Path root) {
        return Files.isDirectory(root) && Files.isReadable(root);
    }

    private static boolean matches(Path file, String extension) {
        String name = file.getFileName().toString();
        return !name.startsWith(".") && name.endsWith(extension);
    }
}
