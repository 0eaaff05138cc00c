package com.musicinsights.sparkifywarehouse.infrastructure.input.json;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.MappingIterator;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 데이터 파일의 JSON 레코드를 DTO로 읽는 리더입니다.
 * <p>
 * {@link MappingIterator}로 루트 레벨 값을 차례로 읽으므로 다음 형식을 모두 지원합니다.
 * <ul>
 *     <li>NDJSON: 한 줄에 JSON 객체 하나 (song_data, log_data 기본 형식)</li>
 *     <li>여러 줄에 걸친(pretty-printed) 객체, 공백으로 이어 붙인 객체들</li>
 *     <li>JSON 배열: 파일 전체가 {@code [ {...}, {...} ]}</li>
 * </ul>
 * 레코드는 먼저 트리로 읽고 DTO로 바꾸므로, 타입이 맞지 않는 레코드는 그 레코드만 rejected가 됩니다.
 * 문법 오류를 만나면 그 앞까지 읽은 레코드는 유지하고, 나머지는 rejected 한 건으로 남깁니다.
 */
@Component
public class JsonRecordReader {

    /** 레코드 → DTO 변환용 ObjectMapper */
    private final ObjectMapper mapper;

    public JsonRecordReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 파싱 결과 묶음.
     *
     * @param records  파싱에 성공한 레코드 (파일 순서 유지)
     * @param rejected 파싱에 실패한 레코드의 예외
     */
    public record Parsed<T>(List<T> records, List<MalformedRecordException> rejected) {}

    /**
     * 파일 하나를 읽어 DTO 목록과 실패 레코드로 나눕니다.
     *
     * @param file 데이터 파일 경로
     * @param type 대상 타입
     * @return 성공/실패 묶음 (파일이 없거나 읽을 수 없으면 에러 시그널)
     */
    public <T> Mono<Parsed<T>> readFile(Path file, Class<T> type) {
        return Mono.fromCallable(() -> readBlocking(file, type))
                .subscribeOn(Schedulers.boundedElastic()); // blocking IO는 elastic으로
    }

    /**
     * JSON 문자열 하나를 DTO로 파싱합니다.
     *
     * @param json JSON 문자열
     * @param type 대상 타입
     * @return 파싱된 DTO
     * @throws MalformedRecordException JSON 파싱 실패 시
     */
    public <T> T parse(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JacksonException e) {
            throw new MalformedRecordException(null, "JSON parse error: " + e.getOriginalMessage(), e);
        }
    }

    private <T> Parsed<T> readBlocking(Path file, Class<T> type) throws IOException {
        List<T> ok = new ArrayList<>();
        List<MalformedRecordException> rejected = new ArrayList<>();
        ObjectReader trees = mapper.readerFor(JsonNode.class);

        try (InputStream in = Files.newInputStream(file);
             MappingIterator<JsonNode> it = trees.readValues(in)) {
            int index = 0;
            while (true) {
                JsonNode node;
                try {
                    if (!it.hasNextValue()) break;
                    node = it.nextValue();
                } catch (JacksonException e) {
                    // 문법 오류 이후로는 레코드 경계를 신뢰할 수 없다
                    rejected.add(new MalformedRecordException(null,
                            "JSON parse error at record #" + index + ", rest of file skipped: "
                                    + e.getOriginalMessage(), e));
                    break;
                }
                if (node == null || !node.isObject()) {
                    rejected.add(new MalformedRecordException(null, "record #" + index + " is not a JSON object"));
                    index++;
                    continue;
                }
                try {
                    ok.add(mapper.treeToValue(node, type));
                } catch (JacksonException e) {
                    rejected.add(new MalformedRecordException(null,
                            "record #" + index + " does not match " + type.getSimpleName() + ": "
                                    + e.getOriginalMessage(), e));
                }
                index++;
            }
        }
        return new Parsed<>(ok, rejected);
    }
}
