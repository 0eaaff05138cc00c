package com.musicinsights.sparkifywarehouse.application.etl;

import com.musicinsights.sparkifywarehouse.application.common.error.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * 잘못된 레코드를 건너뛸지, 실행 전체를 중단할지 결정한다({@code sparkify.etl.skip-malformed-records}).
 */
@Component
public class MalformedRecordPolicy {

    private static final Logger log = LoggerFactory.getLogger(MalformedRecordPolicy.class);

    private final boolean skip;

    public MalformedRecordPolicy(EtlProperties props) {
        this.skip = props.skipMalformedRecords();
    }

    /**
     * 파일에서 나온 실패 레코드를 정책에 따라 처리한다.
     *
     * @param file     파일 경로
     * @param rejected 실패 레코드 예외 목록
     * @return skip이면 건너뛴 수, abort면 첫 번째 예외로 에러 시그널
     */
    public Mono<Long> apply(Path file, List<MalformedRecordException> rejected) {
        if (rejected.isEmpty()) return Mono.just(0L);
        if (!skip) return Mono.error(rejected.get(0));

        for (MalformedRecordException e : rejected) {
            log.warn("skipping malformed record in {}: {}", file, e.getMessage());
        }
        return Mono.just((long) rejected.size());
    }

    public boolean skip() {
        return skip;
    }
}
