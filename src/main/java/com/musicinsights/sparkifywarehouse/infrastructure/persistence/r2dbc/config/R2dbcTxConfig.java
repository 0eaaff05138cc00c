package com.musicinsights.sparkifywarehouse.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * ETL 실행 전체를 하나의 Reactive 트랜잭션으로 묶기 위한 설정 클래스입니다.
 * <p>
 * {@link TransactionalOperator}는 커넥션 획득 → 작업 → commit 또는 rollback → 커넥션 반환을
 * 성공/실패/취소 모든 경로에서 보장합니다.
 */
@Configuration
public class R2dbcTxConfig {

    /** 로그와 DB 세션에서 식별 가능한 트랜잭션 이름 */
    public static final String ETL_TX_NAME = "sparkify-etl";

    /**
     * R2DBC용 트랜잭션 매니저를 생성합니다.
     *
     * @param cf R2DBC {@link ConnectionFactory}
     * @return Reactive 트랜잭션 매니저
     */
    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    /**
     * ETL 실행용 {@link TransactionalOperator}를 생성합니다.
     *
     * @param tm Reactive 트랜잭션 매니저
     * @return READ_COMMITTED, 새 트랜잭션으로 동작하는 operator
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm, etlTransactionDefinition());
    }

    /**
     * ETL 트랜잭션 정의. 테스트에서 같은 정의로 operator를 만들 때도 사용한다.
     *
     * @return 트랜잭션 정의
     */
    public static TransactionDefinition etlTransactionDefinition() {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setName(ETL_TX_NAME);
        def.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        return def;
    }
}
