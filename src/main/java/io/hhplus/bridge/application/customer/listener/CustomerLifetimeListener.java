package io.hhplus.bridge.application.customer.listener;

import io.hhplus.bridge.application.customer.CustomerLifetimeChangeClassifier;
import io.hhplus.bridge.application.customer.LifetimeProcessor;
import io.hhplus.bridge.common.exception.BusinessException;
import io.hhplus.bridge.common.exception.ErrorCode;
import io.hhplus.bridge.config.LifetimeProperties;
import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.customer.CustomerRepository;
import io.hhplus.bridge.domain.lifetime.DrainResult;
import io.hhplus.bridge.domain.lifetime.PendingMutation;
import io.hhplus.bridge.infrastructure.metrics.LifetimeMetrics;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * 고객 생애 가치 트랜잭션 리스너
 *
 * <p>상태 전이 (트랜잭션 단위):
 * <pre>
 * Idle → Collecting (beforeCommit: flush + 분류 + 큐 적재)
 *      → Draining   (afterCommit: REQUIRES_NEW 트랜잭션에서 재계산 + 일괄 저장)
 *      → Idle       (afterCompletion: 항상 정리)
 * </pre>
 *
 * <p>변경 기록은 Hibernate Interceptor(LifetimeTrackingInterceptor)가 전달한다.
 * 롤백된 트랜잭션의 큐는 재계산 없이 버려진다.
 */
@Slf4j
@Component
public class CustomerLifetimeListener {

    private final CustomerLifetimeChangeClassifier classifier;
    private final LifetimeProcessor lifetimeProcessor;
    private final CustomerRepository customerRepository;
    private final EntityManager entityManager;
    private final LifetimeMetrics metrics;
    private final LifetimeProperties lifetimeProperties;
    private final TransactionTemplate drainTransactionTemplate;

    public CustomerLifetimeListener(
            CustomerLifetimeChangeClassifier classifier,
            LifetimeProcessor lifetimeProcessor,
            CustomerRepository customerRepository,
            EntityManager entityManager,
            LifetimeMetrics metrics,
            LifetimeProperties lifetimeProperties,
            PlatformTransactionManager transactionManager
    ) {
        this.classifier = classifier;
        this.lifetimeProcessor = lifetimeProcessor;
        this.customerRepository = customerRepository;
        this.entityManager = entityManager;
        this.metrics = metrics;
        this.lifetimeProperties = lifetimeProperties;

        // 커밋 이후의 쓰기는 원 트랜잭션에 참여할 수 없으므로 항상 새 트랜잭션
        this.drainTransactionTemplate = new TransactionTemplate(transactionManager);
        this.drainTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 현재 트랜잭션의 추적을 시작한다 (변경 없이 컨텍스트만 연다).
     * <p>
     * 커밋 시점 flush에서야 드러나는 dirty checking UPDATE도 beforeCommit에서 분류되도록,
     * 연관 엔티티가 로드되는 시점에 호출된다.
     */
    public void track() {
        currentContext();
    }

    public void record(PendingMutation mutation) {
        LifetimeTransactionContext context = currentContext();
        if (context == null) {
            return;
        }
        log.debug("변경 기록: entity={}, id={}, kind={}, changedFields={}",
                mutation.entity().getClass().getSimpleName(), mutation.entityId(),
                mutation.kind(), mutation.changedFields());
        context.record(mutation);
    }

    /**
     * 현재 트랜잭션의 컨텍스트, 없으면 생성 후 바인딩
     *
     * @return 추적 대상 트랜잭션이 아니면 null
     */
    LifetimeTransactionContext currentContext() {
        if (!lifetimeProperties.isEnabled()
                || !TransactionSynchronizationManager.isSynchronizationActive()
                || !TransactionSynchronizationManager.isActualTransactionActive()
                || TransactionSynchronizationManager.isCurrentTransactionReadOnly()) {
            return null;
        }

        LifetimeTransactionContext context =
                (LifetimeTransactionContext) TransactionSynchronizationManager.getResource(this);
        if (context == null) {
            context = new LifetimeTransactionContext();
            TransactionSynchronizationManager.bindResource(this, context);
            TransactionSynchronizationManager.registerSynchronization(new LifetimeSynchronization(context));
        }
        return context;
    }

    /**
     * Collecting: 대기 중인 변경을 분류해 큐에 적재
     */
    void collect(LifetimeTransactionContext context) {
        List<PendingMutation> mutations = context.takeMutations();
        if (mutations.isEmpty()) {
            return;
        }

        List<Customer> owners = classifier.classify(mutations);
        context.queue().enqueueAll(owners);

        log.debug("생애 가치 재계산 대상 분류: mutations={}, scheduled={}", mutations.size(), owners.size());
    }

    /**
     * Draining: 커밋 이후 새 트랜잭션에서 재계산 + 일괄 저장
     */
    void drain(LifetimeTransactionContext context) {
        if (!context.hasMutations() && context.queue().isEmpty()) {
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            DrainResult result = drainTransactionTemplate.execute(status -> {
                if (context.hasMutations()) {
                    // beforeCommit 이후에 기록된 변경 (커밋 시점 flush)
                    collect(context);
                }
                return context.queue().drain(
                    lifetimeProcessor::calculateLifetimeValue,
                    customerRepository::saveAll
                );
            });

            if (result != null) {
                metrics.recordDrain(result, startTime);
                log.info("고객 생애 가치 재계산 완료: recomputed={}, updated={}, skipped={}",
                        result.recomputed(), result.updated(), result.skipped());
            }
        } catch (RuntimeException e) {
            metrics.recordDrainFailure(startTime);
            log.error("고객 생애 가치 재계산 실패 (저장 없음): queued={}", context.queue().size(), e);
            throw new BusinessException(
                ErrorCode.LIFETIME_RECALCULATION_FAILED,
                "커밋 이후 고객 생애 가치 재계산에 실패했습니다: " + e.getMessage(),
                e
            );
        }
    }

    /**
     * 트랜잭션 하나의 수명 주기에 맞춘 콜백
     */
    private class LifetimeSynchronization implements TransactionSynchronization {

        private final LifetimeTransactionContext context;

        LifetimeSynchronization(LifetimeTransactionContext context) {
            this.context = context;
        }

        @Override
        public void suspend() {
            // REQUIRES_NEW 등으로 중단되면 내부 트랜잭션은 자기 컨텍스트를 갖는다
            TransactionSynchronizationManager.unbindResourceIfPossible(CustomerLifetimeListener.this);
        }

        @Override
        public void resume() {
            TransactionSynchronizationManager.bindResource(CustomerLifetimeListener.this, context);
        }

        @Override
        public void beforeCommit(boolean readOnly) {
            if (!readOnly) {
                // 남은 dirty 엔티티를 내보내 UPDATE 기록을 확정
                entityManager.flush();
            }
            collect(context);
        }

        @Override
        public void afterCommit() {
            drain(context);
        }

        @Override
        public void afterCompletion(int status) {
            TransactionSynchronizationManager.unbindResourceIfPossible(CustomerLifetimeListener.this);
            if (status != STATUS_COMMITTED && !context.queue().isEmpty()) {
                log.debug("롤백된 트랜잭션의 재계산 큐 폐기: queued={}", context.queue().size());
            }
            context.clear();
        }
    }
}
