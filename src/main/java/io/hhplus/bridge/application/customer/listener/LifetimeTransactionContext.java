package io.hhplus.bridge.application.customer.listener;

import io.hhplus.bridge.domain.customer.Customer;
import io.hhplus.bridge.domain.lifetime.DeferredRecomputeQueue;
import io.hhplus.bridge.domain.lifetime.PendingMutation;

import java.util.ArrayList;
import java.util.List;

/**
 * 트랜잭션 하나에 묶인 변경 기록 + 재계산 큐
 *
 * 트랜잭션 리소스로 바인딩되며 트랜잭션 간에 공유되지 않는다.
 */
class LifetimeTransactionContext {

    private final List<PendingMutation> mutations = new ArrayList<>();
    private final DeferredRecomputeQueue<Customer> queue = new DeferredRecomputeQueue<>();

    void record(PendingMutation mutation) {
        mutations.add(mutation);
    }

    /**
     * 아직 분류되지 않은 변경을 꺼낸다.
     */
    List<PendingMutation> takeMutations() {
        List<PendingMutation> taken = List.copyOf(mutations);
        mutations.clear();
        return taken;
    }

    boolean hasMutations() {
        return !mutations.isEmpty();
    }

    DeferredRecomputeQueue<Customer> queue() {
        return queue;
    }

    void clear() {
        mutations.clear();
        queue.clear();
    }
}
