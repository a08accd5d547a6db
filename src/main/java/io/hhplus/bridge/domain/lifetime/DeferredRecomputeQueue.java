package io.hhplus.bridge.domain.lifetime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 트랜잭션 단위 지연 재계산 큐
 *
 * <p>동작:
 * <ul>
 *   <li>enqueue: 식별자 기준 중복 제거 (식별자가 없으면 인스턴스 기준)</li>
 *   <li>drain: 소유자별 1회 재계산, 값이 바뀐 소유자만 한 번에 저장</li>
 *   <li>drain이 끝나면 성공/실패와 무관하게 큐를 비운다</li>
 * </ul>
 *
 * <p>트랜잭션마다 별도 인스턴스를 사용하며 스레드 안전하지 않다.
 * drain 중 저장 콜백이 같은 큐를 다시 drain/enqueue 하면 무시된다.
 */
public class DeferredRecomputeQueue<T extends DerivedValueOwner> {

    private final Map<Object, T> queued = new LinkedHashMap<>();
    private boolean inProgress = false;

    /**
     * @return 새로 추가되었으면 true, 이미 있거나 drain 중이면 false
     */
    public boolean enqueue(T owner) {
        if (owner == null || inProgress) {
            return false;
        }
        return queued.putIfAbsent(keyOf(owner), owner) == null;
    }

    public void enqueueAll(Iterable<? extends T> owners) {
        for (T owner : owners) {
            enqueue(owner);
        }
    }

    /**
     * 대기 중인 소유자를 재계산하고 값이 바뀐 소유자를 저장한다.
     *
     * @param recompute 소유자의 새 파생 값 (커밋된 상태 기준, 읽기 전용)
     * @param persist   값이 바뀐 소유자 목록을 한 번에 저장, 변경이 없으면 호출되지 않음
     * @return drain 결과, 재진입 호출이면 빈 결과
     */
    public DrainResult drain(Function<? super T, Long> recompute, Consumer<? super List<T>> persist) {
        if (inProgress || queued.isEmpty()) {
            return DrainResult.empty();
        }

        inProgress = true;
        try {
            List<T> changed = new ArrayList<>();
            int recomputed = 0;
            int skipped = 0;

            for (T owner : queued.values()) {
                if (owner.getId() == null) {
                    // 저장되기 전에 삭제된 소유자
                    skipped++;
                    continue;
                }

                Long newValue = recompute.apply(owner);
                recomputed++;

                if (!Objects.equals(newValue, owner.getDerivedValue())) {
                    owner.changeDerivedValue(newValue);
                    changed.add(owner);
                }
            }

            if (!changed.isEmpty()) {
                persist.accept(List.copyOf(changed));
            }
            return new DrainResult(recomputed, changed.size(), skipped);
        } finally {
            queued.clear();
            inProgress = false;
        }
    }

    public void clear() {
        queued.clear();
    }

    public boolean isEmpty() {
        return queued.isEmpty();
    }

    public int size() {
        return queued.size();
    }

    public boolean isInProgress() {
        return inProgress;
    }

    private Object keyOf(T owner) {
        return owner.getId() != null ? owner.getId() : owner;
    }
}
