package io.hhplus.bridge.domain.lifetime;

/**
 * 재계산 큐 drain 결과
 *
 * @param recomputed 재계산 함수가 호출된 소유자 수
 * @param updated    값이 바뀌어 저장된 소유자 수
 * @param skipped    식별자가 없어 건너뛴 소유자 수
 */
public record DrainResult(int recomputed, int updated, int skipped) {

    private static final DrainResult EMPTY = new DrainResult(0, 0, 0);

    public static DrainResult empty() {
        return EMPTY;
    }

    public boolean hasUpdates() {
        return updated > 0;
    }

    public int unchanged() {
        return recomputed - updated;
    }
}
