package com.ryuqq.queuebridge.adapter.runner.batch;

import java.util.List;

/**
 * 열린 배치에 다음 항목을 합칠지 결정하는 정책.
 *
 * @param <T> 항목 타입
 * @author QueueBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchPolicy<T> {

    /**
     * 다음 항목을 현재 배치에 추가할지 판단.
     *
     * @param batch 현재 열린 배치 (읽기 전용)
     * @param next 들어온 항목
     * @return true면 추가, false면 현재 배치를 flush한 뒤 새 배치 시작
     */
    boolean shouldBatch(List<T> batch, T next);

    /**
     * 배치 크기 상한 정책.
     *
     * <p>현재 배치에 항목을 하나 더해도 {@code limit}보다 작을 때만 추가합니다.
     * 따라서 한 번에 flush되는 배치는 최대 {@code limit - 1}개입니다.</p>
     *
     * @param limit 배치 상한
     * @param <T> 항목 타입
     * @return BatchPolicy
     */
    static <T> BatchPolicy<T> sizeLimit(int limit) {
        if (limit <= 1) {
            throw new IllegalArgumentException("limit must be greater than 1 (current: " + limit + ")");
        }
        return (batch, next) -> batch.size() + 1 < limit;
    }
}
