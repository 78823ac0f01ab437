package com.ryuqq.queuebridge.adapter.runner.batch;

import java.util.List;

/**
 * 배치 처리 핸들러.
 *
 * <p>정상 반환은 배치 전체 성공, 예외는 배치 전체 실패를 의미합니다.</p>
 *
 * @param <T> 항목 타입
 * @author QueueBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchHandler<T> {

    /**
     * 배치 처리.
     *
     * @param batch 처리할 항목 (순서 유지)
     * @throws Exception 배치 처리 실패 시
     */
    void handle(List<T> batch) throws Exception;
}
