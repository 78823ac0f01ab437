package com.ryuqq.queuebridge.adapter.runner.workqueue;

import com.ryuqq.queuebridge.core.model.Envelope;

import java.util.concurrent.CompletionStage;

/**
 * 로컬 작업 큐의 항목 처리 핸들러.
 *
 * <p>반환된 stage가 정상 완료되면 항목은 처리 완료, 예외로 완료되면 재시도 대상입니다.
 * 동기 핸들러는 완료된 stage를 반환하면 됩니다. 배치 처리처럼 결과가 나중에 정해지는
 * 핸들러는 미완료 stage를 반환하고, 그동안 워커는 다음 항목을 처리합니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * 항목 처리.
     *
     * @param envelope 처리할 Envelope
     * @return 처리 완료 stage
     * @throws Exception 즉시 실패한 경우
     */
    CompletionStage<Void> handle(Envelope envelope) throws Exception;
}
