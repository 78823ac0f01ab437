package com.ryuqq.queuebridge.adapter.runner;

import com.ryuqq.queuebridge.adapter.runner.batch.BatchPolicy;
import com.ryuqq.queuebridge.adapter.runner.batch.Batcher;
import com.ryuqq.queuebridge.adapter.runner.batch.BatcherConfig;
import com.ryuqq.queuebridge.adapter.runner.workqueue.LocalWorkQueue;
import com.ryuqq.queuebridge.adapter.runner.workqueue.PipelineTask;
import com.ryuqq.queuebridge.adapter.runner.workqueue.WorkQueueConfig;
import com.ryuqq.queuebridge.adapter.runner.workqueue.WorkQueueStats;
import com.ryuqq.queuebridge.core.model.Envelope;
import com.ryuqq.queuebridge.core.model.Message;
import com.ryuqq.queuebridge.core.model.ReservationRef;
import com.ryuqq.queuebridge.core.retry.RetryPolicy;
import com.ryuqq.queuebridge.core.spi.RemoteQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 배치 삭제 파이프라인.
 *
 * <p>처리 완료된 Message의 삭제를 로컬 버퍼에 모은 뒤, {@link Batcher}로 묶어
 * 원격 호출 한 번에 최대 9개씩 삭제합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * schedule(msg) → Envelope.wrap(msg, "{queue}:delete-message") → 로컬 버퍼 (워커 1개)
 *   ↓
 * worker → batcher.add(msg)
 *   ↓ (배치 가득 참 / flush 타이머 / close)
 * deleteBatch([msg1..msgN]) → RetryPolicy → deleteReservedMessages(refs)
 *   성공 → 모든 항목 완료
 *   실패 → ERROR 로그, 모든 항목 실패 → 로컬 큐가 항목별로 재시도
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class DeletePipeline {

    private static final Logger log = LoggerFactory.getLogger(DeletePipeline.class);

    /**
     * 원격 배치 삭제 한 번의 상한.
     */
    public static final int BATCH_LIMIT = 10;

    private final RemoteQueue remoteQueue;
    private final RetryPolicy retryPolicy;
    private final String handlerName;
    private final Batcher<Message> batcher;
    private final LocalWorkQueue workQueue;

    /**
     * 생성자.
     *
     * @param queueName 큐 이름
     * @param remoteQueue 원격 큐
     * @param retryPolicy 원격 호출 재시도 정책
     * @param config 어댑터 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeletePipeline(
        String queueName,
        RemoteQueue remoteQueue,
        RetryPolicy retryPolicy,
        RemoteQueueAdapterConfig config
    ) {
        if (remoteQueue == null) {
            throw new IllegalArgumentException("remoteQueue cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.remoteQueue = remoteQueue;
        this.retryPolicy = retryPolicy;
        this.handlerName = queueName + ":delete-message";
        this.batcher = new Batcher<>(
            queueName + ":delete",
            this::deleteBatch,
            BatchPolicy.sizeLimit(BATCH_LIMIT),
            new BatcherConfig(config.flushTimeout())
        );

        PipelineTask task = new PipelineTask(
            handlerName,
            envelope -> batcher.add(envelope.unwrap()),
            null,
            config.taskRetryLimit(),
            config.taskMinBackoff(),
            config.taskMaxBackoff()
        );
        this.workQueue = new LocalWorkQueue(
            queueName + ":delete",
            task,
            new WorkQueueConfig().withBufferSize(config.bufferSize()).withWorkers(1)
        );
    }

    /**
     * 예약된 Message 삭제 예약.
     *
     * @param msg 예약된 Message
     * @throws IllegalArgumentException 예약 정보가 없는 경우
     * @throws IllegalStateException 파이프라인이 닫힌 경우
     */
    public void schedule(Message msg) {
        // 예약 정보 검증
        ReservationRef.of(msg);
        workQueue.add(Envelope.wrap(msg, handlerName));
    }

    /**
     * 배치 삭제 실행.
     *
     * @param msgs 삭제할 Message (1개 이상)
     * @throws IllegalStateException msgs가 비어 있는 경우
     * @throws com.ryuqq.queuebridge.core.spi.RemoteQueueException 원격 삭제 실패 시
     */
    void deleteBatch(List<Message> msgs) {
        if (msgs.isEmpty()) {
            throw new IllegalStateException("no messages to delete");
        }

        List<ReservationRef> refs = new ArrayList<>(msgs.size());
        for (Message msg : msgs) {
            refs.add(ReservationRef.of(msg));
        }

        try {
            retryPolicy.run(() -> remoteQueue.deleteReservedMessages(refs));
        } catch (RuntimeException e) {
            log.error("DeleteReservedMessages failed on {} ({} messages)", remoteQueue.name(), refs.size(), e);
            throw e;
        }
        log.debug("Deleted {} messages from {}", refs.size(), remoteQueue.name());
    }

    /**
     * Batcher 종료 (열린 배치 flush).
     */
    public void closeBatcher() {
        batcher.close();
    }

    /**
     * 버퍼를 비우고 종료.
     *
     * @param timeout drain 기한
     */
    public void closeTimeout(Duration timeout) {
        workQueue.closeTimeout(timeout);
    }

    public WorkQueueStats stats() {
        return workQueue.stats();
    }

    public String getHandlerName() {
        return handlerName;
    }
}
