package com.ryuqq.queuebridge.adapter.runner;

import com.ryuqq.queuebridge.adapter.runner.workqueue.LocalWorkQueue;
import com.ryuqq.queuebridge.adapter.runner.workqueue.PipelineTask;
import com.ryuqq.queuebridge.adapter.runner.workqueue.TaskHandler;
import com.ryuqq.queuebridge.adapter.runner.workqueue.WorkQueueConfig;
import com.ryuqq.queuebridge.adapter.runner.workqueue.WorkQueueStats;
import com.ryuqq.queuebridge.application.consumer.MessageHandler;
import com.ryuqq.queuebridge.core.codec.MessageCodec;
import com.ryuqq.queuebridge.core.dedup.DedupFilter;
import com.ryuqq.queuebridge.core.exception.DuplicateMessageException;
import com.ryuqq.queuebridge.core.exception.TaskNameRequiredException;
import com.ryuqq.queuebridge.core.model.Envelope;
import com.ryuqq.queuebridge.core.model.Message;
import com.ryuqq.queuebridge.core.spi.RemoteQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 비동기 enqueue 파이프라인.
 *
 * <p>호출자의 add를 로컬 버퍼에 넣고 즉시 반환하며, 워커가 원격 큐로 push합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * add(msg)
 *   1. taskName 없음 → TaskNameRequiredException (원격 호출 없음)
 *   2. 중복 → msg.err = DuplicateMessageException, 정상 반환 (push 없음)
 *   3. Envelope.wrap(msg, "{queue}:add-message") → 로컬 버퍼
 *
 * worker
 *   unwrap → encode → pushMessage(body, delaySeconds) → msg.id 설정
 *   실패 → 백오프 재시도 (최대 3회, 1초부터)
 *   소진 → fallback 핸들러가 있으면 원본 Message를 프로세스 내에서 처리
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class AddPipeline {

    private static final Logger log = LoggerFactory.getLogger(AddPipeline.class);

    private final RemoteQueue remoteQueue;
    private final DedupFilter dedupFilter;
    private final String handlerName;
    private final LocalWorkQueue workQueue;

    /**
     * 생성자.
     *
     * @param queueName 큐 이름
     * @param remoteQueue 원격 큐
     * @param dedupFilter 중복 필터
     * @param fallbackHandler 재시도 소진 시 원본 Message를 처리할 핸들러 (null 허용)
     * @param config 어댑터 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AddPipeline(
        String queueName,
        RemoteQueue remoteQueue,
        DedupFilter dedupFilter,
        MessageHandler fallbackHandler,
        RemoteQueueAdapterConfig config
    ) {
        if (remoteQueue == null) {
            throw new IllegalArgumentException("remoteQueue cannot be null");
        }
        if (dedupFilter == null) {
            throw new IllegalArgumentException("dedupFilter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.remoteQueue = remoteQueue;
        this.dedupFilter = dedupFilter;
        this.handlerName = queueName + ":add-message";

        PipelineTask task = new PipelineTask(
            handlerName,
            this::push,
            fallbackHandler == null ? null : fallback(fallbackHandler),
            config.taskRetryLimit(),
            config.taskMinBackoff(),
            config.taskMaxBackoff()
        );
        this.workQueue = new LocalWorkQueue(
            queueName + ":add",
            task,
            new WorkQueueConfig().withBufferSize(config.bufferSize())
        );
    }

    /**
     * Message를 로컬 버퍼에 추가.
     *
     * @param msg 추가할 Message
     * @throws TaskNameRequiredException taskName이 없는 경우
     * @throws IllegalStateException 파이프라인이 닫힌 경우
     */
    public void add(Message msg) {
        if (msg == null) {
            throw new IllegalArgumentException("msg cannot be null");
        }
        if (!msg.hasTaskName()) {
            throw new TaskNameRequiredException();
        }
        if (dedupFilter.isDuplicate(msg)) {
            String key = dedupFilter.fullMessageName(msg);
            msg.setErr(new DuplicateMessageException(key));
            log.debug("Duplicate message skipped: {}", key);
            return;
        }
        workQueue.add(Envelope.wrap(msg, handlerName));
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

    private CompletionStage<Void> push(Envelope envelope) {
        Message msg = envelope.unwrap();
        String body = MessageCodec.encodeToString(msg);
        String id = remoteQueue.pushMessage(body, msg.getDelay().getSeconds());
        msg.setId(id);
        log.debug("Message pushed to {}: id={}, task={}", remoteQueue.name(), id, msg.getTaskName());
        return CompletableFuture.completedFuture(null);
    }

    private static TaskHandler fallback(MessageHandler handler) {
        return envelope -> {
            handler.handleMessage(envelope.unwrap());
            return CompletableFuture.completedFuture(null);
        };
    }
}
