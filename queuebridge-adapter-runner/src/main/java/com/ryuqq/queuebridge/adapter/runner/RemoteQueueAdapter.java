package com.ryuqq.queuebridge.adapter.runner;

import com.ryuqq.queuebridge.adapter.runner.consumer.PollingConsumer;
import com.ryuqq.queuebridge.application.consumer.MessageConsumer;
import com.ryuqq.queuebridge.application.consumer.MessageHandler;
import com.ryuqq.queuebridge.application.queue.TaskQueue;
import com.ryuqq.queuebridge.core.codec.MessageCodec;
import com.ryuqq.queuebridge.core.codec.MessageDecodeException;
import com.ryuqq.queuebridge.core.dedup.DedupFilter;
import com.ryuqq.queuebridge.core.model.Message;
import com.ryuqq.queuebridge.core.model.RemoteMessage;
import com.ryuqq.queuebridge.core.model.ReservationRef;
import com.ryuqq.queuebridge.core.retry.RetryPolicy;
import com.ryuqq.queuebridge.core.spi.DedupStorage;
import com.ryuqq.queuebridge.core.spi.ErrorReason;
import com.ryuqq.queuebridge.core.spi.RemoteQueue;
import com.ryuqq.queuebridge.core.spi.RemoteQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP 폴링 원격 큐를 {@link TaskQueue}로 노출하는 어댑터.
 *
 * <p>원격 큐의 단순한 프리미티브 위에 비동기 enqueue, 배치 삭제, 재시도,
 * 큐 누락 복구를 조합합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link AddPipeline}: 중복 필터 → 로컬 버퍼 → push</li>
 *   <li>{@link DeletePipeline}: 로컬 버퍼 → Batcher → 배치 삭제</li>
 *   <li>{@link RetryPolicy}: release / delete 원격 호출 재시도 (5xx만)</li>
 *   <li>{@link PollingConsumer}: consumer() 첫 호출 시 생성</li>
 * </ul>
 *
 * <p><strong>예약 경로 (reserveN):</strong></p>
 * <pre>
 * longPoll(min(n, 100), reservationSeconds, waitSeconds)
 *   성공 → 각 레코드 독립 디코딩 (실패 시 msg.err), id / reservationId / reservedCount 설정
 *   404 MESSAGE_NOT_FOUND → 빈 목록
 *   404 QUEUE_NOT_FOUND → createQueue() (실패 무시) 후 원래 오류 throw
 *   그 외 → 그대로 throw
 * </pre>
 *
 * <p><strong>종료 순서 (closeTimeout):</strong></p>
 * <ol>
 *   <li>consumer 정지</li>
 *   <li>Batcher 종료 (열린 배치 flush)</li>
 *   <li>delete 버퍼 drain</li>
 *   <li>add 버퍼 drain</li>
 * </ol>
 * <p>첫 번째 오류를 throw하고, 이후 오류는 WARN 로그만 남깁니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class RemoteQueueAdapter implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(RemoteQueueAdapter.class);

    /**
     * 한 번의 예약으로 받을 수 있는 최대 Message 수.
     */
    public static final int MAX_RESERVE = 100;

    private final RemoteQueue remoteQueue;
    private final RemoteQueueAdapterConfig config;
    private final MessageHandler handler;
    private final String name;
    private final RetryPolicy retryPolicy;
    private final AddPipeline addPipeline;
    private final DeletePipeline deletePipeline;

    private volatile PollingConsumer consumer;

    /**
     * 기본 설정, 핸들러 없음, 중복 제거 없음으로 생성.
     *
     * @param remoteQueue 원격 큐
     */
    public RemoteQueueAdapter(RemoteQueue remoteQueue) {
        this(remoteQueue, new RemoteQueueAdapterConfig(), null, null);
    }

    /**
     * 기본 설정으로 생성.
     *
     * @param remoteQueue 원격 큐
     * @param handler consumer 및 add fallback 핸들러 (null 허용)
     */
    public RemoteQueueAdapter(RemoteQueue remoteQueue, MessageHandler handler) {
        this(remoteQueue, new RemoteQueueAdapterConfig(), handler, null);
    }

    /**
     * 생성자.
     *
     * <p>반환 전에 add / delete 파이프라인이 모두 시작됩니다.</p>
     *
     * @param remoteQueue 원격 큐
     * @param config 설정
     * @param handler consumer 및 add fallback 핸들러 (null 허용)
     * @param dedupStorage 중복 제거 저장소 (null이면 중복 제거 비활성화)
     * @throws IllegalArgumentException remoteQueue 또는 config가 null인 경우
     */
    public RemoteQueueAdapter(
        RemoteQueue remoteQueue,
        RemoteQueueAdapterConfig config,
        MessageHandler handler,
        DedupStorage dedupStorage
    ) {
        if (remoteQueue == null) {
            throw new IllegalArgumentException("remoteQueue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.remoteQueue = remoteQueue;
        this.config = config;
        this.handler = handler;
        this.name = config.name() != null ? config.name() : remoteQueue.name();
        this.retryPolicy = new RetryPolicy(config.retry());
        this.addPipeline = new AddPipeline(name, remoteQueue, new DedupFilter(dedupStorage, name), handler, config);
        this.deletePipeline = new DeletePipeline(name, remoteQueue, retryPolicy, config);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int len() {
        return remoteQueue.size();
    }

    @Override
    public void add(Message msg) {
        addPipeline.add(msg);
    }

    /**
     * 예약된 Message 삭제를 배치 삭제 파이프라인에 예약.
     *
     * @param msg 예약된 Message
     * @throws IllegalArgumentException 예약 정보가 없는 경우
     */
    public void scheduleDelete(Message msg) {
        deletePipeline.schedule(msg);
    }

    @Override
    public List<Message> reserveN(int n, Duration waitTimeout) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive (current: " + n + ")");
        }
        if (waitTimeout == null || waitTimeout.isNegative()) {
            throw new IllegalArgumentException("waitTimeout must be non-negative (current: " + waitTimeout + ")");
        }

        int limit = Math.min(n, MAX_RESERVE);
        int reservationSeconds = toSeconds(config.reservationTimeout());
        int waitSeconds = toSeconds(waitTimeout);

        List<RemoteMessage> records;
        try {
            records = remoteQueue.longPoll(limit, reservationSeconds, waitSeconds);
        } catch (RemoteQueueException e) {
            if (e.isNotFound()) {
                if (e.reason() == ErrorReason.MESSAGE_NOT_FOUND) {
                    return new ArrayList<>();
                }
                if (e.reason() == ErrorReason.QUEUE_NOT_FOUND) {
                    recreateQueue();
                }
            }
            throw e;
        }

        List<Message> messages = new ArrayList<>(records.size());
        for (RemoteMessage remoteMessage : records) {
            messages.add(toMessage(remoteMessage));
        }
        return messages;
    }

    @Override
    public void release(Message msg) {
        ReservationRef ref = ReservationRef.of(msg);
        long delaySeconds = msg.getDelay().getSeconds();
        retryPolicy.run(() -> remoteQueue.releaseMessage(ref.id(), ref.reservationId(), delaySeconds));
    }

    @Override
    public void delete(Message msg) {
        ReservationRef ref = ReservationRef.of(msg);
        try {
            retryPolicy.run(() -> remoteQueue.deleteMessage(ref.id(), ref.reservationId()));
        } catch (RemoteQueueException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.debug("Message {} already deleted from {}", ref.id(), name);
        }
    }

    @Override
    public void purge() {
        remoteQueue.clear();
    }

    @Override
    public MessageConsumer consumer() {
        PollingConsumer current = consumer;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (consumer == null) {
                if (handler == null) {
                    throw new IllegalStateException("no handler configured for queue " + name);
                }
                consumer = new PollingConsumer(this, handler, config.consumer(), this::scheduleDelete);
            }
            return consumer;
        }
    }

    @Override
    public void close() {
        closeTimeout(config.closeTimeout());
    }

    @Override
    public void closeTimeout(Duration timeout) {
        RuntimeException firstError = null;

        PollingConsumer current = consumer;
        if (current != null) {
            firstError = keepFirst(firstError, () -> current.stopTimeout(timeout));
        }
        firstError = keepFirst(firstError, deletePipeline::closeBatcher);
        firstError = keepFirst(firstError, () -> deletePipeline.closeTimeout(timeout));
        firstError = keepFirst(firstError, () -> addPipeline.closeTimeout(timeout));

        if (firstError != null) {
            throw firstError;
        }
        log.info("Queue {} closed", name);
    }

    /**
     * 통계 스냅샷.
     *
     * @return QueueStats
     */
    public QueueStats stats() {
        PollingConsumer current = consumer;
        return new QueueStats(
            addPipeline.stats(),
            deletePipeline.stats(),
            current == null ? null : current.stats()
        );
    }

    public RemoteQueueAdapterConfig getConfig() {
        return config;
    }

    private static int toSeconds(Duration duration) {
        return (int) Math.min(duration.getSeconds(), Integer.MAX_VALUE);
    }

    @Override
    public String toString() {
        return "RemoteQueueAdapter{queue=" + name + "}";
    }

    private Message toMessage(RemoteMessage remoteMessage) {
        Message msg;
        try {
            msg = MessageCodec.decodeString(remoteMessage.body());
        } catch (MessageDecodeException e) {
            msg = new Message();
            msg.setErr(e);
        }
        msg.setId(remoteMessage.id());
        msg.setReservationId(remoteMessage.reservationId());
        msg.setReservedCount(remoteMessage.reservedCount());
        return msg;
    }

    private void recreateQueue() {
        try {
            remoteQueue.createQueue();
            log.info("Queue {} was missing and has been recreated", name);
        } catch (RuntimeException e) {
            log.warn("Failed to recreate missing queue {}: {}", name, e.getMessage());
        }
    }

    private RuntimeException keepFirst(RuntimeException firstError, Runnable step) {
        try {
            step.run();
            return firstError;
        } catch (RuntimeException e) {
            if (firstError == null) {
                return e;
            }
            log.warn("Discarding close error on {}: {}", name, e.getMessage());
            return firstError;
        }
    }
}
