package com.ryuqq.queuebridge.adapter.runner.consumer;

import com.ryuqq.queuebridge.adapter.runner.workqueue.BackoffCalculator;
import com.ryuqq.queuebridge.application.consumer.ConsumerStats;
import com.ryuqq.queuebridge.application.consumer.MessageConsumer;
import com.ryuqq.queuebridge.application.consumer.MessageHandler;
import com.ryuqq.queuebridge.application.queue.TaskQueue;
import com.ryuqq.queuebridge.core.exception.DrainTimeoutException;
import com.ryuqq.queuebridge.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 예약 기반 Message Consumer 구현체.
 *
 * <p>{@link TaskQueue}에서 Message를 예약하고, {@link MessageHandler}로 처리한 뒤
 * 결과에 따라 삭제하거나 release합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>reserveN으로 Message 배치 예약</li>
 *   <li>워커 풀을 통한 동시 처리 (concurrency 제한)</li>
 *   <li>성공 시 삭제, 실패 시 백오프 지연을 설정하여 release</li>
 *   <li>reservedCount가 retryLimit에 도달한 Message는 poison message로 삭제</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * reserveN(batchSize, waitTimeout) → [Message1, Message2, ...]
 *   ↓
 * For each Message (워커 풀):
 *   1. msg.err != null (디코딩 실패) → 실패로 처리
 *   2. handler.handleMessage(msg)
 *   3. 성공 → deleter.accept(msg)
 *   4. 실패:
 *      - reservedCount >= retryLimit → ERROR 로그 + 삭제
 *      - 그 외 → msg.delay = backoff(reservedCount) → release(msg)
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class PollingConsumer implements MessageConsumer {

    private static final Logger log = LoggerFactory.getLogger(PollingConsumer.class);
    private static final long CAPACITY_POLL_INTERVAL_MS = 10;

    private final TaskQueue queue;
    private final MessageHandler handler;
    private final ConsumerConfig config;
    private final Consumer<Message> deleter;
    private final BackoffCalculator backoffCalculator;
    private final ExecutorService workerExecutor;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong reserved = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong poisoned = new AtomicLong();

    private volatile Thread poller;
    private volatile boolean stopped;

    /**
     * 생성자 (성공한 Message는 {@link TaskQueue#delete(Message)}로 삭제).
     *
     * @param queue 대상 큐
     * @param handler Message 핸들러
     * @param config 설정
     */
    public PollingConsumer(TaskQueue queue, MessageHandler handler, ConsumerConfig config) {
        this(queue, handler, config, queue == null ? null : queue::delete);
    }

    /**
     * 생성자 (커스텀 삭제 경로 주입).
     *
     * @param queue 대상 큐
     * @param handler Message 핸들러
     * @param config 설정
     * @param deleter 처리 완료 및 poison Message 삭제 경로
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollingConsumer(TaskQueue queue, MessageHandler handler, ConsumerConfig config, Consumer<Message> deleter) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (deleter == null) {
            throw new IllegalArgumentException("deleter cannot be null");
        }

        this.queue = queue;
        this.handler = handler;
        this.config = config;
        this.deleter = deleter;
        this.backoffCalculator = new BackoffCalculator(config.minBackoff(), config.maxBackoff());
        AtomicInteger counter = new AtomicInteger();
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), runnable -> {
            Thread thread = new Thread(runnable, queue.name() + "-consumer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public int pump() {
        if (stopped) {
            throw new IllegalStateException("consumer for " + queue.name() + " is stopped");
        }

        // 1. 배치 예약
        List<Message> messages = queue.reserveN(config.reserveBatchSize(), config.waitTimeout());
        reserved.addAndGet(messages.size());

        // 2. 각 Message를 워커 풀에 제출
        for (Message msg : messages) {
            inFlight.incrementAndGet();
            try {
                workerExecutor.submit(() -> process(msg));
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                log.warn("Consumer for {} stopped, message {} left to reservation timeout", queue.name(), msg.getId());
            }
        }
        return messages.size();
    }

    @Override
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("consumer for " + queue.name() + " is stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::pollLoop, queue.name() + "-poller");
        thread.setDaemon(true);
        poller = thread;
        thread.start();
        log.info("Consumer started for {} (concurrency={}, batchSize={})",
            queue.name(), config.concurrency(), config.reserveBatchSize());
    }

    @Override
    public synchronized void stopTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        if (stopped) {
            return;
        }
        stopped = true;
        running.set(false);
        long deadline = System.nanoTime() + timeout.toNanos();

        Thread thread = poller;
        if (thread != null) {
            thread.interrupt();
            joinUntil(thread, deadline);
        }

        workerExecutor.shutdown();
        boolean terminated = awaitTermination(deadline);
        if (!terminated) {
            workerExecutor.shutdownNow();
            int remaining = inFlight.get();
            log.warn("Consumer for {} stopped with {} messages in flight", queue.name(), remaining);
            throw new DrainTimeoutException("consumer " + queue.name(), timeout, remaining);
        }
        log.info("Consumer stopped for {} (processed={}, failed={}, poisoned={})",
            queue.name(), processed.get(), failed.get(), poisoned.get());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public ConsumerStats stats() {
        return new ConsumerStats(reserved.get(), processed.get(), failed.get(), poisoned.get());
    }

    private void pollLoop() {
        while (running.get()) {
            if (!awaitCapacity()) {
                return;
            }
            try {
                int count = pump();
                if (count == 0 && config.waitTimeout().isZero()) {
                    sleep(config.errorBackoff());
                }
            } catch (RuntimeException e) {
                if (!running.get()) {
                    return;
                }
                log.warn("Reserve failed on {}: {}", queue.name(), e.getMessage());
                sleep(config.errorBackoff());
            }
        }
    }

    private void process(Message msg) {
        try {
            Throwable failure = msg.getErr();
            if (failure == null) {
                try {
                    handler.handleMessage(msg);
                } catch (Exception e) {
                    failure = e;
                }
            }

            if (failure == null) {
                processed.incrementAndGet();
                deleteQuietly(msg);
            } else {
                handleFailure(msg, failure);
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void handleFailure(Message msg, Throwable failure) {
        msg.setErr(failure);

        if (msg.getReservedCount() >= config.retryLimit()) {
            poisoned.incrementAndGet();
            log.error("Message {} on {} failed {} times, deleting", msg.getId(), queue.name(), msg.getReservedCount(), failure);
            deleteQuietly(msg);
            return;
        }

        failed.incrementAndGet();
        msg.setDelay(backoffCalculator.delayFor(Math.max(msg.getReservedCount(), 1)));
        try {
            queue.release(msg);
            log.warn("Message {} on {} released with delay {}ms: {}",
                msg.getId(), queue.name(), msg.getDelay().toMillis(), failure.getMessage());
        } catch (RuntimeException e) {
            log.error("Release failed for message {} on {}", msg.getId(), queue.name(), e);
        }
    }

    private void deleteQuietly(Message msg) {
        try {
            deleter.accept(msg);
        } catch (RuntimeException e) {
            log.error("Delete failed for message {} on {}", msg.getId(), queue.name(), e);
        }
    }

    private boolean awaitCapacity() {
        while (inFlight.get() >= config.concurrency()) {
            if (!running.get()) {
                return false;
            }
            try {
                Thread.sleep(CAPACITY_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return running.get();
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    private static void joinUntil(Thread thread, long deadline) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        try {
            thread.join(Math.max(remainingMs, 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean awaitTermination(long deadline) {
        long remainingNanos = deadline - System.nanoTime();
        try {
            return workerExecutor.awaitTermination(Math.max(remainingNanos, 0), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
