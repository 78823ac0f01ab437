package com.ryuqq.queuebridge.adapter.runner.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 항목을 모아 한 번에 처리하는 배치 수집기.
 *
 * <p>각 항목은 자신이 속한 배치가 처리될 때 완료되는 future를 받습니다.
 * 배치 전체가 성공하면 모든 future가 정상 완료되고, 실패하면 모두 같은 예외로 완료됩니다.</p>
 *
 * <p><strong>flush 시점:</strong></p>
 * <ul>
 *   <li>{@link BatchPolicy}가 다음 항목을 거부할 때 (현재 배치 flush 후 새 배치 시작)</li>
 *   <li>배치가 열린 뒤 flushTimeout이 지났을 때</li>
 *   <li>{@link #close()} 호출 시 (열린 배치를 비동기로 flush)</li>
 * </ul>
 *
 * <p>close 이후 들어오는 항목은 하나씩 즉시 처리됩니다.</p>
 *
 * <p><strong>동시성:</strong> 수집과 flush는 하나의 락을 공유하므로 동시에 둘 이상의 flush가
 * 실행되지 않으며, flush 중에 들어온 항목은 flush가 끝날 때까지 대기합니다.</p>
 *
 * @param <T> 항목 타입
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class Batcher<T> {

    private static final Logger log = LoggerFactory.getLogger(Batcher.class);

    private final String name;
    private final BatchHandler<T> handler;
    private final BatchPolicy<T> policy;
    private final BatcherConfig config;
    private final ScheduledExecutorService timer;
    private final ReentrantLock lock = new ReentrantLock();

    private List<Entry<T>> batch = new ArrayList<>();
    private ScheduledFuture<?> flushTask;
    private long generation;
    private boolean closed;

    /**
     * 생성자.
     *
     * @param name 로그용 이름
     * @param handler 배치 처리 핸들러
     * @param policy 배치 정책
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Batcher(String name, BatchHandler<T> handler, BatchPolicy<T> policy, BatcherConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.handler = handler;
        this.policy = policy;
        this.config = config;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, name + "-flush");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 항목 추가.
     *
     * <p>정책이 항목을 거부하면 현재 스레드에서 열린 배치를 먼저 flush합니다.</p>
     *
     * @param item 추가할 항목
     * @return 항목이 속한 배치가 처리되면 완료되는 future
     */
    public CompletableFuture<Void> add(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        Entry<T> entry = new Entry<>(item, new CompletableFuture<>());

        lock.lock();
        try {
            if (closed) {
                process(List.of(entry));
                return entry.future();
            }

            if (!batch.isEmpty() && !policy.shouldBatch(items(batch), item)) {
                flushLocked();
            }
            batch.add(entry);
            if (batch.size() == 1) {
                scheduleFlush();
            }
        } finally {
            lock.unlock();
        }
        return entry.future();
    }

    /**
     * 열린 배치를 즉시 flush.
     */
    public void flush() {
        lock.lock();
        try {
            flushLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Batcher 종료.
     *
     * <p>열린 배치는 flush 스레드에서 비동기로 처리되고, 호출자는 기다리지 않습니다.
     * 결과는 각 항목의 future로 전달됩니다.</p>
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            cancelFlush();

            List<Entry<T>> remaining = batch;
            batch = new ArrayList<>();
            if (!remaining.isEmpty()) {
                timer.execute(() -> {
                    lock.lock();
                    try {
                        process(remaining);
                    } finally {
                        lock.unlock();
                    }
                });
            }
            timer.shutdown();
        } finally {
            lock.unlock();
        }
        log.debug("Batcher {} closed", name);
    }

    /**
     * 열린 배치 크기.
     *
     * @return 아직 flush되지 않은 항목 수
     */
    public int size() {
        lock.lock();
        try {
            return batch.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void flushLocked() {
        cancelFlush();
        if (batch.isEmpty()) {
            return;
        }
        List<Entry<T>> current = batch;
        batch = new ArrayList<>();
        process(current);
    }

    private void scheduleFlush() {
        long scheduledGeneration = ++generation;
        try {
            flushTask = timer.schedule(
                () -> flushOnTimeout(scheduledGeneration),
                config.flushTimeout().toMillis(),
                TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            log.warn("Batcher {} could not schedule flush timer", name);
        }
    }

    private void flushOnTimeout(long scheduledGeneration) {
        lock.lock();
        try {
            // 이미 flush된 배치의 타이머
            if (closed || scheduledGeneration != generation) {
                return;
            }
            flushLocked();
        } finally {
            lock.unlock();
        }
    }

    private void cancelFlush() {
        generation++;
        if (flushTask != null) {
            flushTask.cancel(false);
            flushTask = null;
        }
    }

    private void process(List<Entry<T>> entries) {
        try {
            handler.handle(items(entries));
        } catch (Exception e) {
            entries.forEach(entry -> entry.future().completeExceptionally(e));
            return;
        }
        entries.forEach(entry -> entry.future().complete(null));
    }

    private static <T> List<T> items(List<Entry<T>> entries) {
        List<T> items = new ArrayList<>(entries.size());
        for (Entry<T> entry : entries) {
            items.add(entry.item());
        }
        return Collections.unmodifiableList(items);
    }

    private record Entry<T>(T item, CompletableFuture<Void> future) {
    }
}
