package com.ryuqq.queuebridge.adapter.runner.workqueue;

import com.ryuqq.queuebridge.core.exception.DrainTimeoutException;
import com.ryuqq.queuebridge.core.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 프로세스 내부의 버퍼 작업 큐.
 *
 * <p>add는 항목을 버퍼에 넣는 즉시 반환하고, 워커 스레드가 {@link PipelineTask}의 핸들러로
 * 처리합니다. 실패한 항목은 지수 백오프 후 다시 버퍼에 들어갑니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>제한된 버퍼 ({@link ArrayBlockingQueue}), 가득 차면 add 대기</li>
 *   <li>고정 워커 스레드로 항목 처리</li>
 *   <li>retryLimit까지 백오프 재시도, 소진 시 fallbackHandler 호출</li>
 *   <li>종료 시 기한 내 pending 항목 drain</li>
 * </ul>
 *
 * <p><strong>pending 계산:</strong></p>
 * <pre>
 * add → pending + 1
 * 핸들러 stage 정상 완료 → pending - 1
 * 재시도 소진 → pending - 1
 * 재시도 예약 → 변화 없음 (스케줄러 대기 중에도 pending)
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class LocalWorkQueue {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkQueue.class);
    private static final long DRAIN_POLL_INTERVAL_MS = 10;

    private final String name;
    private final PipelineTask task;
    private final WorkQueueConfig config;
    private final BackoffCalculator backoffCalculator;
    private final BlockingQueue<Item> buffer;
    private final ExecutorService workers;
    private final ScheduledExecutorService retryScheduler;

    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean closed;
    private volatile boolean stopped;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param name 작업 큐 이름
     * @param task 등록할 태스크
     */
    public LocalWorkQueue(String name, PipelineTask task) {
        this(name, task, new WorkQueueConfig());
    }

    /**
     * 생성자.
     *
     * <p>생성 즉시 워커가 시작됩니다.</p>
     *
     * @param name 작업 큐 이름
     * @param task 등록할 태스크
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LocalWorkQueue(String name, PipelineTask task, WorkQueueConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.name = name;
        this.task = task;
        this.config = config;
        this.backoffCalculator = task.backoffCalculator();
        this.buffer = new ArrayBlockingQueue<>(config.bufferSize());
        this.workers = Executors.newFixedThreadPool(config.workers(), namedThreads(name + "-worker"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads(name + "-retry"));

        for (int i = 0; i < config.workers(); i++) {
            workers.submit(this::workLoop);
        }
        log.info("Work queue {} started (task={}, workers={}, bufferSize={})",
            name, task.name(), config.workers(), config.bufferSize());
    }

    /**
     * 항목 추가.
     *
     * <p>버퍼가 가득 차 있으면 자리가 날 때까지 대기합니다.
     * 대기 중 큐가 닫히면 항목을 넣지 않고 {@link IllegalStateException}을 던집니다.</p>
     *
     * @param envelope 추가할 Envelope
     * @throws IllegalArgumentException envelope의 taskName이 등록된 태스크와 다른 경우
     * @throws IllegalStateException 큐가 닫혔거나 대기 중 인터럽트된 경우
     */
    public void add(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (!task.name().equals(envelope.taskName())) {
            throw new IllegalArgumentException(
                "unknown task: " + envelope.taskName() + " (registered: " + task.name() + ")"
            );
        }
        // closeTimeout이 pending을 읽기 전에 증가시켜야 drain 대상에 포함됨
        pending.incrementAndGet();
        Item item = new Item(envelope, 1);
        boolean accepted = false;
        try {
            while (!closed) {
                if (buffer.offer(item, config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                    accepted = true;
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(name + ": add interrupted", e);
        } finally {
            if (!accepted) {
                pending.decrementAndGet();
            }
        }
        throw new IllegalStateException(name + ": work queue is closed");
    }

    /**
     * 큐 종료.
     *
     * <p>새 항목을 거부하고, pending이 0이 될 때까지 최대 timeout 동안 대기한 뒤 워커를 정지합니다.
     * 두 번째 호출부터는 아무 일도 하지 않습니다.</p>
     *
     * @param timeout drain 기한
     * @throws DrainTimeoutException 기한 내에 pending 항목이 끝나지 않은 경우
     */
    public void closeTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        if (closed) {
            return;
        }
        closed = true;

        boolean drained = awaitDrain(timeout);
        stopped = true;
        workers.shutdownNow();
        retryScheduler.shutdownNow();

        if (!drained) {
            int remaining = pending.get();
            log.warn("Work queue {} closed with {} pending items after {}ms", name, remaining, timeout.toMillis());
            throw new DrainTimeoutException(name, timeout, remaining);
        }
        log.info("Work queue {} closed (processed={}, failed={})", name, processed.get(), failed.get());
    }

    /**
     * 통계 스냅샷.
     *
     * @return WorkQueueStats
     */
    public WorkQueueStats stats() {
        return new WorkQueueStats(name, buffer.size(), pending.get(), processed.get(), retried.get(), failed.get());
    }

    public String getName() {
        return name;
    }

    public PipelineTask getTask() {
        return task;
    }

    public boolean isClosed() {
        return closed;
    }

    private void workLoop() {
        while (!stopped) {
            Item item;
            try {
                item = buffer.poll(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item != null) {
                process(item);
            }
        }
    }

    private void process(Item item) {
        CompletionStage<Void> stage;
        try {
            stage = task.handler().handle(item.envelope());
        } catch (Exception e) {
            onFailure(item, e);
            return;
        }

        stage.whenComplete((ignored, error) -> {
            if (error == null) {
                processed.incrementAndGet();
                pending.decrementAndGet();
            } else {
                onFailure(item, unwrap(error));
            }
        });
    }

    private void onFailure(Item item, Throwable error) {
        if (item.attempt() < task.retryLimit() && !stopped) {
            long delayMs = backoffCalculator.calculate(item.attempt());
            retried.incrementAndGet();
            log.debug("Task {} failed (attempt {}/{}), retrying in {}ms: {}",
                task.name(), item.attempt(), task.retryLimit(), delayMs, error.getMessage());
            try {
                retryScheduler.schedule(() -> requeue(item.next()), delayMs, TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                log.warn("Work queue {} stopped before retry could be scheduled", name);
            }
        }

        failed.incrementAndGet();
        try {
            log.error("Task {} failed after {} attempts", task.name(), item.attempt(), error);
            runFallback(item.envelope());
        } finally {
            pending.decrementAndGet();
        }
    }

    private void runFallback(Envelope envelope) {
        TaskHandler fallback = task.fallbackHandler();
        if (fallback == null) {
            return;
        }
        try {
            fallback.handle(envelope).toCompletableFuture().join();
            log.info("Task {} handled by fallback handler", task.name());
        } catch (Exception e) {
            log.error("Fallback handler failed for task {}", task.name(), e);
        }
    }

    private void requeue(Item item) {
        try {
            buffer.put(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed.incrementAndGet();
            pending.decrementAndGet();
            log.warn("Work queue {} stopped while requeueing a retry", name);
        }
    }

    private boolean awaitDrain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(DRAIN_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return pending.get() == 0;
            }
        }
        return true;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Item(Envelope envelope, int attempt) {

        Item next() {
            return new Item(envelope, attempt + 1);
        }
    }
}
