package com.ryuqq.queuebridge.adapter.runner.workqueue;

import com.ryuqq.queuebridge.core.exception.DrainTimeoutException;
import com.ryuqq.queuebridge.core.model.Envelope;
import com.ryuqq.queuebridge.core.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LocalWorkQueue 유닛 테스트.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
class LocalWorkQueueTest {

    private static final String TASK = "emails:add-message";

    private LocalWorkQueue workQueue;

    @AfterEach
    void tearDown() {
        if (workQueue != null && !workQueue.isClosed()) {
            workQueue.closeTimeout(Duration.ZERO);
        }
    }

    @Test
    void add된_항목은_워커가_처리() {
        // given
        List<Message> handled = new CopyOnWriteArrayList<>();
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> {
            handled.add(envelope.unwrap());
            return CompletableFuture.completedFuture(null);
        }));
        Message msg = Message.of("send", new byte[]{1});

        // when
        workQueue.add(Envelope.wrap(msg, TASK));

        // then
        await(() -> workQueue.stats().processed() == 1);
        assertThat(handled).containsExactly(msg);
        assertThat(workQueue.stats().pending()).isZero();
    }

    @Test
    void 실패하면_백오프_후_재시도하여_성공() {
        // given
        AtomicInteger calls = new AtomicInteger();
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("push failed");
            }
            return CompletableFuture.completedFuture(null);
        }));

        // when
        workQueue.add(Envelope.wrap(Message.of("send", null), TASK));

        // then
        await(() -> workQueue.stats().processed() == 1);
        WorkQueueStats stats = workQueue.stats();
        assertThat(calls.get()).isEqualTo(3);
        assertThat(stats.retried()).isEqualTo(2);
        assertThat(stats.failed()).isZero();
    }

    @Test
    void 비동기_stage_실패도_재시도_대상() {
        // given
        AtomicInteger calls = new AtomicInteger();
        workQueue = new LocalWorkQueue("emails:delete", fastTask(envelope -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IllegalStateException("batch failed"));
            }
            return CompletableFuture.completedFuture(null);
        }));

        // when
        workQueue.add(Envelope.wrap(Message.of("send", null), TASK));

        // then
        await(() -> workQueue.stats().processed() == 1);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void 재시도_소진_시_fallback_핸들러_호출() {
        // given
        AtomicInteger calls = new AtomicInteger();
        List<Envelope> fallbacks = new CopyOnWriteArrayList<>();
        PipelineTask task = fastTask(envelope -> {
            calls.incrementAndGet();
            throw new IllegalStateException("remote down");
        }).withFallbackHandler(envelope -> {
            fallbacks.add(envelope);
            return CompletableFuture.completedFuture(null);
        });
        workQueue = new LocalWorkQueue("emails:add", task);
        Envelope envelope = Envelope.wrap(Message.of("send", null), TASK);

        // when
        workQueue.add(envelope);

        // then
        await(() -> workQueue.stats().failed() == 1);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(fallbacks).containsExactly(envelope);
        assertThat(workQueue.stats().pending()).isZero();
    }

    @Test
    void 등록되지_않은_taskName은_거부() {
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> CompletableFuture.completedFuture(null)));

        assertThatThrownBy(() -> workQueue.add(Envelope.wrap(Message.of("send", null), "other:add-message")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown task");
    }

    @Test
    void 종료_후_add는_IllegalStateException() {
        // given
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> CompletableFuture.completedFuture(null)));
        workQueue.closeTimeout(Duration.ofSeconds(1));

        // when & then
        assertThatThrownBy(() -> workQueue.add(Envelope.wrap(Message.of("send", null), TASK)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");
        assertThat(workQueue.stats().pending()).isZero();
    }

    @Test
    void 버퍼_대기_중인_add는_종료되면_IllegalStateException() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> {
            started.countDown();
            release.await();
            return CompletableFuture.completedFuture(null);
        }), new WorkQueueConfig(1, 1, 10));
        workQueue.add(Envelope.wrap(Message.of("send", new byte[]{1}), TASK));
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        workQueue.add(Envelope.wrap(Message.of("send", new byte[]{2}), TASK));

        CompletableFuture<Void> blockedAdd = CompletableFuture.runAsync(
            () -> workQueue.add(Envelope.wrap(Message.of("send", new byte[]{3}), TASK)));
        Thread.sleep(100);
        assertThat(blockedAdd).isNotDone();

        // when
        assertThatThrownBy(() -> workQueue.closeTimeout(Duration.ofMillis(100)))
            .isInstanceOf(DrainTimeoutException.class);

        // then
        assertThatThrownBy(() -> blockedAdd.get(2, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("closed");
        release.countDown();
    }

    @Test
    void 종료와_동시에_add되어도_수락된_항목은_모두_처리됨() throws Exception {
        // given
        AtomicInteger handled = new AtomicInteger();
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> {
            handled.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        }), new WorkQueueConfig(8, 2, 10));
        ExecutorService producers = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        for (int p = 0; p < 4; p++) {
            producers.submit(() -> {
                go.await();
                for (int i = 0; i < 200; i++) {
                    try {
                        workQueue.add(Envelope.wrap(Message.of("send", null), TASK));
                        accepted.incrementAndGet();
                    } catch (IllegalStateException e) {
                        rejected.incrementAndGet();
                    }
                }
                return null;
            });
        }

        // when
        go.countDown();
        Thread.sleep(5);
        workQueue.closeTimeout(Duration.ofSeconds(5));
        producers.shutdown();
        assertThat(producers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(accepted.get() + rejected.get()).isEqualTo(800);
        assertThat(handled.get()).isEqualTo(accepted.get());
        assertThat(workQueue.stats().pending()).isZero();
    }

    @Test
    void 종료는_pending_항목을_기다림() {
        // given
        List<Message> handled = new CopyOnWriteArrayList<>();
        workQueue = new LocalWorkQueue("emails:add", fastTask(envelope -> {
            Thread.sleep(20);
            handled.add(envelope.unwrap());
            return CompletableFuture.completedFuture(null);
        }));
        for (int i = 0; i < 10; i++) {
            workQueue.add(Envelope.wrap(Message.of("send", new byte[]{(byte) i}), TASK));
        }

        // when
        workQueue.closeTimeout(Duration.ofSeconds(5));

        // then
        assertThat(handled).hasSize(10);
        assertThat(workQueue.stats().pending()).isZero();
    }

    @Test
    void 기한_내에_끝나지_않으면_DrainTimeoutException() {
        // given
        workQueue = new LocalWorkQueue("emails:delete", fastTask(envelope -> new CompletableFuture<>()));
        workQueue.add(Envelope.wrap(Message.of("send", null), TASK));

        // when & then
        assertThatThrownBy(() -> workQueue.closeTimeout(Duration.ofMillis(50)))
            .isInstanceOf(DrainTimeoutException.class)
            .satisfies(e -> {
                DrainTimeoutException timeout = (DrainTimeoutException) e;
                assertThat(timeout.getComponent()).isEqualTo("emails:delete");
                assertThat(timeout.getRemaining()).isEqualTo(1);
            });
    }

    @Test
    void WorkQueueConfig_기본값() {
        WorkQueueConfig config = new WorkQueueConfig();

        assertThat(config.bufferSize()).isEqualTo(100);
        assertThat(config.workers()).isEqualTo(1);
        assertThat(config.withWorkers(4).workers()).isEqualTo(4);
    }

    @Test
    void WorkQueueConfig_bufferSize는_양수여야_함() {
        assertThatThrownBy(() -> new WorkQueueConfig(0, 1, 100))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bufferSize must be positive");
    }

    @Test
    void PipelineTask_기본_재시도_정책은_3회_1초() {
        PipelineTask task = new PipelineTask(TASK, envelope -> CompletableFuture.completedFuture(null));

        assertThat(task.retryLimit()).isEqualTo(3);
        assertThat(task.minBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(task.fallbackHandler()).isNull();
    }

    private static PipelineTask fastTask(TaskHandler handler) {
        return new PipelineTask(TASK, handler, null, 3, Duration.ofMillis(10), Duration.ofMillis(50));
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted", e);
            }
        }
    }
}
