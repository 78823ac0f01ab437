package com.ryuqq.queuebridge.testkit.contract;

import com.ryuqq.queuebridge.adapter.runner.QueueStats;
import com.ryuqq.queuebridge.adapter.runner.RemoteQueueAdapter;
import com.ryuqq.queuebridge.adapter.runner.RemoteQueueAdapterConfig;
import com.ryuqq.queuebridge.adapter.runner.consumer.ConsumerConfig;
import com.ryuqq.queuebridge.application.consumer.MessageConsumer;
import com.ryuqq.queuebridge.application.consumer.MessageHandler;
import com.ryuqq.queuebridge.core.exception.DrainTimeoutException;
import com.ryuqq.queuebridge.core.exception.DuplicateMessageException;
import com.ryuqq.queuebridge.core.exception.TaskNameRequiredException;
import com.ryuqq.queuebridge.core.model.Message;
import com.ryuqq.queuebridge.core.spi.DedupStorage;
import com.ryuqq.queuebridge.core.spi.RemoteQueue;
import com.ryuqq.queuebridge.core.spi.RemoteQueueException;
import com.ryuqq.queuebridge.testkit.contract.FaultInjectingRemoteQueue.Operation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for TaskQueue contract tests.
 *
 * <p>Runs the queue adapter end to end against a {@link RemoteQueue} supplied by the
 * subclass, wrapped in a {@link FaultInjectingRemoteQueue} so calls can be counted,
 * delayed and failed.</p>
 *
 * <p><strong>Covered Contracts:</strong></p>
 * <ul>
 *   <li>Add: task name required, duplicate names skipped, payload round trip</li>
 *   <li>Reserve: empty poll, queue-missing repair, reservation count</li>
 *   <li>Release / delete: transient retries, permanent errors, missing reservations</li>
 *   <li>Batched delete: 9 / 9 / 7 split for 25 deletes</li>
 *   <li>Close: drain deadline and complete drain</li>
 *   <li>Consumer: delete on success, release on failure, poison messages</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryTaskQueueContractTest extends AbstractTaskQueueContractTest {
 *
 *     {@literal @}Override
 *     protected RemoteQueue createRemoteQueue(String name) {
 *         return new InMemoryRemoteQueue(name);
 *     }
 *
 *     {@literal @}Override
 *     protected DedupStorage createDedupStorage() {
 *         return new InMemoryDedupStorage();
 *     }
 * }
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public abstract class AbstractTaskQueueContractTest {

    protected static final String QUEUE_NAME = "contract-queue";
    protected static final String TASK_NAME = "send-email";

    protected FaultInjectingRemoteQueue remote;
    protected DedupStorage dedupStorage;
    protected RemoteQueueAdapter queue;
    protected List<Message> handled;

    /**
     * Creates the remote queue under test. Called once per test.
     *
     * @param name queue name
     * @return a fresh, empty remote queue
     */
    protected abstract RemoteQueue createRemoteQueue(String name);

    /**
     * Creates the dedup storage under test. Called once per test.
     *
     * @return a fresh, empty dedup storage
     */
    protected abstract DedupStorage createDedupStorage();

    /**
     * Adapter configuration with short timings so the suite runs quickly.
     *
     * @return adapter configuration
     */
    protected RemoteQueueAdapterConfig config() {
        return new RemoteQueueAdapterConfig()
            .withTaskMinBackoff(Duration.ofMillis(10))
            .withFlushTimeout(Duration.ofMillis(100))
            .withConsumer(new ConsumerConfig()
                .withWaitTimeout(Duration.ofSeconds(1))
                .withMinBackoff(Duration.ofMillis(10))
                .withErrorBackoff(Duration.ofMillis(50)));
    }

    @BeforeEach
    protected void setUpTaskQueue() {
        remote = new FaultInjectingRemoteQueue(createRemoteQueue(QUEUE_NAME));
        dedupStorage = createDedupStorage();
        handled = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    protected void tearDownTaskQueue() {
        if (queue != null) {
            try {
                queue.closeTimeout(Duration.ofSeconds(2));
            } catch (RuntimeException e) {
                // close errors are asserted by the tests that provoke them
            }
        }
    }

    // ============================================================
    // Add
    // ============================================================

    @Test
    public void taskName이_없는_Message는_push되지_않음() {
        newQueue(null);
        Message msg = Message.of(null, payload(1));

        assertThrows(TaskNameRequiredException.class, () -> queue.add(msg));
        assertEquals(0, remote.calls(Operation.PUSH));
    }

    @Test
    public void 같은_이름의_Message는_한_번만_push됨() {
        newQueue(null);
        Message first = Message.named(TASK_NAME, "welcome-42", payload(1));
        Message second = Message.named(TASK_NAME, "welcome-42", payload(2));

        queue.add(first);
        queue.add(second);
        await(() -> first.getId() != null);

        assertInstanceOf(DuplicateMessageException.class, second.getErr());
        assertTrue(second.isDuplicate());
        assertNull(second.getId());
        assertEquals(1, remote.calls(Operation.PUSH));
    }

    @Test
    public void push한_Message를_예약하면_본문이_그대로_복원됨() {
        newQueue(null);
        Message msg = Message.named(TASK_NAME, "report-7", payload(7));

        queue.add(msg);
        await(() -> msg.getId() != null);
        List<Message> reserved = queue.reserveN(10, Duration.ofSeconds(1));

        assertEquals(1, reserved.size());
        Message got = reserved.get(0);
        assertEquals(msg.getId(), got.getId());
        assertEquals(TASK_NAME, got.getTaskName());
        assertEquals("report-7", got.getName());
        assertArrayEquals(payload(7), got.getPayload());
        assertNotNull(got.getReservationId());
        assertEquals(1, got.getReservedCount());
        assertNull(got.getErr());
    }

    // ============================================================
    // Reserve
    // ============================================================

    @Test
    public void 예약할_Message가_없으면_빈_목록() {
        newQueue(null);

        List<Message> reserved = queue.reserveN(5, Duration.ZERO);

        assertTrue(reserved.isEmpty());
        assertEquals(1, remote.calls(Operation.LONG_POLL));
    }

    @Test
    public void 큐가_없으면_한_번_재생성하고_원래_오류를_던짐() {
        newQueue(null);
        RemoteQueueException missing = RemoteQueueException.queueNotFound();
        remote.failNext(Operation.LONG_POLL, missing);

        RemoteQueueException thrown = assertThrows(RemoteQueueException.class,
            () -> queue.reserveN(5, Duration.ZERO));

        assertSame(missing, thrown);
        assertEquals(1, remote.calls(Operation.CREATE_QUEUE));
    }

    @Test
    public void release된_Message는_다시_예약되고_예약_횟수가_증가함() {
        newQueue(null);
        Message msg = pushAndReserve(1).get(0);
        String firstReservation = msg.getReservationId();

        queue.release(msg);
        List<Message> again = reserveAtLeast(1);

        assertEquals(msg.getId(), again.get(0).getId());
        assertEquals(2, again.get(0).getReservedCount());
        assertNotEquals(firstReservation, again.get(0).getReservationId());
    }

    @Test
    public void len과_purge는_원격_큐에_위임됨() {
        newQueue(null);
        for (int i = 0; i < 3; i++) {
            queue.add(Message.of(TASK_NAME, payload(i)));
        }
        await(() -> queue.stats().add().processed() == 3);

        assertEquals(3, queue.len());
        queue.purge();
        assertEquals(0, queue.len());
    }

    // ============================================================
    // Release / Delete
    // ============================================================

    @Test
    public void 일시적_오류는_재시도_후_성공() {
        newQueue(null);
        Message msg = pushAndReserve(1).get(0);
        remote.failNext(Operation.DELETE, 2, () -> RemoteQueueException.serverError("unavailable"));

        queue.delete(msg);

        assertEquals(3, remote.calls(Operation.DELETE));
        assertEquals(List.of(msg.getId()), remote.deletedIds());
    }

    @Test
    public void 일시적_오류가_계속되면_세_번_시도_후_실패() {
        newQueue(null);
        Message msg = pushAndReserve(1).get(0);
        remote.failNext(Operation.RELEASE, 3, () -> RemoteQueueException.serverError("unavailable"));

        assertThrows(RemoteQueueException.class, () -> queue.release(msg));
        assertEquals(3, remote.calls(Operation.RELEASE));
    }

    @Test
    public void 영구_오류는_재시도하지_않음() {
        newQueue(null);
        Message msg = pushAndReserve(1).get(0);
        remote.failNext(Operation.RELEASE, new RemoteQueueException(400, "Bad request"));

        RemoteQueueException thrown = assertThrows(RemoteQueueException.class, () -> queue.release(msg));

        assertEquals(400, thrown.statusCode());
        assertEquals(1, remote.calls(Operation.RELEASE));
    }

    @Test
    public void 이미_삭제된_Message의_삭제는_성공으로_처리됨() {
        newQueue(null);
        Message msg = pushAndReserve(1).get(0);

        queue.delete(msg);
        assertDoesNotThrow(() -> queue.delete(msg));

        assertEquals(2, remote.calls(Operation.DELETE));
    }

    @Test
    public void 예약_정보가_없으면_원격_호출_없이_거부됨() {
        newQueue(null);
        Message msg = Message.of(TASK_NAME, payload(1));
        msg.setId("1");

        assertThrows(IllegalArgumentException.class, () -> queue.release(msg));
        assertThrows(IllegalArgumentException.class, () -> queue.delete(msg));
        assertThrows(IllegalArgumentException.class, () -> queue.scheduleDelete(msg));
        assertEquals(0, remote.calls(Operation.RELEASE));
        assertEquals(0, remote.calls(Operation.DELETE));
    }

    // ============================================================
    // Batched delete
    // ============================================================

    @Test
    public void 예약된_25개_삭제는_9_9_7개_배치로_전송됨() {
        newQueue(null);
        List<Message> reserved = pushAndReserve(25);

        for (Message msg : reserved) {
            queue.scheduleDelete(msg);
        }
        await(() -> remote.deletedIds().size() == 25);

        assertEquals(List.of(9, 9, 7), remote.deletedBatchSizes());
        assertEquals(ids(reserved), new HashSet<>(remote.deletedIds()));
        assertEquals(0, remote.getDelegate().size());
    }

    // ============================================================
    // Close
    // ============================================================

    @Test
    public void 배치_삭제가_느리면_짧은_종료_기한은_초과됨() {
        newQueue(null);
        Message msg = pushAndReserve(1).get(0);
        remote.withLatency(Operation.DELETE_BATCH, Duration.ofMillis(300));

        queue.scheduleDelete(msg);

        assertThrows(DrainTimeoutException.class, () -> queue.closeTimeout(Duration.ofMillis(1)));
    }

    @Test
    public void 충분한_종료_기한이면_예약된_삭제가_모두_전송됨() {
        newQueue(null);
        List<Message> reserved = pushAndReserve(5);

        for (Message msg : reserved) {
            queue.scheduleDelete(msg);
        }
        queue.closeTimeout(Duration.ofSeconds(5));

        assertEquals(ids(reserved), new HashSet<>(remote.deletedIds()));
        assertEquals(0, remote.getDelegate().size());
    }

    @Test
    public void 종료_후_add는_거부됨() {
        newQueue(null);

        queue.close();

        assertThrows(IllegalStateException.class, () -> queue.add(Message.of(TASK_NAME, payload(1))));
    }

    // ============================================================
    // Consumer
    // ============================================================

    @Test
    public void consumer는_처리한_Message를_삭제함() {
        newQueue(handled::add);
        for (int i = 0; i < 3; i++) {
            queue.add(Message.of(TASK_NAME, payload(i)));
        }

        queue.consumer().start();
        await(() -> remote.deletedIds().size() == 3);

        assertEquals(3, handled.size());
        assertEquals(3, queue.stats().consumer().processed());
        assertEquals(0, remote.getDelegate().size());
    }

    @Test
    public void consumer는_실패한_Message를_release하고_재처리함() {
        AtomicInteger attempts = new AtomicInteger();
        newQueue(msg -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("temporary failure");
            }
            handled.add(msg);
        });
        queue.add(Message.of(TASK_NAME, payload(1)));

        queue.consumer().start();
        await(() -> remote.deletedIds().size() == 1);

        QueueStats stats = queue.stats();
        assertEquals(1, stats.consumer().failed());
        assertEquals(1, stats.consumer().processed());
        assertEquals(2, handled.get(0).getReservedCount());
        assertEquals(1, remote.calls(Operation.RELEASE));
    }

    @Test
    public void 재시도_한도에_도달한_Message는_poison으로_삭제됨() {
        newQueue(msg -> {
            throw new IllegalStateException("always fails");
        });
        queue.add(Message.of(TASK_NAME, payload(1)));

        MessageConsumer consumer = queue.consumer();
        consumer.start();
        await(() -> remote.deletedIds().size() == 1);

        assertEquals(1, consumer.stats().poisoned());
        assertEquals(2, consumer.stats().failed());
        assertEquals(0, remote.getDelegate().size());
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Builds the adapter under test and keeps it for teardown.
     *
     * @param handler consumer handler (null when the test needs no consumer)
     * @return the adapter
     */
    protected RemoteQueueAdapter newQueue(MessageHandler handler) {
        queue = new RemoteQueueAdapter(remote, config(), handler, dedupStorage);
        return queue;
    }

    /**
     * Adds {@code count} messages, waits for every push, then reserves them all.
     *
     * @param count number of messages
     * @return reserved messages
     */
    protected List<Message> pushAndReserve(int count) {
        List<Message> added = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Message msg = Message.of(TASK_NAME, payload(i));
            queue.add(msg);
            added.add(msg);
        }
        await(() -> added.stream().allMatch(msg -> msg.getId() != null));
        return reserveAtLeast(count);
    }

    /**
     * Reserves until {@code count} messages are held or 5 seconds pass.
     *
     * @param count number of messages
     * @return reserved messages
     */
    protected List<Message> reserveAtLeast(int count) {
        List<Message> reserved = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 5000;
        while (reserved.size() < count) {
            if (System.currentTimeMillis() > deadline) {
                fail(String.format("Expected %d reserved messages but got %d", count, reserved.size()));
            }
            reserved.addAll(queue.reserveN(count - reserved.size(), Duration.ofSeconds(1)));
        }
        return reserved;
    }

    protected static byte[] payload(int index) {
        return ("payload-" + index).getBytes(StandardCharsets.UTF_8);
    }

    protected static Set<String> ids(List<Message> messages) {
        Set<String> ids = new HashSet<>();
        for (Message msg : messages) {
            ids.add(msg.getId());
        }
        return ids;
    }

    /**
     * Polls the condition every 10ms for up to 5 seconds.
     *
     * @param condition condition to wait for
     */
    protected static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            sleep(10);
        }
    }

    /**
     * Sleeps for the specified duration. Used for timing-sensitive tests.
     *
     * @param millis milliseconds to sleep
     */
    protected static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
