package com.ryuqq.queuebridge.testkit.contract;

import com.ryuqq.queuebridge.core.model.RemoteMessage;
import com.ryuqq.queuebridge.core.model.ReservationRef;
import com.ryuqq.queuebridge.core.spi.RemoteQueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link RemoteQueue} decorator that records calls and injects faults. Used by contract tests.
 *
 * <p>Every call is counted per {@link Operation} before it reaches the delegate.
 * Scripted failures are consumed in order; while any are queued for an operation
 * the delegate is not called for it. Latency is applied before the failure check.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FaultInjectingRemoteQueue remote = new FaultInjectingRemoteQueue(new InMemoryRemoteQueue("emails"));
 * remote.failNext(Operation.DELETE, 2, () -&gt; RemoteQueueException.serverError("unavailable"));
 * remote.withLatency(Operation.DELETE_BATCH, Duration.ofMillis(300));
 *
 * // ... exercise the adapter ...
 *
 * assertEquals(3, remote.calls(Operation.DELETE));
 * assertEquals(List.of(9, 9, 7), remote.deletedBatchSizes());
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class FaultInjectingRemoteQueue implements RemoteQueue {

    /**
     * Remote operations that can be counted, delayed or failed.
     */
    public enum Operation {
        PUSH,
        LONG_POLL,
        RELEASE,
        DELETE,
        DELETE_BATCH,
        CLEAR,
        SIZE,
        CREATE_QUEUE
    }

    private final RemoteQueue delegate;
    private final Map<Operation, AtomicInteger> calls;
    private final Map<Operation, Queue<Supplier<? extends RuntimeException>>> failures;
    private final Map<Operation, Duration> latencies;
    private final List<List<String>> deletedBatches;
    private final List<String> deletedIds;

    /**
     * Creates a new decorator.
     *
     * @param delegate the remote queue receiving calls that are not failed
     * @throws IllegalArgumentException if delegate is null
     */
    public FaultInjectingRemoteQueue(RemoteQueue delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
        this.calls = new EnumMap<>(Operation.class);
        this.failures = new EnumMap<>(Operation.class);
        for (Operation operation : Operation.values()) {
            calls.put(operation, new AtomicInteger());
            failures.put(operation, new ConcurrentLinkedQueue<>());
        }
        this.latencies = new ConcurrentHashMap<>();
        this.deletedBatches = new CopyOnWriteArrayList<>();
        this.deletedIds = new CopyOnWriteArrayList<>();
    }

    /**
     * Fails the next call of the operation with the given error.
     *
     * @param operation target operation
     * @param error error to throw
     * @return this decorator
     */
    public FaultInjectingRemoteQueue failNext(Operation operation, RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        failures.get(operation).add(() -> error);
        return this;
    }

    /**
     * Fails the next {@code times} calls of the operation with fresh errors.
     *
     * @param operation target operation
     * @param times number of calls to fail
     * @param error error factory
     * @return this decorator
     */
    public FaultInjectingRemoteQueue failNext(Operation operation, int times, Supplier<? extends RuntimeException> error) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive, but was: " + times);
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        for (int i = 0; i < times; i++) {
            failures.get(operation).add(error);
        }
        return this;
    }

    /**
     * Delays every call of the operation.
     *
     * @param operation target operation
     * @param latency delay applied before the call
     * @return this decorator
     */
    public FaultInjectingRemoteQueue withLatency(Operation operation, Duration latency) {
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency must be non-negative, but was: " + latency);
        }
        latencies.put(operation, latency);
        return this;
    }

    /**
     * Returns the number of calls made for the operation, failed ones included.
     *
     * @param operation target operation
     * @return call count
     */
    public int calls(Operation operation) {
        return calls.get(operation).get();
    }

    /**
     * Returns the sizes of successful batch deletes in call order.
     *
     * @return batch sizes
     */
    public List<Integer> deletedBatchSizes() {
        List<Integer> sizes = new ArrayList<>();
        for (List<String> batch : deletedBatches) {
            sizes.add(batch.size());
        }
        return sizes;
    }

    /**
     * Returns ids removed by successful single or batch deletes.
     *
     * @return deleted ids in call order
     */
    public List<String> deletedIds() {
        return new ArrayList<>(deletedIds);
    }

    /**
     * Clears counters, scripted failures, latencies and recorded deletes.
     */
    public void reset() {
        for (Operation operation : Operation.values()) {
            calls.get(operation).set(0);
            failures.get(operation).clear();
        }
        latencies.clear();
        deletedBatches.clear();
        deletedIds.clear();
    }

    public RemoteQueue getDelegate() {
        return delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public String pushMessage(String body, long delaySeconds) {
        before(Operation.PUSH);
        return delegate.pushMessage(body, delaySeconds);
    }

    @Override
    public List<RemoteMessage> longPoll(int n, int reservationSeconds, int waitSeconds) {
        before(Operation.LONG_POLL);
        return delegate.longPoll(n, reservationSeconds, waitSeconds);
    }

    @Override
    public void releaseMessage(String id, String reservationId, long delaySeconds) {
        before(Operation.RELEASE);
        delegate.releaseMessage(id, reservationId, delaySeconds);
    }

    @Override
    public void deleteMessage(String id, String reservationId) {
        before(Operation.DELETE);
        delegate.deleteMessage(id, reservationId);
        deletedIds.add(id);
    }

    @Override
    public void deleteReservedMessages(List<ReservationRef> refs) {
        before(Operation.DELETE_BATCH);
        delegate.deleteReservedMessages(refs);
        List<String> ids = new ArrayList<>(refs.size());
        for (ReservationRef ref : refs) {
            ids.add(ref.id());
        }
        deletedBatches.add(ids);
        deletedIds.addAll(ids);
    }

    @Override
    public void clear() {
        before(Operation.CLEAR);
        delegate.clear();
    }

    @Override
    public int size() {
        before(Operation.SIZE);
        return delegate.size();
    }

    @Override
    public void createQueue() {
        before(Operation.CREATE_QUEUE);
        delegate.createQueue();
    }

    private void before(Operation operation) {
        calls.get(operation).incrementAndGet();

        Duration latency = latencies.get(operation);
        if (latency != null && !latency.isZero()) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while simulating latency for " + operation, e);
            }
        }

        Supplier<? extends RuntimeException> failure = failures.get(operation).poll();
        if (failure != null) {
            throw failure.get();
        }
    }
}
