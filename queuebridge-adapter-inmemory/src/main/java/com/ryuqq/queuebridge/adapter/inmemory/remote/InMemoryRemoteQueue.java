package com.ryuqq.queuebridge.adapter.inmemory.remote;

import com.ryuqq.queuebridge.core.model.RemoteMessage;
import com.ryuqq.queuebridge.core.model.ReservationRef;
import com.ryuqq.queuebridge.core.spi.RemoteQueue;
import com.ryuqq.queuebridge.core.spi.RemoteQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link RemoteQueue} SPI for testing and reference purposes.
 *
 * <p>This implementation simulates the HTTP-polled queue service the adapter talks to,
 * using {@link DelayQueue} for delayed visibility and a reservation table for
 * reservation timeouts.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Visible Queue:</strong> DelayQueue&lt;DelayedMessage&gt; - messages waiting for their delay to pass</li>
 *   <li><strong>Reservations:</strong> message id → Reservation with expiry deadline</li>
 *   <li><strong>Messages:</strong> message id → StoredMessage for every live message</li>
 * </ul>
 *
 * <p><strong>Service Behavior:</strong></p>
 * <ul>
 *   <li>{@code longPoll} blocks up to {@code waitSeconds} and reports an empty poll as
 *       404 "Message not found"</li>
 *   <li>release / delete require the current reservation id, otherwise 404 "Message not found"</li>
 *   <li>every reservation increments {@code reservedCount}</li>
 *   <li>expired reservations return to the visible queue on the next poll</li>
 *   <li>after {@link #dropQueue()} every call fails with 404 "Queue not found" until
 *       {@link #createQueue()} is called</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRemoteQueue remote = new InMemoryRemoteQueue("emails");
 * TaskQueue queue = new RemoteQueueAdapter(remote, handler);
 *
 * queue.add(Message.of("send-email", payload));
 * List&lt;Message&gt; batch = queue.reserveN(10, Duration.ofSeconds(1));
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class InMemoryRemoteQueue implements RemoteQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteQueue.class);

    /**
     * Reservation timeout applied when the caller passes zero, as the service does.
     */
    static final long DEFAULT_RESERVATION_MS = 60_000L;

    /**
     * Largest batch accepted by longPoll and deleteReservedMessages.
     */
    static final int MAX_BATCH = 100;

    private final String name;
    private final DelayQueue<DelayedMessage> visible;
    private final Map<String, StoredMessage> messages;
    private final Map<String, Reservation> reservations;
    private final AtomicLong idSequence;
    private final AtomicInteger createQueueCalls;
    private final Object lock = new Object();

    private volatile boolean dropped;

    /**
     * Creates a new InMemoryRemoteQueue with the given queue name.
     *
     * @param name queue name
     * @throws IllegalArgumentException if name is null or blank
     */
    public InMemoryRemoteQueue(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.visible = new DelayQueue<>();
        this.messages = new HashMap<>();
        this.reservations = new HashMap<>();
        this.idSequence = new AtomicLong();
        this.createQueueCalls = new AtomicInteger();
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Ids are issued from a monotonically increasing sequence.</p>
     */
    @Override
    public String pushMessage(String body, long delaySeconds) {
        requireQueue();
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds cannot be negative, but was: " + delaySeconds);
        }

        StoredMessage stored = new StoredMessage(String.valueOf(idSequence.incrementAndGet()), body);
        synchronized (lock) {
            messages.put(stored.id, stored);
        }
        visible.put(new DelayedMessage(stored, TimeUnit.SECONDS.toMillis(delaySeconds)));
        return stored.id;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Expired reservations are returned to the visible queue first</li>
     *   <li>Blocks on the DelayQueue for the first message only; the rest of the batch
     *       is whatever is visible at that moment</li>
     *   <li>An interrupted wait restores the interrupt flag and is reported as an empty poll</li>
     * </ul>
     */
    @Override
    public List<RemoteMessage> longPoll(int n, int reservationSeconds, int waitSeconds) {
        requireQueue();
        if (n <= 0 || n > MAX_BATCH) {
            throw new RemoteQueueException(400, "n must be between 1 and " + MAX_BATCH + ", but was: " + n);
        }
        if (reservationSeconds < 0 || waitSeconds < 0) {
            throw new RemoteQueueException(400, "timeouts cannot be negative");
        }

        processReservationTimeouts();

        DelayedMessage first;
        try {
            first = waitSeconds == 0 ? visible.poll() : visible.poll(waitSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RemoteQueueException.messageNotFound();
        }
        requireQueue();
        if (first == null) {
            throw RemoteQueueException.messageNotFound();
        }

        long reservationMs = reservationSeconds == 0
            ? DEFAULT_RESERVATION_MS
            : TimeUnit.SECONDS.toMillis(reservationSeconds);
        List<RemoteMessage> result = new ArrayList<>();
        synchronized (lock) {
            DelayedMessage next = first;
            while (next != null) {
                RemoteMessage reserved = reserve(next.message, reservationMs);
                if (reserved != null) {
                    result.add(reserved);
                }
                next = result.size() < n ? visible.poll() : null;
            }
        }
        if (result.isEmpty()) {
            throw RemoteQueueException.messageNotFound();
        }
        return result;
    }

    @Override
    public void releaseMessage(String id, String reservationId, long delaySeconds) {
        requireQueue();
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds cannot be negative, but was: " + delaySeconds);
        }
        Reservation reservation;
        synchronized (lock) {
            reservation = takeReservation(id, reservationId);
        }
        visible.put(new DelayedMessage(reservation.message, TimeUnit.SECONDS.toMillis(delaySeconds)));
    }

    @Override
    public void deleteMessage(String id, String reservationId) {
        requireQueue();
        synchronized (lock) {
            takeReservation(id, reservationId);
            messages.remove(id);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>All references are checked before anything is deleted, so a batch with one
     * stale reservation deletes nothing.</p>
     */
    @Override
    public void deleteReservedMessages(List<ReservationRef> refs) {
        requireQueue();
        if (refs == null || refs.isEmpty() || refs.size() > MAX_BATCH) {
            throw new RemoteQueueException(400, "refs must hold between 1 and " + MAX_BATCH + " entries");
        }
        synchronized (lock) {
            for (ReservationRef ref : refs) {
                findReservation(ref.id(), ref.reservationId());
            }
            for (ReservationRef ref : refs) {
                reservations.remove(ref.id());
                messages.remove(ref.id());
            }
        }
    }

    @Override
    public void clear() {
        requireQueue();
        synchronized (lock) {
            visible.clear();
            reservations.clear();
            messages.clear();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Counts reserved messages as well as visible and delayed ones.</p>
     */
    @Override
    public int size() {
        requireQueue();
        synchronized (lock) {
            return messages.size();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Idempotent: creating an existing queue is a no-op apart from the call count.</p>
     */
    @Override
    public void createQueue() {
        createQueueCalls.incrementAndGet();
        if (dropped) {
            log.info("Queue {} created", name);
        }
        dropped = false;
    }

    /**
     * Deletes the queue on the simulated service. Used for testing queue-missing repair.
     *
     * <p>All messages are discarded and every call fails with "Queue not found"
     * until {@link #createQueue()} is called.</p>
     */
    public void dropQueue() {
        synchronized (lock) {
            dropped = true;
            visible.clear();
            reservations.clear();
            messages.clear();
        }
        log.info("Queue {} dropped", name);
    }

    /**
     * Returns expired reservations to the visible queue.
     *
     * <p>Called at the start of every poll; tests may call it directly.</p>
     *
     * @return number of messages returned to the queue
     */
    public int processReservationTimeouts() {
        long now = System.currentTimeMillis();
        List<StoredMessage> expired = new ArrayList<>();
        synchronized (lock) {
            reservations.values().removeIf(reservation -> {
                if (reservation.expiresAt <= now) {
                    expired.add(reservation.message);
                    return true;
                }
                return false;
            });
        }
        for (StoredMessage message : expired) {
            visible.put(new DelayedMessage(message, 0));
        }
        return expired.size();
    }

    /**
     * Forces every reservation to lapse immediately. Used for redelivery tests.
     *
     * @return number of messages returned to the queue
     */
    public int expireReservations() {
        synchronized (lock) {
            for (Reservation reservation : reservations.values()) {
                reservation.expiresAt = 0L;
            }
        }
        return processReservationTimeouts();
    }

    /**
     * Returns the number of createQueue calls. Used for test assertions.
     *
     * @return createQueue call count
     */
    public int createQueueCalls() {
        return createQueueCalls.get();
    }

    /**
     * Returns the number of visible or delayed messages. Used for test assertions.
     *
     * @return visible queue size
     */
    public int visibleSize() {
        return visible.size();
    }

    /**
     * Returns the number of reserved messages. Used for test assertions.
     *
     * @return reservation count
     */
    public int reservedSize() {
        synchronized (lock) {
            return reservations.size();
        }
    }

    public boolean isDropped() {
        return dropped;
    }

    private void requireQueue() {
        if (dropped) {
            throw RemoteQueueException.queueNotFound();
        }
    }

    private RemoteMessage reserve(StoredMessage message, long reservationMs) {
        if (!messages.containsKey(message.id)) {
            // cleared while waiting in the visible queue
            return null;
        }
        message.reservedCount++;
        String reservationId = UUID.randomUUID().toString();
        reservations.put(message.id, new Reservation(message, reservationId, System.currentTimeMillis() + reservationMs));
        return new RemoteMessage(message.id, reservationId, message.body, message.reservedCount);
    }

    private Reservation findReservation(String id, String reservationId) {
        Reservation reservation = reservations.get(id);
        if (reservation == null
            || !reservation.reservationId.equals(reservationId)
            || reservation.expiresAt <= System.currentTimeMillis()) {
            throw RemoteQueueException.messageNotFound();
        }
        return reservation;
    }

    private Reservation takeReservation(String id, String reservationId) {
        Reservation reservation = findReservation(id, reservationId);
        reservations.remove(id);
        return reservation;
    }

    private static final class StoredMessage {
        private final String id;
        private final String body;
        private int reservedCount;

        StoredMessage(String id, String body) {
            this.id = id;
            this.body = body;
        }
    }

    private static final class Reservation {
        private final StoredMessage message;
        private final String reservationId;
        private long expiresAt;

        Reservation(StoredMessage message, String reservationId, long expiresAt) {
            this.message = message;
            this.reservationId = reservationId;
            this.expiresAt = expiresAt;
        }
    }

    /**
     * Internal class representing a message waiting for visibility.
     *
     * <p>availableAt = enqueue time + delay; DelayQueue hands it out once the delay passed.</p>
     */
    private static final class DelayedMessage implements Delayed {
        private final StoredMessage message;
        private final long availableAt;

        DelayedMessage(StoredMessage message, long delayMs) {
            this.message = message;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long diff = availableAt - System.currentTimeMillis();
            return unit.convert(diff, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }
}
