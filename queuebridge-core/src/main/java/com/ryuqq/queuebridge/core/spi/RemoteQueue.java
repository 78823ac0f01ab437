package com.ryuqq.queuebridge.core.spi;

import com.ryuqq.queuebridge.core.model.RemoteMessage;
import com.ryuqq.queuebridge.core.model.ReservationRef;

import java.util.List;

/**
 * HTTP-polled remote message queue SPI.
 *
 * <p>This interface describes the coarse primitives offered by the remote queue service.
 * The adapter builds asynchronous enqueue, batched deletion and remote-state repair on top of it.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Pushing one encoded message with an optional delay</li>
 *   <li>Long-poll reservation of up to N messages with a visibility timeout</li>
 *   <li>Releasing and deleting reserved messages, one at a time or in batches</li>
 *   <li>Clearing and (re)provisioning the queue</li>
 * </ul>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>Every failure is reported as {@link RemoteQueueException}</li>
 *   <li>5xx status codes mark transient faults; callers may retry</li>
 *   <li>404 responses carry an {@link ErrorReason} that separates an empty poll from a missing queue</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Reserved messages stay invisible to other reservers until delete, release or expiry</li>
 *   <li>{@link #createQueue()} is idempotent</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public interface RemoteQueue {

    /**
     * Remote queue name.
     *
     * @return queue name
     */
    String name();

    /**
     * Pushes one message.
     *
     * @param body encoded message body
     * @param delaySeconds seconds before the message becomes reservable (0 for immediate)
     * @return remote-assigned message id
     * @throws RemoteQueueException on remote failure
     */
    String pushMessage(String body, long delaySeconds);

    /**
     * Reserves up to {@code n} messages, waiting up to {@code waitSeconds} for work to arrive.
     *
     * @param n maximum number of messages (1-100)
     * @param reservationSeconds visibility timeout applied to each reserved message
     * @param waitSeconds long-poll wait
     * @return reserved records (never empty)
     * @throws RemoteQueueException 404 with {@link ErrorReason#MESSAGE_NOT_FOUND} when nothing is reservable,
     *         404 with {@link ErrorReason#QUEUE_NOT_FOUND} when the queue does not exist
     */
    List<RemoteMessage> longPoll(int n, int reservationSeconds, int waitSeconds);

    /**
     * Releases a reservation so the message becomes reservable again after the delay.
     *
     * @param id message id
     * @param reservationId reservation token
     * @param delaySeconds seconds before the message becomes reservable again
     * @throws RemoteQueueException on remote failure
     */
    void releaseMessage(String id, String reservationId, long delaySeconds);

    /**
     * Deletes one reserved message.
     *
     * @param id message id
     * @param reservationId reservation token
     * @throws RemoteQueueException 404 when the message or reservation is already gone
     */
    void deleteMessage(String id, String reservationId);

    /**
     * Deletes many reserved messages in one call (at most 10 per call).
     *
     * @param refs reservations to delete
     * @throws RemoteQueueException on remote failure
     */
    void deleteReservedMessages(List<ReservationRef> refs);

    /**
     * Removes every message from the queue.
     *
     * @throws RemoteQueueException on remote failure
     */
    void clear();

    /**
     * Current number of messages in the queue.
     *
     * @return queue size
     * @throws RemoteQueueException on remote failure
     */
    int size();

    /**
     * Provisions the queue (idempotent).
     *
     * @throws RemoteQueueException on remote failure
     */
    void createQueue();
}
