package com.ryuqq.queuebridge.application.queue;

import com.ryuqq.queuebridge.application.consumer.MessageConsumer;
import com.ryuqq.queuebridge.core.model.Message;

import java.time.Duration;
import java.util.List;

/**
 * Task queue capability exposed to the in-process task framework.
 *
 * <p>This interface lists exactly the operations the framework calls on a queue backend.
 * Any backend (remote, in-memory, ...) implements it to be driven by a {@link MessageConsumer}.</p>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>At-least-once: a reserved message that is neither deleted nor released becomes reservable again after its visibility timeout</li>
 *   <li>No ordering guarantee across messages</li>
 *   <li>Duplicate suppression is best-effort and signalled through {@link Message#getErr()}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TaskQueue queue = ...;
 * queue.add(Message.of("send-email", payload));
 *
 * List&lt;Message&gt; batch = queue.reserveN(10, Duration.ofSeconds(10));
 * for (Message msg : batch) {
 *     try {
 *         handle(msg);
 *         queue.delete(msg);
 *     } catch (Exception e) {
 *         queue.release(msg);
 *     }
 * }
 *
 * queue.closeTimeout(Duration.ofSeconds(30));
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public interface TaskQueue extends AutoCloseable {

    /**
     * Queue name.
     *
     * @return queue name
     */
    String name();

    /**
     * Number of messages currently held by the queue backend.
     *
     * @return queue size
     */
    int len();

    /**
     * Adds a message to the queue.
     *
     * <p>May return before the message reaches the backend. When the message is suppressed as a duplicate,
     * this method returns normally and {@link Message#isDuplicate()} becomes true.</p>
     *
     * @param msg message to add
     * @throws com.ryuqq.queuebridge.core.exception.TaskNameRequiredException if the message has no task name
     */
    void add(Message msg);

    /**
     * Reserves up to {@code n} messages, waiting up to {@code waitTimeout} for work.
     *
     * <p>Messages that could not be decoded are still returned, with their error attached.</p>
     *
     * @param n maximum number of messages
     * @param waitTimeout long-poll wait
     * @return reserved messages (empty when nothing is available)
     */
    List<Message> reserveN(int n, Duration waitTimeout);

    /**
     * Releases a reserved message so it becomes reservable again after {@link Message#getDelay()}.
     *
     * @param msg reserved message
     * @throws IllegalArgumentException if the message carries no reservation
     */
    void release(Message msg);

    /**
     * Deletes a reserved message. Deleting a message that is already gone succeeds.
     *
     * @param msg reserved message
     * @throws IllegalArgumentException if the message carries no reservation
     */
    void delete(Message msg);

    /**
     * Removes every message from the queue.
     */
    void purge();

    /**
     * Consumer that drives reservation for this queue. Created on first call.
     *
     * @return queue consumer
     */
    MessageConsumer consumer();

    /**
     * Closes the queue with the default timeout.
     */
    @Override
    void close();

    /**
     * Closes the queue, waiting up to {@code timeout} for pending local work.
     *
     * @param timeout drain deadline
     * @throws com.ryuqq.queuebridge.core.exception.DrainTimeoutException if pending work did not finish in time
     */
    void closeTimeout(Duration timeout);
}
