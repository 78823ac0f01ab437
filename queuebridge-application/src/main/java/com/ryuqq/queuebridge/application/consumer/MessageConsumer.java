package com.ryuqq.queuebridge.application.consumer;

import java.time.Duration;

/**
 * Reservation-driven message consumer.
 *
 * <p>Repeatedly reserves messages from a queue and hands them to a {@link MessageHandler}.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. reserveN(batchSize, waitTimeout) → [Message1, Message2, ...]
 * 2. For each Message (concurrently):
 *    a. handleMessage(msg)
 *    b. success → delete
 *    c. failure → release with backoff delay, or delete as poison once the retry limit is reached
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>{@link #start()} runs pump() on a background poller until stopped</li>
 *   <li>{@link #pump()} can also be invoked directly (tests, external schedulers)</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public interface MessageConsumer {

    /**
     * Executes a single cycle: reserve one batch and dispatch it.
     *
     * @return number of messages reserved in this cycle
     */
    int pump();

    /**
     * Starts the background poller. Calling it twice has no effect.
     */
    void start();

    /**
     * Stops polling and waits up to {@code timeout} for in-flight handlers.
     *
     * @param timeout drain deadline
     * @throws com.ryuqq.queuebridge.core.exception.DrainTimeoutException if handlers did not finish in time
     */
    void stopTimeout(Duration timeout);

    /**
     * Whether the background poller is running.
     *
     * @return true if started and not stopped
     */
    boolean isRunning();

    /**
     * Processing counters.
     *
     * @return stats snapshot
     */
    ConsumerStats stats();
}
