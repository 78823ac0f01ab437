/**
 * Application Layer - Task queue contract.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuebridge.application.queue.TaskQueue} - queue capability called by the task framework</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (RemoteQueueAdapter)
 *   ↓ implements
 * application (TaskQueue, MessageConsumer)
 *   ↓ depends on
 * core (Message, RemoteQueue SPI, RetryPolicy, DedupFilter)
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.application.queue;
