/**
 * In-memory remote queue simulating the HTTP-polled queue service for testing and reference.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.queuebridge.core.spi.RemoteQueue} SPI. It reproduces the service
 * behaviors the adapter depends on: reservations with a timeout, reservation ids that
 * must be presented on release and delete, long-poll waits, and queue deletion.</p>
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │ pushMessage │ (with optional delay)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │ DelayQueue  │ (wait for delay expiration)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │  longPoll   │ → reservation issued, reservedCount + 1
 * └──────┬──────┘
 *        │
 *        ├──► deleteMessage / deleteReservedMessages ──► [Permanently Removed]
 *        │
 *        ├──► releaseMessage(delay) ──────────────────► [Re-queued after delay]
 *        │
 *        └──► Reservation Timeout Expired ────────────► [Re-queued Automatically]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Lazy Timeouts:</strong> expired reservations are only noticed when a poll starts</li>
 * </ul>
 *
 * @see com.ryuqq.queuebridge.core.spi.RemoteQueue
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.adapter.inmemory.remote;
