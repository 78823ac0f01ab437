/**
 * In-memory dedup storage for testing and reference.
 *
 * @see com.ryuqq.queuebridge.core.spi.DedupStorage
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.adapter.inmemory.dedup;
