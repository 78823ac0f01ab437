/**
 * 항목을 모아 한 번에 처리하는 Batcher.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.adapter.runner.batch;
