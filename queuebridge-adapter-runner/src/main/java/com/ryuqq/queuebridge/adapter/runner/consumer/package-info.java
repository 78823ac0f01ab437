/**
 * 예약 기반 consumer 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuebridge.adapter.runner.consumer.PollingConsumer} - reserveN 폴링 루프와 워커 풀</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.adapter.runner.consumer;
