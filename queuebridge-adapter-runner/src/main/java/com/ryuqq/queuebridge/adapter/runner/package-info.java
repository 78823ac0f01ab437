/**
 * Runner Adapter Layer - 원격 큐 어댑터 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.queuebridge.application.queue.TaskQueue}의 원격 큐 구현과
 * 그 구성 파이프라인을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuebridge.adapter.runner.RemoteQueueAdapter} - 원격 큐 어댑터</li>
 *   <li>{@link com.ryuqq.queuebridge.adapter.runner.AddPipeline} - 비동기 enqueue</li>
 *   <li>{@link com.ryuqq.queuebridge.adapter.runner.DeletePipeline} - 배치 삭제</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (RemoteQueueAdapter, PollingConsumer)
 *   ↓ implements
 * application (TaskQueue, MessageConsumer)
 *   ↓ depends on
 * core (Message, MessageCodec, RetryPolicy, DedupFilter)
 *   ↓ depends on
 * core/spi (RemoteQueue, DedupStorage)
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.adapter.runner;
