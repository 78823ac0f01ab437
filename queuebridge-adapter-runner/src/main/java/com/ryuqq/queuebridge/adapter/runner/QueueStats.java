package com.ryuqq.queuebridge.adapter.runner;

import com.ryuqq.queuebridge.adapter.runner.workqueue.WorkQueueStats;
import com.ryuqq.queuebridge.application.consumer.ConsumerStats;

/**
 * RemoteQueueAdapter 통계 스냅샷.
 *
 * @param add add 파이프라인 통계
 * @param delete delete 파이프라인 통계
 * @param consumer consumer 통계 (consumer가 생성되지 않았으면 null)
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public record QueueStats(
    WorkQueueStats add,
    WorkQueueStats delete,
    ConsumerStats consumer
) {
}
