package com.ryuqq.queuebridge.adapter.runner.workqueue;

/**
 * 로컬 작업 큐 통계 스냅샷.
 *
 * @param name 작업 큐 이름
 * @param buffered 버퍼에 대기 중인 항목 수
 * @param pending 아직 끝나지 않은 항목 수 (버퍼 + 처리 중 + 재시도 대기)
 * @param processed 처리 완료 수
 * @param retried 재시도 예약 횟수
 * @param failed 재시도 소진으로 실패한 수
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public record WorkQueueStats(
    String name,
    int buffered,
    int pending,
    long processed,
    long retried,
    long failed
) {
}
