package com.ryuqq.queuebridge.application.consumer;

/**
 * Consumer 처리 통계 스냅샷.
 *
 * @param reserved 예약으로 받은 Message 수
 * @param processed 처리 성공 수
 * @param failed 처리 실패 수 (release됨)
 * @param poisoned 재시도 한도 초과로 삭제된 수
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public record ConsumerStats(
    long reserved,
    long processed,
    long failed,
    long poisoned
) {

    public ConsumerStats {
        if (reserved < 0 || processed < 0 || failed < 0 || poisoned < 0) {
            throw new IllegalArgumentException(
                "counts must be non-negative (reserved=" + reserved + ", processed=" + processed
                    + ", failed=" + failed + ", poisoned=" + poisoned + ")"
            );
        }
    }
}
