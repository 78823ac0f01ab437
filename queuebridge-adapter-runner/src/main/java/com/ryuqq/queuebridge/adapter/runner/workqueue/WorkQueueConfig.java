package com.ryuqq.queuebridge.adapter.runner.workqueue;

/**
 * LocalWorkQueue 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>bufferSize: 버퍼 용량, 가득 차면 add가 대기 (기본 100)</li>
 *   <li>workers: 워커 스레드 수 (기본 1)</li>
 *   <li>pollIntervalMs: 워커가 버퍼를 확인하는 최대 대기 간격 (기본 100ms)</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 * @param bufferSize 버퍼 용량 (1 이상)
 * @param workers 워커 스레드 수 (1 이상)
 * @param pollIntervalMs 워커 poll 간격 (밀리초, 양수)
 */
public record WorkQueueConfig(
    int bufferSize,
    int workers,
    long pollIntervalMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: bufferSize=100, workers=1, pollIntervalMs=100</p>
     */
    public WorkQueueConfig() {
        this(100, 1, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkQueueConfig {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException(
                "bufferSize must be positive (current: " + bufferSize + ")"
            );
        }
        if (workers <= 0) {
            throw new IllegalArgumentException(
                "workers must be positive (current: " + workers + ")"
            );
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
    }

    /**
     * bufferSize만 변경한 새 인스턴스 생성.
     */
    public WorkQueueConfig withBufferSize(int bufferSize) {
        return new WorkQueueConfig(bufferSize, workers, pollIntervalMs);
    }

    /**
     * workers만 변경한 새 인스턴스 생성.
     */
    public WorkQueueConfig withWorkers(int workers) {
        return new WorkQueueConfig(bufferSize, workers, pollIntervalMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public WorkQueueConfig withPollIntervalMs(long pollIntervalMs) {
        return new WorkQueueConfig(bufferSize, workers, pollIntervalMs);
    }
}
