package com.ryuqq.queuebridge.core.retry;

import java.time.Duration;

/**
 * RetryPolicy 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 전체 시도 횟수 (기본 3)</li>
 *   <li>delayBetweenAttempts: 시도 간 대기 (기본 0, 백오프는 바깥 작업 큐가 담당)</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 * @param maxAttempts 전체 시도 횟수 (1 이상이어야 함)
 * @param delayBetweenAttempts 시도 간 대기 시간 (음수 불가)
 */
public record RetryConfig(int maxAttempts, Duration delayBetweenAttempts) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, delayBetweenAttempts=0</p>
     */
    public RetryConfig() {
        this(3, Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (delayBetweenAttempts == null || delayBetweenAttempts.isNegative()) {
            throw new IllegalArgumentException(
                "delayBetweenAttempts must be non-negative (current: " + delayBetweenAttempts + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, delayBetweenAttempts);
    }

    /**
     * delayBetweenAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withDelayBetweenAttempts(Duration delayBetweenAttempts) {
        return new RetryConfig(maxAttempts, delayBetweenAttempts);
    }
}
