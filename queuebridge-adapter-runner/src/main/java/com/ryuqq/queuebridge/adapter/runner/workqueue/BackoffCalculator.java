package com.ryuqq.queuebridge.adapter.runner.workqueue;

import java.time.Duration;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>로컬 작업 재시도와 consumer release 지연을 계산합니다.
 * 최소 백오프에서 시작해 시도마다 두 배로 늘리고, Jitter를 더해
 * 동시에 실패한 작업들이 같은 시점에 몰리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(minBackoff * 2^(attempt-1) + jitter, maxBackoff)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (minBackoff=1s, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1100ms</li>
 *   <li>attempt=2: 2000-2200ms</li>
 *   <li>attempt=3: 4000-4400ms</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long minBackoffMs;
    private final long maxBackoffMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: minBackoff=1s, maxBackoff=30m, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(Duration.ofSeconds(1), Duration.ofMinutes(30));
    }

    /**
     * 최소/최대 백오프로 생성 (jitterFactor=0.1).
     *
     * @param minBackoff 첫 재시도 지연
     * @param maxBackoff 최대 지연
     */
    public BackoffCalculator(Duration minBackoff, Duration maxBackoff) {
        this(minBackoff.toMillis(), maxBackoff.toMillis(), 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param minBackoffMs 최소 지연 시간 (밀리초, 양수여야 함)
     * @param maxBackoffMs 최대 지연 시간 (밀리초, minBackoffMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long minBackoffMs, long maxBackoffMs, double jitterFactor) {
        if (minBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "minBackoffMs must be positive (current: " + minBackoffMs + ")"
            );
        }
        if (maxBackoffMs < minBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= minBackoffMs (min: " + minBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.minBackoffMs = minBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // overflow 방지를 위해 지수 제한
        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(minBackoffMs * (1L << shift), maxBackoffMs);

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxBackoffMs);
    }

    /**
     * 재시도 지연 시간을 Duration으로 계산.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간
     */
    public Duration delayFor(int attempt) {
        return Duration.ofMillis(calculate(attempt));
    }

    public long getMinBackoffMs() {
        return minBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
