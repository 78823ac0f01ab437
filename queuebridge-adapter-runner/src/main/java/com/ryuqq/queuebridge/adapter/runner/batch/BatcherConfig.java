package com.ryuqq.queuebridge.adapter.runner.batch;

import java.time.Duration;

/**
 * Batcher 설정 (불변 record).
 *
 * @author QueueBridge Team
 * @since 1.0.0
 * @param flushTimeout 배치가 열린 뒤 자동 flush까지의 시간 (기본 3초)
 */
public record BatcherConfig(Duration flushTimeout) {

    /**
     * 기본 설정 생성자 (flushTimeout=3초).
     */
    public BatcherConfig() {
        this(Duration.ofSeconds(3));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException flushTimeout이 양수가 아닌 경우
     */
    public BatcherConfig {
        if (flushTimeout == null || flushTimeout.isZero() || flushTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "flushTimeout must be positive (current: " + flushTimeout + ")"
            );
        }
    }
}
