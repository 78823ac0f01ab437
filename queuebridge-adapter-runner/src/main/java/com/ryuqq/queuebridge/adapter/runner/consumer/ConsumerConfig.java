package com.ryuqq.queuebridge.adapter.runner.consumer;

import java.time.Duration;

/**
 * PollingConsumer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>reserveBatchSize: 한 번에 예약할 메시지 수 (기본 10)</li>
 *   <li>waitTimeout: long-poll 대기 시간 (기본 10초)</li>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>retryLimit: 이 횟수만큼 예약된 뒤에도 실패하면 poison message로 삭제 (기본 3)</li>
 *   <li>minBackoff / maxBackoff: release 지연 범위 (기본 1초 / 30분)</li>
 *   <li>errorBackoff: 예약 자체가 실패했을 때 다음 poll까지 대기 (기본 1초)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>높은 처리량: reserveBatchSize 증가 (10 → 50), concurrency 증가 (5 → 20)</li>
 *   <li>빠른 종료: waitTimeout 감소 (poller는 진행 중인 long-poll이 끝나야 멈춤)</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 * @param reserveBatchSize 예약 배치 크기 (1~100)
 * @param waitTimeout long-poll 대기 시간 (0 이상)
 * @param concurrency 동시 처리 스레드 수 (1 이상)
 * @param retryLimit poison 판정 예약 횟수 (1 이상)
 * @param minBackoff 최소 release 지연 (양수)
 * @param maxBackoff 최대 release 지연 (minBackoff 이상)
 * @param errorBackoff 예약 실패 후 대기 (0 이상)
 */
public record ConsumerConfig(
    int reserveBatchSize,
    Duration waitTimeout,
    int concurrency,
    int retryLimit,
    Duration minBackoff,
    Duration maxBackoff,
    Duration errorBackoff
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: reserveBatchSize=10, waitTimeout=10s, concurrency=5, retryLimit=3,
     * minBackoff=1s, maxBackoff=30m, errorBackoff=1s</p>
     */
    public ConsumerConfig() {
        this(10, Duration.ofSeconds(10), 5, 3, Duration.ofSeconds(1), Duration.ofMinutes(30), Duration.ofSeconds(1));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConsumerConfig {
        if (reserveBatchSize <= 0 || reserveBatchSize > 100) {
            throw new IllegalArgumentException(
                "reserveBatchSize must be between 1 and 100 (current: " + reserveBatchSize + ")"
            );
        }
        if (waitTimeout == null || waitTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "waitTimeout must be non-negative (current: " + waitTimeout + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (retryLimit <= 0) {
            throw new IllegalArgumentException(
                "retryLimit must be positive (current: " + retryLimit + ")"
            );
        }
        if (minBackoff == null || minBackoff.isZero() || minBackoff.isNegative()) {
            throw new IllegalArgumentException(
                "minBackoff must be positive (current: " + minBackoff + ")"
            );
        }
        if (maxBackoff == null || maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException(
                "maxBackoff must be >= minBackoff (min: " + minBackoff + ", max: " + maxBackoff + ")"
            );
        }
        if (errorBackoff == null || errorBackoff.isNegative()) {
            throw new IllegalArgumentException(
                "errorBackoff must be non-negative (current: " + errorBackoff + ")"
            );
        }
    }

    /**
     * reserveBatchSize만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withReserveBatchSize(int reserveBatchSize) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }

    /**
     * waitTimeout만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withWaitTimeout(Duration waitTimeout) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withConcurrency(int concurrency) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }

    /**
     * retryLimit만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withRetryLimit(int retryLimit) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }

    /**
     * minBackoff만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withMinBackoff(Duration minBackoff) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }

    /**
     * maxBackoff만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withMaxBackoff(Duration maxBackoff) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }

    /**
     * errorBackoff만 변경한 새 인스턴스 생성.
     */
    public ConsumerConfig withErrorBackoff(Duration errorBackoff) {
        return new ConsumerConfig(reserveBatchSize, waitTimeout, concurrency, retryLimit, minBackoff, maxBackoff, errorBackoff);
    }
}
