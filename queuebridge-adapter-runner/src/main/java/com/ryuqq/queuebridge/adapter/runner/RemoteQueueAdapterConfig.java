package com.ryuqq.queuebridge.adapter.runner;

import com.ryuqq.queuebridge.adapter.runner.consumer.ConsumerConfig;
import com.ryuqq.queuebridge.core.retry.RetryConfig;

import java.time.Duration;

/**
 * RemoteQueueAdapter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 큐 이름 (null이면 원격 큐 이름 사용)</li>
 *   <li>reservationTimeout: 예약된 메시지의 가시성 타임아웃 (기본 5분)</li>
 *   <li>bufferSize: add/delete 로컬 버퍼 용량 (기본 100)</li>
 *   <li>retry: release/delete 원격 호출 재시도 설정 (기본 3회)</li>
 *   <li>taskRetryLimit: add/delete 로컬 작업 최대 시도 횟수 (기본 3)</li>
 *   <li>taskMinBackoff: 로컬 작업 첫 재시도 지연 (기본 1초)</li>
 *   <li>flushTimeout: 삭제 배치 자동 flush 시간 (기본 3초)</li>
 *   <li>closeTimeout: {@code close()}가 사용하는 기한 (기본 30초)</li>
 *   <li>consumer: consumer 설정</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 * @param name 큐 이름 (null 허용)
 * @param reservationTimeout 가시성 타임아웃 (1초 이상)
 * @param bufferSize 로컬 버퍼 용량 (1 이상)
 * @param retry 원격 호출 재시도 설정
 * @param taskRetryLimit 로컬 작업 최대 시도 횟수 (1 이상)
 * @param taskMinBackoff 로컬 작업 첫 재시도 지연 (양수)
 * @param flushTimeout 삭제 배치 flush 시간 (양수)
 * @param closeTimeout 기본 종료 기한 (0 이상)
 * @param consumer consumer 설정
 */
public record RemoteQueueAdapterConfig(
    String name,
    Duration reservationTimeout,
    int bufferSize,
    RetryConfig retry,
    int taskRetryLimit,
    Duration taskMinBackoff,
    Duration flushTimeout,
    Duration closeTimeout,
    ConsumerConfig consumer
) {

    /**
     * 기본 설정 생성자.
     */
    public RemoteQueueAdapterConfig() {
        this(
            null,
            Duration.ofMinutes(5),
            100,
            new RetryConfig(),
            3,
            Duration.ofSeconds(1),
            Duration.ofSeconds(3),
            Duration.ofSeconds(30),
            new ConsumerConfig()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RemoteQueueAdapterConfig {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (reservationTimeout == null || reservationTimeout.getSeconds() < 1) {
            throw new IllegalArgumentException(
                "reservationTimeout must be at least 1 second (current: " + reservationTimeout + ")"
            );
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException(
                "bufferSize must be positive (current: " + bufferSize + ")"
            );
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (taskRetryLimit <= 0) {
            throw new IllegalArgumentException(
                "taskRetryLimit must be positive (current: " + taskRetryLimit + ")"
            );
        }
        if (taskMinBackoff == null || taskMinBackoff.isZero() || taskMinBackoff.isNegative()) {
            throw new IllegalArgumentException(
                "taskMinBackoff must be positive (current: " + taskMinBackoff + ")"
            );
        }
        if (flushTimeout == null || flushTimeout.isZero() || flushTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "flushTimeout must be positive (current: " + flushTimeout + ")"
            );
        }
        if (closeTimeout == null || closeTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "closeTimeout must be non-negative (current: " + closeTimeout + ")"
            );
        }
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withName(String name) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * reservationTimeout만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withReservationTimeout(Duration reservationTimeout) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * bufferSize만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withBufferSize(int bufferSize) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * retry만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withRetry(RetryConfig retry) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * taskRetryLimit만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withTaskRetryLimit(int taskRetryLimit) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * taskMinBackoff만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withTaskMinBackoff(Duration taskMinBackoff) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * flushTimeout만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withFlushTimeout(Duration flushTimeout) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * closeTimeout만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withCloseTimeout(Duration closeTimeout) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * consumer만 변경한 새 인스턴스 생성.
     */
    public RemoteQueueAdapterConfig withConsumer(ConsumerConfig consumer) {
        return new RemoteQueueAdapterConfig(name, reservationTimeout, bufferSize, retry, taskRetryLimit, taskMinBackoff, flushTimeout, closeTimeout, consumer);
    }

    /**
     * 로컬 작업 최대 재시도 지연.
     *
     * @return taskMinBackoff와 30분 중 큰 값
     */
    public Duration taskMaxBackoff() {
        Duration cap = Duration.ofMinutes(30);
        return taskMinBackoff.compareTo(cap) > 0 ? taskMinBackoff : cap;
    }
}
