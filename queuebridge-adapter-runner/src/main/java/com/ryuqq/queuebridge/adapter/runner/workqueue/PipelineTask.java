package com.ryuqq.queuebridge.adapter.runner.workqueue;

import java.time.Duration;

/**
 * 로컬 작업 큐에 등록되는 태스크 정의 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 핸들러 이름 (Envelope의 taskName과 일치해야 함)</li>
 *   <li>handler: 항목 처리 핸들러</li>
 *   <li>fallbackHandler: 재시도 소진 후 호출되는 핸들러 (선택)</li>
 *   <li>retryLimit: 최대 시도 횟수 (기본 3)</li>
 *   <li>minBackoff: 첫 재시도 지연 (기본 1초)</li>
 *   <li>maxBackoff: 최대 재시도 지연 (기본 30분)</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 * @param name 핸들러 이름
 * @param handler 처리 핸들러
 * @param fallbackHandler 재시도 소진 후 핸들러 (null 허용)
 * @param retryLimit 최대 시도 횟수 (1 이상)
 * @param minBackoff 첫 재시도 지연 (양수)
 * @param maxBackoff 최대 재시도 지연 (minBackoff 이상)
 */
public record PipelineTask(
    String name,
    TaskHandler handler,
    TaskHandler fallbackHandler,
    int retryLimit,
    Duration minBackoff,
    Duration maxBackoff
) {

    /**
     * 기본 재시도 정책(3회, 1초부터)으로 생성.
     *
     * @param name 핸들러 이름
     * @param handler 처리 핸들러
     */
    public PipelineTask(String name, TaskHandler handler) {
        this(name, handler, null, 3, Duration.ofSeconds(1), Duration.ofMinutes(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PipelineTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
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
    }

    /**
     * fallbackHandler만 변경한 새 인스턴스 생성.
     */
    public PipelineTask withFallbackHandler(TaskHandler fallbackHandler) {
        return new PipelineTask(name, handler, fallbackHandler, retryLimit, minBackoff, maxBackoff);
    }

    /**
     * retryLimit만 변경한 새 인스턴스 생성.
     */
    public PipelineTask withRetryLimit(int retryLimit) {
        return new PipelineTask(name, handler, fallbackHandler, retryLimit, minBackoff, maxBackoff);
    }

    /**
     * minBackoff만 변경한 새 인스턴스 생성.
     */
    public PipelineTask withMinBackoff(Duration minBackoff) {
        return new PipelineTask(name, handler, fallbackHandler, retryLimit, minBackoff, maxBackoff);
    }

    /**
     * maxBackoff만 변경한 새 인스턴스 생성.
     */
    public PipelineTask withMaxBackoff(Duration maxBackoff) {
        return new PipelineTask(name, handler, fallbackHandler, retryLimit, minBackoff, maxBackoff);
    }

    /**
     * 태스크 정의에 맞는 백오프 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(minBackoff, maxBackoff);
    }
}
