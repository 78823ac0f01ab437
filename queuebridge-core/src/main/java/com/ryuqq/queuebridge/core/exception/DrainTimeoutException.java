package com.ryuqq.queuebridge.core.exception;

import java.time.Duration;

/**
 * 종료 시 주어진 기한 안에 로컬 작업이 비워지지 않았을 때 발생.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class DrainTimeoutException extends RuntimeException {

    private final String component;
    private final Duration timeout;
    private final int remaining;

    /**
     * 생성자.
     *
     * @param component 종료 대상 이름 (로컬 큐 또는 consumer)
     * @param timeout 적용된 기한
     * @param remaining 기한 만료 시점에 남아 있던 작업 수
     */
    public DrainTimeoutException(String component, Duration timeout, int remaining) {
        super(component + ": close timed out after " + timeout.toMillis() + "ms with " + remaining + " pending");
        this.component = component;
        this.timeout = timeout;
        this.remaining = remaining;
    }

    public String getComponent() {
        return component;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getRemaining() {
        return remaining;
    }
}
