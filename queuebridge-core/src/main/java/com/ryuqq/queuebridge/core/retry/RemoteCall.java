package com.ryuqq.queuebridge.core.retry;

/**
 * 재시도 대상 원격 호출 (반환값 있음).
 *
 * @param <T> 반환 타입
 * @author QueueBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T call();
}
