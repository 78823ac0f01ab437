package com.ryuqq.queuebridge.core.retry;

import com.ryuqq.queuebridge.core.spi.RemoteQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 제한된 횟수의 재시도 실행기.
 *
 * <p>작업을 실행하고, 실패가 일시적 서버 오류({@link RemoteQueueException#isTransient()})로
 * 분류될 때만 재시도합니다. 그 외 오류는 즉시 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   call() 성공 → 즉시 반환
 *   RemoteQueueException && 5xx → 다음 시도 (delayBetweenAttempts 대기)
 *   그 외 → 즉시 throw
 * 마지막 오류 throw
 * </pre>
 *
 * <p>release, 단건 delete, 배치 delete 경로가 동일하게 사용합니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;

    /**
     * 기본 설정(3회, 대기 없음)으로 생성.
     */
    public RetryPolicy() {
        this(new RetryConfig());
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RetryPolicy(RetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 반환값이 있는 호출 실행.
     *
     * @param call 원격 호출
     * @param <T> 반환 타입
     * @return 호출 결과
     * @throws RemoteQueueException 영구 오류이거나 재시도 횟수를 소진한 경우
     */
    public <T> T execute(RemoteCall<T> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        RemoteQueueException last = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                return call.call();
            } catch (RemoteQueueException e) {
                last = e;
                if (!e.isTransient()) {
                    throw e;
                }
                log.debug("Transient remote failure (attempt {}/{}): {}", attempt, config.maxAttempts(), e.getMessage());
                if (attempt < config.maxAttempts()) {
                    pause();
                }
            }
        }
        throw last;
    }

    /**
     * 반환값이 없는 호출 실행.
     *
     * @param action 원격 호출
     * @throws RemoteQueueException 영구 오류이거나 재시도 횟수를 소진한 경우
     */
    public void run(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        execute(() -> {
            action.run();
            return null;
        });
    }

    public RetryConfig getConfig() {
        return config;
    }

    private void pause() {
        long millis = config.delayBetweenAttempts().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", e);
        }
    }
}
