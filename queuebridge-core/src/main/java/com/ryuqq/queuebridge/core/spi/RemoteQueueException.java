package com.ryuqq.queuebridge.core.spi;

/**
 * 원격 큐 호출 실패.
 *
 * <p>HTTP 상태 코드와 구조화된 {@link ErrorReason}을 함께 전달합니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>일시적 오류 ({@link #isTransient()}): 5xx, 재시도 대상</li>
 *   <li>Not Found ({@link #isNotFound()}): 404, {@link #reason()}으로 세부 구분</li>
 *   <li>그 외: 영구 오류, 즉시 반환</li>
 * </ul>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class RemoteQueueException extends RuntimeException {

    private final int statusCode;
    private final ErrorReason reason;

    /**
     * 분류를 명시하여 생성.
     *
     * @param statusCode HTTP 상태 코드
     * @param reason 분류 (null이면 메시지 본문에서 추론)
     * @param message 오류 메시지
     */
    public RemoteQueueException(int statusCode, ErrorReason reason, String message) {
        this(statusCode, reason, message, null);
    }

    /**
     * 분류를 명시하여 생성 (원인 포함).
     *
     * @param statusCode HTTP 상태 코드
     * @param reason 분류 (null이면 메시지 본문에서 추론)
     * @param message 오류 메시지
     * @param cause 원인
     */
    public RemoteQueueException(int statusCode, ErrorReason reason, String message, Throwable cause) {
        super(statusCode + " " + message, cause);
        this.statusCode = statusCode;
        this.reason = reason != null ? reason : ErrorReason.fromMessage(message);
    }

    /**
     * 분류 없이 생성 (메시지 본문에서 추론).
     *
     * @param statusCode HTTP 상태 코드
     * @param message 오류 메시지
     */
    public RemoteQueueException(int statusCode, String message) {
        this(statusCode, null, message, null);
    }

    public static RemoteQueueException messageNotFound() {
        return new RemoteQueueException(404, ErrorReason.MESSAGE_NOT_FOUND, "Message not found");
    }

    public static RemoteQueueException queueNotFound() {
        return new RemoteQueueException(404, ErrorReason.QUEUE_NOT_FOUND, "Queue not found");
    }

    public static RemoteQueueException serverError(String message) {
        return new RemoteQueueException(503, ErrorReason.UNKNOWN, message);
    }

    public int statusCode() {
        return statusCode;
    }

    public ErrorReason reason() {
        return reason;
    }

    /**
     * 서버 측 일시적 오류(5xx) 여부.
     *
     * @return 재시도 대상이면 true
     */
    public boolean isTransient() {
        return statusCode >= 500;
    }

    /**
     * Not Found(404) 여부.
     *
     * @return 404이면 true
     */
    public boolean isNotFound() {
        return statusCode == 404;
    }
}
