package com.ryuqq.queuebridge.core.spi;

/**
 * 원격 큐 오류의 구조화된 분류.
 *
 * <p>원격 서비스는 "예약할 메시지 없음"과 "큐 자체가 없음"을 같은 404로 응답합니다.
 * 이 enum으로 두 경우를 구분합니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public enum ErrorReason {

    /** 예약 가능한 메시지 없음 (정상적인 빈 poll). */
    MESSAGE_NOT_FOUND,

    /** 큐가 존재하지 않음 (삭제되었거나 아직 생성되지 않음). */
    QUEUE_NOT_FOUND,

    /** 기타 오류. */
    UNKNOWN;

    /**
     * 원격 오류 메시지 본문으로부터 분류 추론.
     *
     * <p>클라이언트가 분류를 제공하지 않을 때만 사용하는 호환 경로입니다.
     * 원격 서비스의 오류 본문 문구("Message not found", "Queue not found")에 의존합니다.</p>
     *
     * @param body 오류 메시지 본문 (null 허용)
     * @return 추론된 분류
     */
    public static ErrorReason fromMessage(String body) {
        if (body == null) {
            return UNKNOWN;
        }
        if (body.contains("Message not found")) {
            return MESSAGE_NOT_FOUND;
        }
        if (body.contains("Queue not found")) {
            return QUEUE_NOT_FOUND;
        }
        return UNKNOWN;
    }
}
