package com.ryuqq.queuebridge.core.model;

/**
 * 원격 큐의 long-poll 응답 레코드.
 *
 * @param id 원격 식별자
 * @param reservationId 예약 토큰
 * @param body 인코딩된 본문 문자열
 * @param reservedCount 누적 예약 횟수
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public record RemoteMessage(
    String id,
    String reservationId,
    String body,
    int reservedCount
) {

    public RemoteMessage {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (reservedCount < 0) {
            throw new IllegalArgumentException("reservedCount must be non-negative (current: " + reservedCount + ")");
        }
    }
}
