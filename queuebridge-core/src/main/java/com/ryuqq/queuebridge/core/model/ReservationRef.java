package com.ryuqq.queuebridge.core.model;

/**
 * 하나의 예약을 가리키는 참조 (id + reservationId).
 *
 * <p>배치 삭제 요청의 항목으로 사용됩니다.</p>
 *
 * @param id 원격 식별자
 * @param reservationId 예약 토큰
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public record ReservationRef(String id, String reservationId) {

    public ReservationRef {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (reservationId == null || reservationId.isBlank()) {
            throw new IllegalArgumentException("reservationId cannot be null or blank");
        }
    }

    /**
     * 예약된 Message로부터 참조 생성.
     *
     * @param message 예약된 Message
     * @return ReservationRef
     * @throws IllegalArgumentException message가 예약 정보를 갖고 있지 않은 경우
     */
    public static ReservationRef of(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        return new ReservationRef(message.getId(), message.getReservationId());
    }
}
