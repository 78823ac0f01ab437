/**
 * Queue Bridge 데이터 모델.
 *
 * <ul>
 *   <li>{@link com.ryuqq.queuebridge.core.model.Message} - 작업 단위 (가변)</li>
 *   <li>{@link com.ryuqq.queuebridge.core.model.Envelope} - 내부 파이프라인 봉투</li>
 *   <li>{@link com.ryuqq.queuebridge.core.model.RemoteMessage} - long-poll 응답 레코드</li>
 *   <li>{@link com.ryuqq.queuebridge.core.model.ReservationRef} - 예약 참조</li>
 * </ul>
 *
 * <p><strong>수명 주기:</strong></p>
 * <pre>
 * 생성 → push (id 부여) → reserve (reservationId, reservedCount++)
 *   → delete (영구 삭제) | release (delay 후 재예약 가능) | 만료 (자동 재예약 가능)
 * </pre>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
package com.ryuqq.queuebridge.core.model;
