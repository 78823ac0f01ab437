package com.ryuqq.queuebridge.core.model;

/**
 * 내부 파이프라인 전달용 봉투 (Envelope).
 *
 * <p>Add/Delete 파이프라인은 각각 로컬 작업 큐이며, 항목을 내부 핸들러로 라우팅하기 위해
 * 바깥쪽 taskName을 파이프라인 핸들러 이름으로 사용합니다. 원본 Message는 그대로 보존되어
 * 최종 처리 시 {@link #unwrap()}으로 복원됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Envelope envelope = Envelope.wrap(msg, "emails:add-message");
 * envelope.taskName();   // "emails:add-message"
 * envelope.unwrap();     // msg (taskName 변경 없음)
 * </pre>
 *
 * @param taskName 내부 핸들러 이름
 * @param message 원본 Message
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public record Envelope(
    String taskName,
    Message message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskName이 비어 있거나 message가 null인 경우
     */
    public Envelope {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }

    /**
     * 원본 Message를 내부 핸들러용 봉투로 감쌉니다.
     *
     * @param message 원본 Message
     * @param handlerName 내부 핸들러 이름
     * @return 생성된 Envelope
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public static Envelope wrap(Message message, String handlerName) {
        return new Envelope(handlerName, message);
    }

    /**
     * 원본 Message 복원.
     *
     * @return 감싸기 전의 Message
     */
    public Message unwrap() {
        return message;
    }
}
