package com.ryuqq.queuebridge.core.model;

import com.ryuqq.queuebridge.core.exception.DuplicateMessageException;

import java.time.Duration;
import java.util.Arrays;

/**
 * 큐를 통해 전달되는 작업 단위.
 *
 * <p>Message는 호출자가 생성하고, 원격 큐에 push되면서 {@code id}를 부여받고,
 * 예약(reservation)되면서 {@code reservationId}와 {@code reservedCount}를 부여받습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 원격 큐가 부여한 식별자 (push 전에는 null)</li>
 *   <li><strong>name:</strong> 중복 제거에 사용되는 논리적 이름 (선택)</li>
 *   <li><strong>taskName:</strong> 메시지를 처리할 핸들러 이름 (필수)</li>
 *   <li><strong>payload:</strong> 불투명한 바이너리 본문</li>
 *   <li><strong>delay:</strong> 첫 예약 전 가시성 지연</li>
 *   <li><strong>err:</strong> 조회용으로 첨부된 오류 (반환값으로 전파되지 않음)</li>
 *   <li><strong>reservationId:</strong> 현재 예약 소유를 증명하는 토큰 (release/delete 시 필수)</li>
 *   <li><strong>reservedCount:</strong> 예약된 횟수 (poison message 감지용)</li>
 * </ul>
 *
 * <p><strong>가변성:</strong> 파이프라인이 id, err, 예약 정보를 제자리에서 채우므로
 * 값 객체가 아닌 가변 객체입니다. 스레드 간 공유 시 외부 동기화가 필요합니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class Message {

    private String id;
    private String name;
    private String taskName;
    private byte[] payload;
    private Duration delay = Duration.ZERO;
    private Throwable err;
    private String reservationId;
    private int reservedCount;

    /**
     * 빈 Message 생성.
     *
     * <p>예약 경로에서 원격 레코드를 디코딩할 때 사용됩니다.</p>
     */
    public Message() {
    }

    /**
     * taskName과 payload로 Message 생성.
     *
     * @param taskName 처리 핸들러 이름
     * @param payload 본문 (null 허용)
     * @return 새 Message
     */
    public static Message of(String taskName, byte[] payload) {
        Message msg = new Message();
        msg.taskName = taskName;
        msg.payload = payload;
        return msg;
    }

    /**
     * 중복 제거용 이름을 가진 Message 생성.
     *
     * @param taskName 처리 핸들러 이름
     * @param name 논리적 이름
     * @param payload 본문 (null 허용)
     * @return 새 Message
     */
    public static Message named(String taskName, String name, byte[] payload) {
        Message msg = of(taskName, payload);
        msg.name = name;
        return msg;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTaskName() {
        return taskName;
    }

    public void setTaskName(String taskName) {
        this.taskName = taskName;
    }

    public byte[] getPayload() {
        return payload;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload;
    }

    public Duration getDelay() {
        return delay;
    }

    /**
     * 가시성 지연 설정.
     *
     * @param delay 지연 시간 (null이면 0으로 간주)
     * @throws IllegalArgumentException delay가 음수인 경우
     */
    public void setDelay(Duration delay) {
        if (delay != null && delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative (current: " + delay + ")");
        }
        this.delay = delay == null ? Duration.ZERO : delay;
    }

    public Throwable getErr() {
        return err;
    }

    public void setErr(Throwable err) {
        this.err = err;
    }

    public String getReservationId() {
        return reservationId;
    }

    public void setReservationId(String reservationId) {
        this.reservationId = reservationId;
    }

    public int getReservedCount() {
        return reservedCount;
    }

    public void setReservedCount(int reservedCount) {
        this.reservedCount = reservedCount;
    }

    /**
     * taskName이 지정되었는지 확인.
     *
     * @return taskName이 null 또는 빈 문자열이 아니면 true
     */
    public boolean hasTaskName() {
        return taskName != null && !taskName.isEmpty();
    }

    /**
     * 유효한 예약을 보유하고 있는지 확인.
     *
     * @return id와 reservationId가 모두 있으면 true
     */
    public boolean isReserved() {
        return id != null && !id.isEmpty() && reservationId != null && !reservationId.isEmpty();
    }

    /**
     * 중복으로 판정되어 push가 생략되었는지 확인.
     *
     * @return err가 {@link DuplicateMessageException}이면 true
     */
    public boolean isDuplicate() {
        return err instanceof DuplicateMessageException;
    }

    @Override
    public String toString() {
        return "Message{" +
            "id=" + id +
            ", name=" + name +
            ", taskName=" + taskName +
            ", payload=" + (payload == null ? "null" : payload.length + " bytes") +
            ", delay=" + delay +
            ", reservedCount=" + reservedCount +
            (err == null ? "" : ", err=" + err) +
            '}';
    }

    /**
     * 본문 비교용 헬퍼.
     *
     * @param other 비교할 본문
     * @return 본문이 동일하면 true
     */
    public boolean payloadEquals(byte[] other) {
        return Arrays.equals(payload, other);
    }
}
