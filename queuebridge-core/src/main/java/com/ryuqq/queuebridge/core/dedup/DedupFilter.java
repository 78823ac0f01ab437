package com.ryuqq.queuebridge.core.dedup;

import com.ryuqq.queuebridge.core.model.Message;
import com.ryuqq.queuebridge.core.spi.DedupStorage;

/**
 * push 전 중복 메시지 필터.
 *
 * <p>Message에 논리적 {@code name}이 있으면 큐 이름과 결합한 전체 키로
 * {@link DedupStorage}를 조회합니다. 키가 이미 존재하면 중복으로 판정합니다.</p>
 *
 * <p><strong>키 형식:</strong> {@code queuebridge:{queueName}:{messageName}}</p>
 *
 * <p>저장소가 설정되지 않았거나 name이 없는 Message는 항상 중복이 아닙니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class DedupFilter {

    private static final String KEY_PREFIX = "queuebridge:";

    private final DedupStorage storage;
    private final String queueName;

    /**
     * 생성자.
     *
     * @param storage 중복 제거 저장소 (null이면 필터 비활성화)
     * @param queueName 큐 이름
     * @throws IllegalArgumentException queueName이 비어 있는 경우
     */
    public DedupFilter(DedupStorage storage, String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName cannot be null or blank");
        }
        this.storage = storage;
        this.queueName = queueName;
    }

    /**
     * 중복 여부 판정.
     *
     * @param message 검사할 Message
     * @return 중복이면 true
     */
    public boolean isDuplicate(Message message) {
        if (storage == null || message.getName() == null || message.getName().isEmpty()) {
            return false;
        }
        return storage.exists(fullMessageName(message));
    }

    /**
     * 큐 이름과 메시지 이름으로 전체 키 생성.
     *
     * @param message name이 있는 Message
     * @return 전체 키
     */
    public String fullMessageName(Message message) {
        return KEY_PREFIX + queueName + ":" + message.getName();
    }
}
