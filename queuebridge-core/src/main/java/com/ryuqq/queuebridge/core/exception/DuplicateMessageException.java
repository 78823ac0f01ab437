package com.ryuqq.queuebridge.core.exception;

/**
 * 중복 제거 필터가 이미 존재하는 키를 발견했음을 나타냅니다.
 *
 * <p>이 예외는 던져지지 않습니다. {@code add()}는 정상 반환하고,
 * 이 인스턴스가 {@code Message.err}에 첨부됩니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class DuplicateMessageException extends RuntimeException {

    private final String key;

    public DuplicateMessageException(String key) {
        super("message with the same name already exists: " + key);
        this.key = key;
    }

    /**
     * 중복 판정에 사용된 전체 키.
     *
     * @return 중복 키
     */
    public String getKey() {
        return key;
    }
}
