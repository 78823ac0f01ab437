package com.ryuqq.queuebridge.core.exception;

/**
 * taskName 없이 Message를 추가하려 할 때 발생.
 *
 * <p>호출자 입력 오류이므로 네트워크 호출 전에 즉시 실패합니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class TaskNameRequiredException extends IllegalArgumentException {

    public TaskNameRequiredException() {
        super("message taskName is required");
    }
}
