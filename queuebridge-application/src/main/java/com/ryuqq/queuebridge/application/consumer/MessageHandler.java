package com.ryuqq.queuebridge.application.consumer;

import com.ryuqq.queuebridge.core.model.Message;

/**
 * 예약된 Message를 처리하는 핸들러.
 *
 * <p>정상 반환은 처리 성공, 예외는 처리 실패를 의미합니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Message 처리.
     *
     * @param msg 처리할 Message
     * @throws Exception 처리 실패 시
     */
    void handleMessage(Message msg) throws Exception;
}
