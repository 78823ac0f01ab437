package com.ryuqq.queuebridge.core.codec;

/**
 * 전송 문자열을 Message로 복원하지 못했을 때 발생.
 *
 * <p>예약 경로에서는 던져지지 않고 해당 Message의 {@code err}에만 첨부되어,
 * 같은 배치의 다른 Message 처리에는 영향을 주지 않습니다.</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public class MessageDecodeException extends RuntimeException {

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
