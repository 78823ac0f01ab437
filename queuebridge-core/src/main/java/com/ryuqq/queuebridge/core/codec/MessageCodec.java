package com.ryuqq.queuebridge.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.ryuqq.queuebridge.core.model.Message;

import java.io.IOException;
import java.util.Base64;

/**
 * Message ↔ 전송 문자열 코덱.
 *
 * <p>원격 큐 API는 본문을 출력 가능한 문자열로만 받기 때문에,
 * Message를 CBOR로 바이너리 인코딩한 뒤 Base64 문자열로 표현합니다.</p>
 *
 * <p><strong>인코딩 대상 필드:</strong> taskName, name, payload.
 * id, reservationId, reservedCount는 원격 큐가 관리하므로 인코딩하지 않습니다.</p>
 *
 * <p><strong>보장:</strong> payload는 바이트 단위로 동일하게 왕복됩니다.</p>
 *
 * <p>스레드 안전합니다 (Jackson ObjectMapper는 설정 이후 불변).</p>
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
public final class MessageCodec {

    private static final ObjectMapper MAPPER = CBORMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private MessageCodec() {
    }

    /**
     * Message를 전송 문자열로 인코딩.
     *
     * @param message 인코딩할 Message
     * @return Base64 문자열
     * @throws IllegalArgumentException message가 null인 경우
     * @throws IllegalStateException 직렬화에 실패한 경우
     */
    public static String encodeToString(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        WireMessage wire = new WireMessage(message.getTaskName(), message.getName(), message.getPayload());
        try {
            return Base64.getEncoder().encodeToString(MAPPER.writeValueAsBytes(wire));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode message " + message, e);
        }
    }

    /**
     * 전송 문자열을 Message로 디코딩.
     *
     * @param body Base64 문자열
     * @return 복원된 Message (id 등 원격 필드는 비어 있음)
     * @throws MessageDecodeException 형식이 올바르지 않은 경우
     */
    public static Message decodeString(String body) {
        if (body == null) {
            throw new MessageDecodeException("message body is null", null);
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new MessageDecodeException("message body is not valid base64", e);
        }

        WireMessage wire;
        try {
            wire = MAPPER.readValue(bytes, WireMessage.class);
        } catch (IOException e) {
            throw new MessageDecodeException("message body is not a valid encoded message", e);
        }
        if (wire == null) {
            throw new MessageDecodeException("message body is empty", null);
        }

        Message message = new Message();
        message.setTaskName(wire.taskName());
        message.setName(wire.name());
        message.setPayload(wire.payload());
        return message;
    }

    /**
     * 전송 형식 (CBOR map).
     */
    record WireMessage(String taskName, String name, byte[] payload) {
    }
}
