package com.ryuqq.queuebridge.core.codec;

import com.ryuqq.queuebridge.core.model.Message;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageCodec 테스트.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
class MessageCodecTest {

    @Test
    void encode_ProducesPrintableString() {
        // Given
        Message msg = Message.of("send-email", new byte[]{0, 1, 2, (byte) 0xFF});

        // When
        String body = MessageCodec.encodeToString(msg);

        // Then
        assertThat(body).matches("^[A-Za-z0-9+/=]+$");
    }

    @Test
    void decode_RestoresTaskNameNameAndPayload() {
        // Given
        byte[] payload = "{\"to\":\"a@b.c\"}".getBytes(StandardCharsets.UTF_8);
        Message msg = Message.named("send-email", "welcome-42", payload);
        msg.setId("remote-1");
        msg.setReservationId("res-1");

        // When
        Message decoded = MessageCodec.decodeString(MessageCodec.encodeToString(msg));

        // Then
        assertThat(decoded.getTaskName()).isEqualTo("send-email");
        assertThat(decoded.getName()).isEqualTo("welcome-42");
        assertThat(decoded.getPayload()).isEqualTo(payload);
        assertThat(decoded.getId()).isNull();
        assertThat(decoded.getReservationId()).isNull();
    }

    @Test
    void decode_BinaryPayloadWithAllByteValues_IsByteForByte() {
        // Given
        byte[] payload = new byte[256];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }

        // When
        Message decoded = MessageCodec.decodeString(MessageCodec.encodeToString(Message.of("t", payload)));

        // Then
        assertThat(decoded.getPayload()).containsExactly(payload);
    }

    @Test
    void decode_NullPayload_StaysNull() {
        Message decoded = MessageCodec.decodeString(MessageCodec.encodeToString(Message.of("t", null)));

        assertThat(decoded.getPayload()).isNull();
        assertThat(decoded.getName()).isNull();
    }

    @Test
    void decode_InvalidBase64_ThrowsDecodeException() {
        assertThatThrownBy(() -> MessageCodec.decodeString("%%% not base64 %%%"))
            .isInstanceOf(MessageDecodeException.class)
            .hasMessageContaining("base64");
    }

    @Test
    void decode_ValidBase64ButGarbage_ThrowsDecodeException() {
        String garbage = Base64.getEncoder().encodeToString(new byte[]{0x01});

        assertThatThrownBy(() -> MessageCodec.decodeString(garbage))
            .isInstanceOf(MessageDecodeException.class);
    }

    @Test
    void decode_Null_ThrowsDecodeException() {
        assertThatThrownBy(() -> MessageCodec.decodeString(null))
            .isInstanceOf(MessageDecodeException.class);
    }

    @Test
    void encode_Null_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> MessageCodec.encodeToString(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }
}
