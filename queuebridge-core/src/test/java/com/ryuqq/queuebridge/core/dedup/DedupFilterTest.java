package com.ryuqq.queuebridge.core.dedup;

import com.ryuqq.queuebridge.core.model.Message;
import com.ryuqq.queuebridge.core.spi.DedupStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * DedupFilter 유닛 테스트.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DedupFilterTest {

    @Mock
    private DedupStorage storage;

    @Test
    void name이_없으면_저장소를_조회하지_않고_중복_아님() {
        // given
        DedupFilter filter = new DedupFilter(storage, "emails");

        // when
        boolean duplicate = filter.isDuplicate(Message.of("send", null));

        // then
        assertThat(duplicate).isFalse();
        verifyNoInteractions(storage);
    }

    @Test
    void 저장소에_키가_존재하면_중복() {
        // given
        DedupFilter filter = new DedupFilter(storage, "emails");
        when(storage.exists("queuebridge:emails:welcome-1")).thenReturn(true);

        // when & then
        assertThat(filter.isDuplicate(Message.named("send", "welcome-1", null))).isTrue();
    }

    @Test
    void 저장소에_키가_없으면_중복_아님() {
        DedupFilter filter = new DedupFilter(storage, "emails");
        when(storage.exists(anyString())).thenReturn(false);

        assertThat(filter.isDuplicate(Message.named("send", "welcome-1", null))).isFalse();
        verify(storage).exists("queuebridge:emails:welcome-1");
    }

    @Test
    void 저장소가_없으면_항상_중복_아님() {
        DedupFilter filter = new DedupFilter(null, "emails");

        assertThat(filter.isDuplicate(Message.named("send", "welcome-1", null))).isFalse();
    }

    @Test
    void 전체_키는_큐_이름과_메시지_이름으로_구성됨() {
        DedupFilter filter = new DedupFilter(storage, "billing");

        assertThat(filter.fullMessageName(Message.named("charge", "invoice-9", null)))
            .isEqualTo("queuebridge:billing:invoice-9");
    }

    @Test
    void queueName이_비어있으면_예외() {
        assertThatThrownBy(() -> new DedupFilter(storage, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueName");
    }
}
