package com.ryuqq.queuebridge.adapter.runner.workqueue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author QueueBridge Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 첫_시도는_최소_백오프부터_시작() {
        BackoffCalculator calculator = new BackoffCalculator(Duration.ofSeconds(1), Duration.ofMinutes(30));

        long delay = calculator.calculate(1);

        assertThat(delay).isBetween(1000L, 1100L);
    }

    @Test
    void 시도마다_두_배로_증가() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 300000, 0.0);

        assertThat(calculator.calculate(1)).isEqualTo(1000);
        assertThat(calculator.calculate(2)).isEqualTo(2000);
        assertThat(calculator.calculate(3)).isEqualTo(4000);
    }

    @Test
    void 최대_백오프를_넘지_않음() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 5000, 0.1);

        assertThat(calculator.calculate(10)).isEqualTo(5000);
        assertThat(calculator.calculate(Integer.MAX_VALUE)).isEqualTo(5000);
    }

    @Test
    void delayFor는_Duration으로_반환() {
        BackoffCalculator calculator = new BackoffCalculator(200, 1000, 0.0);

        assertThat(calculator.delayFor(2)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void attempt는_양수여야_함() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be positive");
    }

    @Test
    void 최대값이_최소값보다_작으면_실패() {
        assertThatThrownBy(() -> new BackoffCalculator(1000, 500, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxBackoffMs must be >= minBackoffMs");
    }
}
