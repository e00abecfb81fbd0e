package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.protection.RetryPolicy;
import com.ryuqq.workflow.core.protection.RetryStrategy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 지수_백오프_최대값에서_제한() {
        // given
        BackoffCalculator calculator = calculator(RetryStrategy.EXPONENTIAL, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(400);
        assertThat(calculator.calculate(4)).isEqualTo(800);
        assertThat(calculator.calculate(5)).isEqualTo(1_000);
        assertThat(calculator.calculate(60)).isEqualTo(1_000);
    }

    @Test
    void 선형_백오프() {
        // given
        BackoffCalculator calculator = calculator(RetryStrategy.LINEAR, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(3)).isEqualTo(300);
        assertThat(calculator.calculate(20)).isEqualTo(1_000);
    }

    @Test
    void 고정_백오프() {
        // given
        BackoffCalculator calculator = calculator(RetryStrategy.FIXED, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(7)).isEqualTo(100);
    }

    @Test
    void 즉시_재시도는_지연_없음() {
        // given
        BackoffCalculator calculator = calculator(RetryStrategy.IMMEDIATE, 0.5);

        // when & then
        assertThat(calculator.calculate(1)).isZero();
        assertThat(calculator.calculate(4)).isZero();
    }

    @Test
    void 지터는_대칭_범위_안에서_최대값_이하() {
        // given
        BackoffCalculator calculator = calculator(RetryStrategy.EXPONENTIAL, 0.2);

        // when & then
        for (int i = 0; i < 200; i++) {
            assertThat(calculator.calculate(2)).isBetween(160L, 240L);
            assertThat(calculator.calculate(5)).isBetween(800L, 1_000L);
        }
    }

    @Test
    void 지수_백오프_배수_지정() {
        // given
        BackoffCalculator tripling = new BackoffCalculator(
            new RetryPolicy(RetryStrategy.EXPONENTIAL, 7, 100, 10_000, 3.0, 0.0, 0), new Random(7));
        BackoffCalculator halfAgain = new BackoffCalculator(
            new RetryPolicy(RetryStrategy.EXPONENTIAL, 7, 100, 10_000, 1.5, 0.0, 0), new Random(7));

        // when & then
        assertThat(tripling.calculate(1)).isEqualTo(100);
        assertThat(tripling.calculate(2)).isEqualTo(300);
        assertThat(tripling.calculate(3)).isEqualTo(900);
        assertThat(tripling.calculate(4)).isEqualTo(2_700);
        assertThat(tripling.calculate(5)).isEqualTo(8_100);
        assertThat(tripling.calculate(6)).isEqualTo(10_000);
        assertThat(halfAgain.calculate(2)).isEqualTo(150);
        assertThat(halfAgain.calculate(3)).isEqualTo(225);
    }

    @Test
    void 지터_사용_시_같은_시드면_같은_지연_순서() {
        // given
        RetryPolicy policy = new RetryPolicy(RetryStrategy.EXPONENTIAL, 8, 100, 10_000, 2.0, 0.3, 0);
        BackoffCalculator first = new BackoffCalculator(policy, new Random(42));
        BackoffCalculator second = new BackoffCalculator(policy, new Random(42));
        BackoffCalculator otherSeed = new BackoffCalculator(policy, new Random(43));

        // when
        List<Long> firstDelays = new ArrayList<>();
        List<Long> secondDelays = new ArrayList<>();
        List<Long> otherDelays = new ArrayList<>();
        for (int attempt = 1; attempt <= 7; attempt++) {
            firstDelays.add(first.calculate(attempt));
            secondDelays.add(second.calculate(attempt));
            otherDelays.add(otherSeed.calculate(attempt));
        }

        // then
        assertThat(firstDelays).isEqualTo(secondDelays);
        assertThat(firstDelays).isNotEqualTo(otherDelays);
        assertThat(firstDelays.get(0)).isBetween(70L, 130L);
    }

    @Test
    void 시도_번호_0_예외() {
        // given
        BackoffCalculator calculator = calculator(RetryStrategy.FIXED, 0.0);

        // when & then
        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("failedAttempt must be positive");
    }

    private BackoffCalculator calculator(RetryStrategy strategy, double jitter) {
        return new BackoffCalculator(new RetryPolicy(strategy, 5, 100, 1_000, 2.0, jitter, 0), new Random(7));
    }
}
