package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.protection.RetryPolicy;

import java.util.Random;

/**
 * 재시도 대기 시간 계산기.
 *
 * <p>{@link RetryPolicy}의 전략에 따라 대기 시간을 계산하고 maxDelay로 제한한 뒤,
 * ±jitter를 더해 Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘 (n = 실패한 시도 번호, 1부터):</strong></p>
 * <pre>
 * raw    = EXPONENTIAL: base * m^(n-1)
 *          LINEAR:      base * n
 *          FIXED:       base
 *          IMMEDIATE:   0
 * capped = min(raw, maxDelay)
 * delay  = clamp(capped + capped * jitterFactor * uniform(-1, 1), 0, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (EXPONENTIAL, base=1000ms, m=2.0, jitterFactor=0):</strong></p>
 * <ul>
 *   <li>n=1: 1000ms (2번째 시도 전)</li>
 *   <li>n=2: 2000ms (3번째 시도 전)</li>
 *   <li>n=3: 4000ms</li>
 *   <li>n=10: 512000ms → maxDelay=300000ms</li>
 * </ul>
 *
 * <p>같은 seed의 {@link Random}을 주입하면 jitter를 포함한 결과가 결정적입니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final RetryPolicy policy;
    private final Random random;

    /**
     * 기본 정책으로 생성.
     */
    public BackoffCalculator() {
        this(new RetryPolicy(), new Random());
    }

    /**
     * @param policy 재시도 정책
     * @param random jitter 난수원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy, Random random) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.policy = policy;
        this.random = random;
    }

    /**
     * n번째 시도가 실패한 뒤의 대기 시간 계산.
     *
     * @param failedAttempt 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public long calculate(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }

        long capped = Math.min(rawDelay(failedAttempt), policy.maxDelayMs());
        if (capped == 0 || policy.jitterFactor() == 0.0) {
            return capped;
        }

        double offset = capped * policy.jitterFactor() * (random.nextDouble() * 2.0 - 1.0);
        long jittered = Math.round(capped + offset);
        return Math.max(0L, Math.min(jittered, policy.maxDelayMs()));
    }

    private long rawDelay(int failedAttempt) {
        long base = policy.baseDelayMs();
        return switch (policy.strategy()) {
            case EXPONENTIAL -> {
                // double 연산 후 max로 제한 (overflow 방지)
                double value = base * Math.pow(policy.backoffMultiplier(), failedAttempt - 1);
                yield value >= policy.maxDelayMs() ? policy.maxDelayMs() : (long) value;
            }
            case LINEAR -> {
                double value = (double) base * failedAttempt;
                yield value >= policy.maxDelayMs() ? policy.maxDelayMs() : (long) value;
            }
            case FIXED -> base;
            case IMMEDIATE, NONE -> 0L;
        };
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
