package com.ryuqq.workflow.core.protection;

/**
 * 작업 클래스별 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>strategy: 대기 시간 계산 전략 (기본 EXPONENTIAL)</li>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs: 기본 대기 시간 (기본 1000ms)</li>
 *   <li>maxDelayMs: 최대 대기 시간 (기본 300000ms = 5분)</li>
 *   <li>backoffMultiplier: 지수 배수 (기본 2.0)</li>
 *   <li>jitterFactor: 대기 시간 대비 ±지터 비율 (기본 0.1, 0이면 비활성)</li>
 *   <li>deadlineMs: 전체 기한 (기본 0 = 제한 없음)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 * @param strategy 재시도 전략
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 대기 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
 * @param backoffMultiplier 지수 배수 (1.0 이상)
 * @param jitterFactor 지터 비율 (0.0 ~ 1.0)
 * @param deadlineMs 전체 기한 (밀리초, 0이면 제한 없음)
 */
public record RetryPolicy(
    RetryStrategy strategy,
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double backoffMultiplier,
    double jitterFactor,
    long deadlineMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: EXPONENTIAL, maxAttempts=3, baseDelayMs=1000ms, maxDelayMs=300000ms,
     * backoffMultiplier=2.0, jitterFactor=0.1, deadlineMs=0 (제한 없음)</p>
     */
    public RetryPolicy() {
        this(RetryStrategy.EXPONENTIAL, 3, 1_000, 300_000, 2.0, 0.1, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (deadlineMs < 0) {
            throw new IllegalArgumentException(
                "deadlineMs must be non-negative (current: " + deadlineMs + ")"
            );
        }
    }

    /**
     * 전략을 고려한 실제 최대 시도 횟수.
     *
     * @return NONE이면 1, 아니면 maxAttempts
     */
    public int effectiveMaxAttempts() {
        return strategy == RetryStrategy.NONE ? 1 : maxAttempts;
    }

    public boolean hasDeadline() {
        return deadlineMs > 0;
    }

    public RetryPolicy withStrategy(RetryStrategy strategy) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }

    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }

    public RetryPolicy withBackoffMultiplier(double backoffMultiplier) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }

    public RetryPolicy withDeadlineMs(long deadlineMs) {
        return new RetryPolicy(strategy, maxAttempts, baseDelayMs, maxDelayMs, backoffMultiplier, jitterFactor, deadlineMs);
    }
}
