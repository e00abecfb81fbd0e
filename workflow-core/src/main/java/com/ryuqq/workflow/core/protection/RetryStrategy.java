package com.ryuqq.workflow.core.protection;

/**
 * 재시도 대기 시간 계산 전략.
 *
 * <p>n번째 시도가 실패한 뒤의 대기 시간 (base = baseDelayMs, m = backoffMultiplier):</p>
 * <ul>
 *   <li>EXPONENTIAL: base × m^(n-1)</li>
 *   <li>LINEAR: base × n</li>
 *   <li>FIXED: base</li>
 *   <li>IMMEDIATE: 0 (대기 없이 재시도)</li>
 *   <li>NONE: 재시도하지 않음 (maxAttempts와 무관하게 1회)</li>
 * </ul>
 *
 * <p>모든 값은 maxDelayMs로 제한됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum RetryStrategy {

    EXPONENTIAL,

    LINEAR,

    FIXED,

    IMMEDIATE,

    NONE
}
