package com.ryuqq.workflow.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker 상태 스냅샷 (읽기 전용).
 *
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses HALF_OPEN에서의 연속 성공 수
 * @param openedAt 마지막으로 OPEN된 시각 (CLOSED이면 null)
 * @param windowFailures 현재 모니터링 윈도우 내 실패 수
 * @param windowSuccesses 현재 모니터링 윈도우 내 성공 수
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    CircuitBreakerState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    Instant openedAt,
    long windowFailures,
    long windowSuccesses
) {

    public CircuitBreakerSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }
}
