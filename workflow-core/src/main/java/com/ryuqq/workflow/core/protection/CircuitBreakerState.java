package com.ryuqq.workflow.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 작업 클래스(예: persistence-write)별로 연속 실패를 추적하고,
 * 임계값 도달 시 호출을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과, 시험 호출 1건)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► successThreshold 연속 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>성공하면 연속 실패 카운터가 초기화됩니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>작업을 호출하지 않고 즉시 실패시킵니다.
     * recoveryTimeout이 경과하면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 호출 1건씩만 통과).
     *
     * <p>시험 호출이 실패하면 즉시 OPEN으로 돌아갑니다.</p>
     */
    HALF_OPEN
}
