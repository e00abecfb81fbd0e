package com.ryuqq.workflow.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>작업 클래스 하나의 실패를 추적하고, 임계값 초과 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.forClass("notification-dispatch");
 *
 * if (!cb.tryAcquire()) {
 *     // OPEN 상태: 작업을 호출하지 않음
 *     return circuitOpen();
 * }
 *
 * Outcome<T> outcome = operation.attempt(ctx);
 * if (outcome.isOk()) {
 *     cb.recordSuccess();
 * } else if (outcome.isFail()) {
 *     cb.release();            // 영구 실패는 회로 상태에 반영하지 않음
 * } else {
 *     cb.recordFailure("timeout");
 * }
 * }</pre>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 하며,
 * CLOSED 상태의 {@link #tryAcquire()}는 잠금 없이 동작해야 합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: recoveryTimeout 전이면 false, 경과했으면 HALF_OPEN으로 전이 후 시험 호출 1건만 true</li>
     *   <li>HALF_OPEN: 진행 중인 시험 호출이 없을 때만 true</li>
     * </ul>
     *
     * @return true: 통과 허용, false: 차단
     */
    boolean tryAcquire();

    /**
     * 시도 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: 연속 성공이 successThreshold에 도달하면 CLOSED로 전이</li>
     * </ul>
     */
    void recordSuccess();

    /**
     * 재시도 가능한 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패가 failureThreshold에 도달하면 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이</li>
     * </ul>
     *
     * @param reason 실패 사유 (로깅용)
     */
    void recordFailure(String reason);

    /**
     * 통과 허가를 회로 상태 변경 없이 반납.
     *
     * <p>영구 실패(Fail)처럼 작업 클래스의 건강 상태와 무관한 결과에 사용합니다.
     * HALF_OPEN의 시험 호출 슬롯을 다시 비웁니다.</p>
     */
    void release();

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 카운터를 포함한 현재 상태 스냅샷.
     *
     * @return 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * CLOSED 상태로 강제 리셋 (관리 작업).
     */
    void reset();
}
