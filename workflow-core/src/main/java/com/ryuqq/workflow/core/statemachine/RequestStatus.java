package com.ryuqq.workflow.core.statemachine;

/**
 * 서비스 요청의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>OPEN → IN_PROGRESS / BLOCKED / COMPLETED / CANCELLED</li>
 *   <li>IN_PROGRESS ↔ BLOCKED (return 후 다시 advance)</li>
 *   <li>IN_PROGRESS, BLOCKED → COMPLETED / CANCELLED</li>
 *   <li><strong>종료 상태에서는 어떤 전이도 불가 (불변식)</strong></li>
 *   <li><strong>OPEN으로 되돌아가는 전이 불가</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * OPEN (첫 단계에서 생성)
 *    │
 *    ▼ (advance / assign_directly / escalate)
 * IN_PROGRESS ◄──────► BLOCKED (return)
 *    │                    │
 *    ├─► COMPLETED ◄──────┤ (마지막 단계에서 advance)
 *    │                    │
 *    └─► CANCELLED ◄──────┘ (cancel, 단계 무관)
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum RequestStatus {

    /**
     * 생성됨 (아직 어떤 전이도 없음).
     */
    OPEN,

    /**
     * 처리 중.
     */
    IN_PROGRESS,

    /**
     * 이전 단계로 반려되어 재작업 대기 중.
     */
    BLOCKED,

    /**
     * 완료 (마지막 단계 통과).
     */
    COMPLETED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, CANCELLED)의 요청은 어떤 전이도 받지 않습니다.</p>
     *
     * @return COMPLETED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
