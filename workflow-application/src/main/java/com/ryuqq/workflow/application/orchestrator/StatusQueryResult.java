package com.ryuqq.workflow.application.orchestrator;

import com.ryuqq.workflow.core.statemachine.TransitionErrorKind;

/**
 * 행위자 기준 요청 조회 결과.
 *
 * <ul>
 *   <li>{@link Found}: 접근 허용, 현재 상태 포함</li>
 *   <li>{@link Denied}: 요청 없음(NOT_FOUND) 또는 접근 거부(FORBIDDEN)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public sealed interface StatusQueryResult permits StatusQueryResult.Found, StatusQueryResult.Denied {

    default boolean isFound() {
        return this instanceof Found;
    }

    record Found(WorkflowStatus status) implements StatusQueryResult {

        public Found {
            if (status == null) {
                throw new IllegalArgumentException("status cannot be null");
            }
        }
    }

    record Denied(TransitionErrorKind kind, String reason) implements StatusQueryResult {

        public Denied {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
