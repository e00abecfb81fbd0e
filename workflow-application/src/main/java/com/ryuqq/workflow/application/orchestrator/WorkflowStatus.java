package com.ryuqq.workflow.application.orchestrator;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.ServiceRequest;

import java.util.Set;

/**
 * 요청 상태 조회 결과.
 *
 * @param request 최신 스냅샷
 * @param availableActions 현재 단계에서 가능한 전이 행위 (종료 상태이면 빈 Set)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record WorkflowStatus(ServiceRequest request, Set<Action> availableActions) {

    public WorkflowStatus {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        availableActions = availableActions == null ? Set.of() : Set.copyOf(availableActions);
    }

    public boolean isTerminal() {
        return request.isTerminal();
    }
}
