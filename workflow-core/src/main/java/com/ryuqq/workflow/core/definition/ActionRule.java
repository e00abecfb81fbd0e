package com.ryuqq.workflow.core.definition;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.statemachine.RequestStatus;

/**
 * 단계에서 허용된 전이 한 건: 행위 → (다음 단계, 다음 상태).
 *
 * <p>상태는 행위에서 추론하지 않고 규칙에 명시됩니다.</p>
 *
 * @param action 전이 행위
 * @param targetRole 전이 후 단계
 * @param resultingStatus 전이 후 상태
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record ActionRule(Action action, Role targetRole, RequestStatus resultingStatus) {

    public ActionRule {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (targetRole == null) {
            throw new IllegalArgumentException("targetRole cannot be null");
        }
        if (resultingStatus == null) {
            throw new IllegalArgumentException("resultingStatus cannot be null");
        }
    }
}
