package com.ryuqq.workflow.core.permission;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.WorkflowType;

/**
 * 권한 매트릭스 조회 키.
 *
 * @param role 행위자 역할
 * @param action 행위
 * @param workflowType 워크플로 유형
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record PermissionKey(Role role, Action action, WorkflowType workflowType) {

    public PermissionKey {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
    }
}
