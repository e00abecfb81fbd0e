package com.ryuqq.workflow.core.definition;

import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.WorkflowType;

/**
 * 조직의 기본 워크플로 정의.
 *
 * <ul>
 *   <li>connection_request: manager → junior_manager → controller → technician → warehouse</li>
 *   <li>technical_service: controller → technician → warehouse</li>
 *   <li>call_center_direct: call_center_supervisor → call_center</li>
 * </ul>
 *
 * <p>모든 단계는 escalate와 cancel을 허용하고, 첫 단계를 제외한 모든 단계는 직전 단계로 return할 수 있습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DefaultWorkflowDefinitions {

    private DefaultWorkflowDefinitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static WorkflowDefinitions create() {
        return WorkflowDefinitions.of(connectionRequest(), technicalService(), callCenterDirect());
    }

    public static WorkflowDefinition connectionRequest() {
        return WorkflowDefinition.builder(WorkflowType.CONNECTION_REQUEST)
            .stage(Role.MANAGER).advance().assignDirectlyTo(Role.TECHNICIAN).escalate().cancel()
            .stage(Role.JUNIOR_MANAGER).advance().returnTo(Role.MANAGER).escalate().cancel()
            .stage(Role.CONTROLLER).advance().assignDirectlyTo(Role.TECHNICIAN).returnTo(Role.JUNIOR_MANAGER)
                .escalate().cancel()
            .stage(Role.TECHNICIAN).advance().returnTo(Role.CONTROLLER).escalate().cancel()
            .stage(Role.WAREHOUSE).advance().returnTo(Role.TECHNICIAN).escalate().cancel()
            .build();
    }

    public static WorkflowDefinition technicalService() {
        return WorkflowDefinition.builder(WorkflowType.TECHNICAL_SERVICE)
            .stage(Role.CONTROLLER).advance().assignDirectlyTo(Role.TECHNICIAN).escalate().cancel()
            .stage(Role.TECHNICIAN).advance().returnTo(Role.CONTROLLER).escalate().cancel()
            .stage(Role.WAREHOUSE).advance().returnTo(Role.TECHNICIAN).escalate().cancel()
            .build();
    }

    public static WorkflowDefinition callCenterDirect() {
        return WorkflowDefinition.builder(WorkflowType.CALL_CENTER_DIRECT)
            .stage(Role.CALL_CENTER_SUPERVISOR).advance().assignDirectlyTo(Role.CALL_CENTER).escalate().cancel()
            .stage(Role.CALL_CENTER).advance().returnTo(Role.CALL_CENTER_SUPERVISOR).escalate().cancel()
            .build();
    }
}
