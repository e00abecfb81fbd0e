package com.ryuqq.workflow.core.definition;

import com.ryuqq.workflow.core.model.WorkflowType;

/**
 * 워크플로 정의가 구조적으로 잘못되었을 때 로드 시점에 발생.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InvalidWorkflowDefinitionException extends RuntimeException {

    private final transient WorkflowType workflowType;

    public InvalidWorkflowDefinitionException(WorkflowType workflowType, String message) {
        super("Invalid workflow definition [" + workflowType + "]: " + message);
        this.workflowType = workflowType;
    }

    public WorkflowType getWorkflowType() {
        return workflowType;
    }
}
