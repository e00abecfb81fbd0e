package com.ryuqq.workflow.core.definition;

import com.ryuqq.workflow.core.model.WorkflowType;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 워크플로 유형 → 정의 레지스트리 (불변).
 *
 * <p>프로세스 시작 시 한 번 구성하며 동기화 없이 공유해도 안전합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class WorkflowDefinitions {

    private final Map<WorkflowType, WorkflowDefinition> definitions;

    private WorkflowDefinitions(Map<WorkflowType, WorkflowDefinition> definitions) {
        this.definitions = definitions;
    }

    /**
     * @param definitions 등록할 정의 목록
     * @throws InvalidWorkflowDefinitionException 같은 유형이 두 번 등록된 경우
     */
    public static WorkflowDefinitions of(WorkflowDefinition... definitions) {
        Map<WorkflowType, WorkflowDefinition> map = new EnumMap<>(WorkflowType.class);
        for (WorkflowDefinition definition : definitions) {
            if (map.putIfAbsent(definition.workflowType(), definition) != null) {
                throw new InvalidWorkflowDefinitionException(definition.workflowType(), "registered twice");
            }
        }
        return new WorkflowDefinitions(map);
    }

    public Optional<WorkflowDefinition> find(WorkflowType workflowType) {
        return Optional.ofNullable(definitions.get(workflowType));
    }

    public Collection<WorkflowDefinition> all() {
        return definitions.values();
    }
}
