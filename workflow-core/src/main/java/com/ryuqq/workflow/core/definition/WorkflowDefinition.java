package com.ryuqq.workflow.core.definition;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.WorkflowType;
import com.ryuqq.workflow.core.statemachine.RequestStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 워크플로 유형별 정적 정의: 순서가 있는 단계 목록과 단계별 전이 규칙.
 *
 * <p>생성 시점에 구조를 검증하고, 이후에는 읽기 전용입니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>단계가 하나 이상이며 역할이 중복되지 않음</li>
 *   <li>모든 단계에 전이 규칙이 하나 이상 존재</li>
 *   <li>규칙의 행위는 전이 행위이며, 대상 단계는 이 워크플로에 정의된 단계</li>
 *   <li>어떤 규칙도 OPEN 상태로 보내지 않음</li>
 *   <li>cancel은 항상 CANCELLED, 마지막 단계의 advance는 항상 COMPLETED</li>
 * </ul>
 *
 * <p><strong>Builder 예시:</strong></p>
 * <pre>{@code
 * WorkflowDefinition definition = WorkflowDefinition.builder(WorkflowType.TECHNICAL_SERVICE)
 *     .stage(Role.CONTROLLER).advance().assignDirectlyTo(Role.TECHNICIAN).escalate().cancel()
 *     .stage(Role.TECHNICIAN).advance().returnTo(Role.CONTROLLER).escalate().cancel()
 *     .stage(Role.WAREHOUSE).advance().returnTo(Role.TECHNICIAN).escalate().cancel()
 *     .build();
 * }</pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class WorkflowDefinition {

    private final WorkflowType workflowType;
    private final List<Stage> stages;
    private final Map<Role, Stage> stagesByRole;

    /**
     * @param workflowType 워크플로 유형
     * @param stages 순서가 있는 단계 목록 (첫 단계가 요청 생성 단계)
     * @throws InvalidWorkflowDefinitionException 검증 규칙 위반 시
     */
    public WorkflowDefinition(WorkflowType workflowType, List<Stage> stages) {
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
        if (stages == null || stages.isEmpty()) {
            throw new InvalidWorkflowDefinitionException(workflowType, "at least one stage is required");
        }
        Map<Role, Stage> byRole = new LinkedHashMap<>();
        for (Stage stage : stages) {
            if (byRole.putIfAbsent(stage.role(), stage) != null) {
                throw new InvalidWorkflowDefinitionException(workflowType, "duplicate stage " + stage.role());
            }
        }
        this.workflowType = workflowType;
        this.stages = List.copyOf(stages);
        this.stagesByRole = Collections.unmodifiableMap(byRole);
        validate();
    }

    private void validate() {
        Role last = stages.get(stages.size() - 1).role();
        for (Stage stage : stages) {
            if (stage.actions().isEmpty()) {
                throw new InvalidWorkflowDefinitionException(workflowType,
                    "stage " + stage.role() + " has no outgoing action");
            }
            for (Map.Entry<Action, ActionRule> entry : stage.rules().entrySet()) {
                Action action = entry.getKey();
                ActionRule rule = entry.getValue();
                String where = stage.role() + "/" + action.code();
                if (!action.isTransition()) {
                    throw new InvalidWorkflowDefinitionException(workflowType, where + " is not a transition action");
                }
                if (rule.action() != action) {
                    throw new InvalidWorkflowDefinitionException(workflowType, where + " is keyed to rule " + rule.action());
                }
                if (!stagesByRole.containsKey(rule.targetRole())) {
                    throw new InvalidWorkflowDefinitionException(workflowType,
                        where + " targets undefined stage " + rule.targetRole());
                }
                if (rule.resultingStatus() == RequestStatus.OPEN) {
                    throw new InvalidWorkflowDefinitionException(workflowType, where + " cannot result in OPEN");
                }
                if (action == Action.CANCEL && rule.resultingStatus() != RequestStatus.CANCELLED) {
                    throw new InvalidWorkflowDefinitionException(workflowType, where + " must result in CANCELLED");
                }
                if (action == Action.ADVANCE && stage.role() == last
                    && rule.resultingStatus() != RequestStatus.COMPLETED) {
                    throw new InvalidWorkflowDefinitionException(workflowType, where + " must result in COMPLETED");
                }
            }
        }
    }

    public static Builder builder(WorkflowType workflowType) {
        return new Builder(workflowType);
    }

    public WorkflowType workflowType() {
        return workflowType;
    }

    public List<Stage> stages() {
        return stages;
    }

    /**
     * 요청이 생성되는 첫 단계.
     */
    public Role firstStage() {
        return stages.get(0).role();
    }

    public boolean containsStage(Role role) {
        return stagesByRole.containsKey(role);
    }

    public Optional<Stage> stage(Role role) {
        return Optional.ofNullable(stagesByRole.get(role));
    }

    /**
     * (현재 단계, 행위)에 해당하는 규칙 조회.
     *
     * @return 규칙, 정의되지 않았으면 빈 Optional
     */
    public Optional<ActionRule> rule(Role currentRole, Action action) {
        Stage stage = stagesByRole.get(currentRole);
        return stage == null ? Optional.empty() : stage.rule(action);
    }

    /**
     * 단계에서 가능한 전이 행위.
     *
     * @return 정의되지 않은 단계이면 빈 Set
     */
    public Set<Action> availableActions(Role currentRole) {
        Stage stage = stagesByRole.get(currentRole);
        return stage == null ? Set.of() : stage.actions();
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" + workflowType.code() + ", stages=" + stagesByRole.keySet() + '}';
    }

    /**
     * {@link WorkflowDefinition} 빌더.
     *
     * <p>{@code stage(role)}로 단계를 열고 이어지는 호출로 그 단계의 행위를 선언합니다.
     * advance의 대상 단계와 상태는 단계 순서에서 계산됩니다.</p>
     */
    public static final class Builder {

        private final WorkflowType workflowType;
        private final List<Role> order = new ArrayList<>();
        private final Map<Role, Set<Action>> declared = new LinkedHashMap<>();
        private final Map<Role, Map<Action, Role>> targets = new LinkedHashMap<>();
        private Role current;

        private Builder(WorkflowType workflowType) {
            if (workflowType == null) {
                throw new IllegalArgumentException("workflowType cannot be null");
            }
            this.workflowType = workflowType;
        }

        public Builder stage(Role role) {
            if (role == null) {
                throw new IllegalArgumentException("role cannot be null");
            }
            if (declared.containsKey(role)) {
                throw new InvalidWorkflowDefinitionException(workflowType, "duplicate stage " + role);
            }
            order.add(role);
            declared.put(role, EnumSet.noneOf(Action.class));
            targets.put(role, new EnumMap<>(Action.class));
            current = role;
            return this;
        }

        public Builder advance() {
            return declare(Action.ADVANCE, null);
        }

        public Builder escalate() {
            return declare(Action.ESCALATE, null);
        }

        public Builder cancel() {
            return declare(Action.CANCEL, null);
        }

        public Builder returnTo(Role target) {
            return declare(Action.RETURN, requireTarget(Action.RETURN, target));
        }

        public Builder assignDirectlyTo(Role target) {
            return declare(Action.ASSIGN_DIRECTLY, requireTarget(Action.ASSIGN_DIRECTLY, target));
        }

        private Role requireTarget(Action action, Role target) {
            if (target == null) {
                String where = current == null ? action.code() : current.code() + "/" + action.code();
                throw new InvalidWorkflowDefinitionException(workflowType, where + " requires a target stage");
            }
            return target;
        }

        private Builder declare(Action action, Role target) {
            if (current == null) {
                throw new IllegalStateException("stage(role) must be called before declaring " + action.code());
            }
            declared.get(current).add(action);
            if (target != null) {
                targets.get(current).put(action, target);
            }
            return this;
        }

        public WorkflowDefinition build() {
            List<Stage> stages = new ArrayList<>();
            for (int i = 0; i < order.size(); i++) {
                Role role = order.get(i);
                Role next = i + 1 < order.size() ? order.get(i + 1) : null;
                Map<Action, ActionRule> rules = new EnumMap<>(Action.class);
                for (Action action : declared.get(role)) {
                    rules.put(action, resolve(role, next, action, targets.get(role).get(action)));
                }
                stages.add(new Stage(role, rules));
            }
            return new WorkflowDefinition(workflowType, stages);
        }

        private ActionRule resolve(Role role, Role next, Action action, Role target) {
            switch (action) {
                case ADVANCE:
                    return next == null
                        ? new ActionRule(action, role, RequestStatus.COMPLETED)
                        : new ActionRule(action, next, RequestStatus.IN_PROGRESS);
                case ESCALATE:
                    return new ActionRule(action, role, RequestStatus.IN_PROGRESS);
                case CANCEL:
                    return new ActionRule(action, role, RequestStatus.CANCELLED);
                case RETURN:
                    return new ActionRule(action, target, RequestStatus.BLOCKED);
                case ASSIGN_DIRECTLY:
                    return new ActionRule(action, target, RequestStatus.IN_PROGRESS);
                default:
                    throw new IllegalStateException("Unexpected action: " + action);
            }
        }
    }
}
