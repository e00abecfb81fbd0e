package com.ryuqq.workflow.core.definition;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 워크플로의 한 단계: 담당 역할과 허용된 전이 규칙.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class Stage {

    private final Role role;
    private final Map<Action, ActionRule> rules;

    public Stage(Role role, Map<Action, ActionRule> rules) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.role = role;
        this.rules = rules.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public Role role() {
        return role;
    }

    public Optional<ActionRule> rule(Action action) {
        return Optional.ofNullable(rules.get(action));
    }

    /**
     * 이 단계에서 허용된 행위 (선언 순서와 무관하게 enum 순서).
     */
    public Set<Action> actions() {
        return rules.keySet();
    }

    Map<Action, ActionRule> rules() {
        return rules;
    }

    @Override
    public String toString() {
        return "Stage{" + role + ", actions=" + rules.keySet() + '}';
    }
}
