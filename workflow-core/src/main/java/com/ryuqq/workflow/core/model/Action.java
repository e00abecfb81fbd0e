package com.ryuqq.workflow.core.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 권한 매트릭스가 관리하는 행위(Action).
 *
 * <p>앞의 다섯 개는 요청 상태를 바꾸는 전이 행위이며,
 * 나머지는 상태를 바꾸지 않는 조회/보조 행위입니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum Action {

    ADVANCE("advance"),
    ASSIGN_DIRECTLY("assign_directly"),
    RETURN("return"),
    ESCALATE("escalate"),
    CANCEL("cancel"),

    CREATE("create"),
    VIEW("view"),
    SELECT_CLIENT("select_client"),
    CREATE_CLIENT("create_client"),
    ADD_COMMENT("add_comment");

    private static final Set<Action> TRANSITIONS =
        EnumSet.of(ADVANCE, ASSIGN_DIRECTLY, RETURN, ESCALATE, CANCEL);

    private final String code;

    Action(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * 상태 전이 행위인지 확인.
     *
     * @return advance, assign_directly, return, escalate, cancel 중 하나이면 true
     */
    public boolean isTransition() {
        return TRANSITIONS.contains(this);
    }

    public static Optional<Action> fromCode(String code) {
        for (Action action : values()) {
            if (action.code.equals(code)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
