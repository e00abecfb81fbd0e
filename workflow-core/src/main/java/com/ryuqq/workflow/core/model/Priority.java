package com.ryuqq.workflow.core.model;

/**
 * 요청 우선순위.
 *
 * <p>escalate 권한을 가진 역할만 변경할 수 있습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum Priority {

    LOW,
    MEDIUM,
    HIGH;

    /**
     * 한 단계 상향된 우선순위.
     *
     * @return LOW → MEDIUM → HIGH, HIGH는 그대로 HIGH
     */
    public Priority escalate() {
        return switch (this) {
            case LOW -> MEDIUM;
            case MEDIUM, HIGH -> HIGH;
        };
    }
}
