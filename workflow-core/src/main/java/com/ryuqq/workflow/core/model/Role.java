package com.ryuqq.workflow.core.model;

import java.util.Optional;

/**
 * 조직 내 역할.
 *
 * <p>요청의 처리 단계(Stage)이자 권한 매트릭스의 주체입니다.
 * 목록에 없는 역할(예: 차단된 사용자)은 {@link #fromCode(String)}에서
 * 빈 값으로 해석되며, 권한 엔진은 이를 거부합니다 (fail-closed).</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum Role {

    ADMIN("admin"),
    CLIENT("client"),
    MANAGER("manager"),
    JUNIOR_MANAGER("junior_manager"),
    CONTROLLER("controller"),
    TECHNICIAN("technician"),
    WAREHOUSE("warehouse"),
    CALL_CENTER("call_center"),
    CALL_CENTER_SUPERVISOR("call_center_supervisor");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    /**
     * 외부 표기(snake_case) 조회.
     *
     * @return 역할 코드 (예: junior_manager)
     */
    public String code() {
        return code;
    }

    /**
     * 역할 코드로 Role 조회.
     *
     * @param code 역할 코드
     * @return 일치하는 Role, 없으면 빈 Optional
     */
    public static Optional<Role> fromCode(String code) {
        for (Role role : values()) {
            if (role.code.equals(code)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
