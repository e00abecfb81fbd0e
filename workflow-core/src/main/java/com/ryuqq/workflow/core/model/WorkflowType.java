package com.ryuqq.workflow.core.model;

import java.util.Optional;

/**
 * 요청이 거쳐 갈 단계 순서를 결정하는 워크플로 유형.
 *
 * <p>요청 생성 시 고정되며 변경되지 않습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum WorkflowType {

    CONNECTION_REQUEST("connection_request"),
    TECHNICAL_SERVICE("technical_service"),
    CALL_CENTER_DIRECT("call_center_direct");

    private final String code;

    WorkflowType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<WorkflowType> fromCode(String code) {
        for (WorkflowType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
