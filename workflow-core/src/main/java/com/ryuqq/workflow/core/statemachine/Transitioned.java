package com.ryuqq.workflow.core.statemachine;

import com.ryuqq.workflow.core.model.ServiceRequest;

/**
 * 전이 성공 결과.
 *
 * @param request 저장된 새 스냅샷 (갱신된 version 포함)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Transitioned(ServiceRequest request) implements TransitionResult {

    public Transitioned {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
    }
}
