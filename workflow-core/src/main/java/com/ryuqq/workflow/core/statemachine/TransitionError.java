package com.ryuqq.workflow.core.statemachine;

import com.ryuqq.workflow.core.executor.AttemptRecord;

import java.util.List;

/**
 * 전이 거부 상세.
 *
 * @param kind 거부 분류
 * @param reason 사람이 조치할 수 있는 사유 (감사 로그의 reason과 동일)
 * @param attempts 저장 시도 이력 (저장 단계 이전에 거부된 경우 빈 목록)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record TransitionError(
    TransitionErrorKind kind,
    String reason,
    List<AttemptRecord> attempts
) {

    public TransitionError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static TransitionError of(TransitionErrorKind kind, String reason) {
        return new TransitionError(kind, reason, List.of());
    }
}
