package com.ryuqq.workflow.core.statemachine;

/**
 * 전이 거부 결과.
 *
 * @param error 거부 상세
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Rejected(TransitionError error) implements TransitionResult {

    public Rejected {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    public static Rejected of(TransitionErrorKind kind, String reason) {
        return new Rejected(TransitionError.of(kind, reason));
    }

    public TransitionErrorKind kind() {
        return error.kind();
    }

    public String reason() {
        return error.reason();
    }
}
