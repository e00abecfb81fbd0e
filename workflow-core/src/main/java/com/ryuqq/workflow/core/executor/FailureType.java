package com.ryuqq.workflow.core.executor;

/**
 * 시도 실패 분류.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum FailureType {

    /** 재시도 가능 (Retry 결과 또는 예외). */
    RETRYABLE,

    /** 영구 실패 (Fail 결과). */
    FATAL
}
