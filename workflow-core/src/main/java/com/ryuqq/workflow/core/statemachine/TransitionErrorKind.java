package com.ryuqq.workflow.core.statemachine;

/**
 * 전이 거부 사유 분류.
 *
 * <p>{@link #isRetryableByCaller()}는 호출자가 (다시 로드한 뒤) 재시도할 만한지 알려줍니다.
 * 코어는 어떤 종류도 자동으로 재시도하지 않습니다. 인프라 오류는 이미 Executor 안에서
 * 정책만큼 재시도된 뒤 이 값으로 드러납니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum TransitionErrorKind {

    /** 요청이 존재하지 않음. */
    NOT_FOUND,

    /** 종료 상태의 요청에 전이 시도. */
    TERMINAL,

    /** 현재 단계에 정의되지 않은 행위. */
    INVALID_ACTION,

    /** 권한 없음 (fail-closed). */
    FORBIDDEN,

    /** payload 검증 실패 (사용자가 수정 가능). */
    VALIDATION,

    /** 동시 쓰기 감지 (낙관적 잠금 충돌). */
    STALE_VERSION,

    /** 저장 실패 (재시도 소진 또는 영구 오류). */
    PERSISTENCE_FAILED,

    /** 저장 Circuit Breaker가 열려 있어 즉시 실패. */
    CIRCUIT_OPEN,

    /** 저장 작업의 전체 기한 초과. */
    DEADLINE_EXCEEDED,

    /** 저장 시작 전에 호출자가 취소. */
    CANCELLED;

    /**
     * 호출자가 애플리케이션 레벨에서 재시도할 수 있는지 여부.
     *
     * @return STALE_VERSION, PERSISTENCE_FAILED, CIRCUIT_OPEN, DEADLINE_EXCEEDED이면 true
     */
    public boolean isRetryableByCaller() {
        return this == STALE_VERSION || this == PERSISTENCE_FAILED
            || this == CIRCUIT_OPEN || this == DEADLINE_EXCEEDED;
    }
}
