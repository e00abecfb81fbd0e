package com.ryuqq.workflow.core.statemachine;

/**
 * 전이 거부 사유 코드 (감사 로그의 reason과 동일).
 *
 * <p>권한 엔진의 사유({@code no_matching_grant}, {@code daily_limit_exceeded}, {@code not_stage_owner})와
 * payload 검증 사유({@code reserved_key:<key>}, {@code state_data_conflict:<key>})는 그대로 전달됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class TransitionReasons {

    public static final String NOT_FOUND = "not_found";

    public static final String TERMINAL = "terminal";

    public static final String INVALID_ACTION = "invalid_action";

    public static final String STALE_VERSION = "stale_version";

    public static final String PERSISTENCE_FAILED = "persistence_failed";

    public static final String DEADLINE_EXCEEDED = "deadline_exceeded";

    public static final String CANCELLED = "cancelled";

    /** 저장소가 버전 충돌 시 반환하는 오류 코드. */
    public static final String VERSION_CONFLICT_CODE = "version_conflict";

    private TransitionReasons() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
