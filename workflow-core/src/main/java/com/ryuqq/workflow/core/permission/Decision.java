package com.ryuqq.workflow.core.permission;

/**
 * 권한 판정 결과.
 *
 * @param allowed 허용 여부
 * @param reason 거부 사유 (허용이면 {@link #GRANTED})
 * @param scope 허용된 경우 적용 범위 (거부이면 null)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Decision(boolean allowed, String reason, GrantScope scope) {

    public static final String GRANTED = "granted";

    /** 매트릭스에 해당 조합이 없거나 명시적으로 거부됨. */
    public static final String NO_MATCHING_GRANT = "no_matching_grant";

    /** 일일 한도 도달. */
    public static final String DAILY_LIMIT_EXCEEDED = "daily_limit_exceeded";

    /** OWN_STAGE 권한인데 현재 단계의 역할이 아님. */
    public static final String NOT_STAGE_OWNER = "not_stage_owner";

    /** 고객이 다른 고객의 요청에 접근. */
    public static final String NOT_OWN_REQUEST = "not_own_request";

    public Decision {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (allowed && scope == null) {
            throw new IllegalArgumentException("scope cannot be null for an allowed decision");
        }
    }

    public static Decision allow(GrantScope scope) {
        return new Decision(true, GRANTED, scope);
    }

    public static Decision deny(String reason) {
        return new Decision(false, reason, null);
    }
}
