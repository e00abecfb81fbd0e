package com.ryuqq.workflow.core.permission;

/**
 * 권한 매트릭스의 한 칸.
 *
 * @param allowed 허용 여부 (false이면 명시적 거부)
 * @param dailyLimit 일일 한도 (null이면 무제한)
 * @param scope 적용 범위
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record PermissionGrant(boolean allowed, Integer dailyLimit, GrantScope scope) {

    public PermissionGrant {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (dailyLimit != null && dailyLimit < 0) {
            throw new IllegalArgumentException("dailyLimit must be non-negative (current: " + dailyLimit + ")");
        }
    }

    public static PermissionGrant allow(GrantScope scope) {
        return new PermissionGrant(true, null, scope);
    }

    public static PermissionGrant allowWithLimit(GrantScope scope, int dailyLimit) {
        return new PermissionGrant(true, dailyLimit, scope);
    }

    public static PermissionGrant deny() {
        return new PermissionGrant(false, null, GrantScope.ANY_STAGE);
    }

    public boolean hasDailyLimit() {
        return dailyLimit != null;
    }
}
