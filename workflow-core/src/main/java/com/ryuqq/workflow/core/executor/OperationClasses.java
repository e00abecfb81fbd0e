package com.ryuqq.workflow.core.executor;

/**
 * 코어가 사용하는 작업 클래스 이름.
 *
 * <p>작업 클래스마다 별도의 RetryPolicy와 Circuit Breaker가 적용됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class OperationClasses {

    /** 요청 스냅샷 저장. */
    public static final String PERSISTENCE_WRITE = "persistence-write";

    /** 외부 알림 발송. */
    public static final String NOTIFICATION_DISPATCH = "notification-dispatch";

    /** 감사 로그 기록. */
    public static final String AUDIT_WRITE = "audit-write";

    private OperationClasses() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
