package com.ryuqq.workflow.core.audit;

/**
 * 감사 기록 결과.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum AuditOutcome {

    GRANTED,

    DENIED
}
