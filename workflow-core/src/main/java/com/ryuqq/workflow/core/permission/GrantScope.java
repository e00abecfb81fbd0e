package com.ryuqq.workflow.core.permission;

/**
 * 권한이 적용되는 단계 범위.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum GrantScope {

    /**
     * 행위자 역할이 요청의 현재 단계(currentRole)와 같을 때만 유효.
     */
    OWN_STAGE,

    /**
     * 단계와 무관하게 유효 (관리/감독 역할).
     */
    ANY_STAGE
}
