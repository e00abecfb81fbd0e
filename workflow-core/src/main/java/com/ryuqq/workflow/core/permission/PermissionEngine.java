package com.ryuqq.workflow.core.permission;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;
import com.ryuqq.workflow.core.model.WorkflowType;

/**
 * 권한 엔진.
 *
 * <p>정적 매트릭스에 대한 순수 조회입니다. I/O와 상태가 없고,
 * 같은 입력에는 항상 같은 판정을 돌려줍니다.</p>
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>매트릭스에 칸이 없거나 명시적 거부 → {@code no_matching_grant} (fail-closed)</li>
 *   <li>일일 한도가 있고 {@code dailyCountSoFar >= limit} → {@code daily_limit_exceeded}</li>
 *   <li>{@link #authorizeOnStage}의 경우, OWN_STAGE 권한인데 행위자가 현재 단계의 역할이 아님
 *       → {@code not_stage_owner}</li>
 * </ol>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class PermissionEngine {

    private final PermissionMatrix matrix;

    /**
     * @param matrix 권한 매트릭스
     * @throws IllegalArgumentException matrix가 null인 경우
     */
    public PermissionEngine(PermissionMatrix matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix cannot be null");
        }
        this.matrix = matrix;
    }

    /**
     * 단계와 무관한 권한 판정.
     *
     * @param role 행위자 역할 (null이면 거부)
     * @param action 행위 (null이면 거부)
     * @param workflowType 워크플로 유형 (null이면 거부)
     * @param dailyCountSoFar 오늘(최근 24시간) 이미 수행한 횟수
     * @return 판정
     * @throws IllegalArgumentException dailyCountSoFar가 음수인 경우
     */
    public Decision authorize(Role role, Action action, WorkflowType workflowType, int dailyCountSoFar) {
        if (dailyCountSoFar < 0) {
            throw new IllegalArgumentException("dailyCountSoFar must be non-negative (current: " + dailyCountSoFar + ")");
        }
        PermissionGrant grant = matrix.find(role, action, workflowType).orElse(null);
        if (grant == null || !grant.allowed()) {
            return Decision.deny(Decision.NO_MATCHING_GRANT);
        }
        if (grant.hasDailyLimit() && dailyCountSoFar >= grant.dailyLimit()) {
            return Decision.deny(Decision.DAILY_LIMIT_EXCEEDED);
        }
        return Decision.allow(grant.scope());
    }

    /**
     * 요청의 현재 단계를 고려한 권한 판정.
     *
     * @param role 행위자 역할
     * @param action 행위
     * @param workflowType 워크플로 유형
     * @param dailyCountSoFar 오늘 이미 수행한 횟수
     * @param stageRole 요청의 현재 단계 역할
     * @return 판정
     */
    public Decision authorizeOnStage(Role role, Action action, WorkflowType workflowType,
                                     int dailyCountSoFar, Role stageRole) {
        Decision decision = authorize(role, action, workflowType, dailyCountSoFar);
        if (decision.allowed() && decision.scope() == GrantScope.OWN_STAGE && role != stageRole) {
            return Decision.deny(Decision.NOT_STAGE_OWNER);
        }
        return decision;
    }

    /**
     * 저장된 요청 하나에 대한 조회성 행위(view, add_comment 등) 판정.
     *
     * <p><strong>판정 순서:</strong></p>
     * <ol>
     *   <li>client: 본인 고객 ID의 요청이 아니면 {@code not_own_request}</li>
     *   <li>요청이 현재 행위자 역할의 단계에 있으면 허용 (담당 요청)</li>
     *   <li>그 외에는 매트릭스 판정 ({@link #authorizeOnStage}, 일일 한도 없음)</li>
     * </ol>
     *
     * @param actor 행위자
     * @param request 대상 요청
     * @param action 조회성 행위
     * @return 판정
     * @throws IllegalArgumentException actor 또는 request가 null인 경우
     */
    public Decision authorizeAccess(Actor actor, ServiceRequest request, Action action) {
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (actor.role() == Role.CLIENT
            && !request.clientId().getValue().equals(actor.id().getValue())) {
            return Decision.deny(Decision.NOT_OWN_REQUEST);
        }
        if (actor.role() == request.currentRole() && !request.isTerminal()) {
            return Decision.allow(GrantScope.OWN_STAGE);
        }
        return authorizeOnStage(actor.role(), action, request.workflowType(), 0, request.currentRole());
    }
}
