package com.ryuqq.workflow.core.audit;

import com.ryuqq.workflow.core.model.ActorId;
import com.ryuqq.workflow.core.model.RequestId;

import java.time.Instant;

/**
 * 감사 로그 조회 조건. 모든 항목은 선택이며, null이면 해당 조건을 적용하지 않습니다.
 *
 * @param requestId 요청
 * @param actorId 행위자
 * @param from 시작 시각 (포함)
 * @param to 종료 시각 (미포함)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record AuditFilter(RequestId requestId, ActorId actorId, Instant from, Instant to) {

    private static final AuditFilter ALL = new AuditFilter(null, null, null, null);

    public AuditFilter {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to (from: " + from + ", to: " + to + ")");
        }
    }

    public static AuditFilter all() {
        return ALL;
    }

    public static AuditFilter forRequest(RequestId requestId) {
        return new AuditFilter(requestId, null, null, null);
    }

    public static AuditFilter forActor(ActorId actorId) {
        return new AuditFilter(null, actorId, null, null);
    }

    public AuditFilter withRequestId(RequestId requestId) {
        return new AuditFilter(requestId, actorId, from, to);
    }

    public AuditFilter withActorId(ActorId actorId) {
        return new AuditFilter(requestId, actorId, from, to);
    }

    public AuditFilter between(Instant from, Instant to) {
        return new AuditFilter(requestId, actorId, from, to);
    }

    public boolean matches(AuditEntry entry) {
        if (requestId != null && !requestId.equals(entry.requestId())) {
            return false;
        }
        if (actorId != null && !actorId.equals(entry.actorId())) {
            return false;
        }
        if (from != null && entry.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || entry.timestamp().isBefore(to);
    }
}
