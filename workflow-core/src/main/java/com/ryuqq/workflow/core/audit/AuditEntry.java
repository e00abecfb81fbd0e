package com.ryuqq.workflow.core.audit;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.ActorId;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;

import java.time.Instant;

/**
 * 전이 시도 한 건의 감사 기록 (불변, 한 번만 기록).
 *
 * <p>허용된 전이와 명시적으로 거부된 전이 모두 기록됩니다. 수정하거나 삭제하지 않습니다.</p>
 *
 * @param requestId 대상 요청 (거부된 생성 요청은 발급만 되고 저장되지 않은 ID)
 * @param actorId 행위자
 * @param actorRole 행위자 역할
 * @param action 시도한 행위
 * @param fromRole 시도 시점의 단계 (요청을 찾지 못했거나 생성이면 null)
 * @param toRole 전이 후 단계 (거부되었거나 계산 전이면 null)
 * @param outcome 허용/거부
 * @param reason 거부 사유 (허용이면 null)
 * @param timestamp 기록 시각
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record AuditEntry(
    RequestId requestId,
    ActorId actorId,
    Role actorRole,
    Action action,
    Role fromRole,
    Role toRole,
    AuditOutcome outcome,
    String reason,
    Instant timestamp
) {

    public AuditEntry {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (actorId == null) {
            throw new IllegalArgumentException("actorId cannot be null");
        }
        if (actorRole == null) {
            throw new IllegalArgumentException("actorRole cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome == AuditOutcome.DENIED && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("reason cannot be null or blank for a denied entry");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    public static AuditEntry granted(RequestId requestId, Actor actor, Action action,
                                     Role fromRole, Role toRole, Instant timestamp) {
        return new AuditEntry(requestId, actor.id(), actor.role(), action, fromRole, toRole,
            AuditOutcome.GRANTED, null, timestamp);
    }

    public static AuditEntry denied(RequestId requestId, Actor actor, Action action,
                                    Role fromRole, String reason, Instant timestamp) {
        return new AuditEntry(requestId, actor.id(), actor.role(), action, fromRole, null,
            AuditOutcome.DENIED, reason, timestamp);
    }

    public boolean isGranted() {
        return outcome == AuditOutcome.GRANTED;
    }
}
