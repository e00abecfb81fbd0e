package com.ryuqq.workflow.core.statemachine;

import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditLedger;
import com.ryuqq.workflow.core.definition.ActionRule;
import com.ryuqq.workflow.core.definition.WorkflowDefinition;
import com.ryuqq.workflow.core.definition.WorkflowDefinitions;
import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.executor.ExecutionError;
import com.ryuqq.workflow.core.executor.ExecutionResult;
import com.ryuqq.workflow.core.executor.OperationClasses;
import com.ryuqq.workflow.core.executor.ResilientExecutor;
import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.ActionStamp;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.ClientId;
import com.ryuqq.workflow.core.model.Creator;
import com.ryuqq.workflow.core.model.Priority;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;
import com.ryuqq.workflow.core.model.StateData;
import com.ryuqq.workflow.core.model.WorkflowType;
import com.ryuqq.workflow.core.outcome.Outcome;
import com.ryuqq.workflow.core.permission.Decision;
import com.ryuqq.workflow.core.permission.PermissionEngine;
import com.ryuqq.workflow.core.spi.NotificationDeliveryException;
import com.ryuqq.workflow.core.spi.NotificationDispatcher;
import com.ryuqq.workflow.core.spi.RequestStore;
import com.ryuqq.workflow.core.spi.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 서비스 요청 한 건의 생명주기를 관리하는 상태 머신.
 *
 * <p><strong>전이 처리 순서:</strong></p>
 * <ol>
 *   <li>종료 상태이면 거부 (TERMINAL)</li>
 *   <li>(현재 단계, 행위)에 해당하는 규칙이 없으면 거부 (INVALID_ACTION)</li>
 *   <li>권한 엔진 판정, 거부 시 FORBIDDEN</li>
 *   <li>payload를 stateData에 추가할 수 없으면 거부 (VALIDATION)</li>
 *   <li>규칙에서 다음 단계/상태 계산 (escalate는 우선순위 상향)</li>
 *   <li>{@code persistence-write} 정책으로 저장</li>
 *   <li>저장 성공 시 감사 기록(GRANTED) 후 {@code notification-dispatch}로 알림을 비동기 요청</li>
 *   <li>저장 실패 시 감사 기록(DENIED) 후 실패 분류에 맞는 오류 반환</li>
 * </ol>
 *
 * <p>이 클래스가 판정한 모든 시도는 정확히 한 건의 감사 기록을 남깁니다.
 * 알림 실패는 이미 저장된 전이를 되돌리지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 같은 요청에 대한 호출의 직렬화는 호출자(오케스트레이터)의 책임입니다.
 * 이 클래스 자체는 상태를 갖지 않으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class WorkflowStateMachine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMachine.class);

    private final WorkflowDefinitions definitions;
    private final PermissionEngine permissionEngine;
    private final ResilientExecutor executor;
    private final RequestStore requestStore;
    private final AuditLedger auditLedger;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public WorkflowStateMachine(WorkflowDefinitions definitions,
                                PermissionEngine permissionEngine,
                                ResilientExecutor executor,
                                RequestStore requestStore,
                                AuditLedger auditLedger,
                                NotificationDispatcher notificationDispatcher,
                                Clock clock) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        if (permissionEngine == null) {
            throw new IllegalArgumentException("permissionEngine cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (requestStore == null) {
            throw new IllegalArgumentException("requestStore cannot be null");
        }
        if (auditLedger == null) {
            throw new IllegalArgumentException("auditLedger cannot be null");
        }
        if (notificationDispatcher == null) {
            throw new IllegalArgumentException("notificationDispatcher cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.definitions = definitions;
        this.permissionEngine = permissionEngine;
        this.executor = executor;
        this.requestStore = requestStore;
        this.auditLedger = auditLedger;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    /**
     * 신규 요청 생성.
     *
     * <p>{@code create} 권한을 확인한 뒤 워크플로 첫 단계에서 OPEN 상태로 저장합니다.</p>
     *
     * @param requestId 발급된 요청 ID (거부되어도 감사 기록에 사용)
     * @param workflowType 워크플로 유형
     * @param creator 생성자
     * @param clientId 수혜 고객
     * @param priority 초기 우선순위
     * @param payload 초기 데이터 (null 허용)
     * @param dailyCountSoFar 생성자가 최근 24시간 동안 생성한 요청 수
     * @param signal 취소 신호
     * @return 저장된 요청 또는 거부 사유
     */
    public TransitionResult initiate(RequestId requestId, WorkflowType workflowType, Creator creator,
                                     ClientId clientId, Priority priority, Map<String, String> payload,
                                     int dailyCountSoFar, CancellationSignal signal) {
        Instant now = clock.instant();
        Actor actor = creator.actor();

        Optional<WorkflowDefinition> definition = definitions.find(workflowType);
        if (definition.isEmpty()) {
            return reject(requestId, actor, Action.CREATE, null, TransitionError.of(
                TransitionErrorKind.INVALID_ACTION, TransitionReasons.INVALID_ACTION), now);
        }

        Decision decision = permissionEngine.authorize(actor.role(), Action.CREATE, workflowType, dailyCountSoFar);
        if (!decision.allowed()) {
            return reject(requestId, actor, Action.CREATE, null,
                TransitionError.of(TransitionErrorKind.FORBIDDEN, decision.reason()), now);
        }

        Optional<String> violation = StateData.empty().findViolation(payload);
        if (violation.isPresent()) {
            return reject(requestId, actor, Action.CREATE, null,
                TransitionError.of(TransitionErrorKind.VALIDATION, violation.get()), now);
        }

        Role firstStage = definition.get().firstStage();
        ServiceRequest candidate = ServiceRequest.open(requestId, workflowType, firstStage, creator, clientId,
            priority, StateData.of(payload), now);

        return persist(candidate, 0L, actor, Action.CREATE, null, signal, now);
    }

    /**
     * 요청에 행위를 적용.
     *
     * @param request 마지막으로 저장된 스냅샷
     * @param actor 인증된 행위자
     * @param action 행위
     * @param payload stateData에 추가할 데이터 (null 허용)
     * @param dailyCountSoFar 행위자가 최근 24시간 동안 같은 행위를 수행한 횟수
     * @param signal 취소 신호
     * @return 저장된 새 스냅샷 또는 거부 사유
     */
    public TransitionResult transition(ServiceRequest request, Actor actor, Action action,
                                       Map<String, String> payload, int dailyCountSoFar,
                                       CancellationSignal signal) {
        Instant now = clock.instant();
        RequestId requestId = request.id();
        Role fromRole = request.currentRole();

        if (request.isTerminal()) {
            return reject(requestId, actor, action, fromRole,
                TransitionError.of(TransitionErrorKind.TERMINAL, TransitionReasons.TERMINAL), now);
        }

        Optional<ActionRule> rule = definitions.find(request.workflowType())
            .flatMap(definition -> definition.rule(fromRole, action));
        if (rule.isEmpty() || !StatusTransition.isAllowed(request.status(), rule.get().resultingStatus())) {
            return reject(requestId, actor, action, fromRole,
                TransitionError.of(TransitionErrorKind.INVALID_ACTION, TransitionReasons.INVALID_ACTION), now);
        }

        Decision decision = permissionEngine.authorizeOnStage(
            actor.role(), action, request.workflowType(), dailyCountSoFar, fromRole);
        if (!decision.allowed()) {
            return reject(requestId, actor, action, fromRole,
                TransitionError.of(TransitionErrorKind.FORBIDDEN, decision.reason()), now);
        }

        Optional<String> violation = request.stateData().findViolation(payload);
        if (violation.isPresent()) {
            return reject(requestId, actor, action, fromRole,
                TransitionError.of(TransitionErrorKind.VALIDATION, violation.get()), now);
        }

        ActionRule next = rule.get();
        Priority nextPriority = action == Action.ESCALATE ? request.priority().escalate() : request.priority();
        ServiceRequest candidate = request.advance(next.targetRole(), next.resultingStatus(), nextPriority,
            request.stateData().append(payload), new ActionStamp(actor.id(), action, now));

        return persist(candidate, request.version(), actor, action, fromRole, signal, now);
    }

    /**
     * 요청 조회성 행위(view 등)의 권한 판정. 상태를 바꾸지 않으며 감사 기록은 호출자가 남긴다.
     *
     * @param request 대상 요청
     * @param actor 행위자
     * @param action 조회성 행위
     * @return 판정
     */
    public Decision authorizeAccess(ServiceRequest request, Actor actor, Action action) {
        return permissionEngine.authorizeAccess(actor, request, action);
    }

    /**
     * 현재 단계에서 가능한 전이 행위.
     *
     * @param request 요청
     * @return 종료 상태이거나 정의가 없으면 빈 Set
     */
    public Set<Action> availableActions(ServiceRequest request) {
        if (request.isTerminal()) {
            return Set.of();
        }
        return definitions.find(request.workflowType())
            .map(definition -> definition.availableActions(request.currentRole()))
            .orElse(Set.of());
    }

    private TransitionResult persist(ServiceRequest candidate, long expectedVersion, Actor actor, Action action,
                                     Role fromRole, CancellationSignal signal, Instant now) {
        ExecutionResult<Long> saved = executor.execute(OperationClasses.PERSISTENCE_WRITE, context -> {
            try {
                return Outcome.ok(requestStore.save(candidate, expectedVersion));
            } catch (VersionConflictException e) {
                return Outcome.fail(TransitionReasons.VERSION_CONFLICT_CODE, e.getMessage());
            }
        }, signal);

        if (saved instanceof ExecutionResult.Succeeded<Long> succeeded) {
            ServiceRequest stored = candidate.withVersion(succeeded.value());
            auditLedger.record(AuditEntry.granted(stored.id(), actor, action, fromRole, stored.currentRole(), now));
            notifyAsync(stored, actor, action, fromRole);
            return new Transitioned(stored);
        }

        ExecutionError error = ((ExecutionResult.Failed<Long>) saved).error();
        TransitionError transitionError = toTransitionError(error);
        if (transitionError.kind() != TransitionErrorKind.STALE_VERSION) {
            log.error("Persistence failed: requestId={}, action={}, kind={}, attempts={}, message={}",
                candidate.id(), action.code(), error.kind(), error.attemptCount(), error.message());
        }
        return reject(candidate.id(), actor, action, fromRole, transitionError, now);
    }

    private TransitionError toTransitionError(ExecutionError error) {
        switch (error.kind()) {
            case FATAL:
                if (TransitionReasons.VERSION_CONFLICT_CODE.equals(error.errorCode())) {
                    return new TransitionError(TransitionErrorKind.STALE_VERSION,
                        TransitionReasons.STALE_VERSION, error.attempts());
                }
                return new TransitionError(TransitionErrorKind.PERSISTENCE_FAILED,
                    TransitionReasons.PERSISTENCE_FAILED, error.attempts());
            case CIRCUIT_OPEN:
                return new TransitionError(TransitionErrorKind.CIRCUIT_OPEN,
                    TransitionReasons.PERSISTENCE_FAILED, error.attempts());
            case DEADLINE_EXCEEDED:
                return new TransitionError(TransitionErrorKind.DEADLINE_EXCEEDED,
                    TransitionReasons.DEADLINE_EXCEEDED, error.attempts());
            case CANCELLED:
                return new TransitionError(TransitionErrorKind.CANCELLED,
                    TransitionReasons.CANCELLED, error.attempts());
            case ATTEMPTS_EXHAUSTED:
            default:
                return new TransitionError(TransitionErrorKind.PERSISTENCE_FAILED,
                    TransitionReasons.PERSISTENCE_FAILED, error.attempts());
        }
    }

    private TransitionResult reject(RequestId requestId, Actor actor, Action action, Role fromRole,
                                    TransitionError error, Instant now) {
        log.info("Transition denied: requestId={}, actor={}, role={}, action={}, kind={}, reason={}",
            requestId, actor.id(), actor.role().code(), action.code(), error.kind(), error.reason());
        auditLedger.record(AuditEntry.denied(requestId, actor, action, fromRole, error.reason(), now));
        return new Rejected(error);
    }

    private void notifyAsync(ServiceRequest stored, Actor actor, Action action, Role fromRole) {
        Notification notification = Notification.of(stored, actor, action, fromRole);
        executor.<Void>executeAsync(OperationClasses.NOTIFICATION_DISPATCH, context -> {
            try {
                notificationDispatcher.dispatch(notification.recipientId(), notification.templateKey(),
                    notification.parameters());
                return Outcome.ok(null);
            } catch (NotificationDeliveryException e) {
                if (e.isPermanent()) {
                    return Outcome.fail("notification_rejected", e.getMessage());
                }
                throw e;
            }
        }, CancellationSignal.none()).thenAccept(result -> {
            if (result instanceof ExecutionResult.Failed<Void> failed) {
                log.warn("Notification not delivered: requestId={}, template={}, recipient={}, kind={}, attempts={}",
                    stored.id(), notification.templateKey(), notification.recipientId(),
                    failed.kind(), failed.error().attemptCount());
            }
        });
    }

    /**
     * 전이 결과에 따른 알림 내용.
     */
    private record Notification(String recipientId, String templateKey, Map<String, String> parameters) {

        static Notification of(ServiceRequest stored, Actor actor, Action action, Role fromRole) {
            Map<String, String> parameters = new LinkedHashMap<>();
            parameters.put("request_id", stored.id().getValue());
            parameters.put("workflow_type", stored.workflowType().code());
            parameters.put("action", action.code());
            parameters.put("actor_id", actor.id().getValue());
            if (fromRole != null) {
                parameters.put("from_role", fromRole.code());
            }
            parameters.put("to_role", stored.currentRole().code());
            parameters.put("status", stored.status().name().toLowerCase(Locale.ROOT));
            parameters.put("priority", stored.priority().name().toLowerCase(Locale.ROOT));

            String creator = stored.creator().actorId().getValue();
            String stage = "role:" + stored.currentRole().code();
            if (stored.status() == RequestStatus.CANCELLED) {
                return new Notification(creator, "request.cancelled", parameters);
            }
            if (stored.status() == RequestStatus.COMPLETED) {
                return new Notification(creator, "request.completed", parameters);
            }
            switch (action) {
                case CREATE:
                    return new Notification(stage, "request.created", parameters);
                case RETURN:
                    return new Notification(stage, "request.returned", parameters);
                case ESCALATE:
                    return new Notification(stage, "request.escalated", parameters);
                default:
                    return new Notification(stage, "request.assigned", parameters);
            }
        }
    }
}
