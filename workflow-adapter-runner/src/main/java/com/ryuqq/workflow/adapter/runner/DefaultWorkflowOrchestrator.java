package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.application.orchestrator.CreateRequestCommand;
import com.ryuqq.workflow.application.orchestrator.StatusQueryResult;
import com.ryuqq.workflow.application.orchestrator.TransitionCommand;
import com.ryuqq.workflow.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.workflow.application.orchestrator.WorkflowStatus;
import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditFilter;
import com.ryuqq.workflow.core.audit.AuditLedger;
import com.ryuqq.workflow.core.executor.OperationStatistics;
import com.ryuqq.workflow.core.executor.ResilientExecutor;
import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;
import com.ryuqq.workflow.core.permission.Decision;
import com.ryuqq.workflow.core.spi.RequestStore;
import com.ryuqq.workflow.core.statemachine.Rejected;
import com.ryuqq.workflow.core.statemachine.TransitionErrorKind;
import com.ryuqq.workflow.core.statemachine.TransitionReasons;
import com.ryuqq.workflow.core.statemachine.TransitionResult;
import com.ryuqq.workflow.core.statemachine.WorkflowStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 오케스트레이터 기본 구현체.
 *
 * <p>요청 로드, 일일 사용량 집계, 상태 머신 호출을 묶어 외부 진입점을 제공합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>같은 요청 ID에 대한 전이는 striped lock으로 프로세스 내에서 직렬화됩니다.</li>
 *   <li>다른 요청은 서로 다른 stripe에 걸리는 한 병렬로 처리됩니다.</li>
 *   <li>프로세스 간 경합은 저장소의 버전 비교로 감지되어 STALE_VERSION으로 거부됩니다.</li>
 * </ul>
 *
 * <p><strong>감사:</strong> 상태 머신이 판정한 결과는 상태 머신이 기록하고,
 * 상태 머신에 도달하기 전에 거부된 경우(요청 없음, 로드 실패, 기대 버전 불일치)만 여기서 기록합니다.
 * 호출 한 번당 감사 기록은 정확히 한 건입니다. 행위자 기준 조회는 거부된 경우에만 기록합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DefaultWorkflowOrchestrator implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowOrchestrator.class);

    private static final int LOCK_STRIPES = 64;
    private static final Duration DAILY_WINDOW = Duration.ofDays(1);

    private static final Comparator<ServiceRequest> INBOX_ORDER = Comparator
        .comparing(ServiceRequest::priority, Comparator.reverseOrder())
        .thenComparing(ServiceRequest::createdAt)
        .thenComparing(request -> request.id().getValue());

    private final WorkflowStateMachine stateMachine;
    private final RequestStore requestStore;
    private final AuditLedger auditLedger;
    private final ResilientExecutor executor;
    private final Clock clock;
    private final ReentrantLock[] locks;

    public DefaultWorkflowOrchestrator(WorkflowStateMachine stateMachine,
                                       RequestStore requestStore,
                                       AuditLedger auditLedger,
                                       ResilientExecutor executor,
                                       Clock clock) {
        if (stateMachine == null) {
            throw new IllegalArgumentException("stateMachine cannot be null");
        }
        if (requestStore == null) {
            throw new IllegalArgumentException("requestStore cannot be null");
        }
        if (auditLedger == null) {
            throw new IllegalArgumentException("auditLedger cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.stateMachine = stateMachine;
        this.requestStore = requestStore;
        this.auditLedger = auditLedger;
        this.executor = executor;
        this.clock = clock;
        this.locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public TransitionResult createRequest(CreateRequestCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        RequestId requestId = RequestId.generate();
        Instant now = clock.instant();

        int dailyCount;
        try {
            dailyCount = requestStore.countActions(
                command.creator().actorId(), Action.CREATE, now.minus(DAILY_WINDOW));
        } catch (RuntimeException e) {
            log.error("Could not count daily creations: actor={}", command.creator().actorId(), e);
            return rejectBeforeStateMachine(requestId, command.creator().actor(), Action.CREATE, null,
                TransitionErrorKind.PERSISTENCE_FAILED, TransitionReasons.PERSISTENCE_FAILED, now);
        }

        TransitionResult result = stateMachine.initiate(requestId, command.workflowType(), command.creator(),
            command.clientId(), command.priority(), command.initialPayload(), dailyCount, command.signal());
        if (result.isTransitioned()) {
            log.info("Request created: requestId={}, type={}, creator={}",
                requestId, command.workflowType().code(), command.creator().actorId());
        }
        return result;
    }

    @Override
    public TransitionResult transition(TransitionCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        ReentrantLock lock = lockFor(command.requestId());
        lock.lock();
        try {
            return transitionLocked(command);
        } finally {
            lock.unlock();
        }
    }

    private TransitionResult transitionLocked(TransitionCommand command) {
        Instant now = clock.instant();
        Optional<ServiceRequest> loaded;
        int dailyCount;
        try {
            loaded = requestStore.load(command.requestId());
            dailyCount = requestStore.countActions(
                command.actor().id(), command.action(), now.minus(DAILY_WINDOW));
        } catch (RuntimeException e) {
            log.error("Could not load request: requestId={}", command.requestId(), e);
            return rejectBeforeStateMachine(command.requestId(), command.actor(), command.action(), null,
                TransitionErrorKind.PERSISTENCE_FAILED, TransitionReasons.PERSISTENCE_FAILED, now);
        }

        if (loaded.isEmpty()) {
            return rejectBeforeStateMachine(command.requestId(), command.actor(), command.action(), null,
                TransitionErrorKind.NOT_FOUND, TransitionReasons.NOT_FOUND, now);
        }

        ServiceRequest request = loaded.get();
        if (command.expectedVersion() != null && command.expectedVersion() != request.version()) {
            return rejectBeforeStateMachine(request.id(), command.actor(), command.action(), request.currentRole(),
                TransitionErrorKind.STALE_VERSION, TransitionReasons.STALE_VERSION, now);
        }

        return stateMachine.transition(request, command.actor(), command.action(), command.payload(),
            dailyCount, command.signal());
    }

    @Override
    public Optional<WorkflowStatus> getStatus(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return requestStore.load(requestId)
            .map(request -> new WorkflowStatus(request, stateMachine.availableActions(request)));
    }

    @Override
    public StatusQueryResult getStatus(RequestId requestId, Actor actor) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        Instant now = clock.instant();
        Optional<ServiceRequest> loaded;
        try {
            loaded = requestStore.load(requestId);
        } catch (RuntimeException e) {
            log.error("Could not load request for view: requestId={}", requestId, e);
            return denyView(requestId, actor, null, TransitionErrorKind.PERSISTENCE_FAILED,
                TransitionReasons.PERSISTENCE_FAILED, now);
        }
        if (loaded.isEmpty()) {
            return denyView(requestId, actor, null, TransitionErrorKind.NOT_FOUND, TransitionReasons.NOT_FOUND, now);
        }

        ServiceRequest request = loaded.get();
        Decision decision = stateMachine.authorizeAccess(request, actor, Action.VIEW);
        if (!decision.allowed()) {
            return denyView(requestId, actor, request.currentRole(), TransitionErrorKind.FORBIDDEN,
                decision.reason(), now);
        }
        return new StatusQueryResult.Found(new WorkflowStatus(request, stateMachine.availableActions(request)));
    }

    @Override
    public List<WorkflowStatus> requestsFor(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return requestStore.findByCurrentRole(role).stream()
            .sorted(INBOX_ORDER)
            .map(request -> new WorkflowStatus(request, stateMachine.availableActions(request)))
            .toList();
    }

    @Override
    public List<AuditEntry> getAuditTrail(AuditFilter filter) {
        return auditLedger.query(filter);
    }

    @Override
    public void resetCircuit(String operationClass) {
        executor.resetCircuit(operationClass);
        log.info("Circuit manually reset: {}", operationClass);
    }

    @Override
    public OperationStatistics statistics(String operationClass) {
        return executor.statistics(operationClass);
    }

    @Override
    public long auditWriteFailureCount() {
        return auditLedger.failureCount();
    }

    private TransitionResult rejectBeforeStateMachine(RequestId requestId, Actor actor,
                                                      Action action, Role fromRole, TransitionErrorKind kind,
                                                      String reason, Instant now) {
        log.info("Transition denied: requestId={}, actor={}, action={}, kind={}, reason={}",
            requestId, actor.id(), action.code(), kind, reason);
        auditLedger.record(AuditEntry.denied(requestId, actor, action, fromRole, reason, now));
        return Rejected.of(kind, reason);
    }

    private StatusQueryResult denyView(RequestId requestId, Actor actor, Role fromRole,
                                       TransitionErrorKind kind, String reason, Instant now) {
        log.info("View denied: requestId={}, actor={}, kind={}, reason={}", requestId, actor.id(), kind, reason);
        auditLedger.record(AuditEntry.denied(requestId, actor, Action.VIEW, fromRole, reason, now));
        return new StatusQueryResult.Denied(kind, reason);
    }

    private ReentrantLock lockFor(RequestId requestId) {
        return locks[Math.floorMod(requestId.hashCode(), LOCK_STRIPES)];
    }
}
