package com.ryuqq.workflow.core.statemachine;

import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditLedger;
import com.ryuqq.workflow.core.audit.AuditOutcome;
import com.ryuqq.workflow.core.definition.DefaultWorkflowDefinitions;
import com.ryuqq.workflow.core.executor.AttemptRecord;
import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.executor.ExecutionError;
import com.ryuqq.workflow.core.executor.ExecutionErrorKind;
import com.ryuqq.workflow.core.executor.ExecutionResult;
import com.ryuqq.workflow.core.executor.FailureType;
import com.ryuqq.workflow.core.executor.Operation;
import com.ryuqq.workflow.core.executor.OperationStatistics;
import com.ryuqq.workflow.core.executor.ResilientExecutor;
import com.ryuqq.workflow.core.executor.RetryContext;
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
import com.ryuqq.workflow.core.outcome.Fail;
import com.ryuqq.workflow.core.outcome.Ok;
import com.ryuqq.workflow.core.outcome.Outcome;
import com.ryuqq.workflow.core.permission.DefaultPermissionMatrix;
import com.ryuqq.workflow.core.permission.PermissionEngine;
import com.ryuqq.workflow.core.protection.CircuitBreakerState;
import com.ryuqq.workflow.core.spi.NotificationDispatcher;
import com.ryuqq.workflow.core.spi.RequestStore;
import com.ryuqq.workflow.core.spi.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * WorkflowStateMachine 테스트.
 *
 * <p>저장소/감사/알림은 mock, 실행자는 작업을 한 번만 호출하는 단순 구현으로 대체합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkflowStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");
    private static final Actor MANAGER = Actor.of("manager-1", Role.MANAGER);
    private static final Actor JUNIOR = Actor.of("junior-1", Role.JUNIOR_MANAGER);

    @Mock
    private RequestStore requestStore;

    @Mock
    private AuditLedger auditLedger;

    @Mock
    private NotificationDispatcher dispatcher;

    private SingleAttemptExecutor executor;
    private WorkflowStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        executor = new SingleAttemptExecutor();
        stateMachine = new WorkflowStateMachine(
            DefaultWorkflowDefinitions.create(),
            new PermissionEngine(DefaultPermissionMatrix.create()),
            executor,
            requestStore,
            auditLedger,
            dispatcher,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== initiate ==========

    @Test
    void initiate_Allowed_SavedAtFirstStageWithVersionOne() {
        // Given
        when(requestStore.save(any(ServiceRequest.class), eq(0L))).thenReturn(1L);

        // When
        TransitionResult result = stateMachine.initiate(RequestId.of("req-1"), WorkflowType.CONNECTION_REQUEST,
            creator(MANAGER), ClientId.of("client-1"), Priority.LOW, Map.of("note", "x"), 0,
            CancellationSignal.none());

        // Then
        assertTrue(result.isTransitioned());
        ServiceRequest stored = ((Transitioned) result).request();
        assertEquals(Role.MANAGER, stored.currentRole());
        assertEquals(RequestStatus.OPEN, stored.status());
        assertEquals(Priority.LOW, stored.priority());
        assertEquals(1L, stored.version());
        assertEquals("x", stored.stateData().get("note").orElseThrow());

        AuditEntry entry = capturedAudit();
        assertEquals(AuditOutcome.GRANTED, entry.outcome());
        assertEquals(Action.CREATE, entry.action());
        assertEquals(Role.MANAGER, entry.toRole());
    }

    @Test
    void initiate_NoGrant_ForbiddenWithoutSave() {
        // When
        TransitionResult result = stateMachine.initiate(RequestId.of("req-1"), WorkflowType.TECHNICAL_SERVICE,
            creator(JUNIOR), ClientId.of("client-1"), Priority.MEDIUM, null, 0, CancellationSignal.none());

        // Then
        assertEquals(TransitionErrorKind.FORBIDDEN, ((Rejected) result).kind());
        assertEquals("no_matching_grant", ((Rejected) result).reason());
        verify(requestStore, never()).save(any(), anyLong());
        assertEquals(AuditOutcome.DENIED, capturedAudit().outcome());
    }

    @Test
    void initiate_ReservedKeyInPayload_Validation() {
        // When
        TransitionResult result = stateMachine.initiate(RequestId.of("req-1"), WorkflowType.CONNECTION_REQUEST,
            creator(MANAGER), ClientId.of("client-1"), Priority.MEDIUM, Map.of("status", "done"), 0,
            CancellationSignal.none());

        // Then
        assertEquals(TransitionErrorKind.VALIDATION, ((Rejected) result).kind());
        assertEquals("reserved_key:status", ((Rejected) result).reason());
        verify(requestStore, never()).save(any(), anyLong());
    }

    // ========== transition ==========

    @Test
    void transition_Advance_SavedWithExpectedVersionAndNotified() {
        // Given
        ServiceRequest request = openRequest();
        when(requestStore.save(any(ServiceRequest.class), eq(1L))).thenReturn(2L);

        // When
        TransitionResult result = stateMachine.transition(request, MANAGER, Action.ADVANCE, null, 0,
            CancellationSignal.none());

        // Then
        ServiceRequest stored = ((Transitioned) result).request();
        assertEquals(Role.JUNIOR_MANAGER, stored.currentRole());
        assertEquals(RequestStatus.IN_PROGRESS, stored.status());
        assertEquals(2L, stored.version());
        assertEquals(Action.ADVANCE, stored.lastAction().action());
        assertEquals(NOW, stored.updatedAt());
        verify(dispatcher).dispatch(eq("role:junior_manager"), eq("request.assigned"), anyMap());
    }

    @Test
    void transition_Escalate_PriorityRaised() {
        // Given
        ServiceRequest request = openRequest();
        when(requestStore.save(any(ServiceRequest.class), eq(1L))).thenReturn(2L);

        // When
        TransitionResult result = stateMachine.transition(request, MANAGER, Action.ESCALATE, null, 0,
            CancellationSignal.none());

        // Then
        assertEquals(Priority.HIGH, ((Transitioned) result).request().priority());
        verify(dispatcher).dispatch(eq("role:manager"), eq("request.escalated"), anyMap());
    }

    @Test
    void transition_VersionConflict_StaleVersionAudited() {
        // Given
        ServiceRequest request = openRequest();
        when(requestStore.save(any(ServiceRequest.class), eq(1L)))
            .thenThrow(new VersionConflictException(request.id(), 1L, 2L));

        // When
        TransitionResult result = stateMachine.transition(request, MANAGER, Action.ADVANCE, null, 0,
            CancellationSignal.none());

        // Then
        assertEquals(TransitionErrorKind.STALE_VERSION, ((Rejected) result).kind());
        assertEquals("stale_version", capturedAudit().reason());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void transition_StoreKeepsFailing_PersistenceFailed() {
        // Given
        ServiceRequest request = openRequest();
        when(requestStore.save(any(ServiceRequest.class), eq(1L))).thenThrow(new IllegalStateException("db down"));

        // When
        TransitionResult result = stateMachine.transition(request, MANAGER, Action.ADVANCE, null, 0,
            CancellationSignal.none());

        // Then
        assertEquals(TransitionErrorKind.PERSISTENCE_FAILED, ((Rejected) result).kind());
        assertEquals("persistence_failed", ((Rejected) result).reason());
        assertEquals(1, ((Rejected) result).error().attempts().size());
    }

    @Test
    void transition_CircuitOpen_CircuitOpenWithPersistenceFailedReason() {
        // Given
        ServiceRequest request = openRequest();
        executor.openCircuit = true;

        // When
        TransitionResult result = stateMachine.transition(request, MANAGER, Action.ADVANCE, null, 0,
            CancellationSignal.none());

        // Then
        assertEquals(TransitionErrorKind.CIRCUIT_OPEN, ((Rejected) result).kind());
        assertEquals("persistence_failed", capturedAudit().reason());
        verifyNoInteractions(requestStore);
    }

    @Test
    void transition_TerminalRequest_TerminalBeforeAnythingElse() {
        // Given
        ServiceRequest cancelled = openRequest().advance(Role.MANAGER, RequestStatus.CANCELLED, Priority.MEDIUM,
            StateData.empty(), new ActionStamp(MANAGER.id(), Action.CANCEL, NOW));

        // When
        TransitionResult result = stateMachine.transition(cancelled, JUNIOR, Action.ESCALATE, null, 0,
            CancellationSignal.none());

        // Then
        assertEquals(TransitionErrorKind.TERMINAL, ((Rejected) result).kind());
        assertTrue(stateMachine.availableActions(cancelled).isEmpty());
    }

    @Test
    void transition_NullValueInPayload_Validation() {
        // Given
        Map<String, String> payload = new HashMap<>();
        payload.put("note", null);

        // When
        TransitionResult result = stateMachine.transition(openRequest(), MANAGER, Action.ADVANCE, payload, 0,
            CancellationSignal.none());

        // Then
        assertEquals("null_value:note", ((Rejected) result).reason());
    }

    @Test
    void transition_NotificationThrows_TransitionStillSucceeds() {
        // Given
        ServiceRequest request = openRequest();
        when(requestStore.save(any(ServiceRequest.class), eq(1L))).thenReturn(2L);
        doThrow(new IllegalStateException("smtp down")).when(dispatcher).dispatch(anyString(), anyString(), anyMap());

        // When
        TransitionResult result = stateMachine.transition(request, MANAGER, Action.ADVANCE, null, 0,
            CancellationSignal.none());

        // Then
        assertTrue(result.isTransitioned());
    }

    // ========== helpers ==========

    private Creator creator(Actor actor) {
        return new Creator(actor.id(), actor.role(), false);
    }

    private ServiceRequest openRequest() {
        return ServiceRequest.open(RequestId.of("req-1"), WorkflowType.CONNECTION_REQUEST, Role.MANAGER,
            creator(MANAGER), ClientId.of("client-1"), Priority.MEDIUM, StateData.empty(), NOW).withVersion(1L);
    }

    private AuditEntry capturedAudit() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLedger).record(captor.capture());
        return captor.getValue();
    }

    /**
     * 작업을 호출 스레드에서 정확히 한 번 실행하는 실행자.
     */
    private static final class SingleAttemptExecutor implements ResilientExecutor {

        boolean openCircuit;

        @Override
        public <T> ExecutionResult<T> execute(String operationClass, Operation<T> operation, CancellationSignal signal) {
            if (openCircuit) {
                return new ExecutionResult.Failed<>(new ExecutionError(
                    ExecutionErrorKind.CIRCUIT_OPEN, operationClass, "circuit open", null, List.of()));
            }
            RetryContext context = RetryContext.first("op-1", operationClass);
            try {
                Outcome<T> outcome = operation.attempt(context);
                if (outcome instanceof Ok<T> ok) {
                    return new ExecutionResult.Succeeded<>(ok.value(),
                        List.of(AttemptRecord.success(1, NOW, 0)));
                }
                if (outcome instanceof Fail<T> fail) {
                    return new ExecutionResult.Failed<>(new ExecutionError(ExecutionErrorKind.FATAL, operationClass,
                        fail.message(), fail.errorCode(),
                        List.of(AttemptRecord.failure(1, NOW, 0, FailureType.FATAL, fail.message()))));
                }
                return exhausted(operationClass, "retry requested");
            } catch (Exception e) {
                return exhausted(operationClass, String.valueOf(e.getMessage()));
            }
        }

        private <T> ExecutionResult<T> exhausted(String operationClass, String message) {
            return new ExecutionResult.Failed<>(new ExecutionError(ExecutionErrorKind.ATTEMPTS_EXHAUSTED,
                operationClass, message, null,
                List.of(AttemptRecord.failure(1, NOW, 0, FailureType.RETRYABLE, message))));
        }

        @Override
        public <T> CompletableFuture<ExecutionResult<T>> executeAsync(String operationClass, Operation<T> operation,
                                                                     CancellationSignal signal) {
            return CompletableFuture.completedFuture(execute(operationClass, operation, signal));
        }

        @Override
        public void resetCircuit(String operationClass) {
            openCircuit = false;
        }

        @Override
        public CircuitBreakerState circuitState(String operationClass) {
            return openCircuit ? CircuitBreakerState.OPEN : CircuitBreakerState.CLOSED;
        }

        @Override
        public OperationStatistics statistics(String operationClass) {
            return new OperationStatistics(operationClass, 0, 0, 0, 0, circuitState(operationClass));
        }
    }
}
