package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.application.orchestrator.CreateRequestCommand;
import com.ryuqq.workflow.application.orchestrator.StatusQueryResult;
import com.ryuqq.workflow.application.orchestrator.TransitionCommand;
import com.ryuqq.workflow.application.orchestrator.WorkflowStatus;
import com.ryuqq.workflow.core.executor.OperationClasses;
import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditLedger;
import com.ryuqq.workflow.core.audit.AuditOutcome;
import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.executor.ResilientExecutor;
import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.ClientId;
import com.ryuqq.workflow.core.model.Creator;
import com.ryuqq.workflow.core.model.Priority;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;
import com.ryuqq.workflow.core.model.StateData;
import com.ryuqq.workflow.core.model.WorkflowType;
import com.ryuqq.workflow.core.permission.Decision;
import com.ryuqq.workflow.core.permission.GrantScope;
import com.ryuqq.workflow.core.spi.RequestStore;
import com.ryuqq.workflow.core.statemachine.Rejected;
import com.ryuqq.workflow.core.statemachine.TransitionErrorKind;
import com.ryuqq.workflow.core.statemachine.TransitionResult;
import com.ryuqq.workflow.core.statemachine.Transitioned;
import com.ryuqq.workflow.core.statemachine.WorkflowStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * DefaultWorkflowOrchestrator 유닛 테스트.
 *
 * <p>상태 머신에 위임하기 전 단계(조회, 일일 카운트, 버전 확인)를 검증합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultWorkflowOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");
    private static final Actor MANAGER = Actor.of("manager-1", Role.MANAGER);
    private static final RequestId REQUEST_ID = RequestId.of("req-1");

    @Mock
    private WorkflowStateMachine stateMachine;

    @Mock
    private RequestStore requestStore;

    @Mock
    private AuditLedger auditLedger;

    @Mock
    private ResilientExecutor executor;

    private DefaultWorkflowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new DefaultWorkflowOrchestrator(stateMachine, requestStore, auditLedger, executor,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createRequest_최근_24시간_생성_건수_전달() {
        // given
        Creator creator = new Creator(MANAGER.id(), Role.MANAGER, false);
        when(requestStore.countActions(MANAGER.id(), Action.CREATE, NOW.minus(Duration.ofDays(1)))).thenReturn(7);
        when(stateMachine.initiate(any(RequestId.class), eq(WorkflowType.CONNECTION_REQUEST), eq(creator),
            eq(ClientId.of("client-1")), eq(Priority.MEDIUM), anyMap(), eq(7), any(CancellationSignal.class)))
            .thenReturn(new Transitioned(storedRequest()));

        // when
        TransitionResult result = orchestrator.createRequest(
            CreateRequestCommand.of(WorkflowType.CONNECTION_REQUEST, creator, ClientId.of("client-1")));

        // then
        assertThat(result.isTransitioned()).isTrue();
        verifyNoInteractions(auditLedger);
    }

    @Test
    void createRequest_카운트_실패시_PERSISTENCE_FAILED_감사() {
        // given
        Creator creator = new Creator(MANAGER.id(), Role.MANAGER, false);
        when(requestStore.countActions(any(), any(), any())).thenThrow(new IllegalStateException("db down"));

        // when
        TransitionResult result = orchestrator.createRequest(
            CreateRequestCommand.of(WorkflowType.CONNECTION_REQUEST, creator, ClientId.of("client-1")));

        // then
        assertThat(((Rejected) result).kind()).isEqualTo(TransitionErrorKind.PERSISTENCE_FAILED);
        assertThat(capturedAudit().reason()).isEqualTo("persistence_failed");
        verifyNoInteractions(stateMachine);
    }

    @Test
    void transition_요청_없음_NOT_FOUND_감사() {
        // given
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.empty());

        // when
        TransitionResult result = orchestrator.transition(TransitionCommand.of(REQUEST_ID, MANAGER, Action.ADVANCE));

        // then
        assertThat(((Rejected) result).kind()).isEqualTo(TransitionErrorKind.NOT_FOUND);
        AuditEntry entry = capturedAudit();
        assertThat(entry.outcome()).isEqualTo(AuditOutcome.DENIED);
        assertThat(entry.reason()).isEqualTo("not_found");
        assertThat(entry.fromRole()).isNull();
        verifyNoInteractions(stateMachine);
    }

    @Test
    void transition_기대_버전_불일치_STALE_VERSION() {
        // given
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.of(storedRequest()));

        // when
        TransitionResult result = orchestrator.transition(
            TransitionCommand.of(REQUEST_ID, MANAGER, Action.ADVANCE).expecting(4L));

        // then
        assertThat(((Rejected) result).kind()).isEqualTo(TransitionErrorKind.STALE_VERSION);
        AuditEntry entry = capturedAudit();
        assertThat(entry.reason()).isEqualTo("stale_version");
        assertThat(entry.fromRole()).isEqualTo(Role.MANAGER);
        verifyNoInteractions(stateMachine);
    }

    @Test
    void transition_상태_머신에_위임() {
        // given
        ServiceRequest stored = storedRequest();
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.of(stored));
        when(requestStore.countActions(MANAGER.id(), Action.ADVANCE, NOW.minus(Duration.ofDays(1)))).thenReturn(2);
        Transitioned transitioned = new Transitioned(stored.withVersion(2L));
        when(stateMachine.transition(eq(stored), eq(MANAGER), eq(Action.ADVANCE), anyMap(), eq(2),
            any(CancellationSignal.class))).thenReturn(transitioned);

        // when
        TransitionResult result = orchestrator.transition(
            TransitionCommand.of(REQUEST_ID, MANAGER, Action.ADVANCE, Map.of("note", "x")).expecting(1L));

        // then
        assertThat(result).isSameAs(transitioned);
        verifyNoInteractions(auditLedger);
    }

    @Test
    void transition_조회_실패시_PERSISTENCE_FAILED() {
        // given
        when(requestStore.load(REQUEST_ID)).thenThrow(new IllegalStateException("db down"));

        // when
        TransitionResult result = orchestrator.transition(TransitionCommand.of(REQUEST_ID, MANAGER, Action.ADVANCE));

        // then
        assertThat(((Rejected) result).kind()).isEqualTo(TransitionErrorKind.PERSISTENCE_FAILED);
        verify(stateMachine, never()).transition(any(), any(), any(), anyMap(), anyInt(), any());
    }

    @Test
    void getStatus_가능한_행위_포함() {
        // given
        ServiceRequest stored = storedRequest();
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.of(stored));
        when(stateMachine.availableActions(stored)).thenReturn(Set.of(Action.ADVANCE, Action.CANCEL));

        // when
        Optional<WorkflowStatus> status = orchestrator.getStatus(REQUEST_ID);

        // then
        assertThat(status).isPresent();
        assertThat(status.get().availableActions()).containsExactlyInAnyOrder(Action.ADVANCE, Action.CANCEL);
        assertThat(status.get().isTerminal()).isFalse();
    }

    @Test
    void getStatus_행위자_허용시_상태_반환_감사_없음() {
        // given
        ServiceRequest stored = storedRequest();
        Actor technician = Actor.of("technician-1", Role.TECHNICIAN);
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.of(stored));
        when(stateMachine.authorizeAccess(stored, technician, Action.VIEW)).thenReturn(Decision.allow(GrantScope.ANY_STAGE));
        when(stateMachine.availableActions(stored)).thenReturn(Set.of(Action.ADVANCE));

        // when
        StatusQueryResult result = orchestrator.getStatus(REQUEST_ID, technician);

        // then
        assertThat(result.isFound()).isTrue();
        assertThat(((StatusQueryResult.Found) result).status().request()).isEqualTo(stored);
        verifyNoInteractions(auditLedger);
    }

    @Test
    void getStatus_행위자_거부시_FORBIDDEN_감사() {
        // given
        ServiceRequest stored = storedRequest();
        Actor otherClient = Actor.of("client-2", Role.CLIENT);
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.of(stored));
        when(stateMachine.authorizeAccess(stored, otherClient, Action.VIEW))
            .thenReturn(Decision.deny(Decision.NOT_OWN_REQUEST));

        // when
        StatusQueryResult result = orchestrator.getStatus(REQUEST_ID, otherClient);

        // then
        StatusQueryResult.Denied denied = (StatusQueryResult.Denied) result;
        assertThat(denied.kind()).isEqualTo(TransitionErrorKind.FORBIDDEN);
        assertThat(denied.reason()).isEqualTo("not_own_request");
        AuditEntry entry = capturedAudit();
        assertThat(entry.action()).isEqualTo(Action.VIEW);
        assertThat(entry.outcome()).isEqualTo(AuditOutcome.DENIED);
        assertThat(entry.fromRole()).isEqualTo(Role.MANAGER);
    }

    @Test
    void getStatus_행위자_요청_없음_NOT_FOUND_감사() {
        // given
        when(requestStore.load(REQUEST_ID)).thenReturn(Optional.empty());

        // when
        StatusQueryResult result = orchestrator.getStatus(REQUEST_ID, MANAGER);

        // then
        assertThat(((StatusQueryResult.Denied) result).kind()).isEqualTo(TransitionErrorKind.NOT_FOUND);
        assertThat(capturedAudit().reason()).isEqualTo("not_found");
        verify(stateMachine, never()).authorizeAccess(any(), any(), any());
    }

    @Test
    void requestsFor_우선순위_높은_순_같으면_오래된_순() {
        // given
        ServiceRequest older = request("req-old", Priority.MEDIUM, NOW.minus(Duration.ofHours(2)));
        ServiceRequest newer = request("req-new", Priority.MEDIUM, NOW.minus(Duration.ofHours(1)));
        ServiceRequest urgent = request("req-high", Priority.HIGH, NOW);
        when(requestStore.findByCurrentRole(Role.MANAGER)).thenReturn(List.of(newer, urgent, older));

        // when
        List<WorkflowStatus> inbox = orchestrator.requestsFor(Role.MANAGER);

        // then
        assertThat(inbox).extracting(status -> status.request().id().getValue())
            .containsExactly("req-high", "req-old", "req-new");
    }

    @Test
    void resetCircuit_실행자에_위임() {
        // when
        orchestrator.resetCircuit(OperationClasses.PERSISTENCE_WRITE);

        // then
        verify(executor).resetCircuit(OperationClasses.PERSISTENCE_WRITE);
    }

    @Test
    void auditWriteFailureCount_원장_카운트() {
        // given
        when(auditLedger.failureCount()).thenReturn(3L);

        // when & then
        assertThat(orchestrator.auditWriteFailureCount()).isEqualTo(3L);
    }

    private ServiceRequest storedRequest() {
        return ServiceRequest.open(REQUEST_ID, WorkflowType.CONNECTION_REQUEST, Role.MANAGER,
            new Creator(MANAGER.id(), Role.MANAGER, false), ClientId.of("client-1"), Priority.MEDIUM,
            StateData.empty(), NOW).withVersion(1L);
    }

    private ServiceRequest request(String id, Priority priority, Instant createdAt) {
        return ServiceRequest.open(RequestId.of(id), WorkflowType.CONNECTION_REQUEST, Role.MANAGER,
            new Creator(MANAGER.id(), Role.MANAGER, false), ClientId.of("client-1"), priority,
            StateData.empty(), createdAt).withVersion(1L);
    }

    private AuditEntry capturedAudit() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLedger).record(captor.capture());
        return captor.getValue();
    }
}
