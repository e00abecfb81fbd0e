package com.ryuqq.workflow.application.orchestrator;

import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditFilter;
import com.ryuqq.workflow.core.executor.OperationStatistics;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.statemachine.TransitionResult;

import java.util.List;
import java.util.Optional;

/**
 * 서비스 요청 워크플로의 진입점 (Facade).
 *
 * <p>요청 생성과 전이를 수락하고, 저장소에서 요청을 읽고 쓰며,
 * 권한 엔진, 상태 머신, 재시도 실행자, 감사 원장을 조정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionResult created = orchestrator.createRequest(new CreateRequestCommand(
 *     WorkflowType.CONNECTION_REQUEST, creator, ClientId.of("client-1"), Priority.MEDIUM, Map.of()));
 *
 * if (created instanceof Transitioned t) {
 *     TransitionResult advanced = orchestrator.transition(TransitionCommand.of(
 *         t.request().id(), Actor.of("manager-1", Role.MANAGER), Action.ADVANCE, Map.of("note", "checked")));
 * }
 * </pre>
 *
 * <p><strong>동시성:</strong> 같은 요청 ID에 대한 전이는 직렬화됩니다.
 * 서로 다른 요청은 병렬로 처리됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface WorkflowOrchestrator {

    /**
     * 신규 요청 생성.
     *
     * <p>생성자의 역할로 {@code create} 권한과 일일 한도를 확인합니다.
     * 허용이든 거부든 감사 기록이 한 건 남습니다.</p>
     *
     * @param command 생성 명령
     * @return {@code Transitioned}(OPEN 상태의 저장된 요청) 또는 {@code Rejected}
     * @throws IllegalArgumentException command가 null인 경우
     */
    TransitionResult createRequest(CreateRequestCommand command);

    /**
     * 요청에 행위 적용.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>요청 ID 단위 잠금 획득</li>
     *   <li>저장소에서 최신 스냅샷 로드 (없으면 NOT_FOUND)</li>
     *   <li>expectedVersion이 주어졌고 다르면 STALE_VERSION</li>
     *   <li>행위자의 최근 24시간 수행 횟수 조회</li>
     *   <li>상태 머신에 위임</li>
     * </ol>
     *
     * @param command 전이 명령
     * @return {@code Transitioned} 또는 {@code Rejected}
     * @throws IllegalArgumentException command가 null인 경우
     */
    TransitionResult transition(TransitionCommand command);

    /**
     * 요청의 현재 상태와 가능한 행위 조회 (권한 검사 없음, 내부/관리용).
     *
     * @param requestId 요청 ID
     * @return 상태, 요청이 없으면 빈 Optional
     */
    Optional<WorkflowStatus> getStatus(RequestId requestId);

    /**
     * 행위자 권한으로 요청 조회.
     *
     * <p>{@code view} 권한을 요청 단위로 판정합니다. 고객은 본인 요청만,
     * 직원은 담당 단계의 요청이나 매트릭스에 {@code view} 권한이 있는 유형만 볼 수 있습니다.
     * 거부(요청 없음 포함)는 감사 기록이 한 건 남고, 허용된 조회는 기록하지 않습니다.</p>
     *
     * @param requestId 요청 ID
     * @param actor 조회하는 행위자
     * @return {@code Found} 또는 {@code Denied}
     * @throws IllegalArgumentException requestId 또는 actor가 null인 경우
     */
    StatusQueryResult getStatus(RequestId requestId, Actor actor);

    /**
     * 역할의 처리 대기함: 현재 단계가 해당 역할인 진행 중 요청.
     *
     * @param role 역할
     * @return 우선순위 높은 순, 같은 우선순위는 생성 시각 오름차순
     * @throws IllegalArgumentException role이 null인 경우
     */
    List<WorkflowStatus> requestsFor(Role role);

    /**
     * 감사 기록 조회.
     *
     * @param filter 조회 조건
     * @return timestamp 오름차순 목록
     */
    List<AuditEntry> getAuditTrail(AuditFilter filter);

    /**
     * 작업 클래스의 Circuit Breaker 리셋 (관리 작업).
     *
     * @param operationClass 작업 클래스 (예: notification-dispatch)
     */
    void resetCircuit(String operationClass);

    /**
     * 작업 클래스의 실행 통계.
     *
     * @param operationClass 작업 클래스
     * @return 통계
     */
    OperationStatistics statistics(String operationClass);

    /**
     * 저장에 실패하여 fallback 로그로만 남은 감사 기록 수 (알림용).
     */
    long auditWriteFailureCount();
}
