package com.ryuqq.workflow.core.model;

import com.ryuqq.workflow.core.statemachine.RequestStatus;

import java.time.Instant;

/**
 * 역할 단계를 따라 처리되는 서비스 요청 (작업 단위).
 *
 * <p>불변 스냅샷입니다. 전이는 항상 새 인스턴스를 만들며,
 * 저장소에 쓰기가 성공한 스냅샷만 다음 전이의 입력이 됩니다.</p>
 *
 * <p><strong>불변 필드:</strong> id, workflowType, creator, clientId, createdAt</p>
 * <p><strong>전이로만 변경:</strong> currentRole, status, priority, stateData, updatedAt, lastAction</p>
 *
 * <p>{@code version}은 저장소의 낙관적 잠금 버전입니다.
 * 아직 저장되지 않은 요청은 0입니다.</p>
 *
 * @param id 요청 식별자
 * @param workflowType 워크플로 유형
 * @param currentRole 현재 요청을 소유한 단계
 * @param status 요청 상태
 * @param creator 생성자
 * @param clientId 수혜 고객
 * @param priority 우선순위
 * @param stateData 단계 간 누적 데이터
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 전이 시각
 * @param lastAction 마지막으로 적용된 행위
 * @param version 저장소 버전 (미저장 시 0)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record ServiceRequest(
    RequestId id,
    WorkflowType workflowType,
    Role currentRole,
    RequestStatus status,
    Creator creator,
    ClientId clientId,
    Priority priority,
    StateData stateData,
    Instant createdAt,
    Instant updatedAt,
    ActionStamp lastAction,
    long version
) {

    public ServiceRequest {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
        if (currentRole == null) {
            throw new IllegalArgumentException("currentRole cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (creator == null) {
            throw new IllegalArgumentException("creator cannot be null");
        }
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (stateData == null) {
            throw new IllegalArgumentException("stateData cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        if (lastAction == null) {
            throw new IllegalArgumentException("lastAction cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
    }

    /**
     * 워크플로 첫 단계에서 OPEN 상태로 시작하는 신규 요청 생성.
     *
     * @param id 요청 식별자
     * @param workflowType 워크플로 유형
     * @param firstStage 워크플로의 첫 단계
     * @param creator 생성자
     * @param clientId 수혜 고객
     * @param priority 초기 우선순위
     * @param stateData 초기 데이터
     * @param now 생성 시각
     * @return 미저장(version=0) 요청
     */
    public static ServiceRequest open(RequestId id, WorkflowType workflowType, Role firstStage,
                                      Creator creator, ClientId clientId, Priority priority,
                                      StateData stateData, Instant now) {
        ActionStamp stamp = new ActionStamp(creator.actorId(), Action.CREATE, now);
        return new ServiceRequest(id, workflowType, firstStage, RequestStatus.OPEN, creator, clientId,
            priority, stateData, now, now, stamp, 0L);
    }

    /**
     * 전이 결과를 반영한 다음 스냅샷 생성.
     *
     * <p>버전은 유지됩니다. 저장 성공 후 {@link #withVersion(long)}으로 갱신합니다.</p>
     *
     * @param nextRole 다음 단계
     * @param nextStatus 다음 상태
     * @param nextPriority 다음 우선순위
     * @param nextStateData 병합된 데이터
     * @param stamp 적용된 행위
     * @return 새 스냅샷
     */
    public ServiceRequest advance(Role nextRole, RequestStatus nextStatus, Priority nextPriority,
                                  StateData nextStateData, ActionStamp stamp) {
        return new ServiceRequest(id, workflowType, nextRole, nextStatus, creator, clientId,
            nextPriority, nextStateData, createdAt, stamp.at(), stamp, version);
    }

    public ServiceRequest withVersion(long newVersion) {
        return new ServiceRequest(id, workflowType, currentRole, status, creator, clientId,
            priority, stateData, createdAt, updatedAt, lastAction, newVersion);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
