package com.ryuqq.workflow.application.orchestrator;

import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.model.ClientId;
import com.ryuqq.workflow.core.model.Creator;
import com.ryuqq.workflow.core.model.Priority;
import com.ryuqq.workflow.core.model.WorkflowType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 생성 명령.
 *
 * @param workflowType 워크플로 유형
 * @param creator 생성자 (인증된 역할)
 * @param clientId 수혜 고객
 * @param priority 초기 우선순위 (null이면 MEDIUM)
 * @param initialPayload 초기 stateData (null이면 빈 데이터)
 * @param signal 취소 신호 (null이면 취소 불가)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record CreateRequestCommand(
    WorkflowType workflowType,
    Creator creator,
    ClientId clientId,
    Priority priority,
    Map<String, String> initialPayload,
    CancellationSignal signal
) {

    public CreateRequestCommand {
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
        if (creator == null) {
            throw new IllegalArgumentException("creator cannot be null");
        }
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        priority = priority == null ? Priority.MEDIUM : priority;
        initialPayload = initialPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(initialPayload));
        signal = signal == null ? CancellationSignal.none() : signal;
    }

    public CreateRequestCommand(WorkflowType workflowType, Creator creator, ClientId clientId,
                                Priority priority, Map<String, String> initialPayload) {
        this(workflowType, creator, clientId, priority, initialPayload, null);
    }

    public static CreateRequestCommand of(WorkflowType workflowType, Creator creator, ClientId clientId) {
        return new CreateRequestCommand(workflowType, creator, clientId, null, null, null);
    }
}
