package com.ryuqq.workflow.application.orchestrator;

import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Actor;
import com.ryuqq.workflow.core.model.RequestId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 전이 명령.
 *
 * @param requestId 대상 요청
 * @param actor 인증된 행위자
 * @param action 행위
 * @param payload stateData에 추가할 데이터 (null이면 빈 데이터)
 * @param expectedVersion 호출자가 읽은 버전 (null이면 검사하지 않음)
 * @param signal 취소 신호 (null이면 취소 불가)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record TransitionCommand(
    RequestId requestId,
    Actor actor,
    Action action,
    Map<String, String> payload,
    Long expectedVersion,
    CancellationSignal signal
) {

    public TransitionCommand {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (expectedVersion != null && expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must be non-negative (current: " + expectedVersion + ")");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        signal = signal == null ? CancellationSignal.none() : signal;
    }

    public static TransitionCommand of(RequestId requestId, Actor actor, Action action) {
        return new TransitionCommand(requestId, actor, action, null, null, null);
    }

    public static TransitionCommand of(RequestId requestId, Actor actor, Action action, Map<String, String> payload) {
        return new TransitionCommand(requestId, actor, action, payload, null, null);
    }

    /**
     * 낙관적 잠금 버전을 지정한 사본.
     */
    public TransitionCommand expecting(long version) {
        return new TransitionCommand(requestId, actor, action, payload, version, signal);
    }

    /**
     * 취소 신호를 지정한 사본.
     */
    public TransitionCommand withSignal(CancellationSignal signal) {
        return new TransitionCommand(requestId, actor, action, payload, expectedVersion, signal);
    }
}
