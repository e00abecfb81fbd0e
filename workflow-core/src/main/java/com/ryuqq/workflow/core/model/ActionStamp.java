package com.ryuqq.workflow.core.model;

import java.time.Instant;

/**
 * 요청에 마지막으로 적용된 행위 기록.
 *
 * <p>저장소는 저장 성공 시 이 값을 행위자별 활동 로그에 남기고,
 * 일일 한도 집계({@code countActions})에 사용합니다.</p>
 *
 * @param actorId 행위자
 * @param action 적용된 행위
 * @param at 적용 시각
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record ActionStamp(ActorId actorId, Action action, Instant at) {

    public ActionStamp {
        if (actorId == null) {
            throw new IllegalArgumentException("actorId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
    }
}
