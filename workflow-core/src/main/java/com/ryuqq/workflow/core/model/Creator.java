package com.ryuqq.workflow.core.model;

/**
 * 요청 생성자 정보 (불변).
 *
 * @param actorId 생성한 행위자
 * @param actorRole 생성 당시 역할
 * @param onBehalfOfClient 직원이 고객 대신 생성했는지 여부
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Creator(ActorId actorId, Role actorRole, boolean onBehalfOfClient) {

    public Creator {
        if (actorId == null) {
            throw new IllegalArgumentException("actorId cannot be null");
        }
        if (actorRole == null) {
            throw new IllegalArgumentException("actorRole cannot be null");
        }
    }

    /**
     * 생성자를 행위자로 변환.
     *
     * @return 동일 식별자/역할의 Actor
     */
    public Actor actor() {
        return new Actor(actorId, actorRole);
    }
}
