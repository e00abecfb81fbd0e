package com.ryuqq.workflow.core.model;

/**
 * 인증이 끝난 행위자 (식별자 + 역할).
 *
 * <p>Identity 협력자가 검증한 값을 그대로 전달받습니다.
 * 코어는 자격 증명을 직접 검증하지 않습니다.</p>
 *
 * @param id 행위자 식별자
 * @param role 행위자 역할
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Actor(ActorId id, Role role) {

    public Actor {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }

    public static Actor of(String id, Role role) {
        return new Actor(ActorId.of(id), role);
    }
}
