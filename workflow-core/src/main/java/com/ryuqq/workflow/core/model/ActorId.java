package com.ryuqq.workflow.core.model;

/**
 * 행위자(직원 또는 고객) 식별자.
 *
 * <p>인증은 외부 Identity 협력자가 끝낸 상태로 전달되며,
 * 이 값은 감사(Audit)와 일일 한도 집계에만 사용됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ActorId {

    private final String value;

    private ActorId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ActorId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("ActorId length cannot exceed 128 characters");
        }
        this.value = value;
    }

    /**
     * ActorId 생성.
     *
     * @param value ActorId 값
     * @return ActorId 인스턴스
     * @throws IllegalArgumentException null, 빈 문자열, 128자 초과인 경우
     */
    public static ActorId of(String value) {
        return new ActorId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActorId actorId = (ActorId) o;
        return value.equals(actorId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ActorId{" + value + '}';
    }
}
