package com.ryuqq.workflow.core.model;

/**
 * 요청의 수혜자(고객) 참조.
 *
 * <p>요청 생성 후 변경되지 않습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ClientId {

    private final String value;

    private ClientId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ClientId cannot be null or blank");
        }
        this.value = value;
    }

    public static ClientId of(String value) {
        return new ClientId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClientId clientId = (ClientId) o;
        return value.equals(clientId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ClientId{" + value + '}';
    }
}
