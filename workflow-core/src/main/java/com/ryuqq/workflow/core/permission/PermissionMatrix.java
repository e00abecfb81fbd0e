package com.ryuqq.workflow.core.permission;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.WorkflowType;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 불변 권한 매트릭스: (role, action, workflowType) → {@link PermissionGrant}.
 *
 * <p>프로세스 시작 시 한 번 구성한 뒤 공유합니다. 생성 이후 변경되지 않으므로
 * 동기화 없이 동시에 읽어도 안전합니다. 테스트는 {@link #builder()}로 대체 매트릭스를 만들어 주입합니다.</p>
 *
 * <pre>{@code
 * PermissionMatrix matrix = PermissionMatrix.builder()
 *     .grant(Role.MANAGER, Action.ADVANCE, GrantScope.OWN_STAGE, WorkflowType.CONNECTION_REQUEST)
 *     .grantWithLimit(Role.CALL_CENTER, Action.CREATE, 100, GrantScope.ANY_STAGE, WorkflowType.values())
 *     .build();
 * }</pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class PermissionMatrix {

    private final Map<PermissionKey, PermissionGrant> grants;

    private PermissionMatrix(Map<PermissionKey, PermissionGrant> grants) {
        this.grants = Map.copyOf(grants);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PermissionMatrix empty() {
        return new PermissionMatrix(Map.of());
    }

    /**
     * 권한 조회.
     *
     * @return 정의된 칸, 없으면 빈 Optional
     */
    public Optional<PermissionGrant> find(Role role, Action action, WorkflowType workflowType) {
        if (role == null || action == null || workflowType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(grants.get(new PermissionKey(role, action, workflowType)));
    }

    public int size() {
        return grants.size();
    }

    /**
     * {@link PermissionMatrix} 빌더.
     *
     * <p>같은 키를 다시 지정하면 나중 값이 이깁니다.</p>
     */
    public static final class Builder {

        private final Map<PermissionKey, PermissionGrant> grants = new HashMap<>();

        private Builder() {
        }

        public Builder grant(Role role, Action action, GrantScope scope, WorkflowType... types) {
            return put(role, action, PermissionGrant.allow(scope), types);
        }

        public Builder grantWithLimit(Role role, Action action, int dailyLimit, GrantScope scope,
                                      WorkflowType... types) {
            return put(role, action, PermissionGrant.allowWithLimit(scope, dailyLimit), types);
        }

        public Builder deny(Role role, Action action, WorkflowType... types) {
            return put(role, action, PermissionGrant.deny(), types);
        }

        /**
         * 역할에 여러 행위를 한꺼번에 허용.
         */
        public Builder grantAll(Role role, GrantScope scope, Action[] actions, WorkflowType... types) {
            for (Action action : actions) {
                grant(role, action, scope, types);
            }
            return this;
        }

        private Builder put(Role role, Action action, PermissionGrant grant, WorkflowType... types) {
            if (types == null || types.length == 0) {
                throw new IllegalArgumentException("at least one workflowType is required");
            }
            for (WorkflowType type : types) {
                grants.put(new PermissionKey(role, action, type), grant);
            }
            return this;
        }

        public PermissionMatrix build() {
            return new PermissionMatrix(grants);
        }
    }
}
