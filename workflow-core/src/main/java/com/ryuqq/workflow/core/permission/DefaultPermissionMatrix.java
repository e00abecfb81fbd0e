package com.ryuqq.workflow.core.permission;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.WorkflowType;

import static com.ryuqq.workflow.core.model.WorkflowType.CALL_CENTER_DIRECT;
import static com.ryuqq.workflow.core.model.WorkflowType.CONNECTION_REQUEST;
import static com.ryuqq.workflow.core.model.WorkflowType.TECHNICAL_SERVICE;
import static com.ryuqq.workflow.core.permission.GrantScope.ANY_STAGE;
import static com.ryuqq.workflow.core.permission.GrantScope.OWN_STAGE;

/**
 * 조직의 기본 권한 매트릭스.
 *
 * <p><strong>요약:</strong></p>
 * <ul>
 *   <li>admin: 모든 행위, 모든 단계</li>
 *   <li>manager, controller: 접속/기술 요청 생성, 자기 단계 처리, 단계 무관 escalate/cancel</li>
 *   <li>junior_manager: 접속 요청만 생성 (일 50건), escalate 불가</li>
 *   <li>technician, warehouse: 자기 단계 advance/return만</li>
 *   <li>call_center: 모든 유형 생성 (일 100건), 직접 처리 요청의 자기 단계 처리</li>
 *   <li>call_center_supervisor: 모든 유형 생성, 직접 처리 요청 감독</li>
 *   <li>client: 본인 요청 생성, 조회, 코멘트</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DefaultPermissionMatrix {

    public static final int JUNIOR_MANAGER_DAILY_CREATE_LIMIT = 50;

    public static final int CALL_CENTER_DAILY_CREATE_LIMIT = 100;

    private static final Action[] CLIENT_DESK = {Action.VIEW, Action.SELECT_CLIENT, Action.CREATE_CLIENT, Action.ADD_COMMENT};

    private DefaultPermissionMatrix() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static PermissionMatrix create() {
        WorkflowType[] all = WorkflowType.values();
        WorkflowType[] field = {CONNECTION_REQUEST, TECHNICAL_SERVICE};

        return PermissionMatrix.builder()
            // admin
            .grantAll(Role.ADMIN, ANY_STAGE, Action.values(), all)

            // manager
            .grant(Role.MANAGER, Action.CREATE, ANY_STAGE, field)
            .grant(Role.MANAGER, Action.ADVANCE, OWN_STAGE, CONNECTION_REQUEST)
            .grant(Role.MANAGER, Action.ASSIGN_DIRECTLY, OWN_STAGE, CONNECTION_REQUEST)
            .grant(Role.MANAGER, Action.ESCALATE, ANY_STAGE, field)
            .grant(Role.MANAGER, Action.CANCEL, ANY_STAGE, field)
            .grantAll(Role.MANAGER, ANY_STAGE, CLIENT_DESK, field)

            // junior_manager
            .grantWithLimit(Role.JUNIOR_MANAGER, Action.CREATE, JUNIOR_MANAGER_DAILY_CREATE_LIMIT, ANY_STAGE, CONNECTION_REQUEST)
            .grant(Role.JUNIOR_MANAGER, Action.ADVANCE, OWN_STAGE, CONNECTION_REQUEST)
            .grant(Role.JUNIOR_MANAGER, Action.RETURN, OWN_STAGE, CONNECTION_REQUEST)
            .grantAll(Role.JUNIOR_MANAGER, ANY_STAGE, CLIENT_DESK, CONNECTION_REQUEST)

            // controller
            .grant(Role.CONTROLLER, Action.CREATE, ANY_STAGE, field)
            .grant(Role.CONTROLLER, Action.ADVANCE, OWN_STAGE, field)
            .grant(Role.CONTROLLER, Action.ASSIGN_DIRECTLY, OWN_STAGE, field)
            .grant(Role.CONTROLLER, Action.RETURN, OWN_STAGE, field)
            .grant(Role.CONTROLLER, Action.ESCALATE, ANY_STAGE, field)
            .grant(Role.CONTROLLER, Action.CANCEL, ANY_STAGE, field)
            .grantAll(Role.CONTROLLER, ANY_STAGE, CLIENT_DESK, field)

            // technician
            .grant(Role.TECHNICIAN, Action.ADVANCE, OWN_STAGE, field)
            .grant(Role.TECHNICIAN, Action.RETURN, OWN_STAGE, field)
            .grant(Role.TECHNICIAN, Action.VIEW, ANY_STAGE, field)
            .grant(Role.TECHNICIAN, Action.ADD_COMMENT, ANY_STAGE, field)

            // warehouse
            .grant(Role.WAREHOUSE, Action.ADVANCE, OWN_STAGE, field)
            .grant(Role.WAREHOUSE, Action.RETURN, OWN_STAGE, field)
            .grant(Role.WAREHOUSE, Action.VIEW, ANY_STAGE, field)

            // call_center
            .grantWithLimit(Role.CALL_CENTER, Action.CREATE, CALL_CENTER_DAILY_CREATE_LIMIT, ANY_STAGE, all)
            .grant(Role.CALL_CENTER, Action.ADVANCE, OWN_STAGE, CALL_CENTER_DIRECT)
            .grant(Role.CALL_CENTER, Action.RETURN, OWN_STAGE, CALL_CENTER_DIRECT)
            .grantAll(Role.CALL_CENTER, ANY_STAGE, CLIENT_DESK, all)

            // call_center_supervisor
            .grant(Role.CALL_CENTER_SUPERVISOR, Action.CREATE, ANY_STAGE, all)
            .grant(Role.CALL_CENTER_SUPERVISOR, Action.ADVANCE, OWN_STAGE, CALL_CENTER_DIRECT)
            .grant(Role.CALL_CENTER_SUPERVISOR, Action.ASSIGN_DIRECTLY, OWN_STAGE, CALL_CENTER_DIRECT)
            .grant(Role.CALL_CENTER_SUPERVISOR, Action.ESCALATE, ANY_STAGE, all)
            .grant(Role.CALL_CENTER_SUPERVISOR, Action.CANCEL, ANY_STAGE, CALL_CENTER_DIRECT)
            .grantAll(Role.CALL_CENTER_SUPERVISOR, ANY_STAGE, CLIENT_DESK, all)

            // client
            .grant(Role.CLIENT, Action.CREATE, ANY_STAGE, field)
            .grant(Role.CLIENT, Action.VIEW, ANY_STAGE, field)
            .grant(Role.CLIENT, Action.ADD_COMMENT, ANY_STAGE, field)
            .build();
    }
}
