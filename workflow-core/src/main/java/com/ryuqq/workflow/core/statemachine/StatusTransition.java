package com.ryuqq.workflow.core.statemachine;

/**
 * 요청 상태 전이 검증.
 *
 * <p>워크플로 정의가 계산한 다음 상태가 {@link RequestStatus}의
 * 전이 규칙을 벗어나지 않는지 마지막으로 확인합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>어떤 상태에서도 OPEN으로 전이 불가</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 허용되는지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(RequestStatus from, RequestStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            return false;
        }
        return to != RequestStatus.OPEN;
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RequestStatus from, RequestStatus to) {
        if (isAllowed(from, to)) {
            return;
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        throw new IllegalStateException(
            String.format("Invalid state transition: %s → %s", from, to)
        );
    }
}
