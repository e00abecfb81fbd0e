package com.ryuqq.workflow.core.statemachine;

/**
 * 전이(또는 생성) 시도 결과.
 *
 * <ul>
 *   <li>{@link Transitioned}: 저장까지 성공, 새 스냅샷 포함</li>
 *   <li>{@link Rejected}: 거부, {@link TransitionError} 포함</li>
 * </ul>
 *
 * <p>예상 가능한 실패는 예외가 아닌 값으로 반환됩니다.</p>
 *
 * <pre>
 * TransitionResult result = orchestrator.transition(command);
 * if (result instanceof Transitioned t) {
 *     ServiceRequest saved = t.request();
 * } else if (result instanceof Rejected r) {
 *     log.info("denied: {}", r.error().reason());
 * }
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public sealed interface TransitionResult permits Transitioned, Rejected {

    default boolean isTransitioned() {
        return this instanceof Transitioned;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }
}
