/**
 * Request lifecycle.
 *
 * <p>{@link com.ryuqq.workflow.core.statemachine.RequestStatus} with its transition rules, the typed
 * {@link com.ryuqq.workflow.core.statemachine.TransitionResult}, and the
 * {@link com.ryuqq.workflow.core.statemachine.WorkflowStateMachine} that gates, persists, audits and
 * notifies each transition.</p>
 *
 * <pre>
 * OPEN → IN_PROGRESS ⇄ BLOCKED → COMPLETED | CANCELLED
 * </pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.statemachine;
