/**
 * Fault-tolerant execution contracts.
 *
 * <p>{@link com.ryuqq.workflow.core.executor.ResilientExecutor} wraps any
 * {@link com.ryuqq.workflow.core.executor.Operation} with retry, backoff, deadline,
 * cancellation and circuit-breaker bookkeeping, and always answers with an
 * {@link com.ryuqq.workflow.core.executor.ExecutionResult} instead of throwing.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.executor;
