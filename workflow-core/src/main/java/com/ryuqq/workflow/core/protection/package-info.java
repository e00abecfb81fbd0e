/**
 * Resilience contracts for side-effecting operations.
 *
 * <p>Defines the per-operation-class {@link com.ryuqq.workflow.core.protection.RetryPolicy},
 * the {@link com.ryuqq.workflow.core.protection.CircuitBreaker} SPI and its configuration.
 * Runtime implementations live in the {@code workflow-adapter-runner} module.</p>
 *
 * <h2>Check order per attempt</h2>
 * <pre>
 * 1. Cancellation signal  → stop before starting a new attempt
 * 2. Deadline             → abort remaining attempts
 * 3. CircuitBreaker       → fail fast while OPEN
 * 4. Operation            → the actual side effect
 * </pre>
 *
 * @since 1.0.0
 * @see com.ryuqq.workflow.core.protection.CircuitBreaker
 * @see com.ryuqq.workflow.core.protection.RetryPolicy
 */
package com.ryuqq.workflow.core.protection;
