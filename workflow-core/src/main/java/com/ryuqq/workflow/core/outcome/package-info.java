/**
 * Attempt outcomes for protected operations.
 *
 * <p>An operation reports each attempt as {@link com.ryuqq.workflow.core.outcome.Ok},
 * {@link com.ryuqq.workflow.core.outcome.Retry} or {@link com.ryuqq.workflow.core.outcome.Fail}.
 * Only {@code Fail} stops the retry loop immediately; a thrown exception is treated like {@code Retry}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.outcome;
