/**
 * Permission engine: a pure lookup of (role, action, workflow type) against an immutable matrix.
 *
 * <p>Unknown combinations are denied ({@code no_matching_grant}). Daily limits are compared against a
 * count supplied by the caller; the engine itself performs no I/O.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.permission;
