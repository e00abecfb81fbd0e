/**
 * Audit ledger contracts.
 *
 * <p>Every transition attempt, granted or denied, yields exactly one
 * {@link com.ryuqq.workflow.core.audit.AuditEntry}. Entries are write-once. Write failures never reach
 * the caller; they are logged to a fallback logger and counted.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.audit;
