package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditFilter;

import java.util.List;

/**
 * Durable storage SPI behind the audit ledger.
 *
 * <p>{@link #append} must be durable before returning. Any {@link RuntimeException} is treated as a
 * retryable infrastructure failure by the {@code audit-write} policy.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface AuditStore {

    /**
     * Appends an entry. Entries are never updated or deleted.
     *
     * @param entry the entry
     */
    void append(AuditEntry entry);

    /**
     * Returns entries matching the filter, in any order.
     *
     * @param filter the filter
     * @return matching entries
     */
    List<AuditEntry> query(AuditFilter filter);
}
