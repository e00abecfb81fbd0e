package com.ryuqq.workflow.adapter.inmemory.store;

import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditFilter;
import com.ryuqq.workflow.core.spi.AuditStore;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AuditStore} SPI.
 *
 * <p>Entries are kept in a {@link CopyOnWriteArrayList}: appends are rare compared to scans
 * in tests, and iteration never sees a partially written entry.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InMemoryAuditStore implements AuditStore {

    private final CopyOnWriteArrayList<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();

    @Override
    public void append(AuditEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("Simulated audit storage failure");
        }
        entries.add(entry);
    }

    @Override
    public List<AuditEntry> query(AuditFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        return entries.stream()
            .filter(filter::matches)
            .collect(Collectors.toList());
    }

    /**
     * Makes the next {@code count} appends fail with a retryable exception.
     */
    public void failNextAppends(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        pendingFailures.set(count);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        pendingFailures.set(0);
    }
}
