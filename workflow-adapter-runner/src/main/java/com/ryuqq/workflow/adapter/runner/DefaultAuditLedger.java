package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.audit.AuditEntry;
import com.ryuqq.workflow.core.audit.AuditFilter;
import com.ryuqq.workflow.core.audit.AuditLedger;
import com.ryuqq.workflow.core.executor.ExecutionResult;
import com.ryuqq.workflow.core.executor.OperationClasses;
import com.ryuqq.workflow.core.executor.ResilientExecutor;
import com.ryuqq.workflow.core.outcome.Outcome;
import com.ryuqq.workflow.core.spi.AuditStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 감사 원장 기본 구현체.
 *
 * <p>기록은 {@link OperationClasses#AUDIT_WRITE} 작업 클래스로 재시도하며 {@link AuditStore}에 추가합니다.
 * 재시도 후에도 실패하면 호출자에게 전파하지 않고 {@code workflow.audit.fallback} 로거에
 * ERROR로 남기고 실패 카운터를 증가시킵니다. 요청 결과는 감사 실패로 바뀌지 않습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DefaultAuditLedger implements AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(DefaultAuditLedger.class);
    private static final Logger FALLBACK = LoggerFactory.getLogger("workflow.audit.fallback");

    private final AuditStore auditStore;
    private final ResilientExecutor executor;
    private final AtomicLong failures = new AtomicLong();

    public DefaultAuditLedger(AuditStore auditStore, ResilientExecutor executor) {
        if (auditStore == null) {
            throw new IllegalArgumentException("auditStore cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.auditStore = auditStore;
        this.executor = executor;
    }

    @Override
    public void record(AuditEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        ExecutionResult<Void> result = executor.execute(OperationClasses.AUDIT_WRITE, context -> {
            auditStore.append(entry);
            return Outcome.ok(null);
        });
        if (result instanceof ExecutionResult.Failed<Void> failed) {
            long total = failures.incrementAndGet();
            FALLBACK.error("Audit write lost after {} attempt(s) ({}): request={} actor={} role={} action={} "
                    + "outcome={} from={} to={} reason={} at={} [failures={}]",
                failed.error().attemptCount(), failed.kind(), entry.requestId().getValue(),
                entry.actorId().getValue(), entry.actorRole(), entry.action(), entry.outcome(),
                entry.fromRole(), entry.toRole(), entry.reason(), entry.timestamp(), total);
            return;
        }
        log.debug("Audit recorded: request={} action={} outcome={}",
            entry.requestId().getValue(), entry.action(), entry.outcome());
    }

    @Override
    public List<AuditEntry> query(AuditFilter filter) {
        AuditFilter effective = filter == null ? AuditFilter.all() : filter;
        return auditStore.query(effective).stream()
            .filter(effective::matches)
            .sorted(Comparator.comparing(AuditEntry::timestamp))
            .toList();
    }

    @Override
    public long failureCount() {
        return failures.get();
    }
}
