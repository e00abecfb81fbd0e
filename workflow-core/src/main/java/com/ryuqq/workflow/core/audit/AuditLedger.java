package com.ryuqq.workflow.core.audit;

import java.util.List;

/**
 * 추가 전용(append-only) 감사 원장.
 *
 * <p><strong>기록 경로:</strong> 호출자 입장에서는 fire-and-forget입니다.
 * 구현체는 반환 전에 기록을 내구성 있게 저장하거나, 실패 시 로컬 fallback 로그로 남겨야 하며
 * 어떤 경우에도 조용히 버리지 않습니다. 기록 실패는 호출자에게 전파되지 않고
 * {@link #failureCount()}로만 드러납니다.</p>
 *
 * <p><strong>조회 경로:</strong> 조건에 맞는 기록을 timestamp 오름차순으로 반환합니다.
 * 결과는 유한하며 다시 조회해도 같은 순서를 얻습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface AuditLedger {

    /**
     * 감사 기록 추가 (예외를 던지지 않음).
     *
     * @param entry 기록
     * @throws IllegalArgumentException entry가 null인 경우
     */
    void record(AuditEntry entry);

    /**
     * 감사 기록 조회.
     *
     * @param filter 조회 조건
     * @return timestamp 오름차순 목록 (불변)
     */
    List<AuditEntry> query(AuditFilter filter);

    /**
     * 지금까지 저장에 실패하여 fallback 로그로만 남은 기록 수 (알림용).
     */
    long failureCount();
}
