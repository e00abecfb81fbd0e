package com.ryuqq.workflow.core.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호출자 취소 신호.
 *
 * <p>취소는 새 시도의 시작만 막습니다. 이미 시작된 시도는 끝까지 진행됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationSignal() {
    }

    /**
     * 새 신호 생성.
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * 취소하지 않을 호출을 위한 새 신호.
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 처음 취소되었으면 true
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + cancelled.get() + '}';
    }
}
