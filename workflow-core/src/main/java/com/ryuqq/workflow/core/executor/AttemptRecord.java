package com.ryuqq.workflow.core.executor;

import java.time.Instant;

/**
 * 시도 이력 한 건.
 *
 * <p>실패 결과에 전체 이력이 담겨 감사/디버깅에 사용됩니다.</p>
 *
 * @param attemptNumber 시도 번호 (1부터)
 * @param startedAt 시작 시각
 * @param durationMs 소요 시간 (밀리초)
 * @param succeeded 성공 여부
 * @param failureType 실패 분류 (성공이면 null)
 * @param message 실패 사유 (성공이면 null)
 * @param nextDelayMs 이 시도 후 예약된 대기 시간 (재시도하지 않으면 0)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record AttemptRecord(
    int attemptNumber,
    Instant startedAt,
    long durationMs,
    boolean succeeded,
    FailureType failureType,
    String message,
    long nextDelayMs
) {

    public AttemptRecord {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (!succeeded && failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null for a failed attempt");
        }
    }

    public static AttemptRecord success(int attemptNumber, Instant startedAt, long durationMs) {
        return new AttemptRecord(attemptNumber, startedAt, durationMs, true, null, null, 0);
    }

    public static AttemptRecord failure(int attemptNumber, Instant startedAt, long durationMs,
                                        FailureType failureType, String message) {
        return new AttemptRecord(attemptNumber, startedAt, durationMs, false, failureType, message, 0);
    }

    /**
     * 예약된 대기 시간을 기록한 사본.
     */
    public AttemptRecord withNextDelayMs(long nextDelayMs) {
        return new AttemptRecord(attemptNumber, startedAt, durationMs, succeeded, failureType, message, nextDelayMs);
    }
}
