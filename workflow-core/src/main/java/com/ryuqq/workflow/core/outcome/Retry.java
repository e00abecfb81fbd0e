package com.ryuqq.workflow.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>일시적인 오류로 인해 실패했으나, 재시도하면 성공할 가능성이 있는 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>저장소 연결 타임아웃</li>
 *   <li>알림 게이트웨이 일시 장애 (503 Service Unavailable)</li>
 *   <li>Rate Limit 초과 (429 Too Many Requests)</li>
 * </ul>
 *
 * <p>대기 시간은 작업이 아닌 Executor의 {@code RetryPolicy}가 결정합니다.</p>
 *
 * @param reason 재시도 사유
 * @param <T> 결과 값 타입
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Retry<T>(String reason) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
