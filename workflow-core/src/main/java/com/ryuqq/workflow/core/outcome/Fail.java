package com.ryuqq.workflow.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p>재시도해도 성공할 수 없는 경우를 나타냅니다. Executor는 즉시 중단하고
 * Circuit Breaker 실패 카운트에도 반영하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>낙관적 잠금 충돌 (version_conflict)</li>
 *   <li>존재하지 않는 수신자</li>
 *   <li>저장소 제약 조건 위반</li>
 * </ul>
 *
 * @param errorCode 오류 코드 (예: version_conflict)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @param <T> 결과 값 타입
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Fail<T>(
    String errorCode,
    String message,
    String cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }
}
