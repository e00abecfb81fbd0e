package com.ryuqq.workflow.core.outcome;

/**
 * 보호 대상 작업(Operation) 한 번의 시도 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>작업이 예외를 던지면 Executor는 이를 {@link Retry}와 동일하게(재시도 가능) 취급합니다.
 * 재시도하면 안 되는 실패는 반드시 {@link Fail}로 반환해야 합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok&lt;T&gt; ok) {
 *     return ok.value();
 * } else if (outcome instanceof Fail&lt;T&gt; fail) {
 *     log.error("fatal: {}", fail.errorCode());
 * }
 * </pre>
 *
 * @param <T> 성공 시 결과 값 타입
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Retry, Fail {

    /**
     * 성공 결과 생성.
     *
     * @param value 결과 값 (null 허용)
     * @param <T> 결과 값 타입
     * @return Ok 인스턴스
     */
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 재시도 가능한 실패 생성.
     *
     * @param reason 재시도 사유
     * @param <T> 결과 값 타입
     * @return Retry 인스턴스
     */
    static <T> Outcome<T> retry(String reason) {
        return new Retry<>(reason);
    }

    /**
     * 영구 실패 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param <T> 결과 값 타입
     * @return Fail 인스턴스
     */
    static <T> Outcome<T> fail(String errorCode, String message) {
        return new Fail<>(errorCode, message, null);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
