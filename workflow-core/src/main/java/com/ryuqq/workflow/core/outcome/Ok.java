package com.ryuqq.workflow.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 결과 값 (선택, null 가능)
 * @param <T> 결과 값 타입
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {
}
