package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.adapter.inmemory.clock.MutableClock;
import com.ryuqq.workflow.core.executor.OperationClasses;
import com.ryuqq.workflow.core.executor.AttemptRecord;
import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.executor.ExecutionErrorKind;
import com.ryuqq.workflow.core.executor.ExecutionResult;
import com.ryuqq.workflow.core.executor.FailureType;
import com.ryuqq.workflow.core.executor.OperationStatistics;
import com.ryuqq.workflow.core.outcome.Outcome;
import com.ryuqq.workflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.workflow.core.protection.CircuitBreakerState;
import com.ryuqq.workflow.core.protection.RetryPolicy;
import com.ryuqq.workflow.core.protection.RetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryingExecutor 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>Ok / Retry / Fail / 예외 결과별 처리</li>
 *   <li>최대 시도 횟수, 데드라인, 취소</li>
 *   <li>서킷 브레이커 연동과 작업 유형별 통계</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class RetryingExecutorTest {

    private static final String OPERATION = OperationClasses.PERSISTENCE_WRITE;

    private RetryingExecutor executor;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void 첫_시도_성공() {
        // given
        executor = executor(config(3));

        // when
        ExecutionResult<String> result = executor.execute(OPERATION, context -> Outcome.ok("saved"));

        // then
        assertThat(result.isSucceeded()).isTrue();
        ExecutionResult.Succeeded<String> succeeded = (ExecutionResult.Succeeded<String>) result;
        assertThat(succeeded.value()).isEqualTo("saved");
        assertThat(succeeded.attempts()).hasSize(1);
        assertThat(succeeded.attempts().get(0).succeeded()).isTrue();
    }

    @Test
    void Retry_두번_후_성공시_시도_이력_3건() {
        // given
        executor = executor(config(3));
        List<Integer> seenAttempts = new CopyOnWriteArrayList<>();

        // when
        ExecutionResult<Integer> result = executor.execute(OPERATION, context -> {
            int attempt = context.attemptNumber();
            seenAttempts.add(attempt);
            return attempt < 3 ? Outcome.retry("busy " + attempt) : Outcome.ok(attempt);
        });

        // then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(seenAttempts).containsExactly(1, 2, 3);
        List<AttemptRecord> attempts = result.attempts();
        assertThat(attempts).hasSize(3);
        assertThat(attempts.get(0).failureType()).isEqualTo(FailureType.RETRYABLE);
        assertThat(attempts.get(0).message()).isEqualTo("busy 1");
        assertThat(attempts.get(0).nextDelayMs()).isEqualTo(5);
        assertThat(attempts.get(2).succeeded()).isTrue();
    }

    @Test
    void 계속_Retry시_ATTEMPTS_EXHAUSTED() {
        // given
        executor = executor(config(3));
        AtomicInteger calls = new AtomicInteger();

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            return Outcome.retry("still busy");
        });

        // then
        assertThat(result.isSucceeded()).isFalse();
        ExecutionResult.Failed<Void> failed = (ExecutionResult.Failed<Void>) result;
        assertThat(failed.kind()).isEqualTo(ExecutionErrorKind.ATTEMPTS_EXHAUSTED);
        assertThat(failed.error().attemptCount()).isEqualTo(3);
        assertThat(failed.error().operationClass()).isEqualTo(OPERATION);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void Fail은_재시도_없이_FATAL_브레이커_미반영() {
        // given
        executor = executor(config(3));
        AtomicInteger calls = new AtomicInteger();

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            return Outcome.fail("version_conflict", "expected 1 but was 2");
        });

        // then
        ExecutionResult.Failed<Void> failed = (ExecutionResult.Failed<Void>) result;
        assertThat(failed.kind()).isEqualTo(ExecutionErrorKind.FATAL);
        assertThat(failed.error().errorCode()).isEqualTo("version_conflict");
        assertThat(failed.error().attempts()).hasSize(1);
        assertThat(failed.error().attempts().get(0).failureType()).isEqualTo(FailureType.FATAL);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(executor.circuitBreaker(OPERATION).snapshot().consecutiveFailures()).isZero();
    }

    @Test
    void 예외는_재시도_가능_실패로_기록() {
        // given
        executor = executor(config(2));

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            throw new IllegalStateException("db down");
        });

        // then
        ExecutionResult.Failed<Void> failed = (ExecutionResult.Failed<Void>) result;
        assertThat(failed.kind()).isEqualTo(ExecutionErrorKind.ATTEMPTS_EXHAUSTED);
        assertThat(failed.error().attempts())
            .extracting(AttemptRecord::message)
            .containsOnly("IllegalStateException: db down");
    }

    @Test
    void NONE_전략은_한번만_시도() {
        // given
        RetryPolicy none = new RetryPolicy(RetryStrategy.NONE, 5, 5, 5, 1.0, 0.0, 0);
        executor = executor(config(5).withRetryPolicy(OPERATION, none));
        AtomicInteger calls = new AtomicInteger();

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            return Outcome.retry("busy");
        });

        // then
        assertThat(((ExecutionResult.Failed<Void>) result).kind()).isEqualTo(ExecutionErrorKind.ATTEMPTS_EXHAUSTED);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void 브레이커_OPEN시_남은_재시도_중단_이후_호출_단락() {
        // given
        executor = executor(config(5).withCircuitBreakerConfig(OPERATION,
            new CircuitBreakerConfig(2, 60_000, 1, 300_000)));
        AtomicInteger calls = new AtomicInteger();

        // when
        ExecutionResult<Void> first = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            return Outcome.retry("down");
        });
        ExecutionResult<Void> second = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            return Outcome.ok(null);
        });

        // then
        ExecutionResult.Failed<Void> firstFailed = (ExecutionResult.Failed<Void>) first;
        assertThat(firstFailed.kind()).isEqualTo(ExecutionErrorKind.CIRCUIT_OPEN);
        assertThat(firstFailed.error().attemptCount()).isEqualTo(2);
        ExecutionResult.Failed<Void> secondFailed = (ExecutionResult.Failed<Void>) second;
        assertThat(secondFailed.kind()).isEqualTo(ExecutionErrorKind.CIRCUIT_OPEN);
        assertThat(secondFailed.error().attempts()).isEmpty();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(executor.circuitState(OPERATION)).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void resetCircuit_후_정상_실행() {
        // given
        executor = executor(config(1).withCircuitBreakerConfig(OPERATION,
            new CircuitBreakerConfig(1, 60_000, 1, 300_000)));
        executor.execute(OPERATION, context -> Outcome.retry("down"));
        assertThat(executor.circuitState(OPERATION)).isEqualTo(CircuitBreakerState.OPEN);

        // when
        executor.resetCircuit(OPERATION);
        ExecutionResult<String> result = executor.execute(OPERATION, context -> Outcome.ok("back"));

        // then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(executor.circuitState(OPERATION)).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 취소된_신호는_시도_없이_CANCELLED() {
        // given
        executor = executor(config(3));
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            return Outcome.ok(null);
        }, signal);

        // then
        assertThat(((ExecutionResult.Failed<Void>) result).kind()).isEqualTo(ExecutionErrorKind.CANCELLED);
        assertThat(result.attempts()).isEmpty();
        assertThat(calls.get()).isZero();
    }

    @Test
    void 재시도_대기중_취소시_다음_시도_전_중단() {
        // given
        RetryPolicy slow = new RetryPolicy(RetryStrategy.FIXED, 3, 50, 50, 1.0, 0.0, 0);
        executor = executor(config(3).withRetryPolicy(OPERATION, slow));
        CancellationSignal signal = CancellationSignal.create();

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            signal.cancel();
            return Outcome.retry("busy");
        }, signal);

        // then
        assertThat(((ExecutionResult.Failed<Void>) result).kind()).isEqualTo(ExecutionErrorKind.CANCELLED);
        assertThat(result.attempts()).hasSize(1);
    }

    @Test
    void 다음_시도가_데드라인_이후면_DEADLINE_EXCEEDED() {
        // given
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        RetryPolicy bounded = new RetryPolicy(RetryStrategy.FIXED, 5, 5, 5, 1.0, 0.0, 1_000);
        executor = new RetryingExecutor(config(5).withRetryPolicy(OPERATION, bounded), clock, new Random(1));
        AtomicInteger calls = new AtomicInteger();

        // when
        ExecutionResult<Void> result = executor.execute(OPERATION, context -> {
            calls.incrementAndGet();
            clock.advance(Duration.ofMillis(400));
            return Outcome.retry("slow store");
        });

        // then
        ExecutionResult.Failed<Void> failed = (ExecutionResult.Failed<Void>) result;
        assertThat(failed.kind()).isEqualTo(ExecutionErrorKind.DEADLINE_EXCEEDED);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(failed.error().attemptCount()).isEqualTo(3);
    }

    @Test
    void executeAsync_워커_스레드에서_실행() throws Exception {
        // given
        executor = executor(config(3));
        AtomicReference<String> threadName = new AtomicReference<>();

        // when
        CompletableFuture<ExecutionResult<Void>> future = executor.executeAsync(OperationClasses.NOTIFICATION_DISPATCH, context -> {
            threadName.set(Thread.currentThread().getName());
            return Outcome.ok(null);
        }, CancellationSignal.none());
        ExecutionResult<Void> result = future.get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(threadName.get()).startsWith("workflow-executor-");
    }

    @Test
    void 작업_유형별_통계_집계() {
        // given
        executor = executor(config(2));

        // when
        executor.execute(OPERATION, context -> Outcome.ok(null));
        executor.execute(OPERATION, context -> Outcome.retry("busy"));
        executor.execute(OperationClasses.AUDIT_WRITE, context -> Outcome.ok(null));

        // then
        OperationStatistics stats = executor.statistics(OPERATION);
        assertThat(stats.executions()).isEqualTo(2);
        assertThat(stats.successes()).isEqualTo(1);
        assertThat(stats.failures()).isEqualTo(1);
        assertThat(stats.attempts()).isEqualTo(3);
        assertThat(executor.statistics(OperationClasses.AUDIT_WRITE).executions()).isEqualTo(1);
    }

    @Test
    void 알_수_없는_작업_유형_통계는_0과_CLOSED() {
        // given
        executor = executor(config(2));

        // when
        OperationStatistics stats = executor.statistics("unknown");

        // then
        assertThat(stats.executions()).isZero();
        assertThat(stats.circuitState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 빈_작업_유형_예외() {
        // given
        executor = executor(config(2));

        // when & then
        assertThatThrownBy(() -> executor.execute(" ", context -> Outcome.ok(null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("operationClass cannot be null or blank");
    }

    private RetryingExecutor executor(ResilienceConfig config) {
        return new RetryingExecutor(config, Clock.systemUTC(), new Random(1));
    }

    private ResilienceConfig config(int maxAttempts) {
        return new ResilienceConfig()
            .withDefaultRetryPolicy(new RetryPolicy(RetryStrategy.FIXED, maxAttempts, 5, 5, 1.0, 0.0, 0))
            .withDefaultCircuitBreakerConfig(new CircuitBreakerConfig(10, 60_000, 1, 300_000));
    }
}
