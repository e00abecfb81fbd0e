package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.executor.AttemptRecord;
import com.ryuqq.workflow.core.executor.CancellationSignal;
import com.ryuqq.workflow.core.executor.ExecutionError;
import com.ryuqq.workflow.core.executor.ExecutionErrorKind;
import com.ryuqq.workflow.core.executor.ExecutionResult;
import com.ryuqq.workflow.core.executor.FailureType;
import com.ryuqq.workflow.core.executor.Operation;
import com.ryuqq.workflow.core.executor.OperationStatistics;
import com.ryuqq.workflow.core.executor.ResilientExecutor;
import com.ryuqq.workflow.core.executor.RetryContext;
import com.ryuqq.workflow.core.outcome.Fail;
import com.ryuqq.workflow.core.outcome.Ok;
import com.ryuqq.workflow.core.outcome.Outcome;
import com.ryuqq.workflow.core.outcome.Retry;
import com.ryuqq.workflow.core.protection.CircuitBreaker;
import com.ryuqq.workflow.core.protection.CircuitBreakerState;
import com.ryuqq.workflow.core.protection.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 재시도/Circuit Breaker 실행자 구현체.
 *
 * <p>각 시도는 워커 스레드 풀에서 실행되고, 재시도 대기는
 * {@link CompletableFuture#delayedExecutor}로 예약되어 어떤 스레드도 점유하지 않습니다.
 * 동기 {@link #execute}는 호출 스레드만 결과를 기다립니다.</p>
 *
 * <p><strong>시도 흐름:</strong></p>
 * <pre>
 * attempt(n)
 *   ├─ 취소됨?            → CANCELLED
 *   ├─ 기한 지남?          → DEADLINE_EXCEEDED
 *   ├─ !breaker.tryAcquire → CIRCUIT_OPEN (작업 호출 없음)
 *   └─ operation.attempt(ctx)
 *        ├─ Ok              → recordSuccess → Succeeded
 *        ├─ Fail            → release       → FATAL
 *        └─ Retry / 예외    → recordFailure
 *             ├─ n == maxAttempts        → ATTEMPTS_EXHAUSTED
 *             ├─ 회로가 OPEN으로 전이     → CIRCUIT_OPEN
 *             ├─ now + delay ≥ deadline  → DEADLINE_EXCEEDED
 *             └─ delay 후 attempt(n+1)
 * </pre>
 *
 * <p>어떤 경우에도 예외를 던지지 않고 전체 시도 이력을 담은 {@link ExecutionResult}로 완료됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class RetryingExecutor implements ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);

    private final ResilienceConfig config;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Clock clock;
    private final Random random;
    private final ExecutorService workers;
    private final ConcurrentHashMap<String, BackoffCalculator> calculators = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counters> counters = new ConcurrentHashMap<>();

    /**
     * 기본 설정, 시스템 시계로 생성.
     */
    public RetryingExecutor() {
        this(new ResilienceConfig(), Clock.systemUTC(), new Random());
    }

    /**
     * @param config 설정
     * @param clock 시계 (기한, Circuit Breaker 판정용)
     * @param random jitter 난수원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryingExecutor(ResilienceConfig config, Clock clock, Random random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.random = random;
        this.circuitBreakers = new CircuitBreakerRegistry(config, clock);
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
    }

    @Override
    public <T> ExecutionResult<T> execute(String operationClass, Operation<T> operation, CancellationSignal signal) {
        return executeAsync(operationClass, operation, signal).join();
    }

    @Override
    public <T> CompletableFuture<ExecutionResult<T>> executeAsync(String operationClass, Operation<T> operation,
                                                                 CancellationSignal signal) {
        if (operationClass == null || operationClass.isBlank()) {
            throw new IllegalArgumentException("operationClass cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        CancellationSignal effectiveSignal = signal == null ? CancellationSignal.none() : signal;

        Counters stats = counters(operationClass);
        stats.executions.increment();

        Run<T> run = new Run<>(operationClass, operation, effectiveSignal, config.retryPolicyFor(operationClass));
        run.schedule(RetryContext.first(run.operationId, operationClass), 0L);

        return run.result.whenComplete((result, throwable) -> {
            if (result != null && result.isSucceeded()) {
                stats.successes.increment();
            } else {
                stats.failures.increment();
            }
            stats.attempts.add(result == null ? 0 : result.attempts().size());
        });
    }

    @Override
    public void resetCircuit(String operationClass) {
        circuitBreakers.forClass(operationClass).reset();
    }

    @Override
    public CircuitBreakerState circuitState(String operationClass) {
        return circuitBreakers.find(operationClass)
            .map(CircuitBreaker::getState)
            .orElse(CircuitBreakerState.CLOSED);
    }

    @Override
    public OperationStatistics statistics(String operationClass) {
        Counters stats = counters.get(operationClass);
        CircuitBreakerState state = circuitState(operationClass);
        if (stats == null) {
            return new OperationStatistics(operationClass, 0, 0, 0, 0, state);
        }
        return new OperationStatistics(operationClass, stats.executions.sum(), stats.successes.sum(),
            stats.failures.sum(), stats.attempts.sum(), state);
    }

    /**
     * 작업 클래스의 Circuit Breaker (테스트, 관리 도구용).
     */
    public CircuitBreaker circuitBreaker(String operationClass) {
        return circuitBreakers.forClass(operationClass);
    }

    /**
     * 실행자 종료 (리소스 정리).
     *
     * <p>워커 풀을 graceful shutdown하여 진행 중인 시도가 완료되도록 대기합니다.
     * 예약만 되어 있던 재시도는 실행되지 않습니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
    }

    private Counters counters(String operationClass) {
        return counters.computeIfAbsent(operationClass, name -> new Counters());
    }

    private BackoffCalculator calculator(String operationClass, RetryPolicy policy) {
        return calculators.computeIfAbsent(operationClass, name -> new BackoffCalculator(policy, random));
    }

    /**
     * 실행 한 건의 시도 체인.
     *
     * <p>시도는 순차적으로만 실행되므로 history는 동기화가 필요 없습니다
     * (다음 시도 예약이 happens-before를 보장).</p>
     */
    private final class Run<T> {

        final String operationId = UUID.randomUUID().toString();
        final String operationClass;
        final Operation<T> operation;
        final CancellationSignal signal;
        final RetryPolicy policy;
        final CircuitBreaker breaker;
        final BackoffCalculator backoff;
        final Instant deadline;
        final List<AttemptRecord> history = new ArrayList<>();
        final CompletableFuture<ExecutionResult<T>> result = new CompletableFuture<>();

        Run(String operationClass, Operation<T> operation, CancellationSignal signal, RetryPolicy policy) {
            this.operationClass = operationClass;
            this.operation = operation;
            this.signal = signal;
            this.policy = policy;
            this.breaker = circuitBreakers.forClass(operationClass);
            this.backoff = calculator(operationClass, policy);
            this.deadline = policy.hasDeadline() ? clock.instant().plusMillis(policy.deadlineMs()) : null;
        }

        void schedule(RetryContext context, long delayMs) {
            try {
                if (delayMs <= 0) {
                    workers.execute(() -> attempt(context));
                } else {
                    CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, workers)
                        .execute(() -> attempt(context));
                }
            } catch (RuntimeException e) {
                log.error("Could not schedule attempt {} of {} [{}]", context.attemptNumber(), operationClass,
                    operationId, e);
                fail(ExecutionErrorKind.ATTEMPTS_EXHAUSTED,
                    "attempt " + context.attemptNumber() + " could not be scheduled: " + e.getMessage(), null);
            }
        }

        void attempt(RetryContext context) {
            try {
                runAttempt(context);
            } catch (RuntimeException e) {
                log.error("Unexpected executor failure in {} [{}]", operationClass, operationId, e);
                fail(ExecutionErrorKind.FATAL, "executor failure: " + e.getMessage(), null);
            }
        }

        private void runAttempt(RetryContext context) {
            int attemptNumber = context.attemptNumber();
            if (signal.isCancelled()) {
                fail(ExecutionErrorKind.CANCELLED, "cancelled before attempt " + attemptNumber, null);
                return;
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                fail(ExecutionErrorKind.DEADLINE_EXCEEDED, "deadline reached before attempt " + attemptNumber, null);
                return;
            }
            if (!breaker.tryAcquire()) {
                fail(ExecutionErrorKind.CIRCUIT_OPEN, "circuit open, attempt " + attemptNumber + " not made", null);
                return;
            }

            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();
            Outcome<T> outcome;
            String failureMessage = null;
            try {
                outcome = operation.attempt(context);
                if (outcome == null) {
                    failureMessage = "operation returned no outcome";
                }
            } catch (Exception e) {
                outcome = null;
                failureMessage = e.getClass().getSimpleName() + ": " + e.getMessage();
            }
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            if (outcome instanceof Ok<T> ok) {
                breaker.recordSuccess();
                history.add(AttemptRecord.success(attemptNumber, startedAt, durationMs));
                result.complete(new ExecutionResult.Succeeded<>(ok.value(), history));
                return;
            }
            if (outcome instanceof Fail<T> fatal) {
                breaker.release();
                history.add(AttemptRecord.failure(attemptNumber, startedAt, durationMs, FailureType.FATAL,
                    fatal.errorCode() + ": " + fatal.message()));
                fail(ExecutionErrorKind.FATAL, fatal.message(), fatal.errorCode());
                return;
            }
            if (outcome instanceof Retry<T> retry) {
                failureMessage = retry.reason();
            }

            breaker.recordFailure(failureMessage);
            AttemptRecord failed = AttemptRecord.failure(attemptNumber, startedAt, durationMs,
                FailureType.RETRYABLE, failureMessage);

            if (attemptNumber >= policy.effectiveMaxAttempts()) {
                history.add(failed);
                fail(ExecutionErrorKind.ATTEMPTS_EXHAUSTED,
                    "gave up after " + attemptNumber + " attempt(s): " + failureMessage, null);
                return;
            }
            if (breaker.getState() == CircuitBreakerState.OPEN) {
                history.add(failed);
                fail(ExecutionErrorKind.CIRCUIT_OPEN, "circuit opened after attempt " + attemptNumber, null);
                return;
            }
            long delayMs = backoff.calculate(attemptNumber);
            if (deadline != null && !clock.instant().plusMillis(delayMs).isBefore(deadline)) {
                history.add(failed);
                fail(ExecutionErrorKind.DEADLINE_EXCEEDED,
                    "next attempt would start after the deadline (delay " + delayMs + "ms)", null);
                return;
            }

            history.add(failed.withNextDelayMs(delayMs));
            log.info("Retry scheduled: {} [{}] attempt {}/{} in {}ms ({})", operationClass, operationId,
                attemptNumber + 1, policy.effectiveMaxAttempts(), delayMs, failureMessage);
            schedule(context.next(FailureType.RETRYABLE, delayMs), delayMs);
        }

        private void fail(ExecutionErrorKind kind, String message, String errorCode) {
            ExecutionError error = new ExecutionError(kind, operationClass, message, errorCode, history);
            switch (kind) {
                case CIRCUIT_OPEN:
                    log.debug("{} [{}] short-circuited: {}", operationClass, operationId, message);
                    break;
                case CANCELLED:
                    log.info("{} [{}] cancelled: {}", operationClass, operationId, message);
                    break;
                default:
                    log.warn("{} [{}] failed ({}): {}", operationClass, operationId, kind, message);
                    break;
            }
            result.complete(new ExecutionResult.Failed<>(error));
        }
    }

    private static final class Counters {
        final LongAdder executions = new LongAdder();
        final LongAdder successes = new LongAdder();
        final LongAdder failures = new LongAdder();
        final LongAdder attempts = new LongAdder();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "workflow-executor-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
