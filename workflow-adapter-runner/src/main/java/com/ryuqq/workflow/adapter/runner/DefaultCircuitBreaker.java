package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.protection.CircuitBreaker;
import com.ryuqq.workflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.workflow.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.workflow.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 연속 실패 기반 Circuit Breaker 구현체.
 *
 * <p>모든 상태는 불변 {@link Cell} 하나에 담기고 {@link AtomicReference} CAS로 갱신됩니다.
 * 잠금이 없으므로 높은 경합에서도 호출 스레드를 막지 않으며,
 * CLOSED 상태의 {@link #tryAcquire()}는 읽기 한 번으로 끝납니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED: 연속 실패가 failureThreshold에 도달하면 OPEN (openedAt 기록)</li>
 *   <li>OPEN: openedAt + recoveryTimeout 이후 첫 tryAcquire가 HALF_OPEN으로 전이하며 시험 호출 1건 허용</li>
 *   <li>HALF_OPEN: 시험 호출은 동시에 1건만. 성공이 successThreshold번 이어지면 CLOSED, 실패하면 즉시 OPEN</li>
 * </ul>
 *
 * <p>성공/실패 통계는 monitoringWindow 단위로 초기화되는 윈도우에 집계됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Duration recoveryTimeout;
    private final Duration monitoringWindow;
    private final AtomicReference<Cell> cell;

    /**
     * @param name 작업 클래스 이름 (로깅용)
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.recoveryTimeout = Duration.ofMillis(config.recoveryTimeoutMs());
        this.monitoringWindow = Duration.ofMillis(config.monitoringWindowMs());
        this.cell = new AtomicReference<>(Cell.closed(clock.instant()));
    }

    @Override
    public boolean tryAcquire() {
        while (true) {
            Cell current = cell.get();
            switch (current.state) {
                case CLOSED:
                    return true;
                case OPEN: {
                    Instant now = clock.instant();
                    if (now.isBefore(current.openedAt.plus(recoveryTimeout))) {
                        return false;
                    }
                    if (cell.compareAndSet(current, current.halfOpenTrial())) {
                        log.info("Circuit half-open: {} (trial call allowed)", name);
                        return true;
                    }
                    break;
                }
                case HALF_OPEN:
                    if (current.trialInFlight) {
                        return false;
                    }
                    if (cell.compareAndSet(current, current.withTrialInFlight(true))) {
                        return true;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected state: " + current.state);
            }
        }
    }

    @Override
    public void recordSuccess() {
        while (true) {
            Cell current = cell.get();
            Instant now = clock.instant();
            Cell next;
            if (current.state == CircuitBreakerState.HALF_OPEN) {
                int successes = current.consecutiveSuccesses + 1;
                next = successes >= config.successThreshold()
                    ? Cell.closed(now).withWindowFrom(current.rolled(now, monitoringWindow)).countSuccess()
                    : current.rolled(now, monitoringWindow).halfOpenSuccess(successes);
            } else if (current.state == CircuitBreakerState.CLOSED) {
                next = current.rolled(now, monitoringWindow).closedSuccess();
            } else {
                // OPEN 전에 통과한 호출의 늦은 성공: 통계만 반영
                next = current.rolled(now, monitoringWindow).countSuccess();
            }
            if (cell.compareAndSet(current, next)) {
                if (current.state == CircuitBreakerState.HALF_OPEN && next.state == CircuitBreakerState.CLOSED) {
                    log.info("Circuit closed: {} after {} consecutive successful trials", name, config.successThreshold());
                }
                return;
            }
        }
    }

    @Override
    public void recordFailure(String reason) {
        while (true) {
            Cell current = cell.get();
            Instant now = clock.instant();
            Cell rolled = current.rolled(now, monitoringWindow).countFailure();
            Cell next;
            if (current.state == CircuitBreakerState.HALF_OPEN) {
                next = rolled.open(now);
            } else if (current.state == CircuitBreakerState.CLOSED) {
                int failures = current.consecutiveFailures + 1;
                next = failures >= config.failureThreshold() ? rolled.open(now) : rolled.withConsecutiveFailures(failures);
            } else {
                next = rolled;
            }
            if (cell.compareAndSet(current, next)) {
                if (current.state != CircuitBreakerState.OPEN && next.state == CircuitBreakerState.OPEN) {
                    log.warn("Circuit opened: {} (from {}, consecutiveFailures={}, reason={})",
                        name, current.state, next.consecutiveFailures, reason);
                }
                return;
            }
        }
    }

    @Override
    public void release() {
        while (true) {
            Cell current = cell.get();
            if (current.state != CircuitBreakerState.HALF_OPEN || !current.trialInFlight) {
                return;
            }
            if (cell.compareAndSet(current, current.withTrialInFlight(false))) {
                return;
            }
        }
    }

    @Override
    public CircuitBreakerState getState() {
        return cell.get().state;
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        Cell current = cell.get().rolled(clock.instant(), monitoringWindow);
        return new CircuitBreakerSnapshot(current.state, current.consecutiveFailures, current.consecutiveSuccesses,
            current.openedAt, current.windowFailures, current.windowSuccesses);
    }

    @Override
    public void reset() {
        Cell previous = cell.getAndSet(Cell.closed(clock.instant()));
        log.info("Circuit reset: {} (was {})", name, previous.state);
    }

    public String getName() {
        return name;
    }

    /**
     * Circuit Breaker 상태 한 벌 (불변).
     */
    private static final class Cell {

        final CircuitBreakerState state;
        final int consecutiveFailures;
        final int consecutiveSuccesses;
        final Instant openedAt;
        final boolean trialInFlight;
        final Instant windowStart;
        final long windowFailures;
        final long windowSuccesses;

        Cell(CircuitBreakerState state, int consecutiveFailures, int consecutiveSuccesses, Instant openedAt,
             boolean trialInFlight, Instant windowStart, long windowFailures, long windowSuccesses) {
            this.state = state;
            this.consecutiveFailures = consecutiveFailures;
            this.consecutiveSuccesses = consecutiveSuccesses;
            this.openedAt = openedAt;
            this.trialInFlight = trialInFlight;
            this.windowStart = windowStart;
            this.windowFailures = windowFailures;
            this.windowSuccesses = windowSuccesses;
        }

        static Cell closed(Instant now) {
            return new Cell(CircuitBreakerState.CLOSED, 0, 0, null, false, now, 0, 0);
        }

        Cell open(Instant now) {
            return new Cell(CircuitBreakerState.OPEN, consecutiveFailures + 1, 0, now, false,
                windowStart, windowFailures, windowSuccesses);
        }

        Cell halfOpenTrial() {
            return new Cell(CircuitBreakerState.HALF_OPEN, consecutiveFailures, 0, openedAt, true,
                windowStart, windowFailures, windowSuccesses);
        }

        Cell halfOpenSuccess(int successes) {
            return new Cell(CircuitBreakerState.HALF_OPEN, consecutiveFailures, successes, openedAt, false,
                windowStart, windowFailures, windowSuccesses + 1);
        }

        Cell closedSuccess() {
            return new Cell(state, 0, 0, null, false, windowStart, windowFailures, windowSuccesses + 1);
        }

        Cell withTrialInFlight(boolean inFlight) {
            return new Cell(state, consecutiveFailures, consecutiveSuccesses, openedAt, inFlight,
                windowStart, windowFailures, windowSuccesses);
        }

        Cell withConsecutiveFailures(int failures) {
            return new Cell(state, failures, consecutiveSuccesses, openedAt, trialInFlight,
                windowStart, windowFailures, windowSuccesses);
        }

        Cell withWindowFrom(Cell other) {
            return new Cell(state, consecutiveFailures, consecutiveSuccesses, openedAt, trialInFlight,
                other.windowStart, other.windowFailures, other.windowSuccesses);
        }

        Cell countSuccess() {
            return new Cell(state, consecutiveFailures, consecutiveSuccesses, openedAt, trialInFlight,
                windowStart, windowFailures, windowSuccesses + 1);
        }

        Cell countFailure() {
            return new Cell(state, consecutiveFailures, consecutiveSuccesses, openedAt, trialInFlight,
                windowStart, windowFailures + 1, windowSuccesses);
        }

        /**
         * 윈도우가 지났으면 통계를 비운 사본, 아니면 자기 자신.
         */
        Cell rolled(Instant now, Duration window) {
            if (now.isBefore(windowStart.plus(window))) {
                return this;
            }
            return new Cell(state, consecutiveFailures, consecutiveSuccesses, openedAt, trialInFlight, now, 0, 0);
        }
    }
}
