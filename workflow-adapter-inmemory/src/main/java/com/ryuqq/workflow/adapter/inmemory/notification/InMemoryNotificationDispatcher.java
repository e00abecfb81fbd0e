package com.ryuqq.workflow.adapter.inmemory.notification;

import com.ryuqq.workflow.core.spi.NotificationDeliveryException;
import com.ryuqq.workflow.core.spi.NotificationDispatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recording implementation of {@link NotificationDispatcher} SPI for tests.
 *
 * <p>Every call counts as an attempt. Successful calls are kept in order as {@link Dispatch} records.
 * Failures can be injected either for the next N calls or for all calls.</p>
 *
 * <p>Dispatch happens on executor worker threads, so tests wait with {@link #awaitAttempts}.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InMemoryNotificationDispatcher implements NotificationDispatcher {

    private final Object lock = new Object();
    private final List<Dispatch> dispatches = new ArrayList<>();
    private int attempts;
    private int pendingFailures;
    private boolean failAlways;
    private boolean permanentFailures;

    @Override
    public void dispatch(String recipientId, String templateKey, Map<String, String> parameters) {
        synchronized (lock) {
            try {
                attempts++;
                if (failAlways || pendingFailures > 0) {
                    if (pendingFailures > 0) {
                        pendingFailures--;
                    }
                    throw new NotificationDeliveryException(
                        "Simulated delivery failure to " + recipientId, permanentFailures);
                }
                dispatches.add(new Dispatch(recipientId, templateKey, Map.copyOf(parameters)));
            } finally {
                lock.notifyAll();
            }
        }
    }

    /**
     * Makes the next {@code count} calls fail with a retryable delivery error.
     */
    public void failNext(int count) {
        synchronized (lock) {
            pendingFailures = count;
            permanentFailures = false;
        }
    }

    /**
     * Makes every call fail until {@link #clear()}.
     *
     * @param permanent whether the injected failure is permanent (not retried)
     */
    public void failAlways(boolean permanent) {
        synchronized (lock) {
            failAlways = true;
            permanentFailures = permanent;
        }
    }

    /**
     * Waits until at least {@code count} calls have been made.
     *
     * @return true if reached before the timeout
     */
    public boolean awaitAttempts(int count, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (attempts < count) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    lock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public int attempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    public List<Dispatch> dispatches() {
        synchronized (lock) {
            return List.copyOf(dispatches);
        }
    }

    public void clear() {
        synchronized (lock) {
            dispatches.clear();
            attempts = 0;
            pendingFailures = 0;
            failAlways = false;
            permanentFailures = false;
        }
    }

    /**
     * A delivered notification.
     *
     * @param recipientId recipient
     * @param templateKey template key
     * @param parameters template parameters
     */
    public record Dispatch(String recipientId, String templateKey, Map<String, String> parameters) {
    }
}
