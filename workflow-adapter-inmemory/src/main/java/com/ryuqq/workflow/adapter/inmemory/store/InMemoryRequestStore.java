package com.ryuqq.workflow.adapter.inmemory.store;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.ActionStamp;
import com.ryuqq.workflow.core.model.ActorId;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;
import com.ryuqq.workflow.core.spi.RequestStore;
import com.ryuqq.workflow.core.spi.VersionConflictException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link RequestStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>requests:</strong> ConcurrentHashMap&lt;RequestId, ServiceRequest&gt; - latest snapshot per request;
 *       version compare-and-set runs inside {@link ConcurrentHashMap#compute}</li>
 *   <li><strong>activity:</strong> ConcurrentHashMap&lt;ActorId, ConcurrentLinkedQueue&lt;ActionStamp&gt;&gt; -
 *       one stamp per successful save, bucketed by actor, used by {@link #countActions}</li>
 * </ul>
 *
 * <p><strong>Activity Retention:</strong> {@link #countActions} drops the actor's stamps older than
 * {@code since}. Callers query a sliding window ending at the current time, so a dropped stamp is never
 * counted again.</p>
 *
 * <p><strong>Failure Injection (tests only):</strong></p>
 * <ul>
 *   <li>{@link #failNextSaves(int)}: the next N saves throw an infrastructure exception before touching state</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>{@link #findByCurrentRole} scans every stored request</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class InMemoryRequestStore implements RequestStore {

    private final ConcurrentHashMap<RequestId, ServiceRequest> requests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ActorId, ConcurrentLinkedQueue<ActionStamp>> activity = new ConcurrentHashMap<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final AtomicInteger saveAttempts = new AtomicInteger();

    @Override
    public Optional<ServiceRequest> load(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return Optional.ofNullable(requests.get(requestId));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The version check and the write are atomic per request id</li>
     *   <li>A conflicting save leaves the stored snapshot untouched</li>
     * </ul>
     */
    @Override
    public long save(ServiceRequest request, long expectedVersion) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must be non-negative (current: " + expectedVersion + ")");
        }
        saveAttempts.incrementAndGet();
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("Simulated storage failure for " + request.id());
        }

        long newVersion = expectedVersion + 1;
        requests.compute(request.id(), (id, current) -> {
            long actual = current == null ? 0L : current.version();
            if (actual != expectedVersion) {
                throw new VersionConflictException(id, expectedVersion, actual);
            }
            return request.withVersion(newVersion);
        });
        ActionStamp stamp = request.lastAction();
        activity.computeIfAbsent(stamp.actorId(), id -> new ConcurrentLinkedQueue<>()).add(stamp);
        return newVersion;
    }

    @Override
    public int countActions(ActorId actorId, Action action, Instant since) {
        ConcurrentLinkedQueue<ActionStamp> stamps = activity.get(actorId);
        if (stamps == null) {
            return 0;
        }
        stamps.removeIf(stamp -> stamp.at().isBefore(since));
        int count = 0;
        for (ActionStamp stamp : stamps) {
            if (stamp.action() == action && !stamp.at().isBefore(since)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public List<ServiceRequest> findByCurrentRole(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        List<ServiceRequest> matches = new ArrayList<>();
        for (ServiceRequest request : requests.values()) {
            if (request.currentRole() == role && !request.isTerminal()) {
                matches.add(request);
            }
        }
        return matches;
    }

    /**
     * Makes the next {@code count} saves fail with a retryable infrastructure exception.
     *
     * @param count number of saves to fail
     */
    public void failNextSaves(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        pendingFailures.set(count);
    }

    /**
     * Total number of {@link #save} invocations, including failed ones.
     */
    public int saveAttempts() {
        return saveAttempts.get();
    }

    /**
     * Number of action stamps still retained for the actor.
     */
    public int retainedActivity(ActorId actorId) {
        ConcurrentLinkedQueue<ActionStamp> stamps = activity.get(actorId);
        return stamps == null ? 0 : stamps.size();
    }

    public int size() {
        return requests.size();
    }

    /**
     * Clears all data (test helper).
     */
    public void clear() {
        requests.clear();
        activity.clear();
        pendingFailures.set(0);
        saveAttempts.set(0);
    }
}
