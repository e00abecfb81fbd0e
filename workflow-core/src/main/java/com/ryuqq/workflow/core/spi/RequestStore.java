package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.model.Action;
import com.ryuqq.workflow.core.model.ActorId;
import com.ryuqq.workflow.core.model.RequestId;
import com.ryuqq.workflow.core.model.Role;
import com.ryuqq.workflow.core.model.ServiceRequest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage SPI for service requests with optimistic concurrency control.
 *
 * <p>The core treats the store as a key-indexed record store with transactional single-record writes.
 * Every successful {@link #save} increments the stored version by one.</p>
 *
 * <p><strong>Failure signalling:</strong></p>
 * <ul>
 *   <li>{@link VersionConflictException}: the stored version differs from {@code expectedVersion};
 *       never retried by the core</li>
 *   <li>any other {@link RuntimeException}: infrastructure failure; retried per the
 *       {@code persistence-write} policy</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Atomic compare-and-set on version for a single request id</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface RequestStore {

    /**
     * Loads the latest snapshot of a request.
     *
     * @param requestId the request id
     * @return the stored snapshot (with its current version), or empty if unknown
     * @throws IllegalArgumentException if requestId is null
     */
    Optional<ServiceRequest> load(RequestId requestId);

    /**
     * Saves a snapshot if the stored version equals {@code expectedVersion}.
     *
     * <p>{@code expectedVersion == 0} means "create": the id must not exist yet.</p>
     *
     * @param request the snapshot to store
     * @param expectedVersion the version the caller read
     * @return the new stored version ({@code expectedVersion + 1})
     * @throws VersionConflictException if the stored version differs
     * @throws IllegalArgumentException if request is null or expectedVersion is negative
     */
    long save(ServiceRequest request, long expectedVersion);

    /**
     * Counts actions an actor performed since the given instant (for daily limits).
     *
     * @param actorId the actor
     * @param action the action
     * @param since lower bound (inclusive)
     * @return number of persisted actions
     */
    int countActions(ActorId actorId, Action action, Instant since);

    /**
     * Lists non-terminal requests whose current stage belongs to the given role.
     *
     * @param role the stage role
     * @return latest snapshots, in no particular order
     * @throws IllegalArgumentException if role is null
     */
    List<ServiceRequest> findByCurrentRole(Role role);
}
