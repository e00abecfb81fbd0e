/**
 * Service request domain model.
 *
 * <p>Value objects shared by every module: identifiers, roles, actions,
 * workflow types and the immutable {@link com.ryuqq.workflow.core.model.ServiceRequest} snapshot.</p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>All types are immutable; transitions produce new snapshots.</li>
 *   <li>{@link com.ryuqq.workflow.core.model.StateData} is append-only and rejects reserved keys.</li>
 *   <li>Unknown role/action codes resolve to an empty {@code Optional}, never to a default.</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.model;
