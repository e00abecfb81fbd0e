/**
 * In-memory storage adapters.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.adapter.inmemory.store.InMemoryRequestStore}:
 *       versioned request storage implementing {@link com.ryuqq.workflow.core.spi.RequestStore}</li>
 *   <li>{@link com.ryuqq.workflow.adapter.inmemory.store.InMemoryAuditStore}:
 *       append-only audit storage implementing {@link com.ryuqq.workflow.core.spi.AuditStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for contract tests and as a reference implementation</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.store;
