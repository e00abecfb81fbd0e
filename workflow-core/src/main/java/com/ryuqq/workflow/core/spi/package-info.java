/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the workflow core consumes. Adapter modules
 * (e.g. workflow-adapter-inmemory) provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.spi.RequestStore} - versioned request storage</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.AuditStore} - durable audit entry storage</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.NotificationDispatcher} - outbound notifications</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Failure as exceptions at the edge:</strong> adapters throw; the core classifies and retries</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.spi;
