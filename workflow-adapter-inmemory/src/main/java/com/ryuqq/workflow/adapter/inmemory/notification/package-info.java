/**
 * In-memory notification adapter.
 *
 * <p>{@link com.ryuqq.workflow.adapter.inmemory.notification.InMemoryNotificationDispatcher} records
 * deliveries and supports failure injection for circuit breaker and best-effort delivery tests.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.notification;
