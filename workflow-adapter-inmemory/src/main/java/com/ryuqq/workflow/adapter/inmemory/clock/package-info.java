/**
 * Controllable time source for tests and local runs.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.clock;
