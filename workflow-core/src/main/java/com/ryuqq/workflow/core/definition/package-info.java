/**
 * Static workflow definitions.
 *
 * <p>Each {@link com.ryuqq.workflow.core.definition.WorkflowDefinition} lists the ordered role stages of a
 * workflow type and, per stage, the permitted transition actions with their destination stage and status.
 * Definitions are validated once at load time and are read-only afterwards.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.workflow.core.definition;
