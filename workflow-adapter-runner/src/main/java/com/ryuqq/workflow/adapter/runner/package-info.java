/**
 * Runner Adapter Layer - 오케스트레이터와 실행자 구현체.
 *
 * <p>이 패키지는 core/application 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.DefaultWorkflowOrchestrator} - 요청 로드, 요청별 직렬화, 상태 머신 호출</li>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.RetryingExecutor} - 재시도/Circuit Breaker 실행자</li>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.DefaultCircuitBreaker} - CAS 기반 Circuit Breaker</li>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.DefaultAuditLedger} - 재시도 및 fallback 로그를 갖춘 감사 원장</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultWorkflowOrchestrator, RetryingExecutor)
 *   ↓ implements
 * application (WorkflowOrchestrator interface)
 *   ↓ depends on
 * core (WorkflowStateMachine, PermissionEngine, AuditLedger)
 *   ↓ depends on
 * core/executor (ResilientExecutor interface)
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.runner;
