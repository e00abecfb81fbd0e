/**
 * Workflow Application Layer - 요청 생성/전이 조정 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.application.orchestrator.WorkflowOrchestrator} - 오케스트레이션 Facade</li>
 *   <li>{@link com.ryuqq.workflow.application.orchestrator.CreateRequestCommand} - 생성 명령</li>
 *   <li>{@link com.ryuqq.workflow.application.orchestrator.TransitionCommand} - 전이 명령</li>
 *   <li>{@link com.ryuqq.workflow.application.orchestrator.WorkflowStatus} - 상태 조회 결과</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>불변성:</strong> 명령과 결과는 불변 record</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.application.orchestrator;
