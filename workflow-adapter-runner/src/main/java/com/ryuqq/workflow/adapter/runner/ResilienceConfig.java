package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.executor.OperationClasses;
import com.ryuqq.workflow.core.protection.CircuitBreakerConfig;
import com.ryuqq.workflow.core.protection.RetryPolicy;
import com.ryuqq.workflow.core.protection.RetryStrategy;

import java.util.HashMap;
import java.util.Map;

/**
 * RetryingExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultRetryPolicy: 개별 설정이 없는 작업 클래스의 재시도 정책 (기본 {@code new RetryPolicy()})</li>
 *   <li>defaultCircuitBreakerConfig: 개별 설정이 없는 작업 클래스의 Circuit Breaker 설정</li>
 *   <li>retryPolicies: 작업 클래스별 재시도 정책 (기본: audit-write는 대기 없는 IMMEDIATE)</li>
 *   <li>circuitBreakerConfigs: 작업 클래스별 Circuit Breaker 설정</li>
 *   <li>workerThreads: 시도를 실행하는 워커 스레드 수 (기본 4)</li>
 * </ul>
 *
 * <pre>{@code
 * ResilienceConfig config = new ResilienceConfig()
 *     .withRetryPolicy("notification-dispatch", new RetryPolicy().withMaxAttempts(5))
 *     .withCircuitBreakerConfig("notification-dispatch", new CircuitBreakerConfig().withFailureThreshold(3));
 * }</pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 * @param defaultRetryPolicy 기본 재시도 정책
 * @param defaultCircuitBreakerConfig 기본 Circuit Breaker 설정
 * @param retryPolicies 작업 클래스별 재시도 정책
 * @param circuitBreakerConfigs 작업 클래스별 Circuit Breaker 설정
 * @param workerThreads 워커 스레드 수 (1 이상)
 */
public record ResilienceConfig(
    RetryPolicy defaultRetryPolicy,
    CircuitBreakerConfig defaultCircuitBreakerConfig,
    Map<String, RetryPolicy> retryPolicies,
    Map<String, CircuitBreakerConfig> circuitBreakerConfigs,
    int workerThreads
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>audit-write는 전이 호출 스레드에서 동기로 실행되므로 재시도 사이에 대기하지 않는다.</p>
     */
    public ResilienceConfig() {
        this(new RetryPolicy(), new CircuitBreakerConfig(),
            Map.of(OperationClasses.AUDIT_WRITE, new RetryPolicy().withStrategy(RetryStrategy.IMMEDIATE)),
            Map.of(), 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ResilienceConfig {
        if (defaultRetryPolicy == null) {
            throw new IllegalArgumentException("defaultRetryPolicy cannot be null");
        }
        if (defaultCircuitBreakerConfig == null) {
            throw new IllegalArgumentException("defaultCircuitBreakerConfig cannot be null");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
        retryPolicies = retryPolicies == null ? Map.of() : Map.copyOf(retryPolicies);
        circuitBreakerConfigs = circuitBreakerConfigs == null ? Map.of() : Map.copyOf(circuitBreakerConfigs);
    }

    public RetryPolicy retryPolicyFor(String operationClass) {
        return retryPolicies.getOrDefault(operationClass, defaultRetryPolicy);
    }

    public CircuitBreakerConfig circuitBreakerConfigFor(String operationClass) {
        return circuitBreakerConfigs.getOrDefault(operationClass, defaultCircuitBreakerConfig);
    }

    public ResilienceConfig withDefaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
        return new ResilienceConfig(defaultRetryPolicy, defaultCircuitBreakerConfig, retryPolicies, circuitBreakerConfigs, workerThreads);
    }

    public ResilienceConfig withDefaultCircuitBreakerConfig(CircuitBreakerConfig defaultCircuitBreakerConfig) {
        return new ResilienceConfig(defaultRetryPolicy, defaultCircuitBreakerConfig, retryPolicies, circuitBreakerConfigs, workerThreads);
    }

    /**
     * 작업 클래스 하나의 재시도 정책을 지정한 새 인스턴스 생성.
     */
    public ResilienceConfig withRetryPolicy(String operationClass, RetryPolicy policy) {
        Map<String, RetryPolicy> copy = new HashMap<>(retryPolicies);
        copy.put(operationClass, policy);
        return new ResilienceConfig(defaultRetryPolicy, defaultCircuitBreakerConfig, copy, circuitBreakerConfigs, workerThreads);
    }

    /**
     * 작업 클래스 하나의 Circuit Breaker 설정을 지정한 새 인스턴스 생성.
     */
    public ResilienceConfig withCircuitBreakerConfig(String operationClass, CircuitBreakerConfig circuitBreakerConfig) {
        Map<String, CircuitBreakerConfig> copy = new HashMap<>(circuitBreakerConfigs);
        copy.put(operationClass, circuitBreakerConfig);
        return new ResilienceConfig(defaultRetryPolicy, defaultCircuitBreakerConfig, retryPolicies, copy, workerThreads);
    }

    public ResilienceConfig withWorkerThreads(int workerThreads) {
        return new ResilienceConfig(defaultRetryPolicy, defaultCircuitBreakerConfig, retryPolicies, circuitBreakerConfigs, workerThreads);
    }
}
