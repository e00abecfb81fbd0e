package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.protection.CircuitBreaker;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 작업 클래스별 Circuit Breaker 레지스트리.
 *
 * <p>처음 요청된 작업 클래스에 대해 {@link ResilienceConfig}의 설정으로
 * {@link DefaultCircuitBreaker}를 한 번만 생성합니다. 인스턴스는 프로세스 수명 동안 유지됩니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry {

    private final ResilienceConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(ResilienceConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    /**
     * 작업 클래스의 Circuit Breaker (없으면 생성).
     */
    public CircuitBreaker forClass(String operationClass) {
        return breakers.computeIfAbsent(operationClass,
            name -> new DefaultCircuitBreaker(name, config.circuitBreakerConfigFor(name), clock));
    }

    /**
     * 이미 생성된 Circuit Breaker 조회.
     */
    public Optional<CircuitBreaker> find(String operationClass) {
        return Optional.ofNullable(breakers.get(operationClass));
    }
}
