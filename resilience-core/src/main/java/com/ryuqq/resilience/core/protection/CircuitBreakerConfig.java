package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @param enabled 계층 활성화 여부
 * @param failureThreshold OPEN으로 전이하는 연속 실패 횟수 (1 이상)
 * @param resetTimeout OPEN 후 Probe를 허용하기까지의 시간 (양수)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(boolean enabled, int failureThreshold, Duration resetTimeout) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException if failureThreshold is not positive
     * @throws ConfigurationException if resetTimeout is null or not positive
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new ConfigurationException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (resetTimeout == null || resetTimeout.isZero() || resetTimeout.isNegative()) {
            throw new ConfigurationException(
                "resetTimeout must be positive (current: " + resetTimeout + ")"
            );
        }
    }

    /**
     * 비활성 설정 (failureThreshold=5, resetTimeout=30s).
     *
     * @return 비활성 CircuitBreakerConfig
     */
    public static CircuitBreakerConfig disabled() {
        return new CircuitBreakerConfig(false, 5, Duration.ofSeconds(30));
    }

    /**
     * 활성 설정 생성.
     *
     * @param failureThreshold 연속 실패 임계값
     * @param resetTimeout OPEN 유지 시간
     * @return 활성 CircuitBreakerConfig
     */
    public static CircuitBreakerConfig of(int failureThreshold, Duration resetTimeout) {
        return new CircuitBreakerConfig(true, failureThreshold, resetTimeout);
    }

    public CircuitBreakerConfig withEnabled(boolean enabled) {
        return new CircuitBreakerConfig(enabled, failureThreshold, resetTimeout);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(enabled, failureThreshold, resetTimeout);
    }

    public CircuitBreakerConfig withResetTimeout(Duration resetTimeout) {
        return new CircuitBreakerConfig(enabled, failureThreshold, resetTimeout);
    }
}
