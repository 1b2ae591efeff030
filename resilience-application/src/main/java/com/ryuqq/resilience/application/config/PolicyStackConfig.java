package com.ryuqq.resilience.application.config;

import com.ryuqq.resilience.application.stack.LayerType;
import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.retry.RetryConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Policy Stack 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>cache: {enabled, ttl, maxEntries}</li>
 *   <li>rateLimit: {enabled, maxRequests, window}</li>
 *   <li>circuitBreaker: {enabled, failureThreshold, resetTimeout}</li>
 *   <li>retry: {enabled, policy, maxAttempts}</li>
 *   <li>order: 계층 순서 (바깥 → 안쪽). 비어있으면 {@link LayerType#DEFAULT_ORDER}에서 활성 계층만</li>
 *   <li>attemptTimeout: Invoker 시도별 타임아웃 (null이면 없음)</li>
 * </ul>
 *
 * <p>null 하위 설정은 비활성으로 간주합니다. 순서 중복은 생성 시점에,
 * 활성 여부와의 모순은 {@link #resolveOrder()}에서 검출합니다.</p>
 *
 * @param cache 캐시 설정
 * @param rateLimit Rate Limit 설정
 * @param circuitBreaker Circuit Breaker 설정
 * @param retry 재시도 설정
 * @param order 계층 순서 (빈 리스트면 기본 순서)
 * @param attemptTimeout 시도별 타임아웃 (null 허용)
 * @author Resilience Team
 * @since 1.0.0
 */
public record PolicyStackConfig(
    CacheConfig cache,
    RateLimiterConfig rateLimit,
    CircuitBreakerConfig circuitBreaker,
    RetryConfig retry,
    List<LayerType> order,
    Duration attemptTimeout
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 순서에 중복이 있거나 attemptTimeout이 양수가 아닌 경우
     */
    public PolicyStackConfig {
        cache = cache == null ? CacheConfig.disabled() : cache;
        rateLimit = rateLimit == null ? RateLimiterConfig.disabled() : rateLimit;
        circuitBreaker = circuitBreaker == null ? CircuitBreakerConfig.disabled() : circuitBreaker;
        retry = retry == null ? RetryConfig.disabled() : retry;

        if (order == null) {
            order = List.of();
        } else {
            Set<LayerType> seen = EnumSet.noneOf(LayerType.class);
            for (LayerType type : order) {
                if (type == null) {
                    throw new ConfigurationException("order cannot contain null");
                }
                if (!seen.add(type)) {
                    throw new ConfigurationException("Duplicate layer in order: " + type.getConfigName());
                }
            }
            order = List.copyOf(order);
        }

        if (attemptTimeout != null && (attemptTimeout.isZero() || attemptTimeout.isNegative())) {
            throw new ConfigurationException("attemptTimeout must be positive (current: " + attemptTimeout + ")");
        }
    }

    /**
     * 모든 계층이 비활성인 기본 설정 (Invoker 직접 호출).
     *
     * @return 기본 PolicyStackConfig
     */
    public static PolicyStackConfig defaults() {
        return new PolicyStackConfig(null, null, null, null, List.of(), null);
    }

    public PolicyStackConfig withCache(CacheConfig cache) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, order, attemptTimeout);
    }

    public PolicyStackConfig withRateLimit(RateLimiterConfig rateLimit) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, order, attemptTimeout);
    }

    public PolicyStackConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, order, attemptTimeout);
    }

    public PolicyStackConfig withRetry(RetryConfig retry) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, order, attemptTimeout);
    }

    /**
     * 계층 순서 지정 (바깥 → 안쪽).
     *
     * @param layers 계층 순서
     * @return 새 인스턴스
     * @throws ConfigurationException 중복이 있는 경우
     */
    public PolicyStackConfig withOrder(LayerType... layers) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, Arrays.asList(layers), attemptTimeout);
    }

    public PolicyStackConfig withOrder(List<LayerType> order) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, order, attemptTimeout);
    }

    public PolicyStackConfig withAttemptTimeout(Duration attemptTimeout) {
        return new PolicyStackConfig(cache, rateLimit, circuitBreaker, retry, order, attemptTimeout);
    }

    /**
     * 계층 활성 여부.
     *
     * @param type 계층 종류
     * @return 활성이면 true
     */
    public boolean isEnabled(LayerType type) {
        return switch (type) {
            case CACHE -> cache.enabled();
            case RATE_LIMIT -> rateLimit.enabled();
            case CIRCUIT_BREAKER -> circuitBreaker.enabled();
            case RETRY -> retry.enabled();
        };
    }

    /**
     * 실제 적용할 계층 순서 계산.
     *
     * <ul>
     *   <li>order가 비어있으면: {@link LayerType#DEFAULT_ORDER}에서 활성 계층만</li>
     *   <li>order가 있으면: 그대로 사용하되, 비활성 계층이 포함되었거나
     *       활성 계층이 빠졌으면 모순으로 간주</li>
     * </ul>
     *
     * @return 불변 계층 순서 (바깥 → 안쪽)
     * @throws ConfigurationException 순서가 활성 여부와 모순되는 경우
     */
    public List<LayerType> resolveOrder() {
        if (order.isEmpty()) {
            List<LayerType> resolved = new ArrayList<>();
            for (LayerType type : LayerType.DEFAULT_ORDER) {
                if (isEnabled(type)) {
                    resolved.add(type);
                }
            }
            return List.copyOf(resolved);
        }

        for (LayerType type : order) {
            if (!isEnabled(type)) {
                throw new ConfigurationException(
                    "Layer '" + type.getConfigName() + "' is listed in order but not enabled"
                );
            }
        }
        for (LayerType type : LayerType.values()) {
            if (isEnabled(type) && !order.contains(type)) {
                throw new ConfigurationException(
                    "Layer '" + type.getConfigName() + "' is enabled but missing from order " + order
                );
            }
        }
        return order;
    }
}
