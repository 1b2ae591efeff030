package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.ResponseCache;

/**
 * 보호 계층 구현체 생성 SPI.
 *
 * <p>Composer는 이 SPI를 통해 설정으로부터 상태를 가진 구현체를 만듭니다.
 * 호출마다 새 인스턴스를 반환해야 하며, 생성된 인스턴스는 하나의 스택이 독점합니다.</p>
 *
 * <p>참조 구현: {@code resilience-adapter-inmemory} 모듈의 {@code InMemoryProtectionProvider}</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ProtectionProvider {

    ResponseCache createCache(CacheConfig config);

    RateLimiter createRateLimiter(RateLimiterConfig config);

    /**
     * Circuit Breaker 생성.
     *
     * @param config Breaker 설정
     * @param listener 상태 전이 이벤트 수신자
     * @return 새 CircuitBreaker
     */
    CircuitBreaker createCircuitBreaker(CircuitBreakerConfig config, PolicyEventListener listener);
}
