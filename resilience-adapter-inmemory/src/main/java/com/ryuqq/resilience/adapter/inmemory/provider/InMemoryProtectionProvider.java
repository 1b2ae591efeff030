package com.ryuqq.resilience.adapter.inmemory.provider;

import com.ryuqq.resilience.adapter.inmemory.breaker.InMemoryCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.cache.InMemoryResponseCache;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.SlidingWindowRateLimiter;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.ResponseCache;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import com.ryuqq.resilience.core.spi.ProtectionProvider;

import java.time.Clock;

/**
 * {@link ProtectionProvider} SPI의 In-Memory 구현체.
 *
 * <p>{@code create*} 호출마다 {@link Clock}만 공유하는 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProtectionProvider provider = new InMemoryProtectionProvider();
 * PolicyStack stack = new PolicyStackComposer(provider).compose(config, invoker);
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class InMemoryProtectionProvider implements ProtectionProvider {

    private final Clock clock;

    /**
     * UTC 시스템 시계를 사용하는 Provider 생성.
     */
    public InMemoryProtectionProvider() {
        this(Clock.systemUTC());
    }

    /**
     * 주어진 시계를 사용하는 Provider 생성.
     *
     * @param clock 시간 소스
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public InMemoryProtectionProvider(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public ResponseCache createCache(CacheConfig config) {
        return new InMemoryResponseCache(config, clock);
    }

    @Override
    public RateLimiter createRateLimiter(RateLimiterConfig config) {
        return new SlidingWindowRateLimiter(config, clock);
    }

    @Override
    public CircuitBreaker createCircuitBreaker(CircuitBreakerConfig config, PolicyEventListener listener) {
        return new InMemoryCircuitBreaker(config, clock, listener);
    }

    public Clock getClock() {
        return clock;
    }
}
