package com.ryuqq.resilience.application.stack;

import com.ryuqq.resilience.application.config.PolicyStackConfig;
import com.ryuqq.resilience.core.error.CircuitOpenException;
import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.ResponseCache;
import com.ryuqq.resilience.core.retry.RetryConfig;
import com.ryuqq.resilience.core.spi.FailureClassifier;
import com.ryuqq.resilience.core.spi.Invoker;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import com.ryuqq.resilience.core.spi.ProtectionProvider;
import com.ryuqq.resilience.core.spi.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * PolicyStackComposer 유닛 테스트.
 *
 * <p>구성 요소 생성, 계층 배치 순서, 설정 오류 처리를 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PolicyStackComposerTest {

    @Mock
    private ProtectionProvider provider;

    @Mock
    private ResponseCache cache;

    @Mock
    private RateLimiter limiter;

    @Mock
    private CircuitBreaker breaker;

    @Mock
    private Invoker invoker;

    @Mock
    private PolicyEventListener listener;

    @Mock
    private Sleeper sleeper;

    private PolicyStackComposer composer;
    private Request request;

    @BeforeEach
    void setUp() {
        composer = new PolicyStackComposer(provider, listener, sleeper, FailureClassifier.standard());
        request = Request.of(Target.of("orders"), "1");
    }

    @Test
    void compose_계층_없음_Invoker_직접_호출() throws Exception {
        // given
        Response ok = Response.of("ok");
        when(invoker.invoke(request)).thenReturn(ok);

        // when
        try (PolicyStack stack = composer.compose(PolicyStackConfig.defaults(), invoker)) {

            // then
            assertThat(stack.layers()).isEmpty();
            assertThat(stack.call(request)).isSameAs(ok);
            verifyNoInteractions(provider);
        }
    }

    @Test
    void compose_활성_계층만_Provider_로_생성() {
        // given
        CacheConfig cacheConfig = CacheConfig.of(Duration.ofMinutes(1), 10);
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.of(3, Duration.ofSeconds(30));
        PolicyStackConfig config = PolicyStackConfig.defaults()
            .withCache(cacheConfig)
            .withCircuitBreaker(breakerConfig);
        when(provider.createCache(cacheConfig)).thenReturn(cache);
        when(provider.createCircuitBreaker(breakerConfig, listener)).thenReturn(breaker);

        // when
        try (PolicyStack stack = composer.compose(config, invoker)) {

            // then
            assertThat(stack.layers()).containsExactly(LayerType.CIRCUIT_BREAKER, LayerType.CACHE);
            verify(provider, never()).createRateLimiter(any());
        }
    }

    @Test
    void compose_지정한_순서대로_바깥부터_호출() throws Exception {
        // given: [cache, rate-limit, circuit-breaker]
        CacheConfig cacheConfig = CacheConfig.of(Duration.ofMinutes(1), 10);
        RateLimiterConfig limiterConfig = RateLimiterConfig.of(10, Duration.ofSeconds(1));
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.of(3, Duration.ofSeconds(30));
        PolicyStackConfig config = PolicyStackConfig.defaults()
            .withCache(cacheConfig)
            .withRateLimit(limiterConfig)
            .withCircuitBreaker(breakerConfig)
            .withOrder(LayerType.CACHE, LayerType.RATE_LIMIT, LayerType.CIRCUIT_BREAKER);
        when(provider.createCache(cacheConfig)).thenReturn(cache);
        when(provider.createRateLimiter(limiterConfig)).thenReturn(limiter);
        when(provider.createCircuitBreaker(breakerConfig, listener)).thenReturn(breaker);
        when(cache.get(request.cacheKey())).thenReturn(Optional.empty());
        when(limiter.tryAcquire(request.target())).thenReturn(true);
        CircuitBreakerPermit permit = new CircuitBreakerPermit(request.target(), 0, false);
        when(breaker.tryAcquire(request.target())).thenReturn(Optional.of(permit));
        Response ok = Response.of("ok");
        when(invoker.invoke(request)).thenReturn(ok);

        // when
        try (PolicyStack stack = composer.compose(config, invoker)) {
            Response response = stack.call(request);

            // then
            assertThat(response).isSameAs(ok);
            InOrder inOrder = inOrder(cache, limiter, breaker, invoker);
            inOrder.verify(cache).get(request.cacheKey());
            inOrder.verify(limiter).tryAcquire(request.target());
            inOrder.verify(breaker).tryAcquire(request.target());
            inOrder.verify(invoker).invoke(request);
            inOrder.verify(breaker).recordSuccess(permit);
            inOrder.verify(cache).put(request.cacheKey(), ok, cacheConfig.ttl());
        }
    }

    @Test
    void compose_재시도_설정은_Sleeper_로_대기() throws Exception {
        // given: retry outside breaker; breaker rejects every attempt
        PolicyStackConfig config = PolicyStackConfig.defaults()
            .withCircuitBreaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(30)))
            .withRetry(RetryConfig.fixed(3, Duration.ofMillis(10)))
            .withOrder(LayerType.RETRY, LayerType.CIRCUIT_BREAKER);
        when(provider.createCircuitBreaker(any(), any())).thenReturn(breaker);
        when(breaker.tryAcquire(request.target())).thenReturn(Optional.empty());
        when(breaker.getState(request.target())).thenReturn(CircuitBreakerState.OPEN);

        // when
        try (PolicyStack stack = composer.compose(config, invoker)) {

            // then: CIRCUIT_OPEN is never retried
            assertThatThrownBy(() -> stack.call(request)).isInstanceOf(CircuitOpenException.class);
            verify(sleeper, never()).sleep(any());
            verifyNoInteractions(invoker);
        }
    }

    @Test
    void compose_모순된_순서는_ConfigurationException_이고_생성하지_않음() {
        // given
        PolicyStackConfig config = PolicyStackConfig.defaults()
            .withRetry(RetryConfig.fixed(2, Duration.ZERO))
            .withOrder(LayerType.RETRY, LayerType.CACHE);

        // when & then
        assertThatThrownBy(() -> composer.compose(config, invoker))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("'cache' is listed in order but not enabled");
        verifyNoInteractions(provider);
    }

    @Test
    void compose_Provider_실패는_그대로_전파() {
        // given
        CacheConfig cacheConfig = CacheConfig.of(Duration.ofMinutes(1), 10);
        when(provider.createCache(cacheConfig)).thenThrow(new IllegalStateException("cache backend down"));
        PolicyStackConfig config = PolicyStackConfig.defaults()
            .withCache(cacheConfig)
            .withAttemptTimeout(Duration.ofSeconds(1));

        // when & then
        assertThatThrownBy(() -> composer.compose(config, invoker))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cache backend down");
    }

    @Test
    void compose_null_인자_거부() {
        assertThatThrownBy(() -> composer.compose(null, invoker))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> composer.compose(PolicyStackConfig.defaults(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invoker cannot be null");
    }

    @Test
    void with_메서드는_새_Composer_를_반환() {
        // when
        PolicyStackComposer other = composer.withSleeper(Sleeper.threadSleep())
            .withListener(PolicyEventListener.NO_OP)
            .withClassifier(FailureClassifier.standard());

        // then
        assertThat(other).isNotSameAs(composer);
    }

    @Test
    void 생성자_null_Provider_거부() {
        assertThatThrownBy(() -> new PolicyStackComposer(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("provider cannot be null");
    }
}
