package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.application.config.PolicyStackConfig;
import com.ryuqq.resilience.application.stack.LayerType;
import com.ryuqq.resilience.application.stack.PolicyStack;
import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.retry.RetryConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Layer ordering decides which layer observes which outcome.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class CompositionOrderContractTest extends AbstractPolicyStackContractTest {

    private static PolicyStackConfig allEnabled() {
        return PolicyStackConfig.defaults()
                .withCache(CacheConfig.of(Duration.ofMinutes(1), 100))
                .withRateLimit(RateLimiterConfig.of(100, Duration.ofSeconds(1)))
                .withCircuitBreaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(30)))
                .withRetry(RetryConfig.fixed(3, Duration.ZERO));
    }

    @Test
    void testOrder_CacheBreakerRetry_RetriesExhaustedInsideOneBreakerCall() {
        // Given: [cache, breaker, retry], threshold 1, invoker always transient
        PolicyStackConfig config = PolicyStackConfig.defaults()
                .withCache(CacheConfig.of(Duration.ofMinutes(1), 100))
                .withCircuitBreaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(30)))
                .withRetry(RetryConfig.fixed(3, Duration.ZERO))
                .withOrder(LayerType.CACHE, LayerType.CIRCUIT_BREAKER, LayerType.RETRY);
        ScriptedInvoker invoker = new ScriptedInvoker().otherwiseFail(new IOException("down"));
        PolicyStack stack = compose(config, invoker);

        // When: first call exhausts retries, then the breaker records one failure
        assertFailsWith(ErrorKind.TRANSIENT, stack, request("ledger", "k"));

        // Then
        assertEquals(3, invoker.invocationCount(), "All retries run inside a single breaker admission");
        assertTrue(events.events().contains("state:ledger:CLOSED->OPEN"));

        // Second call for the same key: cache miss, then breaker rejects
        assertFailsWith(ErrorKind.CIRCUIT_OPEN, stack, request("ledger", "k"));
        assertEquals(3, invoker.invocationCount());
        assertEquals(2, events.count("cache-miss:ledger|k"));
        assertEquals(0, events.count("cache-hit:"));
    }

    @Test
    void testOrder_RetryOutsideBreaker_BreakerOpensOnFirstAttempt() {
        // Given: [retry, breaker], threshold 1
        PolicyStackConfig config = PolicyStackConfig.defaults()
                .withCircuitBreaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(30)))
                .withRetry(RetryConfig.fixed(3, Duration.ZERO))
                .withOrder(LayerType.RETRY, LayerType.CIRCUIT_BREAKER);
        ScriptedInvoker invoker = new ScriptedInvoker().otherwiseFail(new IOException("down"));
        PolicyStack stack = compose(config, invoker);

        // When: second attempt hits the open breaker, which is not retryable
        assertFailsWith(ErrorKind.CIRCUIT_OPEN, stack, request("ledger", "k"));

        // Then
        assertEquals(1, invoker.invocationCount());
        assertEquals(1, sleeper.sleepCount());
    }

    @Test
    void testOrder_CacheOutermost_HitSkipsRateLimit() {
        // Given
        PolicyStackConfig config = PolicyStackConfig.defaults()
                .withCache(CacheConfig.of(Duration.ofMinutes(1), 100))
                .withRateLimit(RateLimiterConfig.of(1, Duration.ofMinutes(1)))
                .withOrder(LayerType.CACHE, LayerType.RATE_LIMIT);
        ScriptedInvoker invoker = new ScriptedInvoker();
        PolicyStack stack = compose(config, invoker);

        // When
        body(stack, request("ledger", "k"));
        String second = body(stack, request("ledger", "k"));

        // Then: cached hit never consumed a permit
        assertEquals("ok", second);
        assertFailsWith(ErrorKind.RATE_LIMITED, stack, request("ledger", "other"));
    }

    @Test
    void testOrder_DefaultOrder_AppliedWhenUnspecified() {
        // When
        PolicyStack stack = compose(allEnabled(), new ScriptedInvoker());

        // Then
        assertEquals(List.of(LayerType.RATE_LIMIT, LayerType.CIRCUIT_BREAKER, LayerType.RETRY, LayerType.CACHE),
                stack.layers());
    }

    @Test
    void testOrder_DuplicateLayer_RejectedAtConstruction() {
        // When & Then
        assertThrows(ConfigurationException.class,
                () -> allEnabled().withOrder(LayerType.RETRY, LayerType.CACHE, LayerType.RETRY));
    }

    @Test
    void testOrder_DisabledLayerInOrder_RejectedAtCompose() {
        // Given
        PolicyStackConfig config = PolicyStackConfig.defaults()
                .withRetry(RetryConfig.fixed(2, Duration.ZERO))
                .withOrder(LayerType.CACHE, LayerType.RETRY);
        ScriptedInvoker invoker = new ScriptedInvoker();

        // When & Then
        assertThrows(ConfigurationException.class, () -> compose(config, invoker));
        assertEquals(0, invoker.invocationCount());
    }

    @Test
    void testOrder_EnabledLayerMissingFromOrder_RejectedAtCompose() {
        // Given
        PolicyStackConfig config = allEnabled().withOrder(LayerType.RETRY, LayerType.CACHE);

        // When & Then
        assertThrows(ConfigurationException.class, () -> compose(config, new ScriptedInvoker()));
    }

    @Test
    void testOrder_NoLayers_InvokesDirectly() {
        // Given
        ScriptedInvoker invoker = new ScriptedInvoker().thenRespond("direct");
        PolicyStack stack = compose(PolicyStackConfig.defaults(), invoker);

        // When & Then
        assertTrue(stack.layers().isEmpty());
        assertEquals("direct", body(stack, request("ledger", "k")));
    }
}
