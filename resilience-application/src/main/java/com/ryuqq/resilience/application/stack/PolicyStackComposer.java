package com.ryuqq.resilience.application.stack;

import com.ryuqq.resilience.application.config.PolicyStackConfig;
import com.ryuqq.resilience.application.layer.CacheLayer;
import com.ryuqq.resilience.application.layer.CallLayer;
import com.ryuqq.resilience.application.layer.CircuitBreakerLayer;
import com.ryuqq.resilience.application.layer.InvokerLayer;
import com.ryuqq.resilience.application.layer.RateLimitLayer;
import com.ryuqq.resilience.application.layer.RetryLayer;
import com.ryuqq.resilience.core.spi.FailureClassifier;
import com.ryuqq.resilience.core.spi.Invoker;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import com.ryuqq.resilience.core.spi.ProtectionProvider;
import com.ryuqq.resilience.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Policy Stack 조립기.
 *
 * <p>설정에 지정된 순서 그대로 계층을 감싸며, 순서를 강제하지 않습니다.
 * 순서는 의미를 가집니다:</p>
 * <ul>
 *   <li>CACHE가 가장 바깥: 캐시 Hit은 Rate Limit / Breaker 검사를 모두 건너뜀</li>
 *   <li>RETRY가 Breaker 안쪽: 하나의 논리 호출의 재시도 전체가 Breaker에는 한 번의 결과</li>
 *   <li>RETRY가 Breaker 바깥: 매 시도가 Breaker 검사를 받고 각각 실패로 기록됨</li>
 * </ul>
 *
 * <p><strong>조립 흐름:</strong></p>
 * <ol>
 *   <li>{@link PolicyStackConfig#resolveOrder()}로 순서 검증 (중복/모순 시 ConfigurationException)</li>
 *   <li>가장 안쪽 {@link InvokerLayer} 생성</li>
 *   <li>순서의 역순으로 계층을 감쌈</li>
 * </ol>
 *
 * <p>조립 중 실패하면 생성한 자원을 해제하고 예외를 전달합니다. 부분 스택은 반환되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PolicyStackComposer {

    private static final Logger log = LoggerFactory.getLogger(PolicyStackComposer.class);
    private static final AtomicInteger EXECUTOR_SEQUENCE = new AtomicInteger();

    private final ProtectionProvider provider;
    private final PolicyEventListener listener;
    private final Sleeper sleeper;
    private final FailureClassifier classifier;

    /**
     * 기본 Listener(no-op), Sleeper(Thread.sleep), FailureClassifier(standard)로 생성.
     *
     * @param provider 보호 계층 구현체 생성 SPI
     */
    public PolicyStackComposer(ProtectionProvider provider) {
        this(provider, PolicyEventListener.NO_OP, Sleeper.threadSleep(), FailureClassifier.standard());
    }

    /**
     * 생성자.
     *
     * @param provider 보호 계층 구현체 생성 SPI
     * @param listener 이벤트 수신자
     * @param sleeper 재시도 대기 수단
     * @param classifier Invoker 실패 분류기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PolicyStackComposer(ProtectionProvider provider, PolicyEventListener listener,
                               Sleeper sleeper, FailureClassifier classifier) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        this.provider = provider;
        this.listener = listener;
        this.sleeper = sleeper;
        this.classifier = classifier;
    }

    public PolicyStackComposer withListener(PolicyEventListener listener) {
        return new PolicyStackComposer(provider, listener, sleeper, classifier);
    }

    public PolicyStackComposer withSleeper(Sleeper sleeper) {
        return new PolicyStackComposer(provider, listener, sleeper, classifier);
    }

    public PolicyStackComposer withClassifier(FailureClassifier classifier) {
        return new PolicyStackComposer(provider, listener, sleeper, classifier);
    }

    /**
     * Policy Stack 조립.
     *
     * @param config 스택 설정
     * @param invoker 가장 안쪽 Invoker
     * @return 조립된 PolicyStack
     * @throws IllegalArgumentException config 또는 invoker가 null인 경우
     * @throws com.ryuqq.resilience.core.error.ConfigurationException 순서가 중복되거나 모순된 경우
     */
    public PolicyStack compose(PolicyStackConfig config, Invoker invoker) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }

        List<LayerType> order = config.resolveOrder();
        ExecutorService attemptExecutor = config.attemptTimeout() == null ? null : newAttemptExecutor();

        try {
            CallLayer head = new InvokerLayer(invoker, classifier, listener, config.attemptTimeout(), attemptExecutor);
            for (int i = order.size() - 1; i >= 0; i--) {
                head = wrap(order.get(i), config, head);
            }

            log.info("Policy stack composed: {} → invoker (attemptTimeout: {})",
                order, config.attemptTimeout() == null ? "none" : config.attemptTimeout().toMillis() + "ms");
            return new DefaultPolicyStack(head, order, attemptExecutor);
        } catch (RuntimeException e) {
            if (attemptExecutor != null) {
                attemptExecutor.shutdownNow();
            }
            throw e;
        }
    }

    private CallLayer wrap(LayerType type, PolicyStackConfig config, CallLayer next) {
        return switch (type) {
            case CACHE -> new CacheLayer(
                provider.createCache(config.cache()), config.cache().ttl(), listener, next);
            case RATE_LIMIT -> new RateLimitLayer(
                provider.createRateLimiter(config.rateLimit()), listener, next);
            case CIRCUIT_BREAKER -> new CircuitBreakerLayer(
                provider.createCircuitBreaker(config.circuitBreaker(), listener), listener, next);
            case RETRY -> new RetryLayer(
                config.retry().toPolicy(), config.retry().maxAttempts(), sleeper, listener, next);
        };
    }

    private static ExecutorService newAttemptExecutor() {
        int sequence = EXECUTOR_SEQUENCE.incrementAndGet();
        AtomicInteger threadCount = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "resilience-attempt-" + sequence + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}
