package com.ryuqq.resilience.application.layer;

import com.ryuqq.resilience.core.error.RateLimitExceededException;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate Limit 계층.
 *
 * <p>Target 윈도우가 가득 차 있으면 안쪽 계층을 호출하지 않고
 * {@link RateLimitExceededException}으로 즉시 실패합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RateLimitLayer implements CallLayer {

    private static final Logger log = LoggerFactory.getLogger(RateLimitLayer.class);

    private final RateLimiter limiter;
    private final PolicyEventListener listener;
    private final CallLayer next;

    public RateLimitLayer(RateLimiter limiter, PolicyEventListener listener, CallLayer next) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        this.limiter = limiter;
        this.listener = listener;
        this.next = next;
    }

    @Override
    public Response call(Request request) {
        if (!limiter.tryAcquire(request.target())) {
            RateLimiterConfig config = limiter.getConfig();
            log.warn("Rate limit exceeded for {} ({} per {}ms)",
                request.target(), config.maxRequests(), config.window().toMillis());
            listener.onRateLimited(request.target());
            throw new RateLimitExceededException(request.target(), config.maxRequests(), config.window());
        }
        return next.call(request);
    }
}
