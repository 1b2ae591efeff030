package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.Target;

import java.time.Duration;

/**
 * Rate Limiter가 진입을 거부한 경우.
 *
 * <p>내부적으로 재시도되지 않으며 호출자에게 즉시 전달됩니다.
 * 외부에서 백오프할지는 호출자가 결정합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RateLimitExceededException extends CallException {

    private final int maxRequests;
    private final Duration window;

    public RateLimitExceededException(Target target, int maxRequests, Duration window) {
        super(target, String.format("Rate limit exceeded for %s: %d requests per %dms",
            target, maxRequests, window.toMillis()), null);
        this.maxRequests = maxRequests;
        this.window = window;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMITED;
    }
}
