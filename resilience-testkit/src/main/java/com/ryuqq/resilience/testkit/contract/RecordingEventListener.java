package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.error.CallException;
import com.ryuqq.resilience.core.model.CacheKey;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.spi.PolicyEventListener;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PolicyEventListener that records every event as a readable line.
 *
 * <p>Events look like {@code "cache-hit:orders|42"} or {@code "state:payments:CLOSED->OPEN"},
 * which keeps assertions on event order short.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RecordingEventListener implements PolicyEventListener {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void onCacheHit(CacheKey key) {
        events.add("cache-hit:" + key.getValue());
    }

    @Override
    public void onCacheMiss(CacheKey key) {
        events.add("cache-miss:" + key.getValue());
    }

    @Override
    public void onRateLimited(Target target) {
        events.add("rate-limited:" + target.getValue());
    }

    @Override
    public void onCircuitStateChanged(Target target, CircuitBreakerState from, CircuitBreakerState to) {
        events.add("state:" + target.getValue() + ":" + from + "->" + to);
    }

    @Override
    public void onCallRejected(Target target, CircuitBreakerState state) {
        events.add("rejected:" + target.getValue() + ":" + state);
    }

    @Override
    public void onRetry(Target target, int failedAttempt, Duration delay, CallException failure) {
        events.add("retry:" + target.getValue() + ":" + failedAttempt + ":" + delay.toMillis() + "ms");
    }

    @Override
    public void onRetriesExhausted(Target target, int attempts, CallException lastFailure) {
        events.add("exhausted:" + target.getValue() + ":" + attempts);
    }

    @Override
    public void onAttemptTimeout(Target target, Duration timeout) {
        events.add("timeout:" + target.getValue() + ":" + timeout.toMillis() + "ms");
    }

    public List<String> events() {
        return List.copyOf(events);
    }

    public long count(String prefix) {
        return events.stream().filter(event -> event.startsWith(prefix)).count();
    }

    public void clear() {
        events.clear();
    }
}
