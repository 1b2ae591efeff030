package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 슬라이딩 윈도우 로그 방식의 {@link RateLimiter} 구현체.
 *
 * <p>Target마다 허용된 호출 시각(epoch millis)을 순서대로 담은 deque를 가집니다.
 * 허용 판단마다 {@code now - window}보다 오래된 시각을 정리한 뒤 {@code maxRequests}와
 * 비교합니다. 정리, 판단, 추가는 Target 자신의 모니터 안에서 수행되므로 경쟁 상황에서도
 * 윈도우가 이중으로 증가하지 않습니다.</p>
 *
 * <p><strong>불변식:</strong> 판단 직후 윈도우의 모든 시각은
 * {@code [now - window, now]} 범위에 있습니다.</p>
 *
 * <p><strong>메모리:</strong> Target당 최대 {@code maxRequests}개의 시각.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final RateLimiterConfig config;
    private final Clock clock;
    private final long windowMs;
    private final ConcurrentHashMap<Target, RateWindow> windows;

    /**
     * 생성자.
     *
     * @param config Rate Limiter 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SlidingWindowRateLimiter(RateLimiterConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.windowMs = config.window().toMillis();
        this.windows = new ConcurrentHashMap<>();
    }

    @Override
    public boolean tryAcquire(Target target) {
        RateWindow window = windowOf(target);

        synchronized (window) {
            // 시각이 순서대로 쌓이도록 모니터 안에서 읽음
            long now = clock.millis();
            window.prune(now - windowMs);
            if (window.timestamps.size() >= config.maxRequests()) {
                log.debug("Rate window full for {}: {} calls in {}ms", target, window.timestamps.size(), windowMs);
                return false;
            }
            window.timestamps.addLast(now);
            return true;
        }
    }

    @Override
    public int availablePermits(Target target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        RateWindow window = windows.get(target);
        if (window == null) {
            return config.maxRequests();
        }
        synchronized (window) {
            window.prune(clock.millis() - windowMs);
            return config.maxRequests() - window.timestamps.size();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    private RateWindow windowOf(Target target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return windows.computeIfAbsent(target, t -> new RateWindow());
    }

    /**
     * Target별 허용 시각 (오래된 순). 자신의 모니터로 보호됩니다.
     */
    private static final class RateWindow {

        private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

        private void prune(long boundary) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() < boundary) {
                timestamps.pollFirst();
            }
        }
    }
}
