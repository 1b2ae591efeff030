package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * <p>record를 사용하여 불변성을 보장합니다.</p>
 *
 * @param enabled 계층 활성화 여부
 * @param maxRequests 윈도우당 허용 요청 수 (예: 100)
 * @param window 슬라이딩 윈도우 길이 (양수)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimiterConfig(boolean enabled, int maxRequests, Duration window) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException if maxRequests is not positive
     * @throws ConfigurationException if window is null or not positive
     */
    public RateLimiterConfig {
        if (maxRequests <= 0) {
            throw new ConfigurationException("maxRequests must be positive (current: " + maxRequests + ")");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new ConfigurationException("window must be positive (current: " + window + ")");
        }
    }

    /**
     * 비활성 설정 (maxRequests=100, window=1s).
     *
     * @return 비활성 RateLimiterConfig
     */
    public static RateLimiterConfig disabled() {
        return new RateLimiterConfig(false, 100, Duration.ofSeconds(1));
    }

    /**
     * 활성 설정 생성.
     *
     * @param maxRequests 윈도우당 허용 요청 수
     * @param window 윈도우 길이
     * @return 활성 RateLimiterConfig
     */
    public static RateLimiterConfig of(int maxRequests, Duration window) {
        return new RateLimiterConfig(true, maxRequests, window);
    }

    public RateLimiterConfig withEnabled(boolean enabled) {
        return new RateLimiterConfig(enabled, maxRequests, window);
    }

    public RateLimiterConfig withMaxRequests(int maxRequests) {
        return new RateLimiterConfig(enabled, maxRequests, window);
    }

    public RateLimiterConfig withWindow(Duration window) {
        return new RateLimiterConfig(enabled, maxRequests, window);
    }
}
