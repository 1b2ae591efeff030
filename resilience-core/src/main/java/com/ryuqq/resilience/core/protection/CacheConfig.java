package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.time.Duration;

/**
 * 응답 캐시 설정.
 *
 * @param enabled 계층 활성화 여부
 * @param ttl 항목 보관 시간 (양수)
 * @param maxEntries 최대 항목 수 (0이면 제한 없음)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CacheConfig(boolean enabled, Duration ttl, int maxEntries) {

    /**
     * 제한 없음을 나타내는 maxEntries 값.
     */
    public static final int UNBOUNDED = 0;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException if ttl is null or not positive
     * @throws ConfigurationException if maxEntries is negative
     */
    public CacheConfig {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ConfigurationException("ttl must be positive (current: " + ttl + ")");
        }
        if (maxEntries < 0) {
            throw new ConfigurationException("maxEntries must be non-negative (current: " + maxEntries + ")");
        }
    }

    /**
     * 비활성 설정 (ttl=30s, maxEntries=10000).
     *
     * @return 비활성 CacheConfig
     */
    public static CacheConfig disabled() {
        return new CacheConfig(false, Duration.ofSeconds(30), 10_000);
    }

    /**
     * 활성 설정 생성.
     *
     * @param ttl 보관 시간
     * @param maxEntries 최대 항목 수 (0이면 제한 없음)
     * @return 활성 CacheConfig
     */
    public static CacheConfig of(Duration ttl, int maxEntries) {
        return new CacheConfig(true, ttl, maxEntries);
    }

    /**
     * 항목 수 제한이 있는지 확인.
     *
     * @return maxEntries &gt; 0이면 true
     */
    public boolean isBounded() {
        return maxEntries > UNBOUNDED;
    }

    public CacheConfig withEnabled(boolean enabled) {
        return new CacheConfig(enabled, ttl, maxEntries);
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(enabled, ttl, maxEntries);
    }

    public CacheConfig withMaxEntries(int maxEntries) {
        return new CacheConfig(enabled, ttl, maxEntries);
    }
}
