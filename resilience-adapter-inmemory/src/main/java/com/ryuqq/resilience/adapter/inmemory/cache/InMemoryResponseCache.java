package com.ryuqq.resilience.adapter.inmemory.cache;

import com.ryuqq.resilience.core.model.CacheKey;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ResponseCache} SPI의 In-Memory 구현체.
 *
 * <p>구조 전체를 보호하는 단일 락 안에서 조회와 갱신을 하나의 원자적 단위로 수행합니다.
 * {@link #get(CacheKey)}는 만료 확인과 제거를, {@link #put(CacheKey, Response, Duration)}는
 * 삽입과 제거를 락 안에서 처리합니다.</p>
 *
 * <p><strong>제거 정책:</strong></p>
 * <ul>
 *   <li>Lazy: 만료된 엔트리는 조회될 때 제거</li>
 *   <li>용량 제한: {@code maxEntries}를 넘으면 만료된 엔트리를 먼저 정리하고,
 *       그래도 넘치면 {@code expiresAt}이 가장 이른 엔트리부터 제거</li>
 * </ul>
 *
 * <p><strong>제약 사항:</strong></p>
 * <ul>
 *   <li>용량 초과 시 전체 엔트리를 순회 (O(N))</li>
 *   <li>프로세스 재시작 시 데이터 유실</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class InMemoryResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResponseCache.class);

    private final CacheConfig config;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<CacheKey, CacheEntry> entries;

    /**
     * 생성자.
     *
     * @param config 캐시 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InMemoryResponseCache(CacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.entries = new HashMap<>();
    }

    @Override
    public Optional<Response> get(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Instant now = clock.instant();

        synchronized (lock) {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                log.debug("Cache entry expired: {}", key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        }
    }

    @Override
    public void put(CacheKey key, Response response, Duration ttl) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        Instant now = clock.instant();

        synchronized (lock) {
            entries.put(key, new CacheEntry(response, now.plus(ttl)));
            if (config.isBounded() && entries.size() > config.maxEntries()) {
                evictOverflow(now);
            }
        }
    }

    @Override
    public boolean evict(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        synchronized (lock) {
            return entries.remove(key) != null;
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    @Override
    public CacheConfig getConfig() {
        return config;
    }

    // 호출자가 lock 보유
    private void evictOverflow(Instant now) {
        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(now)) {
                iterator.remove();
            }
        }

        while (entries.size() > config.maxEntries()) {
            CacheKey oldest = entries.entrySet().stream()
                .min(Comparator.comparing(entry -> entry.getValue().expiresAt()))
                .map(Map.Entry::getKey)
                .orElseThrow();
            entries.remove(oldest);
            log.debug("Cache full ({} entries), evicted {}", config.maxEntries(), oldest);
        }
    }

    private record CacheEntry(Response value, Instant expiresAt) {

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
