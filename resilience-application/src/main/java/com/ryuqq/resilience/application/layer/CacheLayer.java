package com.ryuqq.resilience.application.layer;

import com.ryuqq.resilience.core.model.CacheKey;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.protection.ResponseCache;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 응답 캐시 계층.
 *
 * <ul>
 *   <li>Hit: 캐시된 응답 즉시 반환. 안쪽 계층은 전혀 호출되지 않음</li>
 *   <li>Miss/만료: 안쪽 계층에 위임, 성공한 경우에만 {@code now + ttl}로 저장</li>
 *   <li>실패는 캐시하지 않음 (예외는 그대로 전달)</li>
 * </ul>
 *
 * <p>변경을 일으키는 호출에 적용하면 안 됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CacheLayer implements CallLayer {

    private static final Logger log = LoggerFactory.getLogger(CacheLayer.class);

    private final ResponseCache cache;
    private final Duration ttl;
    private final PolicyEventListener listener;
    private final CallLayer next;

    /**
     * 생성자.
     *
     * @param cache 응답 캐시
     * @param ttl 저장 시 보관 시간
     * @param listener 이벤트 수신자
     * @param next 안쪽 계층
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CacheLayer(ResponseCache cache, Duration ttl, PolicyEventListener listener, CallLayer next) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (ttl == null) {
            throw new IllegalArgumentException("ttl cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        this.cache = cache;
        this.ttl = ttl;
        this.listener = listener;
        this.next = next;
    }

    @Override
    public Response call(Request request) {
        CacheKey key = request.cacheKey();

        Optional<Response> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            listener.onCacheHit(key);
            return cached.get();
        }

        log.debug("Cache miss: {}", key);
        listener.onCacheMiss(key);

        Response response = next.call(request);
        cache.put(key, response, ttl);
        return response;
    }
}
