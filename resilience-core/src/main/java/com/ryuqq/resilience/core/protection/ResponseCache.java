package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.CacheKey;
import com.ryuqq.resilience.core.model.Response;

import java.time.Duration;
import java.util.Optional;

/**
 * 응답 캐시 SPI.
 *
 * <p>성공한 응답을 CacheKey 단위로 일정 시간(TTL) 동안 보관합니다.
 * 만료는 조회 시점에 지연(lazy) 판단합니다.</p>
 *
 * <p><strong>주의:</strong> 변경을 일으키는(non-idempotent) 호출에 캐시를 적용하면 안 됩니다.
 * 이는 설정 계약이며 캐시가 강제하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResponseCache {

    /**
     * 만료되지 않은 응답 조회.
     *
     * <p>만료된 항목을 발견하면 제거하고 빈 값을 반환합니다.</p>
     *
     * @param key 캐시 키
     * @return 캐시된 응답 (없거나 만료되었으면 empty)
     */
    Optional<Response> get(CacheKey key);

    /**
     * 응답 저장 ({@code expiresAt = now + ttl}). 기존 항목은 덮어씁니다.
     *
     * <p>maxEntries를 초과하면 만료된 항목, 그 다음 만료 시각이 가장 이른 항목 순으로 제거합니다.</p>
     *
     * @param key 캐시 키
     * @param response 성공 응답
     * @param ttl 보관 시간 (양수)
     */
    void put(CacheKey key, Response response, Duration ttl);

    /**
     * 명시적 제거.
     *
     * @param key 캐시 키
     * @return 제거된 항목이 있으면 true
     */
    boolean evict(CacheKey key);

    void clear();

    /**
     * 현재 보관 중인 항목 수 (만료되었지만 아직 제거되지 않은 항목 포함).
     *
     * @return 항목 수
     */
    int size();

    CacheConfig getConfig();
}
