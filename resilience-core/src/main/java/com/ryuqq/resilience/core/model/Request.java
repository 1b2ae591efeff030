package com.ryuqq.resilience.core.model;

/**
 * Policy Stack을 통과하는 호출 요청.
 *
 * <p>Request는 생성 후 변경되지 않으며, 다음 두 가지 키를 제공합니다:</p>
 * <ul>
 *   <li>{@link #target()}: 어떤 Circuit Breaker / Rate Limiter 상태를 적용할지 결정</li>
 *   <li>{@link #cacheKey()}: 응답 캐시 조회 키</li>
 * </ul>
 *
 * @param target 호출 대상
 * @param cacheKey 캐시 키
 * @param payload 요청 본문 (Invoker만 해석)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Request(
    Target target,
    CacheKey cacheKey,
    Payload payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException target 또는 cacheKey가 null인 경우
     */
    public Request {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (cacheKey == null) {
            throw new IllegalArgumentException("cacheKey cannot be null");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * Target 내 세부 키로 Request 생성.
     *
     * <p>CacheKey는 {@link CacheKey#of(Target, String)}로 만들어집니다.</p>
     *
     * @param target 호출 대상
     * @param key 대상 내 세부 키 (예: "GET /users/42")
     * @param payload 요청 본문
     * @return Request 인스턴스
     */
    public static Request of(Target target, String key, Payload payload) {
        return new Request(target, CacheKey.of(target, key), payload);
    }

    /**
     * 본문 없는 Request 생성.
     *
     * @param target 호출 대상
     * @param key 대상 내 세부 키
     * @return Request 인스턴스
     */
    public static Request of(Target target, String key) {
        return of(target, key, Payload.empty());
    }
}
