package com.ryuqq.resilience.core.model;

/**
 * 응답 캐시 조회에 사용되는 결정적(deterministic) 키.
 *
 * <p>같은 의미의 요청은 항상 같은 CacheKey를 만들어야 합니다.
 * 키 구성 방식(예: {@code GET:/users/42})은 Request를 만드는 쪽이 결정합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CacheKey {

    private final String value;

    private CacheKey(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("CacheKey cannot be null or empty");
        }
        this.value = value;
    }

    /**
     * CacheKey 생성.
     *
     * @param value 키 값
     * @return CacheKey 인스턴스
     * @throws IllegalArgumentException value가 null이거나 빈 문자열인 경우
     */
    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    /**
     * Target과 세부 키를 결합하여 CacheKey 생성.
     *
     * <p>결과 형식: {@code target-value + "|" + key}</p>
     *
     * @param target 호출 대상
     * @param key 대상 내 세부 키
     * @return CacheKey 인스턴스
     * @throws IllegalArgumentException target이 null이거나 key가 비어있는 경우
     */
    public static CacheKey of(Target target, String key) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
        return new CacheKey(target.getValue() + "|" + key);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey{" + value + '}';
    }
}
