package com.ryuqq.resilience.core.model;

/**
 * 호출 대상(다운스트림 엔드포인트)의 식별자.
 *
 * <p>Circuit Breaker와 Rate Limiter는 Target 단위로 상태를 독립적으로 추적합니다.
 * 서로 다른 Target의 트래픽은 같은 잠금을 공유하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Target {

    private final String value;

    private Target(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Target cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("Target length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException(
                "Target contains invalid characters. Only alphanumeric, hyphen, underscore, dot and colon are allowed"
            );
        }
        this.value = value;
    }

    /**
     * Target 생성.
     *
     * @param value Target 값 (예: "payment-api", "billing.internal:8443")
     * @return Target 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Target of(String value) {
        return new Target(value);
    }

    /**
     * Target 값 조회.
     *
     * @return Target 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Target target = (Target) o;
        return value.equals(target.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Target{" + value + '}';
    }
}
