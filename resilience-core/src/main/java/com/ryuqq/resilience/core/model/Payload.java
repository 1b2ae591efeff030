package com.ryuqq.resilience.core.model;

/**
 * Request/Response에 실리는 업무 데이터의 직렬화된 형태.
 *
 * <p>직렬화 형식(JSON, XML 등)은 Invoker를 구현하는 쪽이 선택합니다.
 * 이 라이브러리는 Payload의 내용을 해석하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload("");

    private final String value;

    private Payload(String value) {
        this.value = value == null ? "" : value;
    }

    /**
     * Payload 생성.
     *
     * @param value Payload 값 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(String value) {
        return new Payload(value);
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * Payload 값 조회.
     *
     * @return Payload 값 (null 아님)
     */
    public String getValue() {
        return value;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value.length() + " chars}";
    }
}
