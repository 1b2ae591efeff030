package com.ryuqq.resilience.core.model;

import java.util.Map;

/**
 * 성공한 호출의 응답.
 *
 * <p>캐시에 저장된 Response가 여러 호출자에게 그대로 반환되므로
 * attributes는 생성 시 불변 복사본으로 고정됩니다.</p>
 *
 * @param body 응답 본문
 * @param attributes 응답 메타데이터 (예: 상태 코드, 헤더). 불변
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Response(
    Payload body,
    Map<String, String> attributes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException body가 null인 경우
     */
    public Response {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 본문만 있는 Response 생성.
     *
     * @param body 응답 본문 문자열
     * @return Response 인스턴스
     */
    public static Response of(String body) {
        return new Response(Payload.of(body), Map.of());
    }

    /**
     * 메타데이터 조회.
     *
     * @param name 속성 이름
     * @return 속성 값 (없으면 null)
     */
    public String attribute(String name) {
        return attributes.get(name);
    }
}
