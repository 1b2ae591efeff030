package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;

/**
 * 실제 원격 호출을 수행하는 외부 협력자 SPI.
 *
 * <p>Policy Stack의 가장 안쪽에 위치하며, 이 라이브러리는 Invoker 내부를 알지 못합니다.
 * 네트워크 I/O, 직렬화, 인증은 모두 Invoker 구현의 책임입니다.</p>
 *
 * <p><strong>실패 계약:</strong></p>
 * <ul>
 *   <li>재시도 가능한 실패: {@link com.ryuqq.resilience.core.error.TransientCallException}</li>
 *   <li>재시도 불가 실패: {@link com.ryuqq.resilience.core.error.PermanentCallException}</li>
 *   <li>그 외 예외는 경계에서 {@link FailureClassifier}가 분류합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invoker invoker = request -> {
 *     HttpResponse<String> http = client.send(toHttp(request), BodyHandlers.ofString());
 *     if (http.statusCode() >= 500) {
 *         throw new TransientCallException(request.target(), "HTTP " + http.statusCode());
 *     }
 *     if (http.statusCode() >= 400) {
 *         throw new PermanentCallException(request.target(), "HTTP " + http.statusCode());
 *     }
 *     return Response.of(http.body());
 * };
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Invoker {

    /**
     * 원격 호출 실행.
     *
     * @param request 호출 요청
     * @return 응답 (null 불가)
     * @throws Exception 호출 실패 시
     */
    Response invoke(Request request) throws Exception;
}
