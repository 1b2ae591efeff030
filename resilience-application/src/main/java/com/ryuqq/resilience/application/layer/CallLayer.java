package com.ryuqq.resilience.application.layer;

import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;

/**
 * Policy Stack을 구성하는 단일 호출 계층.
 *
 * <p>모든 계층(Cache, RateLimit, CircuitBreaker, Retry, Invoker)은 같은 시그니처를 구현하고
 * 다음 계층에 대한 참조를 가집니다. 상속이 아닌 조합으로 체인을 만듭니다.</p>
 *
 * <p><strong>실패 계약:</strong> 실패는 항상 {@link com.ryuqq.resilience.core.error.CallException}의
 * 하위 타입으로 전달됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CallLayer {

    /**
     * 호출 실행.
     *
     * @param request 호출 요청
     * @return 성공 응답
     * @throws com.ryuqq.resilience.core.error.CallException 호출 실패 시
     */
    Response call(Request request);
}
