package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.error.CallException;
import com.ryuqq.resilience.core.error.StandardFailureClassifier;
import com.ryuqq.resilience.core.model.Target;

/**
 * Invoker 경계에서 임의의 예외를 {@link CallException}으로 분류하는 SPI.
 *
 * <p>Retry와 Circuit Breaker는 이 분류가 정확하다는 가정하에 동작합니다.
 * 전송 계층의 오류 코드 규칙이 기본 분류와 다르다면 직접 구현하십시오.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * 예외 분류.
     *
     * @param target 호출 대상
     * @param failure Invoker가 던진 예외 (null 아님)
     * @return 분류된 CallException (원본은 cause로 보존)
     */
    CallException classify(Target target, Throwable failure);

    /**
     * 기본 분류기.
     *
     * @return {@link StandardFailureClassifier} 인스턴스
     */
    static FailureClassifier standard() {
        return new StandardFailureClassifier();
    }
}
