package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.Target;

/**
 * Circuit Breaker가 허용한 단일 호출의 허가증 (불변).
 *
 * <p>{@link CircuitBreaker#tryAcquire(Target)}가 발급하고, 호출이 끝나면 결과 기록 메서드에
 * 그대로 돌려줍니다. Breaker는 {@code generation}으로 결과가 현재 상태 구간에서 허용된 호출의 것인지
 * 판별합니다. 이전 구간에서 허용된 호출의 늦은 결과는 무시됩니다.</p>
 *
 * @param target 호출 대상
 * @param generation 허용 시점의 상태 구간 번호
 * @param probe HALF_OPEN Probe 여부
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerPermit(Target target, long generation, boolean probe) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException target이 null인 경우
     */
    public CircuitBreakerPermit {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }
}
