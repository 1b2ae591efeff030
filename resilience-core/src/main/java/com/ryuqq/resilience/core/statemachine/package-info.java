/**
 * Circuit Breaker 상태 기계 규칙.
 *
 * <p>상태 정의는 {@link com.ryuqq.resilience.core.protection.CircuitBreakerState},
 * 허용된 전이는 {@link com.ryuqq.resilience.core.statemachine.BreakerTransition}이 담당합니다.
 * 구현체는 전이 전에 반드시 검증을 거쳐야 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.statemachine;
