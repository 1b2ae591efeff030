/**
 * 호출 계층 패키지.
 *
 * <p>각 계층은 {@link com.ryuqq.resilience.application.layer.CallLayer}를 구현하고
 * 다음 계층을 감쌉니다. 계층 자체는 호출별 가변 상태를 가지지 않으며,
 * 모든 가변 상태는 주입된 Protection 구현체가 소유합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.layer.CacheLayer}: 유일하게 Invoker 전에 단락(short-circuit) 가능</li>
 *   <li>{@link com.ryuqq.resilience.application.layer.RateLimitLayer}: 진입 제한</li>
 *   <li>{@link com.ryuqq.resilience.application.layer.CircuitBreakerLayer}: 진입 제한 + 결과 관찰</li>
 *   <li>{@link com.ryuqq.resilience.application.layer.RetryLayer}: 일시적 실패 재시도</li>
 *   <li>{@link com.ryuqq.resilience.application.layer.InvokerLayer}: Invoker 호출, 타임아웃, 실패 분류</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.layer;
