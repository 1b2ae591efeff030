/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>라이브러리 외부에서 구현하거나 교체할 수 있는 확장점을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.spi.Invoker}: 실제 원격 호출 (필수)</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.FailureClassifier}: 예외 → 실패 종류 분류</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.ProtectionProvider}: 보호 계층 구현체 생성</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.PolicyEventListener}: 메트릭/트레이싱 연동</li>
 *   <li>{@link com.ryuqq.resilience.core.spi.Sleeper}: 재시도 대기</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
