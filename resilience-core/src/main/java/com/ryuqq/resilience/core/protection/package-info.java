/**
 * Protection SPI 패키지.
 *
 * <p>Invoker 호출 주변에 적용되는 보호 메커니즘의 확장점과 설정을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.protection.ResponseCache}: 성공 응답 캐시 (TTL, 최대 항목 수)</li>
 *   <li>{@link com.ryuqq.resilience.core.protection.RateLimiter}: Target별 슬라이딩 윈도우 호출 제한</li>
 *   <li>{@link com.ryuqq.resilience.core.protection.CircuitBreaker}: Target별 상태 기계 (CLOSED/OPEN/HALF_OPEN)</li>
 * </ul>
 *
 * <h2>상태 소유권</h2>
 *
 * <p>캐시 항목, Rate 윈도우, Breaker 상태는 각 구현 인스턴스가 독점 소유합니다.
 * 호출자는 불변 값({@link com.ryuqq.resilience.core.model.Response},
 * {@link com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot})만 받습니다.</p>
 *
 * <h2>설정</h2>
 *
 * <p>모든 설정은 record이며 compact constructor에서 검증합니다. 잘못된 값은
 * {@link com.ryuqq.resilience.core.error.ConfigurationException}을 발생시킵니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.spi.ProtectionProvider
 */
package com.ryuqq.resilience.core.protection;
