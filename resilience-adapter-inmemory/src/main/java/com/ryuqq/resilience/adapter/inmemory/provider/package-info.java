/**
 * In-Memory {@link com.ryuqq.resilience.core.spi.ProtectionProvider} Adapter.
 *
 * <p>설정으로부터 In-Memory Breaker, Rate Limiter, 캐시를 생성합니다.
 * 단일 프로세스 배포와 계약 테스트에 적합합니다.</p>
 *
 * @see com.ryuqq.resilience.core.spi.ProtectionProvider
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.provider;
