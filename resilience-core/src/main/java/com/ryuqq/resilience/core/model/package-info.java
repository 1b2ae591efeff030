/**
 * 호출 요청/응답 도메인 모델.
 *
 * <p>모든 모델은 불변이며, 정적 팩토리({@code of}) 또는 record compact constructor에서
 * 유효성을 검증합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.model.Target}: Breaker/Limiter 상태 단위</li>
 *   <li>{@link com.ryuqq.resilience.core.model.CacheKey}: 응답 캐시 키</li>
 *   <li>{@link com.ryuqq.resilience.core.model.Request}: 호출 요청</li>
 *   <li>{@link com.ryuqq.resilience.core.model.Response}: 성공 응답</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
