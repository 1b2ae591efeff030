/**
 * In-Memory 응답 캐시 Adapter.
 *
 * <p>{@link com.ryuqq.resilience.adapter.inmemory.cache.InMemoryResponseCache}는
 * {@code {value, expiresAt}} 엔트리를 단일 락 뒤에 보관하며, 조회 시 만료를 확인하고
 * 용량 초과 시 만료 시각이 가장 이른 엔트리부터 제거합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.cache;
