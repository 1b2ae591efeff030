/**
 * In-Memory Circuit Breaker Adapter.
 *
 * <p>{@link com.ryuqq.resilience.adapter.inmemory.breaker.InMemoryCircuitBreaker}는 Target마다
 * 모니터로 보호되는 셀 하나를 {@link java.util.concurrent.ConcurrentHashMap}에 보관합니다.
 * 프로세스 재시작 시 상태는 사라집니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.breaker;
