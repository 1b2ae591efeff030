package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.Target;

import java.util.Optional;

/**
 * Circuit Breaker SPI.
 *
 * <p>Target별 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 호출자에게 전파되는 것을 막습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>상태 확인과 전이는 같은 Target 잠금 안에서 원자적으로 수행</li>
 *   <li>HALF_OPEN Probe는 동시에 단 하나만 허용</li>
 *   <li>결과는 발급한 {@link CircuitBreakerPermit}로 기록하며, 현재 상태 구간의 허가증이 아니면 무시</li>
 *   <li>서로 다른 Target은 서로를 직렬화하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreakerPermit permit = breaker.tryAcquire(target)
 *     .orElseThrow(() -> new CircuitOpenException(target));
 * try {
 *     Response response = next.call(request);
 *     breaker.recordSuccess(permit);
 *     return response;
 * } catch (TransientCallException e) {
 *     breaker.recordFailure(permit, e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 허용 여부 확인 (비블로킹).
     *
     * <ul>
     *   <li>CLOSED: 항상 허용</li>
     *   <li>OPEN: resetTimeout 경과 시 HALF_OPEN으로 전이하고 이 호출만 Probe로 허용, 아니면 차단</li>
     *   <li>HALF_OPEN: Probe가 진행 중이면 차단</li>
     * </ul>
     *
     * @param target 호출 대상
     * @return 허용 시 허가증, 차단 시 empty
     */
    Optional<CircuitBreakerPermit> tryAcquire(Target target);

    /**
     * 허용된 호출의 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수 0으로 초기화</li>
     *   <li>HALF_OPEN: CLOSED로 전이</li>
     * </ul>
     *
     * <p>현재 상태 구간의 허가증이 아니면 무시됩니다.</p>
     *
     * @param permit tryAcquire가 발급한 허가증
     */
    void recordSuccess(CircuitBreakerPermit permit);

    /**
     * 허용된 호출의 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 횟수 증가, 임계값 도달 시 OPEN</li>
     *   <li>HALF_OPEN: 즉시 OPEN, openedAt 갱신</li>
     * </ul>
     *
     * <p>현재 상태 구간의 허가증이 아니면 무시됩니다.</p>
     *
     * @param permit tryAcquire가 발급한 허가증
     * @param throwable 실패 원인
     */
    void recordFailure(CircuitBreakerPermit permit, Throwable throwable);

    /**
     * 허용된 호출이 대상에 도달하지 못하고 끝났음을 기록.
     *
     * <p>안쪽 계층(Rate Limiter 등)이 호출을 막았거나 호출이 취소된 경우입니다.
     * 상태는 바뀌지 않으며, 현재 Probe의 허가증이었다면 Probe 슬롯만 반환됩니다.</p>
     *
     * @param permit tryAcquire가 발급한 허가증
     */
    void releasePermission(CircuitBreakerPermit permit);

    /**
     * 현재 상태 조회.
     *
     * @param target 호출 대상
     * @return CLOSED, OPEN, HALF_OPEN 중 하나 (처음 보는 Target은 CLOSED)
     */
    CircuitBreakerState getState(Target target);

    /**
     * 현재 상태 스냅샷 조회.
     *
     * @param target 호출 대상
     * @return 불변 스냅샷
     */
    CircuitBreakerSnapshot snapshot(Target target);

    /**
     * 특정 Target을 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     *
     * @param target 호출 대상
     */
    void reset(Target target);

    CircuitBreakerConfig getConfig();
}
