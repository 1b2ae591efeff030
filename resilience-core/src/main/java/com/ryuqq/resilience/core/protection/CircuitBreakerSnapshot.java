package com.ryuqq.resilience.core.protection;

import java.time.Instant;

/**
 * 특정 Target의 Circuit Breaker 상태 스냅샷 (불변).
 *
 * <p>내부 상태 객체를 노출하지 않기 위해 조회 시점의 복사본을 반환합니다.</p>
 *
 * @param state 상태
 * @param consecutiveFailures CLOSED 상태에서의 연속 실패 횟수
 * @param openedAt 마지막으로 OPEN 된 시각 (한 번도 열리지 않았으면 null)
 * @param probeInFlight HALF_OPEN Probe 진행 여부
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    CircuitBreakerState state,
    int consecutiveFailures,
    Instant openedAt,
    boolean probeInFlight
) {

    /**
     * 초기(CLOSED) 스냅샷.
     *
     * @return CLOSED, 실패 0회
     */
    public static CircuitBreakerSnapshot closed() {
        return new CircuitBreakerSnapshot(CircuitBreakerState.CLOSED, 0, null, false);
    }
}
