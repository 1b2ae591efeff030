package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Target마다 정확히 하나의 상태를 가집니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 횟수 == failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (호출 시점에 now - openedAt &gt;= resetTimeout, 해당 호출이 Probe)
 * HALF_OPEN (Probe 진행 중)
 *   │
 *   ├─► Probe 성공 → CLOSED
 *   └─► Probe 실패 → OPEN (openedAt 갱신)
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>연속 실패 횟수를 추적하며, 성공 시 0으로 초기화합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>resetTimeout 경과 후 첫 호출이 들어오면 HALF_OPEN으로 전이합니다.
     * 백그라운드 타이머는 없습니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (단 하나의 Probe 호출만 통과).
     *
     * <p>Probe 진행 중 도착한 다른 호출은 즉시 거부됩니다.</p>
     */
    HALF_OPEN;

    /**
     * 호출을 거부하는 상태인지 확인.
     *
     * @return OPEN이면 true
     */
    public boolean isOpen() {
        return this == OPEN;
    }
}
