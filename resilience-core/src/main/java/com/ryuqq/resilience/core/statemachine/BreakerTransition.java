package com.ryuqq.resilience.core.statemachine;

import com.ryuqq.resilience.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Breaker 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (연속 실패 임계값 도달)</li>
 *   <li>OPEN → HALF_OPEN (resetTimeout 경과 후 첫 호출)</li>
 *   <li>HALF_OPEN → CLOSED (Probe 성공)</li>
 *   <li>HALF_OPEN → OPEN (Probe 실패)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>CLOSED → HALF_OPEN, OPEN → CLOSED 직접 전이 불가</li>
 *   <li>같은 상태로의 전이는 전이가 아님 (거부)</li>
 *   <li>수동 리셋은 {@link #reset(CircuitBreakerState)}로만 허용</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class BreakerTransition {

    // Utility class - prevent instantiation
    private BreakerTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        return switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit breaker transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }

    /**
     * 수동 리셋 (어느 상태에서든 CLOSED).
     *
     * @param current 현재 상태
     * @return CLOSED
     * @throws IllegalArgumentException current가 null인 경우
     */
    public static CircuitBreakerState reset(CircuitBreakerState current) {
        if (current == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        return CircuitBreakerState.CLOSED;
    }
}
