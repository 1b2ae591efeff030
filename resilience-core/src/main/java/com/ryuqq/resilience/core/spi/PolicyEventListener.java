package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.error.CallException;
import com.ryuqq.resilience.core.model.CacheKey;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.time.Duration;

/**
 * 정책 계층 이벤트 수신 SPI (메트릭/트레이싱 연동 지점).
 *
 * <p>모든 메서드는 기본적으로 아무 동작도 하지 않으므로 필요한 이벤트만 재정의하면 됩니다.
 * 구현은 호출 경로에서 동기적으로 실행되므로 가볍게 유지해야 하며, 예외를 던지지 않아야 합니다.</p>
 *
 * <p>Circuit Breaker 상태 변경 이벤트는 Breaker 내부 잠금 밖에서 전달됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface PolicyEventListener {

    /**
     * 아무 동작도 하지 않는 Listener.
     */
    PolicyEventListener NO_OP = new PolicyEventListener() { };

    default void onCacheHit(CacheKey key) {
    }

    default void onCacheMiss(CacheKey key) {
    }

    default void onRateLimited(Target target) {
    }

    /**
     * Circuit Breaker 상태 전이.
     *
     * @param target 대상
     * @param from 이전 상태
     * @param to 새 상태
     */
    default void onCircuitStateChanged(Target target, CircuitBreakerState from, CircuitBreakerState to) {
    }

    /**
     * Circuit Breaker가 호출을 거부함.
     *
     * @param target 대상
     * @param state 거부 시점 상태 (OPEN 또는 HALF_OPEN)
     */
    default void onCallRejected(Target target, CircuitBreakerState state) {
    }

    /**
     * 재시도 예정.
     *
     * @param target 대상
     * @param failedAttempt 실패한 시도 번호 (1부터 시작)
     * @param delay 다음 시도까지 대기 시간
     * @param failure 실패 원인
     */
    default void onRetry(Target target, int failedAttempt, Duration delay, CallException failure) {
    }

    default void onRetriesExhausted(Target target, int attempts, CallException lastFailure) {
    }

    default void onAttemptTimeout(Target target, Duration timeout) {
    }
}
