package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.Target;

/**
 * Circuit Breaker가 진입을 거부한 경우.
 *
 * <p>OPEN 상태이거나, HALF_OPEN 상태에서 이미 Probe 호출이 진행 중인 경우 발생합니다.
 * 내부적으로 재시도되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitOpenException extends CallException {

    public CircuitOpenException(Target target) {
        super(target, "Circuit breaker is OPEN for " + target, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
