package com.ryuqq.resilience.application.layer;

import com.ryuqq.resilience.core.error.CallException;
import com.ryuqq.resilience.core.error.CircuitOpenException;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Circuit Breaker 계층.
 *
 * <p><strong>결과 기록 규칙:</strong></p>
 * <ul>
 *   <li>성공: {@code recordSuccess}</li>
 *   <li>TRANSIENT: {@code recordFailure}</li>
 *   <li>PERMANENT: 대상이 응답했으므로 {@code recordSuccess}</li>
 *   <li>RATE_LIMITED, CIRCUIT_OPEN 및 그 외: 대상에 도달하지 못했으므로 {@code releasePermission}</li>
 *   <li>호출 스레드가 인터럽트된 상태의 실패: 취소된 호출이므로 {@code releasePermission}</li>
 * </ul>
 *
 * <p>어떤 경로로 끝나더라도 허용을 받은 호출은 반드시 한 번 기록되거나 반환됩니다.
 * 그렇지 않으면 HALF_OPEN Probe 슬롯이 영구히 점유됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitBreakerLayer implements CallLayer {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerLayer.class);

    private final CircuitBreaker breaker;
    private final PolicyEventListener listener;
    private final CallLayer next;

    public CircuitBreakerLayer(CircuitBreaker breaker, PolicyEventListener listener, CallLayer next) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        this.breaker = breaker;
        this.listener = listener;
        this.next = next;
    }

    @Override
    public Response call(Request request) {
        Target target = request.target();

        Optional<CircuitBreakerPermit> acquired = breaker.tryAcquire(target);
        if (acquired.isEmpty()) {
            log.debug("Circuit breaker rejected call to {}", target);
            listener.onCallRejected(target, breaker.getState(target));
            throw new CircuitOpenException(target);
        }
        CircuitBreakerPermit permit = acquired.get();

        boolean recorded = false;
        try {
            Response response = next.call(request);
            breaker.recordSuccess(permit);
            recorded = true;
            return response;
        } catch (CallException e) {
            recorded = record(permit, e);
            throw e;
        } finally {
            if (!recorded) {
                breaker.releasePermission(permit);
            }
        }
    }

    private boolean record(CircuitBreakerPermit permit, CallException failure) {
        if (Thread.currentThread().isInterrupted()) {
            log.debug("Call to {} cancelled, releasing breaker permit", permit.target());
            return false;
        }
        return switch (failure.kind()) {
            case TRANSIENT -> {
                breaker.recordFailure(permit, failure);
                yield true;
            }
            case PERMANENT -> {
                breaker.recordSuccess(permit);
                yield true;
            }
            case RATE_LIMITED, CIRCUIT_OPEN -> false;
        };
    }
}
