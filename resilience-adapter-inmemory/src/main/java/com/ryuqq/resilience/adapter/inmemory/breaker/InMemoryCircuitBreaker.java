package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import com.ryuqq.resilience.core.statemachine.BreakerTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CircuitBreaker} SPI의 In-Memory 구현체.
 *
 * <p>Target마다 자신의 모니터로 보호되는 {@code BreakerCell}을 가집니다.
 * 한 Target의 허용 판단, 카운터, 상태 전이는 그 모니터 안에서 수행되므로
 * 서로 다른 Target은 서로를 직렬화하지 않습니다.</p>
 *
 * <p><strong>Lazy HALF_OPEN:</strong> 백그라운드 타이머는 없습니다. resetTimeout 이후 처음 도착한 호출이
 * OPEN → HALF_OPEN 전이를 일으키고 Probe가 됩니다. Probe 결과가 기록될 때까지 같은 Target의
 * 다른 호출은 모두 거부됩니다.</p>
 *
 * <p><strong>상태 구간 (generation):</strong></p>
 * <ul>
 *   <li>상태 전이, Probe 발급, reset 마다 구간 번호가 증가</li>
 *   <li>발급된 {@link CircuitBreakerPermit}는 발급 시점의 구간 번호를 가짐</li>
 *   <li>구간 번호가 현재와 다른 허가증의 결과는 무시 (OPEN 이후 도착한 결과, HALF_OPEN 중 도착한
 *       CLOSED 시절 호출의 결과 등)</li>
 * </ul>
 * <p>따라서 HALF_OPEN에서 상태를 바꿀 수 있는 것은 현재 Probe의 결과뿐입니다.</p>
 *
 * <p>상태 변경 이벤트는 모니터를 놓은 뒤 로그와 {@link PolicyEventListener}로 발행합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final PolicyEventListener listener;
    private final ConcurrentHashMap<Target, BreakerCell> cells;

    /**
     * 생성자.
     *
     * @param config Breaker 설정
     * @param clock 시간 소스
     * @param listener 상태 전이 이벤트 수신자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InMemoryCircuitBreaker(CircuitBreakerConfig config, Clock clock, PolicyEventListener listener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.listener = listener;
        this.cells = new ConcurrentHashMap<>();
    }

    @Override
    public Optional<CircuitBreakerPermit> tryAcquire(Target target) {
        BreakerCell cell = cellOf(target);
        StateChange change = null;
        CircuitBreakerPermit permit;

        synchronized (cell) {
            switch (cell.state) {
                case CLOSED -> permit = new CircuitBreakerPermit(target, cell.generation, false);
                case OPEN -> {
                    Duration elapsed = Duration.between(cell.openedAt, clock.instant());
                    if (elapsed.compareTo(config.resetTimeout()) >= 0) {
                        change = cell.moveTo(target, CircuitBreakerState.HALF_OPEN);
                        permit = cell.admitProbe(target);
                    } else {
                        permit = null;
                    }
                }
                case HALF_OPEN -> permit = cell.probeInFlight ? null : cell.admitProbe(target);
                default -> throw new IllegalStateException("Unknown state: " + cell.state);
            }
        }

        publish(change);
        if (permit != null && permit.probe()) {
            log.info("Circuit breaker probe admitted for {}", target);
        }
        return Optional.ofNullable(permit);
    }

    @Override
    public void recordSuccess(CircuitBreakerPermit permit) {
        BreakerCell cell = cellOf(permit);
        Target target = permit.target();
        StateChange change = null;

        synchronized (cell) {
            if (cell.isStale(permit)) {
                log.debug("Ignoring stale success for {} (state: {})", target, cell.state);
                return;
            }
            switch (cell.state) {
                case CLOSED -> cell.consecutiveFailures = 0;
                case HALF_OPEN -> {
                    change = cell.moveTo(target, CircuitBreakerState.CLOSED);
                    cell.consecutiveFailures = 0;
                    cell.probeInFlight = false;
                }
                case OPEN -> log.debug("Ignoring late success for {} while OPEN", target);
                default -> throw new IllegalStateException("Unknown state: " + cell.state);
            }
        }

        publish(change);
    }

    @Override
    public void recordFailure(CircuitBreakerPermit permit, Throwable throwable) {
        BreakerCell cell = cellOf(permit);
        Target target = permit.target();
        StateChange change = null;

        synchronized (cell) {
            if (cell.isStale(permit)) {
                log.debug("Ignoring stale failure for {} (state: {})", target, cell.state);
                return;
            }
            switch (cell.state) {
                case CLOSED -> {
                    cell.consecutiveFailures++;
                    if (cell.consecutiveFailures >= config.failureThreshold()) {
                        change = cell.moveTo(target, CircuitBreakerState.OPEN);
                        cell.openedAt = clock.instant();
                    }
                }
                case HALF_OPEN -> {
                    change = cell.moveTo(target, CircuitBreakerState.OPEN);
                    cell.openedAt = clock.instant();
                    cell.probeInFlight = false;
                }
                case OPEN -> log.debug("Ignoring late failure for {} while OPEN", target);
                default -> throw new IllegalStateException("Unknown state: " + cell.state);
            }
        }

        if (change != null) {
            log.warn("Circuit breaker for {} opened after failure: {}", target,
                throwable == null ? "unknown" : throwable.getMessage());
        }
        publish(change);
    }

    @Override
    public void releasePermission(CircuitBreakerPermit permit) {
        BreakerCell cell = cellOf(permit);
        synchronized (cell) {
            if (!cell.isStale(permit) && permit.probe() && cell.state == CircuitBreakerState.HALF_OPEN) {
                cell.probeInFlight = false;
            }
        }
    }

    @Override
    public CircuitBreakerState getState(Target target) {
        return snapshot(target).state();
    }

    @Override
    public CircuitBreakerSnapshot snapshot(Target target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        BreakerCell cell = cells.get(target);
        if (cell == null) {
            return CircuitBreakerSnapshot.closed();
        }
        synchronized (cell) {
            return new CircuitBreakerSnapshot(cell.state, cell.consecutiveFailures, cell.openedAt, cell.probeInFlight);
        }
    }

    @Override
    public void reset(Target target) {
        BreakerCell cell = cellOf(target);
        StateChange change = null;

        synchronized (cell) {
            CircuitBreakerState previous = cell.state;
            cell.state = BreakerTransition.reset(previous);
            cell.generation++;
            cell.consecutiveFailures = 0;
            cell.openedAt = null;
            cell.probeInFlight = false;
            if (previous != CircuitBreakerState.CLOSED) {
                change = new StateChange(target, previous, CircuitBreakerState.CLOSED);
            }
        }

        publish(change);
    }

    @Override
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private BreakerCell cellOf(CircuitBreakerPermit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
        return cellOf(permit.target());
    }

    private BreakerCell cellOf(Target target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return cells.computeIfAbsent(target, t -> new BreakerCell());
    }

    private void publish(StateChange change) {
        if (change == null) {
            return;
        }
        log.info("Circuit breaker {}: {} → {}", change.target(), change.from(), change.to());
        listener.onCircuitStateChanged(change.target(), change.from(), change.to());
    }

    /**
     * Target별 가변 상태. 자신의 모니터로 보호됩니다.
     */
    private static final class BreakerCell {

        private CircuitBreakerState state = CircuitBreakerState.CLOSED;
        private long generation;
        private int consecutiveFailures;
        private Instant openedAt;
        private boolean probeInFlight;

        private StateChange moveTo(Target target, CircuitBreakerState next) {
            CircuitBreakerState previous = state;
            state = BreakerTransition.transition(previous, next);
            generation++;
            return new StateChange(target, previous, next);
        }

        // 새 Probe마다 구간을 올려서 반환된 이전 Probe의 허가증을 무효화
        private CircuitBreakerPermit admitProbe(Target target) {
            generation++;
            probeInFlight = true;
            return new CircuitBreakerPermit(target, generation, true);
        }

        private boolean isStale(CircuitBreakerPermit permit) {
            return permit.generation() != generation;
        }
    }

    private record StateChange(Target target, CircuitBreakerState from, CircuitBreakerState to) {
    }
}
