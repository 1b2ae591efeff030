package com.ryuqq.resilience.adapter.inmemory.breaker;

import com.ryuqq.resilience.adapter.inmemory.TestClock;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerPermit;
import com.ryuqq.resilience.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * InMemoryCircuitBreaker 유닛 테스트.
 *
 * <p>상태 머신, 단일 Probe 보장, 늦은 결과 무시, Listener 통지를 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryCircuitBreakerTest {

    private static final Target TARGET = Target.of("payment-api");
    private static final Duration RESET_TIMEOUT = Duration.ofSeconds(30);

    @Mock
    private PolicyEventListener listener;

    private TestClock clock;
    private InMemoryCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        breaker = new InMemoryCircuitBreaker(CircuitBreakerConfig.of(3, RESET_TIMEOUT), clock, listener);
    }

    private CircuitBreakerPermit acquire() {
        return breaker.tryAcquire(TARGET).orElseThrow();
    }

    private void open() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(acquire(), new IOException("down"));
        }
    }

    private CircuitBreakerPermit halfOpen() {
        open();
        clock.advance(RESET_TIMEOUT);
        return acquire();
    }

    // ============================================================
    // 1. CLOSED
    // ============================================================

    @Test
    void 처음_보는_target_은_CLOSED_스냅샷() {
        // when
        CircuitBreakerSnapshot snapshot = breaker.snapshot(Target.of("unknown"));

        // then
        assertThat(snapshot).isEqualTo(CircuitBreakerSnapshot.closed());
        assertThat(breaker.tryAcquire(TARGET)).hasValueSatisfying(permit -> assertThat(permit.probe()).isFalse());
    }

    @Test
    void 임계치_미만_실패는_CLOSED_유지() {
        // when
        breaker.recordFailure(acquire(), new IOException("1"));
        breaker.recordFailure(acquire(), new IOException("2"));

        // then
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot(TARGET).consecutiveFailures()).isEqualTo(2);
        verifyNoInteractions(listener);
    }

    @Test
    void 성공은_연속_실패_횟수를_초기화() {
        // given
        breaker.recordFailure(acquire(), new IOException("1"));
        breaker.recordFailure(acquire(), new IOException("2"));

        // when
        breaker.recordSuccess(acquire());
        breaker.recordFailure(acquire(), new IOException("3"));

        // then
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.snapshot(TARGET).consecutiveFailures()).isEqualTo(1);
    }

    // ============================================================
    // 2. OPEN
    // ============================================================

    @Test
    void 임계치_도달_시_OPEN_전이_및_통지() {
        // when
        open();

        // then
        CircuitBreakerSnapshot snapshot = breaker.snapshot(TARGET);
        assertThat(snapshot.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(snapshot.openedAt()).isEqualTo(clock.instant());
        verify(listener).onCircuitStateChanged(TARGET, CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
    }

    @Test
    void OPEN_상태에서_resetTimeout_전에는_거부() {
        // given
        open();

        // when
        clock.advance(RESET_TIMEOUT.minusMillis(1));

        // then
        assertThat(breaker.tryAcquire(TARGET)).isEmpty();
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void OPEN_상태의_늦은_결과는_무시() {
        // given
        CircuitBreakerPermit slowSuccess = acquire();
        CircuitBreakerPermit slowFailure = acquire();
        open();
        Instant openedAt = breaker.snapshot(TARGET).openedAt();
        clock.advance(Duration.ofSeconds(5));

        // when
        breaker.recordSuccess(slowSuccess);
        breaker.recordFailure(slowFailure, new IOException("late"));

        // then
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.snapshot(TARGET).openedAt()).isEqualTo(openedAt);
    }

    // ============================================================
    // 3. HALF_OPEN
    // ============================================================

    @Test
    void resetTimeout_경과_후_단일_Probe_허용() {
        // given
        open();
        clock.advance(RESET_TIMEOUT);

        // when
        Optional<CircuitBreakerPermit> probe = breaker.tryAcquire(TARGET);
        Optional<CircuitBreakerPermit> second = breaker.tryAcquire(TARGET);

        // then
        assertThat(probe).hasValueSatisfying(permit -> assertThat(permit.probe()).isTrue());
        assertThat(second).isEmpty();
        assertThat(breaker.snapshot(TARGET).probeInFlight()).isTrue();
        verify(listener).onCircuitStateChanged(TARGET, CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void Probe_성공_시_CLOSED_및_실패_횟수_초기화() {
        // given
        CircuitBreakerPermit probe = halfOpen();

        // when
        breaker.recordSuccess(probe);

        // then
        CircuitBreakerSnapshot snapshot = breaker.snapshot(TARGET);
        assertThat(snapshot.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(snapshot.consecutiveFailures()).isZero();
        assertThat(snapshot.probeInFlight()).isFalse();

        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onCircuitStateChanged(TARGET, CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
        inOrder.verify(listener).onCircuitStateChanged(TARGET, CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
        inOrder.verify(listener).onCircuitStateChanged(TARGET, CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
    }

    @Test
    void Probe_실패_시_OPEN_으로_돌아가고_openedAt_갱신() {
        // given
        open();
        clock.advance(RESET_TIMEOUT.plusSeconds(7));
        CircuitBreakerPermit probe = acquire();

        // when
        breaker.recordFailure(probe, new IOException("probe failed"));

        // then
        CircuitBreakerSnapshot snapshot = breaker.snapshot(TARGET);
        assertThat(snapshot.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(snapshot.openedAt()).isEqualTo(clock.instant());
        assertThat(breaker.tryAcquire(TARGET)).isEmpty();
    }

    @Test
    void releasePermission_은_결과_없이_Probe_슬롯을_반환() {
        // given
        CircuitBreakerPermit probe = halfOpen();

        // when
        breaker.releasePermission(probe);

        // then
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker.tryAcquire(TARGET)).isPresent();
    }

    @Test
    void 동시_요청_중_Probe_는_정확히_하나() throws Exception {
        // given
        open();
        clock.advance(RESET_TIMEOUT);
        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<CircuitBreakerPermit>>> results = new ArrayList<>();

        try {
            // when
            for (int i = 0; i < threads; i++) {
                Callable<Optional<CircuitBreakerPermit>> task = () -> {
                    start.await();
                    return breaker.tryAcquire(TARGET);
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            // then
            int admitted = 0;
            for (Future<Optional<CircuitBreakerPermit>> result : results) {
                if (result.get(5, TimeUnit.SECONDS).isPresent()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    // ============================================================
    // 4. 늦은 결과 (허가증 구간)
    // ============================================================

    @Test
    void HALF_OPEN_중_CLOSED_시절_호출의_성공은_Probe_결과가_아님() {
        // given: 느린 호출이 CLOSED 상태에서 허용된 뒤 Breaker가 열리고 Probe가 나감
        CircuitBreakerPermit slow = acquire();
        CircuitBreakerPermit probe = halfOpen();

        // when
        breaker.recordSuccess(slow);

        // then: Probe는 여전히 진행 중이며 두 번째 호출은 거부
        CircuitBreakerSnapshot snapshot = breaker.snapshot(TARGET);
        assertThat(snapshot.state()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(snapshot.probeInFlight()).isTrue();
        assertThat(breaker.tryAcquire(TARGET)).isEmpty();

        // Probe 결과만 상태를 바꿈
        breaker.recordSuccess(probe);
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void HALF_OPEN_중_CLOSED_시절_호출의_실패와_반환은_무시() {
        // given
        CircuitBreakerPermit slowFailure = acquire();
        CircuitBreakerPermit slowRelease = acquire();
        CircuitBreakerPermit probe = halfOpen();

        // when
        breaker.recordFailure(slowFailure, new IOException("late"));
        breaker.releasePermission(slowRelease);

        // then
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker.tryAcquire(TARGET)).isEmpty();
        breaker.recordFailure(probe, new IOException("probe failed"));
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 반환된_Probe_의_늦은_결과는_다음_Probe_에_영향_없음() {
        // given
        CircuitBreakerPermit first = halfOpen();
        breaker.releasePermission(first);
        CircuitBreakerPermit second = acquire();

        // when
        breaker.recordFailure(first, new IOException("late"));

        // then
        assertThat(second.probe()).isTrue();
        assertThat(breaker.snapshot(TARGET).probeInFlight()).isTrue();
        assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void 다시_닫힌_뒤_이전_구간의_실패는_집계하지_않음() {
        // given
        CircuitBreakerPermit slow = acquire();
        breaker.recordSuccess(halfOpen());

        // when
        breaker.recordFailure(slow, new IOException("late"));

        // then
        assertThat(breaker.snapshot(TARGET).consecutiveFailures()).isZero();
    }

    @Test
    void Probe_진행_중_동시에_도착한_늦은_결과는_단일_Probe_를_깨지_않음() throws Exception {
        // given
        int threads = 16;
        List<CircuitBreakerPermit> slow = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            slow.add(acquire());
        }
        CircuitBreakerPermit probe = halfOpen();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<CircuitBreakerPermit>>> results = new ArrayList<>();

        try {
            // when
            for (int i = 0; i < threads; i++) {
                CircuitBreakerPermit late = slow.get(i);
                int kind = i % 3;
                Callable<Optional<CircuitBreakerPermit>> task = () -> {
                    start.await();
                    if (kind == 0) {
                        breaker.recordSuccess(late);
                    } else if (kind == 1) {
                        breaker.recordFailure(late, new IOException("late"));
                    } else {
                        breaker.releasePermission(late);
                    }
                    return breaker.tryAcquire(TARGET);
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            // then
            for (Future<Optional<CircuitBreakerPermit>> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEmpty();
            }
            assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.HALF_OPEN);
            breaker.recordSuccess(probe);
            assertThat(breaker.getState(TARGET)).isEqualTo(CircuitBreakerState.CLOSED);
        } finally {
            executor.shutdownNow();
        }
    }

    // ============================================================
    // 5. reset / 격리
    // ============================================================

    @Test
    void reset_은_CLOSED_로_강제() {
        // given
        open();

        // when
        breaker.reset(TARGET);

        // then
        assertThat(breaker.snapshot(TARGET)).isEqualTo(CircuitBreakerSnapshot.closed());
        verify(listener).onCircuitStateChanged(TARGET, CircuitBreakerState.OPEN, CircuitBreakerState.CLOSED);
    }

    @Test
    void target_별_상태는_독립적() {
        // given
        open();

        // when & then
        assertThat(breaker.tryAcquire(Target.of("inventory-api"))).isPresent();
        assertThat(breaker.getState(Target.of("inventory-api"))).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 생성자_null_검증() {
        assertThatThrownBy(
                () -> new InMemoryCircuitBreaker(null, clock, listener))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }
}
