package com.ryuqq.resilience.core.spi;

import java.time.Duration;

/**
 * 재시도 간 대기 SPI.
 *
 * <p>테스트에서 실제 대기 없이 지연 값을 기록할 수 있도록 분리되어 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정된 시간만큼 현재 스레드를 대기.
     *
     * @param duration 대기 시간 (0이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     *
     * @return Sleeper
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Sleep interrupted");
                }
                return;
            }
            Thread.sleep(duration.toMillis());
        };
    }
}
