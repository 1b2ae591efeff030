package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.spi.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested delays without waiting.
 *
 * <p>Retry tests assert on {@link #delays()} instead of measuring wall-clock time.
 * {@link #interruptAfter(int)} simulates cancellation of the waiting caller.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private volatile int interruptAfter = -1;

    /**
     * Makes the sleep call after {@code count} recorded sleeps throw {@link InterruptedException}.
     *
     * @param count number of sleeps that complete normally (0 interrupts the first sleep)
     * @return this sleeper
     */
    public RecordingSleeper interruptAfter(int count) {
        this.interruptAfter = count;
        return this;
    }

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        if (interruptAfter >= 0 && delays.size() >= interruptAfter) {
            throw new InterruptedException("Sleep interrupted by test");
        }
        delays.add(delay);
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }

    public int sleepCount() {
        return delays.size();
    }
}
