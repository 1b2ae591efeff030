package com.ryuqq.resilience.core.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 정책.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^attempt, maxDelay)
 * jitter      = random[0, 1) * exponential * jitterFraction
 * delay       = exponential + jitter
 * </pre>
 *
 * <p>결과는 {@code [exponential, exponential * (1 + jitterFraction)]} 범위이며,
 * {@code maxDelay * (1 + jitterFraction)}을 넘지 않습니다.</p>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=10000ms, jitterFraction=0.1):</strong></p>
 * <ul>
 *   <li>attempt=0: 1000ms + jitter(0-100ms)</li>
 *   <li>attempt=1: 2000ms + jitter(0-200ms)</li>
 *   <li>attempt=3: 8000ms + jitter(0-800ms)</li>
 *   <li>attempt=4: 10000ms (capped) + jitter(0-1000ms)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ExponentialJitterRetryPolicy implements RetryPolicy {

    /**
     * 기본 Jitter 비율 (10%).
     */
    public static final double DEFAULT_JITTER_FRACTION = 0.1;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFraction;
    private final DoubleSupplier random;

    /**
     * 기본 Jitter 비율(0.1)로 생성.
     *
     * @param baseDelay 기본 지연 시간 (양수)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     */
    public ExponentialJitterRetryPolicy(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, DEFAULT_JITTER_FRACTION);
    }

    /**
     * 커스텀 Jitter 비율로 생성.
     *
     * @param baseDelay 기본 지연 시간 (양수)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     * @param jitterFraction Jitter 비율 (0.0 ~ 1.0)
     */
    public ExponentialJitterRetryPolicy(Duration baseDelay, Duration maxDelay, double jitterFraction) {
        this(baseDelay, maxDelay, jitterFraction, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성 (테스트용).
     *
     * @param baseDelay 기본 지연 시간 (1ms 이상)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상)
     * @param jitterFraction Jitter 비율 (0.0 ~ 1.0)
     * @param random [0.0, 1.0) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialJitterRetryPolicy(Duration baseDelay, Duration maxDelay, double jitterFraction, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (baseDelay.toMillis() == 0) {
            throw new IllegalArgumentException(
                "baseDelay must be at least 1ms (current: " + baseDelay + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException(
                "jitterFraction must be between 0.0 and 1.0 (current: " + jitterFraction + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.jitterFraction = jitterFraction;
        this.random = random;
    }

    @Override
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt must be non-negative (current: " + attempt + ")"
            );
        }

        long exponential = exponentialMillis(attempt);
        long jitter = (long) (exponential * jitterFraction * random.getAsDouble());

        return Duration.ofMillis(exponential + jitter);
    }

    /**
     * Jitter 적용 전 지수 지연 계산 (overflow 방지).
     *
     * @param attempt 0부터 시작하는 시도 번호
     * @return min(baseDelay * 2^attempt, maxDelay) 밀리초
     */
    long exponentialMillis(int attempt) {
        // base << attempt 가 max 를 넘는지 shift 전에 판단
        if (attempt >= Long.SIZE - 2 || baseDelayMs > (maxDelayMs >> attempt)) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs << attempt, maxDelayMs);
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public double getJitterFraction() {
        return jitterFraction;
    }

    @Override
    public String toString() {
        return "ExponentialJitterRetryPolicy{base=" + baseDelayMs + "ms, max=" + maxDelayMs
            + "ms, jitter=" + jitterFraction + '}';
    }
}
