package com.ryuqq.resilience.core.retry;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.time.Duration;

/**
 * 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 계층 활성화 여부</li>
 *   <li>backoffType: FIXED 또는 EXPONENTIAL</li>
 *   <li>baseDelay: FIXED는 고정 지연(0 허용), EXPONENTIAL은 첫 지연(양수)</li>
 *   <li>지연은 밀리초 단위로 대기하므로 0보다 크고 1ms보다 작은 값은 거부</li>
 *   <li>maxDelay: EXPONENTIAL 상한 (baseDelay 이상)</li>
 *   <li>jitterFraction: EXPONENTIAL Jitter 비율 (0.0 ~ 1.0, 기본 0.1)</li>
 *   <li>maxAttempts: 첫 시도를 포함한 최대 시도 횟수 (1 이상)</li>
 * </ul>
 *
 * @param enabled 계층 활성화 여부
 * @param backoffType 지연 방식
 * @param baseDelay 기본 지연
 * @param maxDelay 최대 지연
 * @param jitterFraction Jitter 비율
 * @param maxAttempts 최대 시도 횟수
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryConfig(
    boolean enabled,
    BackoffType backoffType,
    Duration baseDelay,
    Duration maxDelay,
    double jitterFraction,
    int maxAttempts
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (backoffType == null) {
            throw new ConfigurationException("backoffType cannot be null");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new ConfigurationException("baseDelay must be non-negative (current: " + baseDelay + ")");
        }
        if (isSubMillisecond(baseDelay)) {
            throw new ConfigurationException("baseDelay must be zero or at least 1ms (current: " + baseDelay + ")");
        }
        if (backoffType == BackoffType.EXPONENTIAL && baseDelay.isZero()) {
            throw new ConfigurationException("baseDelay must be positive for exponential backoff");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new ConfigurationException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (isSubMillisecond(maxDelay)) {
            throw new ConfigurationException("maxDelay must be zero or at least 1ms (current: " + maxDelay + ")");
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new ConfigurationException(
                "jitterFraction must be between 0.0 and 1.0 (current: " + jitterFraction + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new ConfigurationException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
    }

    /**
     * 비활성 설정 (EXPONENTIAL, 1s ~ 10s, jitter 0.1, 3회).
     *
     * @return 비활성 RetryConfig
     */
    public static RetryConfig disabled() {
        return new RetryConfig(false, BackoffType.EXPONENTIAL, Duration.ofSeconds(1), Duration.ofSeconds(10),
            ExponentialJitterRetryPolicy.DEFAULT_JITTER_FRACTION, 3);
    }

    /**
     * 고정 간격 재시도 설정.
     *
     * @param maxAttempts 최대 시도 횟수
     * @param delay 고정 지연 (0 허용)
     * @return 활성 RetryConfig
     */
    public static RetryConfig fixed(int maxAttempts, Duration delay) {
        return new RetryConfig(true, BackoffType.FIXED, delay, delay, 0.0, maxAttempts);
    }

    /**
     * 지수 백오프 재시도 설정 (jitter 0.1).
     *
     * @param maxAttempts 최대 시도 횟수
     * @param baseDelay 기본 지연
     * @param maxDelay 최대 지연
     * @return 활성 RetryConfig
     */
    public static RetryConfig exponential(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryConfig(true, BackoffType.EXPONENTIAL, baseDelay, maxDelay,
            ExponentialJitterRetryPolicy.DEFAULT_JITTER_FRACTION, maxAttempts);
    }

    /**
     * 설정에 맞는 RetryPolicy 생성.
     *
     * @return FixedDelayRetryPolicy 또는 ExponentialJitterRetryPolicy
     */
    public RetryPolicy toPolicy() {
        return switch (backoffType) {
            case FIXED -> new FixedDelayRetryPolicy(baseDelay);
            case EXPONENTIAL -> new ExponentialJitterRetryPolicy(baseDelay, maxDelay, jitterFraction);
        };
    }

    public RetryConfig withEnabled(boolean enabled) {
        return new RetryConfig(enabled, backoffType, baseDelay, maxDelay, jitterFraction, maxAttempts);
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(enabled, backoffType, baseDelay, maxDelay, jitterFraction, maxAttempts);
    }

    public RetryConfig withJitterFraction(double jitterFraction) {
        return new RetryConfig(enabled, backoffType, baseDelay, maxDelay, jitterFraction, maxAttempts);
    }

    // 밀리초 단위 대기에서 0으로 잘리는 값
    private static boolean isSubMillisecond(Duration delay) {
        return !delay.isZero() && !delay.isNegative() && delay.toMillis() == 0;
    }
}
