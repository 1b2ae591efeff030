package com.ryuqq.resilience.core.retry;

import java.time.Duration;

/**
 * 고정 간격 재시도 정책.
 *
 * <p>시도 번호와 무관하게 항상 같은 지연을 반환합니다.
 * 지연 0은 테스트 모드 용도로 허용됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class FixedDelayRetryPolicy implements RetryPolicy {

    private final Duration delay;

    /**
     * 생성자.
     *
     * @param delay 고정 지연 (0 이상)
     * @throws IllegalArgumentException delay가 null이거나 음수인 경우
     */
    public FixedDelayRetryPolicy(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        this.delay = delay;
    }

    @Override
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        return delay;
    }

    @Override
    public String toString() {
        return "FixedDelayRetryPolicy{delay=" + delay.toMillis() + "ms}";
    }
}
