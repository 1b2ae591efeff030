package com.ryuqq.resilience.core.retry;

import java.time.Duration;

/**
 * 재시도 지연 계산 정책.
 *
 * <p>순수 함수입니다: 부수 효과와 I/O가 없으며 Invoker를 호출하지 않습니다.
 * 실제 재시도 루프는 application 모듈의 {@code RetryLayer}가 담당합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 방금 실패한 시도의 0부터 시작하는 번호 (첫 시도 실패 시 0)
     * @return 대기 시간 (0 이상)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    Duration delay(int attempt);
}
