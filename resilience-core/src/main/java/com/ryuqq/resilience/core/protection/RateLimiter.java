package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.Target;

/**
 * Rate Limiter SPI.
 *
 * <p>Target별로 슬라이딩 윈도우 안의 호출 수를 제한하여
 * 다운스트림 과부하를 방지합니다.</p>
 *
 * <p><strong>슬라이딩 윈도우:</strong> 현재 시각에서 끝나는 고정 길이 구간.
 * 구간 안의 허용된 호출 수가 maxRequests에 도달하면 이후 호출은 거부됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!limiter.tryAcquire(target)) {
 *     throw new RateLimitExceededException(target, config.maxRequests(), config.window());
 * }
 * return next.call(request);
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 호출 허용 여부 확인 (비블로킹).
     *
     * <p>허용되면 현재 시각을 윈도우에 기록합니다. 확인과 기록은 Target 단위로 원자적입니다.
     * 허용되지 않으면 false를 반환하며 대기하지 않습니다.</p>
     *
     * @param target 호출 대상
     * @return true: 요청 허용, false: Rate Limit 초과
     */
    boolean tryAcquire(Target target);

    /**
     * 현재 윈도우에서 추가로 허용 가능한 호출 수.
     *
     * @param target 호출 대상
     * @return 남은 허용량 (0 이상)
     */
    int availablePermits(Target target);

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig();
}
