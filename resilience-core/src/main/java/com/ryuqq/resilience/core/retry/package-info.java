/**
 * 재시도 지연 정책 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.retry.RetryPolicy}는 지연만 계산합니다.
 * 재시도 루프(어떤 오류를 재시도할지, 언제 멈출지)는 application 모듈의 RetryLayer가 담당합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.retry;
