package com.ryuqq.resilience.core.error;

/**
 * 호출 실패의 종류.
 *
 * <p>Retry / Circuit Breaker 계층은 예외 타입이 아닌 ErrorKind로 판단합니다.</p>
 *
 * <ul>
 *   <li>TRANSIENT: 일시적 실패 (타임아웃, 5xx 등). 재시도 대상</li>
 *   <li>PERMANENT: 영구적 실패 (잘못된 요청, 4xx, 인증 실패). 재시도 불가</li>
 *   <li>RATE_LIMITED: Rate Limiter가 진입 거부. 내부 재시도 불가</li>
 *   <li>CIRCUIT_OPEN: Circuit Breaker가 진입 거부. 내부 재시도 불가</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum ErrorKind {

    TRANSIENT,

    PERMANENT,

    RATE_LIMITED,

    CIRCUIT_OPEN;

    /**
     * Retry 계층이 재시도할 수 있는 종류인지 확인.
     *
     * @return TRANSIENT인 경우에만 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }

    /**
     * 실제로 Invoker까지 도달한 결과인지 확인.
     *
     * <p>RATE_LIMITED, CIRCUIT_OPEN은 보호 계층이 호출 자체를 막은 경우입니다.</p>
     *
     * @return TRANSIENT 또는 PERMANENT인 경우 true
     */
    public boolean reachedTarget() {
        return this == TRANSIENT || this == PERMANENT;
    }
}
