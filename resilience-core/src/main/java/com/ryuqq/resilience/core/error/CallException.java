package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.Target;

/**
 * Policy Stack 호출이 실패했을 때 호출자가 받는 유일한 예외 계층.
 *
 * <p>Sealed class로 정의되어 네 가지 종류만 존재합니다:</p>
 * <ul>
 *   <li>{@link TransientCallException}</li>
 *   <li>{@link PermanentCallException}</li>
 *   <li>{@link RateLimitExceededException}</li>
 *   <li>{@link CircuitOpenException}</li>
 * </ul>
 *
 * <p>전송 계층의 원본 예외는 {@link #getCause()}로만 노출됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract sealed class CallException extends RuntimeException
    permits TransientCallException, PermanentCallException, RateLimitExceededException, CircuitOpenException {

    private final Target target;

    protected CallException(Target target, String message, Throwable cause) {
        super(message, cause);
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        this.target = target;
    }

    /**
     * 실패 종류.
     *
     * @return ErrorKind
     */
    public abstract ErrorKind kind();

    /**
     * 실패한 호출의 대상.
     *
     * @return Target
     */
    public Target target() {
        return target;
    }

    /**
     * 재시도 가능 여부.
     *
     * @return {@code kind().isRetryable()}
     */
    public boolean isRetryable() {
        return kind().isRetryable();
    }
}
