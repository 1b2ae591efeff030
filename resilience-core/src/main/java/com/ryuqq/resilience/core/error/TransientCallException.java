package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.Target;

import java.time.Duration;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃, 연결 실패</li>
 *   <li>외부 서비스 일시 장애 (503 Service Unavailable)</li>
 *   <li>시도별 타임아웃 초과</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class TransientCallException extends CallException {

    public TransientCallException(Target target, String message) {
        super(target, message, null);
    }

    public TransientCallException(Target target, String message, Throwable cause) {
        super(target, message, cause);
    }

    /**
     * 시도별 타임아웃 초과로 인한 실패 생성.
     *
     * @param target 호출 대상
     * @param timeout 초과한 타임아웃
     * @return TransientCallException
     */
    public static TransientCallException timeout(Target target, Duration timeout) {
        return new TransientCallException(target, "Attempt timed out after " + timeout.toMillis() + "ms");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}
