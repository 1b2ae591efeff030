package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.Target;

/**
 * 재시도해도 성공할 수 없는 영구적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>잘못된 요청 (400 Bad Request)</li>
 *   <li>인증/권한 실패 (401, 403)</li>
 *   <li>리소스 없음 (404 Not Found)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PermanentCallException extends CallException {

    public PermanentCallException(Target target, String message) {
        super(target, message, null);
    }

    public PermanentCallException(Target target, String message, Throwable cause) {
        super(target, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMANENT;
    }
}
