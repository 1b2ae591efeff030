package com.ryuqq.resilience.core.error;

import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.spi.FailureClassifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * 기본 실패 분류기.
 *
 * <p><strong>분류 규칙 (원인 체인 전체를 검사):</strong></p>
 * <ul>
 *   <li>{@link CallException}: 그대로 전달</li>
 *   <li>{@link TimeoutException}, {@link IOException}, {@link UncheckedIOException},
 *       {@link InterruptedException}: TRANSIENT</li>
 *   <li>그 외: PERMANENT</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class StandardFailureClassifier implements FailureClassifier {

    @Override
    public CallException classify(Target target, Throwable failure) {
        if (failure instanceof CallException callException) {
            return callException;
        }
        String message = failure.getClass().getSimpleName()
            + (failure.getMessage() == null ? "" : ": " + failure.getMessage());
        if (isTransient(failure)) {
            return new TransientCallException(target, message, failure);
        }
        return new PermanentCallException(target, message, failure);
    }

    private boolean isTransient(Throwable failure) {
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof TimeoutException
                || current instanceof IOException
                || current instanceof UncheckedIOException
                || current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
