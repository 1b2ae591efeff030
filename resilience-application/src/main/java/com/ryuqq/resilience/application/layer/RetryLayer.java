package com.ryuqq.resilience.application.layer;

import com.ryuqq.resilience.core.error.CallException;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.retry.RetryPolicy;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import com.ryuqq.resilience.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 재시도 루프 계층.
 *
 * <p><strong>동작 방식 (attempt는 0부터 시작):</strong></p>
 * <ol>
 *   <li>안쪽 계층 호출, 성공하면 즉시 반환</li>
 *   <li>재시도 불가 실패(PERMANENT, RATE_LIMITED, CIRCUIT_OPEN)는 즉시 전달</li>
 *   <li>TRANSIENT이고 남은 시도가 있으면 {@code policy.delay(attempt)} 대기 후 재시도</li>
 *   <li>maxAttempts 소진 시 마지막 실패를 그대로 전달</li>
 * </ol>
 *
 * <p>대기는 어떤 잠금도 잡지 않은 상태에서 수행됩니다.
 * 대기 중 인터럽트되면 남은 시도를 중단하고, 인터럽트 플래그를 복원한 뒤 마지막 실패를 전달합니다.
 * 시도 중 인터럽트되어 실패한 경우에도 재시도하지 않고 그 실패를 그대로 전달합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryLayer implements CallLayer {

    private static final Logger log = LoggerFactory.getLogger(RetryLayer.class);

    private final RetryPolicy policy;
    private final int maxAttempts;
    private final Sleeper sleeper;
    private final PolicyEventListener listener;
    private final CallLayer next;

    /**
     * 생성자.
     *
     * @param policy 지연 정책
     * @param maxAttempts 첫 시도를 포함한 최대 시도 횟수 (1 이상)
     * @param sleeper 대기 수단
     * @param listener 이벤트 수신자
     * @param next 안쪽 계층
     * @throws IllegalArgumentException 의존성이 null이거나 maxAttempts가 양수가 아닌 경우
     */
    public RetryLayer(RetryPolicy policy, int maxAttempts, Sleeper sleeper, PolicyEventListener listener, CallLayer next) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        this.policy = policy;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
        this.listener = listener;
        this.next = next;
    }

    @Override
    public Response call(Request request) {
        Target target = request.target();
        CallException lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return next.call(request);
            } catch (CallException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Call to {} cancelled during attempt {}/{}", target, attempt + 1, maxAttempts);
                    throw e;
                }
                lastFailure = e;
            }

            if (attempt + 1 >= maxAttempts) {
                break;
            }

            Duration delay = policy.delay(attempt);
            log.debug("Attempt {}/{} to {} failed: {}. Retrying in {}ms",
                attempt + 1, maxAttempts, target, lastFailure.getMessage(), delay.toMillis());
            listener.onRetry(target, attempt + 1, delay, lastFailure);

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry to {} cancelled after {} attempt(s)", target, attempt + 1);
                throw lastFailure;
            }
        }

        log.warn("Retries exhausted for {} after {} attempt(s): {}", target, maxAttempts, lastFailure.getMessage());
        listener.onRetriesExhausted(target, maxAttempts, lastFailure);
        throw lastFailure;
    }
}
