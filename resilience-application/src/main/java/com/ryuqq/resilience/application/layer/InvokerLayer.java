package com.ryuqq.resilience.application.layer;

import com.ryuqq.resilience.core.error.CallException;
import com.ryuqq.resilience.core.error.PermanentCallException;
import com.ryuqq.resilience.core.error.TransientCallException;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.spi.FailureClassifier;
import com.ryuqq.resilience.core.spi.Invoker;
import com.ryuqq.resilience.core.spi.PolicyEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 가장 안쪽 계층: Invoker 호출과 실패 분류.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>attemptTimeout이 없으면 호출 스레드에서 Invoker 직접 실행</li>
 *   <li>attemptTimeout이 있으면 스택 소유 Executor에서 실행하고 timeout 동안 대기</li>
 *   <li>timeout 초과 시 Future 취소 후 {@link TransientCallException}</li>
 *   <li>Invoker 예외는 {@link FailureClassifier}로 분류 ({@link CallException}은 그대로 전달)</li>
 *   <li>null 응답은 {@link PermanentCallException}</li>
 * </ol>
 *
 * <p>대기 중 인터럽트되면 시도를 취소하고 인터럽트 플래그를 복원한 뒤
 * {@link TransientCallException}으로 실패합니다.
 * 스택이 닫힌 뒤의 호출은 {@link IllegalStateException}입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class InvokerLayer implements CallLayer {

    private static final Logger log = LoggerFactory.getLogger(InvokerLayer.class);

    private final Invoker invoker;
    private final FailureClassifier classifier;
    private final PolicyEventListener listener;
    private final Duration attemptTimeout;
    private final ExecutorService executor;

    /**
     * 타임아웃 없는 생성자.
     *
     * @param invoker 실제 호출자
     * @param classifier 실패 분류기
     */
    public InvokerLayer(Invoker invoker, FailureClassifier classifier) {
        this(invoker, classifier, PolicyEventListener.NO_OP, null, null);
    }

    /**
     * 생성자.
     *
     * @param invoker 실제 호출자
     * @param classifier 실패 분류기
     * @param listener 이벤트 수신자
     * @param attemptTimeout 시도별 타임아웃 (null이면 타임아웃 없음)
     * @param executor 타임아웃 적용 시 Invoker를 실행할 Executor (attemptTimeout이 있으면 필수)
     * @throws IllegalArgumentException 의존성이 null이거나 timeout이 양수가 아닌 경우
     */
    public InvokerLayer(Invoker invoker, FailureClassifier classifier, PolicyEventListener listener,
                        Duration attemptTimeout, ExecutorService executor) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (attemptTimeout != null) {
            if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
                throw new IllegalArgumentException("attemptTimeout must be positive (current: " + attemptTimeout + ")");
            }
            if (executor == null) {
                throw new IllegalArgumentException("executor cannot be null when attemptTimeout is set");
            }
        }
        this.invoker = invoker;
        this.classifier = classifier;
        this.listener = listener;
        this.attemptTimeout = attemptTimeout;
        this.executor = executor;
    }

    @Override
    public Response call(Request request) {
        if (attemptTimeout == null) {
            return invokeDirect(request);
        }
        return invokeWithTimeout(request);
    }

    private Response invokeDirect(Request request) {
        Response response;
        try {
            response = invoker.invoke(request);
        } catch (CallException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw classifier.classify(request.target(), e);
        }
        return requireResponse(request, response);
    }

    private Response invokeWithTimeout(Request request) {
        Future<Response> future;
        try {
            future = executor.submit(() -> invoker.invoke(request));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Policy stack is closed", e);
        }
        try {
            return requireResponse(request, future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Attempt to {} timed out after {}ms", request.target(), attemptTimeout.toMillis());
            listener.onAttemptTimeout(request.target(), attemptTimeout);
            throw TransientCallException.timeout(request.target(), attemptTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof CallException callException) {
                throw callException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw classifier.classify(request.target(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientCallException(request.target(), "Attempt interrupted", e);
        }
    }

    private Response requireResponse(Request request, Response response) {
        if (response == null) {
            throw new PermanentCallException(request.target(), "Invoker returned null response");
        }
        return response;
    }
}
