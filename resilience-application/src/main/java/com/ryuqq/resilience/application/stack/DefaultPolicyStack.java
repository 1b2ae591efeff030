package com.ryuqq.resilience.application.stack;

import com.ryuqq.resilience.application.layer.CallLayer;
import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * {@link PolicyStack} 기본 구현.
 *
 * <p>{@link PolicyStackComposer}가 한 번 조립한 계층 체인의 머리를 보관합니다.
 * 호출별 가변 상태는 없습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
final class DefaultPolicyStack implements PolicyStack {

    private static final Logger log = LoggerFactory.getLogger(DefaultPolicyStack.class);

    private final CallLayer head;
    private final List<LayerType> layers;
    private final ExecutorService attemptExecutor;

    /**
     * 생성자.
     *
     * @param head 가장 바깥 계층
     * @param layers 계층 순서
     * @param attemptExecutor 시도 타임아웃용 Executor (없으면 null)
     */
    DefaultPolicyStack(CallLayer head, List<LayerType> layers, ExecutorService attemptExecutor) {
        this.head = head;
        this.layers = List.copyOf(layers);
        this.attemptExecutor = attemptExecutor;
    }

    @Override
    public Response call(Request request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return head.call(request);
    }

    @Override
    public List<LayerType> layers() {
        return layers;
    }

    @Override
    public void close() {
        if (attemptExecutor != null && !attemptExecutor.isShutdown()) {
            attemptExecutor.shutdownNow();
            log.info("Policy stack closed: attempt executor shut down");
        }
    }

    @Override
    public String toString() {
        return "PolicyStack" + layers;
    }
}
