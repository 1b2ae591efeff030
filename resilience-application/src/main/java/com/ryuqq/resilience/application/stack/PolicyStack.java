package com.ryuqq.resilience.application.stack;

import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;

import java.util.List;

/**
 * 애플리케이션 코드에 노출되는 단일 호출 표면.
 *
 * <p>내부 계층 구성은 호출자에게 보이지 않으며, 실패 종류로만 드러납니다.
 * 여러 스레드가 하나의 인스턴스를 동시에 사용할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (PolicyStack stack = composer.compose(config, invoker)) {
 *     Response response = stack.call(Request.of(Target.of("user-api"), "GET /users/42"));
 * } catch (RateLimitExceededException e) {
 *     // 외부에서 백오프
 * } catch (CircuitOpenException e) {
 *     // 대체 응답
 * } catch (TransientCallException | PermanentCallException e) {
 *     // 실패 처리
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface PolicyStack extends AutoCloseable {

    /**
     * 논리적 호출 실행.
     *
     * @param request 호출 요청
     * @return 성공 응답
     * @throws IllegalArgumentException request가 null인 경우
     * @throws com.ryuqq.resilience.core.error.CallException 호출 실패 시 (네 가지 종류 중 하나)
     */
    Response call(Request request);

    /**
     * 구성된 계층 순서 (바깥 → 안쪽, Invoker 제외).
     *
     * @return 불변 리스트
     */
    List<LayerType> layers();

    /**
     * 스택이 소유한 자원(시도 타임아웃용 Executor) 해제.
     */
    @Override
    void close();
}
