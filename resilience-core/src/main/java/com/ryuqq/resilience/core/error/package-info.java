/**
 * 호출 실패 분류 체계.
 *
 * <p>호출자는 항상 Response 또는 {@link com.ryuqq.resilience.core.error.CallException}의
 * 네 가지 하위 타입 중 하나를 받습니다. 원본 전송 예외가 그대로 노출되지 않습니다.</p>
 *
 * <p>{@link com.ryuqq.resilience.core.error.ConfigurationException}은 스택 생성 시점에만 발생합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.error;
