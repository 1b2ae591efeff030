/**
 * Policy Stack 조립 및 호출 표면.
 *
 * <p>{@link com.ryuqq.resilience.application.stack.PolicyStackComposer}가
 * {@link com.ryuqq.resilience.application.config.PolicyStackConfig}를 한 번 읽어
 * {@link com.ryuqq.resilience.application.stack.PolicyStack}을 만듭니다.
 * 전역 레지스트리나 싱글톤은 없으며, 스택은 명시적으로 생성하고 전달합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.stack;
