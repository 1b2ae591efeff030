/**
 * Policy Stack 설정.
 *
 * <p>{@link com.ryuqq.resilience.application.config.PolicyStackConfig}는 스택 생성 시 한 번만 읽힙니다.
 * 외부 설정 소스는 {@link com.ryuqq.resilience.application.config.PolicyStackConfigLoader}로
 * {@link java.util.Properties}에서 변환합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.config;
