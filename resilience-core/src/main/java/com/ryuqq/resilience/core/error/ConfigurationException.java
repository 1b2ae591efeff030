package com.ryuqq.resilience.core.error;

/**
 * Policy Stack 설정이 유효하지 않은 경우.
 *
 * <p>스택 생성 시점에만 발생하며, 이 예외가 발생하면 스택은 생성되지 않습니다
 * (부분적으로 조립된 스택을 반환하지 않음).</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
