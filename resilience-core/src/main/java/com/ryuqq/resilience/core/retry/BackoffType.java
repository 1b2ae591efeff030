package com.ryuqq.resilience.core.retry;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.util.Locale;

/**
 * 재시도 지연 방식.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum BackoffType {

    /** 고정 간격 */
    FIXED,

    /** 지수 증가 + Jitter */
    EXPONENTIAL;

    /**
     * 설정 문자열에서 변환 (대소문자 무시).
     *
     * @param value "fixed" 또는 "exponential"
     * @return BackoffType
     * @throws ConfigurationException 알 수 없는 값인 경우
     */
    public static BackoffType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("retry policy cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown retry policy: " + value + " (expected: fixed, exponential)", e);
        }
    }
}
