package com.ryuqq.resilience.application.stack;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.util.List;
import java.util.Locale;

/**
 * Policy Stack에 배치할 수 있는 계층 종류.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum LayerType {

    CACHE("cache"),

    RATE_LIMIT("rate-limit"),

    CIRCUIT_BREAKER("circuit-breaker"),

    RETRY("retry");

    /**
     * 순서를 지정하지 않았을 때의 권장 순서 (바깥 → 안쪽).
     *
     * <pre>
     * RATE_LIMIT → CIRCUIT_BREAKER → RETRY → CACHE → Invoker
     * </pre>
     */
    public static final List<LayerType> DEFAULT_ORDER = List.of(RATE_LIMIT, CIRCUIT_BREAKER, RETRY, CACHE);

    private final String configName;

    LayerType(String configName) {
        this.configName = configName;
    }

    /**
     * 설정 파일에서 사용하는 이름.
     *
     * @return 예: "rate-limit"
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * 설정 문자열에서 변환.
     *
     * <p>대소문자, 하이픈, 언더스코어를 무시합니다.
     * "cache", "rate-limit"/"rateLimit"/"rate_limiter", "circuit-breaker"/"breaker", "retry"를 인식합니다.</p>
     *
     * @param value 계층 이름
     * @return LayerType
     * @throws ConfigurationException 알 수 없는 이름인 경우
     */
    public static LayerType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("layer name cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        return switch (normalized) {
            case "cache" -> CACHE;
            case "ratelimit", "ratelimiter", "limiter" -> RATE_LIMIT;
            case "circuitbreaker", "breaker" -> CIRCUIT_BREAKER;
            case "retry" -> RETRY;
            default -> throw new ConfigurationException("Unknown layer: " + value);
        };
    }
}
