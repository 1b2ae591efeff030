package com.ryuqq.resilience.application.config;

import com.ryuqq.resilience.application.stack.LayerType;
import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.protection.CacheConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.retry.BackoffType;
import com.ryuqq.resilience.core.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * {@link Properties} / {@link Map} 기반 설정 로더.
 *
 * <p><strong>인식하는 키 (prefix 이후):</strong></p>
 * <pre>
 * cache.enabled                      = true
 * cache.ttl                          = PT30S
 * cache.max-entries                  = 10000
 * rate-limit.enabled                 = true
 * rate-limit.max-requests            = 100
 * rate-limit.window                  = PT1S
 * circuit-breaker.enabled            = true
 * circuit-breaker.failure-threshold  = 5
 * circuit-breaker.reset-timeout      = PT30S
 * retry.enabled                      = true
 * retry.policy                       = exponential   # fixed | exponential
 * retry.base-delay                   = PT1S
 * retry.max-delay                    = PT10S
 * retry.jitter-fraction              = 0.1
 * retry.max-attempts                 = 3
 * order                              = rate-limit, circuit-breaker, retry, cache
 * attempt-timeout                    = PT2S
 * </pre>
 *
 * <p>Duration은 ISO-8601(예: {@code PT30S}) 또는 밀리초 정수를 받습니다.
 * 알 수 없는 키는 무시하고, 값이 잘못되면 {@link ConfigurationException}을 발생시킵니다.
 * 지정하지 않은 값은 각 설정의 {@code disabled()} 기본값을 따릅니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PolicyStackConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyStackConfigLoader.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
        "cache.enabled", "cache.ttl", "cache.max-entries",
        "rate-limit.enabled", "rate-limit.max-requests", "rate-limit.window",
        "circuit-breaker.enabled", "circuit-breaker.failure-threshold", "circuit-breaker.reset-timeout",
        "retry.enabled", "retry.policy", "retry.base-delay", "retry.max-delay",
        "retry.jitter-fraction", "retry.max-attempts",
        "order", "attempt-timeout"
    );

    // Utility class - prevent instantiation
    private PolicyStackConfigLoader() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * prefix 없이 Properties에서 로드.
     *
     * @param properties 설정
     * @return PolicyStackConfig
     * @throws ConfigurationException 값이 잘못된 경우
     */
    public static PolicyStackConfig load(Properties properties) {
        return load(properties, "");
    }

    /**
     * prefix가 붙은 키만 Properties에서 로드.
     *
     * @param properties 설정
     * @param prefix 키 prefix (예: "resilience.payment-api.")
     * @return PolicyStackConfig
     * @throws ConfigurationException 값이 잘못된 경우
     */
    public static PolicyStackConfig load(Properties properties, String prefix) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        Map<String, String> values = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name));
        }
        return load(values, prefix);
    }

    /**
     * prefix가 붙은 키만 Map에서 로드.
     *
     * @param source 설정
     * @param prefix 키 prefix (빈 문자열 허용)
     * @return PolicyStackConfig
     * @throws ConfigurationException 값이 잘못된 경우
     */
    public static PolicyStackConfig load(Map<String, String> source, String prefix) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        String effectivePrefix = prefix == null ? "" : prefix;

        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, String> entry : source.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(effectivePrefix)) {
                continue;
            }
            String name = key.substring(effectivePrefix.length());
            if (KNOWN_KEYS.contains(name)) {
                values.put(name, entry.getValue() == null ? "" : entry.getValue().trim());
            } else {
                log.debug("Ignoring unknown policy stack option: {}", key);
            }
        }

        PolicyStackConfig config = new PolicyStackConfig(
            cache(values),
            rateLimit(values),
            circuitBreaker(values),
            retry(values),
            order(values),
            values.containsKey("attempt-timeout") ? duration(values, "attempt-timeout", null) : null
        );
        log.debug("Loaded policy stack config: {}", config);
        return config;
    }

    private static CacheConfig cache(Map<String, String> values) {
        CacheConfig defaults = CacheConfig.disabled();
        return new CacheConfig(
            bool(values, "cache.enabled", defaults.enabled()),
            duration(values, "cache.ttl", defaults.ttl()),
            integer(values, "cache.max-entries", defaults.maxEntries())
        );
    }

    private static RateLimiterConfig rateLimit(Map<String, String> values) {
        RateLimiterConfig defaults = RateLimiterConfig.disabled();
        return new RateLimiterConfig(
            bool(values, "rate-limit.enabled", defaults.enabled()),
            integer(values, "rate-limit.max-requests", defaults.maxRequests()),
            duration(values, "rate-limit.window", defaults.window())
        );
    }

    private static CircuitBreakerConfig circuitBreaker(Map<String, String> values) {
        CircuitBreakerConfig defaults = CircuitBreakerConfig.disabled();
        return new CircuitBreakerConfig(
            bool(values, "circuit-breaker.enabled", defaults.enabled()),
            integer(values, "circuit-breaker.failure-threshold", defaults.failureThreshold()),
            duration(values, "circuit-breaker.reset-timeout", defaults.resetTimeout())
        );
    }

    private static RetryConfig retry(Map<String, String> values) {
        RetryConfig defaults = RetryConfig.disabled();
        BackoffType type = values.containsKey("retry.policy")
            ? BackoffType.parse(values.get("retry.policy"))
            : defaults.backoffType();
        Duration baseDelay = duration(values, "retry.base-delay", defaults.baseDelay());
        // fixed 정책은 max-delay를 따로 지정하지 않으면 base-delay와 같게 둔다
        Duration maxDelay = values.containsKey("retry.max-delay") || type == BackoffType.EXPONENTIAL
            ? duration(values, "retry.max-delay", defaults.maxDelay())
            : baseDelay;
        return new RetryConfig(
            bool(values, "retry.enabled", defaults.enabled()),
            type,
            baseDelay,
            maxDelay,
            decimal(values, "retry.jitter-fraction", defaults.jitterFraction()),
            integer(values, "retry.max-attempts", defaults.maxAttempts())
        );
    }

    private static List<LayerType> order(Map<String, String> values) {
        String raw = values.get("order");
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<LayerType> order = new ArrayList<>();
        for (String name : raw.split(",")) {
            if (!name.isBlank()) {
                order.add(LayerType.parse(name));
            }
        }
        return order;
    }

    private static boolean bool(Map<String, String> values, String key, boolean defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        String normalized = raw.toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        throw new ConfigurationException(key + " must be true or false (current: " + raw + ")");
    }

    private static int integer(Map<String, String> values, String key, int defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    private static double decimal(Map<String, String> values, String key, double defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number (current: " + raw + ")", e);
        }
    }

    private static Duration duration(Map<String, String> values, String key, Duration defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isEmpty()) {
            return defaultValue;
        }
        if (raw.chars().allMatch(Character::isDigit)) {
            try {
                return Duration.ofMillis(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " is out of range in milliseconds (current: " + raw + ")", e);
            }
        }
        try {
            return Duration.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(
                key + " must be an ISO-8601 duration or milliseconds (current: " + raw + ")", e);
        }
    }
}
