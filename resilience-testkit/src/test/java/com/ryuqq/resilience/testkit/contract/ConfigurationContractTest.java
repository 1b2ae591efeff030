package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.application.config.PolicyStackConfig;
import com.ryuqq.resilience.application.config.PolicyStackConfigLoader;
import com.ryuqq.resilience.application.stack.LayerType;
import com.ryuqq.resilience.application.stack.PolicyStack;
import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Stacks built from properties files.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ConfigurationContractTest extends AbstractPolicyStackContractTest {

    private static Properties loadFixture(String name) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = ConfigurationContractTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, "Missing fixture " + name);
            properties.load(in);
        }
        return properties;
    }

    @Test
    void testConfiguration_PropertiesFile_ComposesConfiguredOrder() throws IOException {
        // Given
        PolicyStackConfig config = PolicyStackConfigLoader.load(loadFixture("policy-stack.properties"), "resilience.");

        // When
        ScriptedInvoker invoker = new ScriptedInvoker()
                .thenFail(new IOException("first"))
                .thenRespond("second");
        PolicyStack stack = compose(config, invoker);

        // Then
        assertEquals(List.of(LayerType.CACHE, LayerType.CIRCUIT_BREAKER, LayerType.RETRY), stack.layers());
        assertEquals("second", body(stack, request("orders", "1")));
        assertEquals("second", body(stack, request("orders", "1")));
        assertEquals(2, invoker.invocationCount());
    }

    @Test
    void testConfiguration_RateLimitFromProperties_Enforced() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("rate-limit.enabled", "true");
        properties.setProperty("rate-limit.max-requests", "1");
        properties.setProperty("rate-limit.window", "PT1M");
        properties.setProperty("unrelated.option", "ignored");

        // When
        PolicyStack stack = compose(PolicyStackConfigLoader.load(properties), new ScriptedInvoker());

        // Then
        assertEquals("ok", body(stack, request("orders", "1")));
        assertFailsWith(ErrorKind.RATE_LIMITED, stack, request("orders", "2"));
    }

    @Test
    void testConfiguration_InvalidValues_FailBeforeAnyStackExists() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("circuit-breaker.enabled", "true");
        properties.setProperty("circuit-breaker.failure-threshold", "-1");

        // When & Then
        assertThrows(ConfigurationException.class, () -> PolicyStackConfigLoader.load(properties));
    }

    @Test
    void testConfiguration_ContradictoryOrder_FailsComposition() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("retry.enabled", "true");
        properties.setProperty("order", "retry, cache");
        PolicyStackConfig config = PolicyStackConfigLoader.load(properties);
        ScriptedInvoker invoker = new ScriptedInvoker();

        // When & Then
        assertThrows(ConfigurationException.class, () -> compose(config, invoker));
        assertEquals(0, invoker.invocationCount());
    }
}
