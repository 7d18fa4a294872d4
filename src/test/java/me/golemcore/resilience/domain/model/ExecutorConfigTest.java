package me.golemcore.resilience.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorConfigTest {

    @Test
    void shouldProvideDefaults() {
        ExecutorConfig config = ExecutorConfig.defaults();

        assertEquals(10, config.getMaxConcurrent());
        assertEquals(5, config.getCircuitBreakerThreshold());
        assertEquals(Duration.ofSeconds(30), config.getCircuitBreakerTimeout());
        assertEquals(3, config.getRetryMaxAttempts());
        assertEquals(Duration.ofMillis(100), config.getRetryInitialDelay());
        assertEquals(2.0, config.getRetryBackoffMultiplier());
        assertEquals(Duration.ZERO, config.getRetryMaxDelay());
        assertEquals(Duration.ofSeconds(30), config.getDefaultTimeout());
        assertFalse(config.hasRetryMaxDelay());
    }

    @Test
    void shouldApplyOptionsInOrder() {
        ExecutorConfig config = ExecutorConfig.defaults().with(
                ExecutorOptions.withMaxConcurrent(5),
                ExecutorOptions.withCircuitBreakerThreshold(3),
                ExecutorOptions.withCircuitBreakerTimeout(Duration.ofSeconds(10)),
                ExecutorOptions.withRetryAttempts(2),
                ExecutorOptions.withRetryDelay(Duration.ofMillis(50)),
                ExecutorOptions.withRetryBackoffMultiplier(3.0),
                ExecutorOptions.withRetryMaxDelay(Duration.ofSeconds(1)),
                ExecutorOptions.withTimeout(Duration.ofSeconds(10)),
                ExecutorOptions.withMaxConcurrent(7));

        assertEquals(7, config.getMaxConcurrent());
        assertEquals(3, config.getCircuitBreakerThreshold());
        assertEquals(Duration.ofSeconds(10), config.getCircuitBreakerTimeout());
        assertEquals(2, config.getRetryMaxAttempts());
        assertEquals(Duration.ofMillis(50), config.getRetryInitialDelay());
        assertEquals(3.0, config.getRetryBackoffMultiplier());
        assertEquals(Duration.ofSeconds(1), config.getRetryMaxDelay());
        assertEquals(Duration.ofSeconds(10), config.getDefaultTimeout());
        assertTrue(config.hasRetryMaxDelay());
    }

    @Test
    void withDoesNotMutateOriginal() {
        ExecutorConfig original = ExecutorConfig.defaults();

        original.with(ExecutorOptions.withMaxConcurrent(1));

        assertEquals(10, original.getMaxConcurrent());
    }

    @Test
    void normalizedReplacesNonPositiveValuesWithDefaults() {
        ExecutorConfig config = ExecutorConfig.builder()
                .maxConcurrent(-1)
                .circuitBreakerThreshold(0)
                .circuitBreakerTimeout(Duration.ofSeconds(-5))
                .retryMaxAttempts(0)
                .retryInitialDelay(Duration.ZERO)
                .retryBackoffMultiplier(Double.NaN)
                .retryMaxDelay(Duration.ofMillis(-1))
                .defaultTimeout(null)
                .build()
                .normalized();

        assertEquals(ExecutorConfig.DEFAULT_MAX_CONCURRENT, config.getMaxConcurrent());
        assertEquals(ExecutorConfig.DEFAULT_CIRCUIT_BREAKER_THRESHOLD, config.getCircuitBreakerThreshold());
        assertEquals(ExecutorConfig.DEFAULT_CIRCUIT_BREAKER_TIMEOUT, config.getCircuitBreakerTimeout());
        assertEquals(ExecutorConfig.DEFAULT_RETRY_MAX_ATTEMPTS, config.getRetryMaxAttempts());
        assertEquals(ExecutorConfig.DEFAULT_RETRY_INITIAL_DELAY, config.getRetryInitialDelay());
        assertEquals(ExecutorConfig.DEFAULT_RETRY_BACKOFF_MULTIPLIER, config.getRetryBackoffMultiplier());
        assertEquals(Duration.ZERO, config.getRetryMaxDelay());
        assertEquals(ExecutorConfig.DEFAULT_TIMEOUT, config.getDefaultTimeout());
    }

    @Test
    void normalizedKeepsValidValues() {
        ExecutorConfig config = ExecutorConfig.defaults()
                .with(ExecutorOptions.withMaxConcurrent(1), ExecutorOptions.withRetryAttempts(1))
                .normalized();

        assertEquals(1, config.getMaxConcurrent());
        assertEquals(1, config.getRetryMaxAttempts());
    }
}
