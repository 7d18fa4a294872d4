package me.golemcore.resilience.infrastructure.config;

import me.golemcore.resilience.domain.model.ExecutorConfig;
import me.golemcore.resilience.executor.ResilientToolExecutor;
import me.golemcore.resilience.executor.ToolExecutorPort;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ResilienceAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ResilienceAutoConfiguration.class));

    @Test
    void shouldCreateExecutorWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ToolExecutorPort.class);
            assertThat(context).hasSingleBean(Clock.class);
            ExecutorConfig config = context.getBean(ResilientToolExecutor.class).getConfig();
            assertThat(config).isEqualTo(ExecutorConfig.defaults());
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "resilience.executor.max-concurrent=4",
                        "resilience.executor.circuit-breaker-threshold=2",
                        "resilience.executor.circuit-breaker-timeout=10s",
                        "resilience.executor.retry-max-attempts=5",
                        "resilience.executor.retry-initial-delay=250ms",
                        "resilience.executor.retry-backoff-multiplier=1.5",
                        "resilience.executor.retry-max-delay=2s",
                        "resilience.executor.default-timeout=1m")
                .run(context -> {
                    ResilientToolExecutor executor = context.getBean(ResilientToolExecutor.class);
                    ExecutorConfig config = executor.getConfig();
                    assertThat(config.getMaxConcurrent()).isEqualTo(4);
                    assertThat(config.getCircuitBreakerThreshold()).isEqualTo(2);
                    assertThat(config.getCircuitBreakerTimeout()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(config.getRetryMaxAttempts()).isEqualTo(5);
                    assertThat(config.getRetryInitialDelay()).isEqualTo(Duration.ofMillis(250));
                    assertThat(config.getRetryBackoffMultiplier()).isEqualTo(1.5);
                    assertThat(config.getRetryMaxDelay()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(config.getDefaultTimeout()).isEqualTo(Duration.ofMinutes(1));
                    assertThat(executor.getAvailablePermits()).isEqualTo(4);
                });
    }

    @Test
    void shouldClampInvalidProperties() {
        contextRunner
                .withPropertyValues("resilience.executor.max-concurrent=0",
                        "resilience.executor.default-timeout=0s")
                .run(context -> {
                    ExecutorConfig config = context.getBean(ResilientToolExecutor.class).getConfig();
                    assertThat(config.getMaxConcurrent()).isEqualTo(ExecutorConfig.DEFAULT_MAX_CONCURRENT);
                    assertThat(config.getDefaultTimeout()).isEqualTo(ExecutorConfig.DEFAULT_TIMEOUT);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("resilience.executor.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ToolExecutorPort.class));
    }

    @Test
    void shouldBackOffWhenUserProvidesExecutor() {
        ToolExecutorPort custom = mock(ToolExecutorPort.class);
        contextRunner
                .withBean(ToolExecutorPort.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(ToolExecutorPort.class);
                    assertThat(context.getBean(ToolExecutorPort.class)).isSameAs(custom);
                });
    }

    @Test
    void shouldUseProvidedClock() {
        Clock fixed = Clock.systemDefaultZone();
        contextRunner
                .withBean(Clock.class, () -> fixed)
                .run(context -> assertThat(context.getBean(Clock.class)).isSameAs(fixed));
    }
}
