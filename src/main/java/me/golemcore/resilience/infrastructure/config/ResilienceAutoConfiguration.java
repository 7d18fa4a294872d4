package me.golemcore.resilience.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.resilience.domain.model.ExecutorConfig;
import me.golemcore.resilience.executor.ResilientToolExecutor;
import me.golemcore.resilience.executor.ToolExecutorPort;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Spring Boot auto-configuration contributing a {@link ResilientToolExecutor}
 * built from {@link ResilienceProperties}.
 *
 * <p>
 * Both beans back off when the application defines its own. The whole
 * configuration is skipped with {@code resilience.executor.enabled=false}.
 *
 * @since 1.0
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "resilience.executor", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ResilienceProperties.class)
@Slf4j
public class ResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ToolExecutorPort.class)
    public ResilientToolExecutor resilientToolExecutor(ResilienceProperties properties, Clock clock) {
        ResilientToolExecutor executor = new ResilientToolExecutor(properties.toExecutorConfig(), clock);
        ExecutorConfig config = executor.getConfig();
        log.info("[Resilience] Tool executor ready: maxConcurrent={}, breakerThreshold={}, breakerTimeout={}ms,"
                + " retryAttempts={}, retryDelay={}ms, timeout={}ms",
                config.getMaxConcurrent(), config.getCircuitBreakerThreshold(),
                config.getCircuitBreakerTimeout().toMillis(), config.getRetryMaxAttempts(),
                config.getRetryInitialDelay().toMillis(), config.getDefaultTimeout().toMillis());
        return executor;
    }
}
