package com.herzen.practice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Executors for answer evaluation and for analytics refresh, kept apart so a slow scorer never
 * delays insight recomputation.
 */
@Configuration
@EnableConfigurationProperties(SessionEngineProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(name = "evaluationExecutor")
    public Executor evaluationExecutor(SessionEngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getEvaluation().getPoolSize());
        executor.setMaxPoolSize(properties.getEvaluation().getPoolSize() * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("evaluation-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "insightsExecutor")
    public Executor insightsExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("insights-");
        executor.initialize();
        return executor;
    }
}
