package com.example.chronology.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool for secondary-extractor calls. Pool size caps the number of in-flight calls. */
@Configuration
public class EscalationExecutorConfig {

    @Bean(name = "escalationExecutor")
    public ThreadPoolTaskExecutor escalationExecutor(ChronologyProperties properties) {
        int maxCalls = Math.max(1, properties.llm().maxConcurrentCalls());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxCalls);
        executor.setMaxPoolSize(maxCalls);
        executor.setThreadNamePrefix("escalation-");
        return executor;
    }
}
