package com.caltrack.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    // export/import are disk + base64 heavy; one worker keeps them off the caller thread
    @Bean("backupExecutor")
    public TaskExecutor backupExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(1);
        ex.setQueueCapacity(16);
        ex.setThreadNamePrefix("backup-");
        ex.initialize();
        return ex;
    }
}
