package cull.email.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool for disposing the chunks of one rule and label in parallel.
 * Sized by cull.disposal-concurrency to stay inside Gmail's per-user rate limits.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "disposalExecutor")
    public Executor disposalExecutor(CullProperties properties) {
        int threads = Math.max(1, properties.getDisposalConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("disposal-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
