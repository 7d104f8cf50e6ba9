package complaint.router.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for per-mailbox processing passes.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "mailboxProcessingExecutor")
    public Executor mailboxProcessingExecutor(ComplaintRouterProperties properties) {
        int mailboxes = Math.max(1, properties.getMonitoredMailboxes().size());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(mailboxes, 5)); // Core threads
        executor.setMaxPoolSize(10); // Maximum threads
        executor.setQueueCapacity(100); // Queue capacity
        executor.setThreadNamePrefix("mailbox-processor-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
