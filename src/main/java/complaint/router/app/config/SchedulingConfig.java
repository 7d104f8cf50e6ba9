package complaint.router.app.config;

import complaint.router.app.service.ComplaintProcessingService;
import complaint.router.app.service.FeedbackLoopService;
import complaint.router.app.service.KeywordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Registers the periodic tasks, each on its own configured interval: main classification loop,
 * false-positive loop, false-negative loop and keyword file check.
 * A failing run is logged and the next one runs on schedule.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final ComplaintRouterProperties properties;
    private final ComplaintProcessingService processingService;
    private final FeedbackLoopService feedbackLoopService;
    private final KeywordStore keywordStore;

    public SchedulingConfig(ComplaintRouterProperties properties,
                            ComplaintProcessingService processingService,
                            FeedbackLoopService feedbackLoopService,
                            KeywordStore keywordStore) {
        this.properties = properties;
        this.processingService = processingService;
        this.feedbackLoopService = feedbackLoopService;
        this.keywordStore = keywordStore;
    }

    @Bean(name = "complaintTaskScheduler")
    public ThreadPoolTaskScheduler complaintTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("complaint-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(60);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        ComplaintRouterProperties.SchedulingIntervals intervals = properties.getSchedulingIntervals();
        registrar.setTaskScheduler(complaintTaskScheduler());
        registrar.addFixedDelayTask(guarded("main loop", processingService::processMonitoredMailboxes), intervals.getMainLoop());
        registrar.addFixedDelayTask(guarded("fp feedback loop", feedbackLoopService::runFalsePositiveLoop), intervals.getFpFeedbackLoop());
        registrar.addFixedDelayTask(guarded("fn feedback loop", feedbackLoopService::runFalseNegativeLoop), intervals.getFnFeedbackLoop());
        registrar.addFixedDelayTask(guarded("keyword reload", keywordStore::refreshIfModified), intervals.getKeywordReload());
        log.info("Scheduled main loop every {}, fp loop every {}, fn loop every {}, keyword check every {}",
            intervals.getMainLoop(), intervals.getFpFeedbackLoop(), intervals.getFnFeedbackLoop(), intervals.getKeywordReload());
    }

    private static Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Error in scheduled {}: {}", name, e.getMessage(), e);
            }
        };
    }
}
