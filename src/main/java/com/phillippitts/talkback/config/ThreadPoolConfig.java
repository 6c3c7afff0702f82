package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.talkback.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs conversation workers.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the expected number of concurrent sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the worker pool for provider stream readers, playback workers and prefetch tasks.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.conversation.*} properties:
     * <ul>
     *   <li>Core pool: default 8 - two sessions' long-running readers</li>
     *   <li>Max pool: default 64 - bursts of prefetch tasks across sessions</li>
     *   <li>Queue: default 0 - a task never waits behind a blocking stream reader</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a stream reader on the
     * caller would block the session loop, so a saturated pool fails the task instead and the
     * orchestrator maps the failure.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext ({@code sessionId}) from the submitting
     * session loop to the worker thread.
     *
     * @return configured executor for conversation workers
     */
    @Bean(name = "conversationWorkerExecutor")
    public Executor conversationWorkerExecutor() {
        ThreadPoolProperties.ConversationPoolProperties props = threadPoolProperties.getConversation();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(new ThreadContextTaskDecorator());

        executor.initialize();
        return executor;
    }
}
