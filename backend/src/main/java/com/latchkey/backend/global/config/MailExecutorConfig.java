package com.latchkey.backend.global.config;

import java.util.Map;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Outgoing mail runs on its own small pool so SMTP latency never reaches the request thread.
 */
@Configuration(proxyBeanMethods = false)
public class MailExecutorConfig {

    public static final String MAIL_TASK_EXECUTOR = "mailTaskExecutor";

    @Bean(name = MAIL_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor mailTaskExecutor(
            @Value("${latchkey.mail.pool-size:2}") int poolSize,
            @Value("${latchkey.mail.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("mail-");
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setTaskDecorator(copyingMdc());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    static TaskDecorator copyingMdc() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    task.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
