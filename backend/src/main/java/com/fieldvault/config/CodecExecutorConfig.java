package com.fieldvault.config;

import java.util.concurrent.ThreadPoolExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class CodecExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(CodecExecutorConfig.class);

    @Bean(name = "fieldCodecExecutor")
    public ThreadPoolTaskExecutor fieldCodecExecutor(CodecExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int poolSize = properties.effectivePoolSize();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("field-codec-");
        executor.setTaskDecorator(new LoggingTaskDecorator());
        // A dropped task would leave a batch join waiting forever.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("Field codec pool wired with PoolSize: {}, QueueCapacity: {}", poolSize, properties.queueCapacity());
        return executor;
    }

    @Bean(name = "fieldCodecScheduler", destroyMethod = "dispose")
    public Scheduler fieldCodecScheduler(@Qualifier("fieldCodecExecutor") ThreadPoolTaskExecutor executor) {
        return Schedulers.fromExecutor(executor);
    }
}
