package ru.tigran.stylistengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Конфигурация thread pools (bulkhead): вызовы источников признаков изолированы
 * от потоков HTTP-запросов
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Executor для параллельного опроса источников признаков.
     * На одно изображение приходится три задачи, поэтому очередь в 100 задач
     * вмещает около 33 одновременных анализов.
     */
    @Bean(name = "featureExtractionExecutor")
    public Executor featureExtractionExecutor(
            @Value("${app.features.executor.core-pool-size:6}") int corePoolSize,
            @Value("${app.features.executor.max-pool-size:12}") int maxPoolSize,
            @Value("${app.features.executor.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("feature-src-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        // Отклонённая задача становится отказом источника, поэтому исключение пробрасываем дальше
        executor.setRejectedExecutionHandler((r, exec) -> {
            log.warn("Feature extraction task rejected: queue is full");
            throw new RejectedExecutionException("Feature extraction queue is full");
        });
        executor.initialize();

        return executor;
    }
}
