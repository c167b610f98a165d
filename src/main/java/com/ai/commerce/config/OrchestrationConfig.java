package com.ai.commerce.config;

import com.ai.commerce.dto.CatalogSearchResult;
import com.ai.commerce.service.CatalogSearchClient;
import com.ai.commerce.store.DistributedLock;
import com.ai.commerce.store.InMemoryKeyValueStore;
import com.ai.commerce.store.KeyValueStore;
import com.ai.commerce.store.StoreBackedDistributedLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OrchestrationConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfig.class);

    @Value("${orchestrator.workers.core-size:4}")
    private int workerCoreSize;

    @Value("${orchestrator.workers.max-size:8}")
    private int workerMaxSize;

    @Value("${orchestrator.workers.queue-capacity:500}")
    private int workerQueueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "orchestrator.store.type", havingValue = "memory", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore(Clock clock) {
        log.info("Using in-memory key/value store for locks and rate limits (single instance only)");
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    public DistributedLock distributedLock(KeyValueStore keyValueStore) {
        return new StoreBackedDistributedLock(keyValueStore);
    }

    /**
     * Worker pool for pipeline runs. When the queue is full the submitting thread runs the turn
     * itself, which slows intake instead of dropping messages.
     */
    @Bean(name = "orchestratorExecutor")
    public ThreadPoolTaskExecutor orchestratorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerCoreSize);
        executor.setMaxPoolSize(workerMaxSize);
        executor.setQueueCapacity(workerQueueCapacity);
        executor.setThreadNamePrefix("orchestrator-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Worker queue full, running turn on caller thread. activeCount={}, queueSize={}",
                    e.getActiveCount(), e.getQueue().size());
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "burstScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService burstScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "burst-flush-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean(CatalogSearchClient.class)
    public CatalogSearchClient catalogSearchClient() {
        log.info("No catalog search configured; sales turns will ask customers what they are looking for");
        return (tenantId, query) -> CatalogSearchResult.empty();
    }
}
