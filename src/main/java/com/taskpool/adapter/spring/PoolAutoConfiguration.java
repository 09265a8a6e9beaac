package com.taskpool.adapter.spring;

import com.taskpool.config.ConfigLoader;
import com.taskpool.config.PoolConfig;
import com.taskpool.core.DefaultWorkerPool;
import com.taskpool.core.WorkerPool;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the task pool.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "taskpool", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PoolProperties.class)
public class PoolAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PoolAutoConfiguration.class);

    private WorkerPool workerPool;

    @Bean
    @ConditionalOnMissingBean
    public PoolConfig poolConfig(PoolProperties properties) {
        log.info("Loading pool configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerPool workerPool(PoolConfig config) {
        log.info("Creating WorkerPool: {}", config.name());
        this.workerPool = new DefaultWorkerPool(config);
        return this.workerPool;
    }

    @PreDestroy
    public void shutdown() {
        if (workerPool != null && !workerPool.isShutdown()) {
            log.info("Shutting down WorkerPool");
            workerPool.shutdown();
        }
    }
}
