package com.ivamare.bulkload.health;

import com.ivamare.bulkload.BulkLoadAutoConfiguration;
import com.ivamare.bulkload.pool.PoolRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for bulk load health indicators.
 */
@AutoConfiguration(after = BulkLoadAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(PoolRegistry.class)
@ConditionalOnProperty(prefix = "bulkload", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(PoolHealthIndicator.class)
    public PoolHealthIndicator poolHealthIndicator(PoolRegistry poolRegistry) {
        return new PoolHealthIndicator(poolRegistry);
    }
}
