package com.ivamare.hostbridge.health;

import com.ivamare.hostbridge.HostBridgeAutoConfiguration;
import com.ivamare.hostbridge.stream.StreamBus;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Host Bridge health indicators.
 */
@AutoConfiguration(after = HostBridgeAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "hostbridge", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(StreamBus.class)
    @ConditionalOnMissingBean(StreamBusHealthIndicator.class)
    public StreamBusHealthIndicator streamBusHealthIndicator(StreamBus streamBus) {
        return new StreamBusHealthIndicator(streamBus);
    }
}
