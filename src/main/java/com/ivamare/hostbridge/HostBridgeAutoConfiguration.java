package com.ivamare.hostbridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.hostbridge.api.CommandInvoker;
import com.ivamare.hostbridge.api.impl.BatchingCommandInvoker;
import com.ivamare.hostbridge.api.impl.CachingCommandInvoker;
import com.ivamare.hostbridge.handler.HandlerRegistry;
import com.ivamare.hostbridge.handler.impl.DefaultHandlerRegistry;
import com.ivamare.hostbridge.stream.StreamBus;
import com.ivamare.hostbridge.stream.impl.DefaultStreamBus;
import com.ivamare.hostbridge.transport.CommandTransport;
import com.ivamare.hostbridge.transport.impl.LocalCommandTransport;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Host Bridge.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Handler Registry</li>
 *   <li>Local Command Transport</li>
 *   <li>Command Invoker (batching, optionally cached)</li>
 *   <li>Stream Bus, published as {@link StreamBus#getInstance()}</li>
 * </ul>
 *
 * <p>Provide a {@link CommandTransport} bean to call a remote host instead of the local
 * handlers. To disable auto-configuration:
 * <pre>
 * hostbridge.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "hostbridge", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(HostBridgeProperties.class)
public class HostBridgeAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper hostBridgeObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Handler Registry ---

    @Bean
    @ConditionalOnMissingBean(HandlerRegistry.class)
    public static DefaultHandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    // --- Transport ---

    @Bean
    @ConditionalOnMissingBean
    public CommandTransport commandTransport(HandlerRegistry handlerRegistry, ObjectMapper objectMapper) {
        return new LocalCommandTransport(handlerRegistry, objectMapper);
    }

    // --- Command Invoker ---

    @Bean
    @ConditionalOnMissingBean
    public CommandInvoker commandInvoker(
            CommandTransport commandTransport,
            ObjectMapper objectMapper,
            HostBridgeProperties properties) {
        CommandInvoker invoker = new BatchingCommandInvoker(
            commandTransport,
            objectMapper,
            properties.getBatch().getWindow()
        );

        HostBridgeProperties.CacheProperties cache = properties.getCache();
        if (!cache.isEnabled()) {
            return invoker;
        }
        return new CachingCommandInvoker(
            invoker,
            objectMapper,
            cache.getTtls(),
            cache.getInvalidation(),
            cache.getMaxSize()
        );
    }

    // --- Stream Bus ---

    @Bean(destroyMethod = "destroy")
    @ConditionalOnMissingBean
    public StreamBus streamBus(HostBridgeProperties properties) {
        HostBridgeProperties.StreamProperties stream = properties.getStream();
        StreamBus bus = StreamBus.builder()
            .drainInterval(stream.getDrainInterval())
            .highWaterMark(stream.getHighWaterMark())
            .maxQueueSize(stream.getMaxQueueSize())
            .maxUpdatesPerDrain(stream.getMaxUpdatesPerDrain())
            .build();
        // producers outside the context reach this bus through StreamBus.getInstance()
        if (bus instanceof DefaultStreamBus defaultBus) {
            DefaultStreamBus.setInstance(defaultBus);
        }
        if (stream.isAutoStart()) {
            bus.start();
        }
        return bus;
    }
}
