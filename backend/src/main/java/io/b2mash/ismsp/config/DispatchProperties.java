package io.b2mash.ismsp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sizing of the worker pool that runs tool operations. Once {@code maxPoolSize} workers are busy
 * and {@code queueCapacity} invocations wait, further invocations are rejected.
 */
@ConfigurationProperties("isms.dispatch")
public record DispatchProperties(
    @DefaultValue("4") int corePoolSize,
    @DefaultValue("4") int maxPoolSize,
    @DefaultValue("64") int queueCapacity,
    @DefaultValue("30") int awaitTerminationSeconds) {}
