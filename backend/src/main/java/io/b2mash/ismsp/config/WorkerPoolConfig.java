package io.b2mash.ismsp.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class WorkerPoolConfig {

  @Bean(name = "toolExecutor")
  public ThreadPoolTaskExecutor toolExecutor(DispatchProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("isms-tool-");
    executor.setCorePoolSize(properties.corePoolSize());
    executor.setMaxPoolSize(properties.maxPoolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    return executor;
  }
}
