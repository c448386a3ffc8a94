package com.ospicorp.nitrateforecast.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties({ForecastProperties.class, ExecutorProperties.class})
public class ForecastConfig {

  private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

  /** Validated at startup so a bad configuration fails before any request is served. */
  @Bean
  PipelineConfig defaultPipelineConfig(ForecastProperties properties) {
    PipelineConfig config = properties.toBuilder().build();
    log.info("Pipeline defaults: step={} target={} family={} orders={} mode={} train={} "
            + "horizon={} advance={}",
        config.gridStep(), config.targetVariable(), config.modelFamily(), config.modelOrders(),
        config.rollingMode(), config.trainWindowSteps(), config.forecastHorizonSteps(),
        config.stepAdvanceSteps());
    return config;
  }

  @Bean(name = "forecastExecutor")
  ThreadPoolTaskExecutor forecastExecutor(ExecutorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getCorePoolSize());
    executor.setMaxPoolSize(properties.getMaxPoolSize());
    executor.setQueueCapacity(properties.getQueueCapacity());
    executor.setThreadNamePrefix(properties.getThreadNamePrefix());
    // a long evaluation can plan more windows than the queue holds
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
