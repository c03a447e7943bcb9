package com.flamingo.ai.doctranslator.config;

import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for page-level parallelism. */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final TranslationConfig translationConfig;

  @Bean(name = "pageTranslationExecutor")
  public Executor pageTranslationExecutor() {
    TranslationConfig.Pipeline pipeline = translationConfig.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pipeline.getConcurrency());
    executor.setMaxPoolSize(pipeline.getConcurrency());
    executor.setQueueCapacity(pipeline.getQueueCapacity());
    executor.setThreadNamePrefix("page-xlate-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
