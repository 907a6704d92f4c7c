package com.dataprep.standardizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean(name = "analysisExecutor")
  public ThreadPoolTaskExecutor analysisExecutor(StandardizerProperties properties) {
    StandardizerProperties.Analysis analysis = properties.getAnalysis();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(analysis.getCorePoolSize());
    executor.setMaxPoolSize(analysis.getMaxPoolSize());
    executor.setQueueCapacity(analysis.getQueueCapacity());
    executor.setThreadNamePrefix("analysis-");
    executor.initialize();
    return executor;
  }
}
