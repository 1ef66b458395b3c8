package com.example.authclient.config;

import com.example.authclient.properties.AuthClientProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationExcludeFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Registers the authentication client with a Spring Boot application.
 */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(AuthClientProperties.class)
@ComponentScan(
    basePackages = "com.example.authclient",
    excludeFilters = @ComponentScan.Filter(type = FilterType.CUSTOM, classes = AutoConfigurationExcludeFilter.class))
public class AuthClientAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Used when the host application has no Jackson auto-configuration of its own
   */
  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper objectMapper() {
    return new ObjectMapper().registerModule(new JavaTimeModule());
  }

  /**
   * Runs discovery and request building off the caller's thread
   */
  @Bean(name = "authClientExecutor")
  public ThreadPoolTaskExecutor authClientExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("auth-client-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    log.debug("Initialized auth client executor");
    return executor;
  }
}
