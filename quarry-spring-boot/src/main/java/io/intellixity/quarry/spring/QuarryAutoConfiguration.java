package io.intellixity.quarry.spring;

import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.pool.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires one {@link PoolManager} per application context. The pool is closed with the context, which
 * tears down every cached driver and SSH tunnel.
 */
@AutoConfiguration
@EnableConfigurationProperties(QuarryProperties.class)
public class QuarryAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(QuarryAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public DriverSettings quarryDriverSettings(QuarryProperties props) {
    return props.toDriverSettings();
  }

  @Bean
  @ConditionalOnMissingBean
  public ConnectionConfigSource quarryConnectionConfigSource(QuarryProperties props) {
    return new InMemoryConnectionConfigSource(props.toConnectionConfigs());
  }

  @Bean
  @ConditionalOnMissingBean
  public DriverFactory quarryDriverFactory(DriverSettings settings) {
    StandardDriverFactory factory = new StandardDriverFactory(settings);
    log.info("quarry.spring drivers={}", factory.supportedTypes());
    return factory;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public PoolManager quarryPoolManager(DriverFactory factory, ConnectionConfigSource configs) {
    return new PoolManager(factory, configs);
  }

  @Bean
  @ConditionalOnMissingBean
  public RowEditService quarryRowEditService(PoolManager pool) {
    return new RowEditService(pool);
  }
}
