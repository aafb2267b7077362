package io.b2mash.ismsp.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.ismsp.store.StoreContentionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean(name = "storeDataSource", destroyMethod = "close")
  public HikariDataSource storeDataSource(StoreProperties properties) {
    return createDataSource(properties);
  }

  @Bean
  public JdbcClient storeJdbcClient(DataSource storeDataSource) {
    return JdbcClient.create(storeDataSource);
  }

  @Bean
  public PlatformTransactionManager transactionManager(DataSource storeDataSource) {
    return new DataSourceTransactionManager(storeDataSource);
  }

  @Bean
  public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
    return new TransactionTemplate(transactionManager);
  }

  @Bean
  public RetryTemplate storeRetryTemplate(StoreProperties properties) {
    return createRetryTemplate(properties.retry());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Builds the pooled SQLite data source. Pragmas are passed as driver properties so every pooled
   * connection gets them, not only the first one.
   *
   * <p>Transactions begin {@code IMMEDIATE}: the write lock is taken at {@code BEGIN}, where {@code
   * busy_timeout} waits for it. A deferred transaction that reads first and then writes fails with
   * {@code SQLITE_BUSY_SNAPSHOT} under WAL instead of waiting.
   */
  public static HikariDataSource createDataSource(StoreProperties properties) {
    var file = properties.file();
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create store directory for " + file, e);
    }

    var config = new HikariConfig();
    config.setPoolName("isms-store");
    config.setJdbcUrl(properties.jdbcUrl());
    config.setMaximumPoolSize(properties.maxPoolSize());
    config.addDataSourceProperty("foreign_keys", "true");
    config.addDataSourceProperty("journal_mode", "WAL");
    config.addDataSourceProperty("busy_timeout", String.valueOf(properties.busyTimeoutMs()));
    config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
    log.info("Opening store {} (pool size {})", file, properties.maxPoolSize());
    return new HikariDataSource(config);
  }

  public static RetryTemplate createRetryTemplate(StoreProperties.Retry retry) {
    return RetryTemplate.builder()
        .maxAttempts(retry.maxAttempts())
        .exponentialBackoff(retry.initialIntervalMs(), retry.multiplier(), retry.maxIntervalMs())
        .retryOn(StoreContentionException.class)
        .build();
  }
}
