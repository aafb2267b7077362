package io.b2mash.ismsp.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location and tuning of the single-file SQLite store.
 *
 * @param path store file; {@code application.yml} lets {@code ISMS_DB_PATH} override it
 * @param busyTimeoutMs how long SQLite itself waits on a locked database before reporting busy
 * @param maxPoolSize upper bound of pooled connections
 * @param retry backoff applied when a store operation still hits lock contention
 */
@ConfigurationProperties("isms.store")
public record StoreProperties(
    @DefaultValue("data/isms_p.db") String path,
    @DefaultValue("5000") int busyTimeoutMs,
    @DefaultValue("4") int maxPoolSize,
    @DefaultValue Retry retry) {

  public Path file() {
    return Path.of(path).toAbsolutePath();
  }

  public String jdbcUrl() {
    return "jdbc:sqlite:" + file();
  }

  public record Retry(
      @DefaultValue("4") int maxAttempts,
      @DefaultValue("50") long initialIntervalMs,
      @DefaultValue("2.0") double multiplier,
      @DefaultValue("1000") long maxIntervalMs) {}
}
