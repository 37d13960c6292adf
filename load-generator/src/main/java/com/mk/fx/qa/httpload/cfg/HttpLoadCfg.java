package com.mk.fx.qa.httpload.cfg;

import com.mk.fx.qa.httpload.http.RequestExecutor;
import com.mk.fx.qa.httpload.http.TransportSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Run configuration, bound from {@code http-load.*} properties. Command-line arguments such as
 * {@code --http-load.url=http://host:8080/api --http-load.concurrency=20} override the defaults.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "http-load")
public class HttpLoadCfg {

  /** Default target; also used for corpus entries without a URL. */
  @NotBlank private String url = "http://localhost:8080";

  /** Number of concurrent workers. */
  @Min(1)
  private int concurrency = 10;

  /** Total number of requests shared by all workers. */
  @Min(1)
  private long requests = 100;

  /** Probability that a request goes through the connection-reusing client. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double keepAliveRatio = 0.7;

  /** HTTP method of every request. */
  @NotBlank private String method = "POST";

  /** Optional JSON file with request bodies or (URL, body) pairs. */
  private String bodyFile;

  /** Cadence of the live reports and trend samples. */
  @NotNull private Duration reportInterval = Duration.ofSeconds(1);

  /** Timeout applied to connect, connection lease and response inactivity. */
  @NotNull private Duration requestTimeout = TransportSettings.DEFAULT_REQUEST_TIMEOUT;

  /** Upper bound of idle keep-alive connections kept in the pool. */
  @Min(1)
  private int maxIdleConnections = TransportSettings.DEFAULT_MAX_CONNECTIONS;

  /** Idle time after which keep-alive connections are evicted. */
  @NotNull private Duration idleTimeout = TransportSettings.DEFAULT_IDLE_TIMEOUT;

  private String userAgent = RequestExecutor.DEFAULT_USER_AGENT;

  /** Whether the run starts as soon as the application is up. */
  private boolean runOnStartup = true;

  /** Transport settings derived from this configuration; the pool is never smaller than the worker count. */
  public TransportSettings transportSettings() {
    return new TransportSettings(
        requestTimeout, Math.max(maxIdleConnections, concurrency), idleTimeout);
  }
}
