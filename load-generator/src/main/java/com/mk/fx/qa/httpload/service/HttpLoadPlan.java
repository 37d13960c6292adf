package com.mk.fx.qa.httpload.service;

import com.mk.fx.qa.httpload.cfg.HttpLoadCfg;
import com.mk.fx.qa.httpload.corpus.RequestCorpus;
import java.time.Duration;
import java.util.Objects;

/**
 * Everything a single run needs besides its transport.
 *
 * @param runId identifier used for thread names and logs
 * @param defaultUrl target of corpus entries without a URL
 * @param method HTTP method of every request
 * @param concurrency number of workers
 * @param totalRequests request budget shared by all workers
 * @param reportInterval cadence of live reports
 * @param corpus request parameters to draw from, possibly empty
 */
public record HttpLoadPlan(
    String runId,
    String defaultUrl,
    String method,
    int concurrency,
    long totalRequests,
    Duration reportInterval,
    RequestCorpus corpus) {

  public HttpLoadPlan {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(defaultUrl, "defaultUrl");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(reportInterval, "reportInterval");
    Objects.requireNonNull(corpus, "corpus");
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    if (totalRequests < 1) {
      throw new IllegalArgumentException("totalRequests must be >= 1");
    }
  }

  public static HttpLoadPlan from(String runId, HttpLoadCfg cfg, RequestCorpus corpus) {
    return new HttpLoadPlan(
        runId,
        cfg.getUrl(),
        cfg.getMethod(),
        cfg.getConcurrency(),
        cfg.getRequests(),
        cfg.getReportInterval(),
        corpus);
  }
}
