package com.mk.fx.qa.httpload;

import com.mk.fx.qa.httpload.cfg.HttpLoadCfg;
import com.mk.fx.qa.httpload.corpus.RequestCorpusLoader;
import com.mk.fx.qa.httpload.http.RequestExecutor;
import com.mk.fx.qa.httpload.http.TransportKind;
import com.mk.fx.qa.httpload.http.TransportPool;
import com.mk.fx.qa.httpload.report.ConsoleReportPrinter;
import com.mk.fx.qa.httpload.report.LoggingProgressListener;
import com.mk.fx.qa.httpload.service.HttpLoadEngine;
import com.mk.fx.qa.httpload.service.HttpLoadOutcome;
import com.mk.fx.qa.httpload.service.HttpLoadPlan;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the configured load test once the application context is ready. The exit code is 0 for
 * every completed run, whatever its failure rate, and 130 when the run was interrupted.
 */
@Slf4j
@Component
@ConditionalOnProperty(
    prefix = "http-load",
    name = "run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class HttpLoadRunner implements CommandLineRunner, ExitCodeGenerator {

  private final HttpLoadCfg cfg;
  private final RequestCorpusLoader corpusLoader;

  private volatile int exitCode;

  public HttpLoadRunner(HttpLoadCfg cfg, RequestCorpusLoader corpusLoader) {
    this.cfg = cfg;
    this.corpusLoader = corpusLoader;
  }

  @Override
  public void run(String... args) throws Exception {
    var runId = UUID.randomUUID().toString().substring(0, 8);
    var corpus = corpusLoader.loadOrEmpty(cfg.getBodyFile());
    logBanner(runId, corpus.size());

    var plan = HttpLoadPlan.from(runId, cfg, corpus);
    var printer = new ConsoleReportPrinter();

    try (var transports = TransportPool.create(cfg.transportSettings(), cfg.getKeepAliveRatio())) {
      var engine =
          new HttpLoadEngine(
              transports,
              new RequestExecutor(cfg.getUserAgent() == null ? "" : cfg.getUserAgent()),
              printer,
              new LoggingProgressListener(runId, cfg.getRequests()));
      HttpLoadOutcome outcome;
      try {
        outcome = engine.run(plan);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        exitCode = 130;
        log.warn("Run {} interrupted", runId);
        return;
      }
      printer.onTrendHistory(outcome.history());
      log.info(
          "Run {} transport usage: keep-alive={} no-keep-alive={}",
          runId,
          transports.selectionCount(TransportKind.KEEP_ALIVE),
          transports.selectionCount(TransportKind.NO_KEEP_ALIVE));
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private void logBanner(String runId, int corpusSize) {
    var sb = new StringBuilder();
    sb.append("Starting load test run ").append(runId).append('\n');
    sb.append("  Target URL: ").append(cfg.getUrl()).append('\n');
    sb.append("  Method: ").append(cfg.getMethod()).append('\n');
    sb.append("  Concurrency: ").append(cfg.getConcurrency()).append('\n');
    sb.append("  Total requests: ").append(cfg.getRequests()).append('\n');
    sb.append("  Keep-alive ratio: ")
        .append(String.format(Locale.ROOT, "%.0f%%", cfg.getKeepAliveRatio() * 100))
        .append('\n');
    sb.append("  Report interval: ").append(cfg.getReportInterval());
    if (cfg.getBodyFile() != null && !cfg.getBodyFile().isBlank()) {
      sb.append('\n').append("  Body file: ").append(cfg.getBodyFile());
    }
    sb.append('\n').append("  Corpus entries: ").append(corpusSize);
    log.info("{}", sb);
  }
}
