package com.mk.fx.qa.httpload.service;

import com.mk.fx.qa.httpload.executors.closed.ClosedLoadExecutor;
import com.mk.fx.qa.httpload.executors.closed.ClosedLoadParameters;
import com.mk.fx.qa.httpload.executors.closed.ClosedLoadResult;
import com.mk.fx.qa.httpload.executors.closed.RequestBudget;
import com.mk.fx.qa.httpload.http.RequestExecutor;
import com.mk.fx.qa.httpload.http.TransportPool;
import com.mk.fx.qa.httpload.metrics.LoadReport;
import com.mk.fx.qa.httpload.metrics.StatsAggregator;
import com.mk.fx.qa.httpload.metrics.TrendRecorder;
import com.mk.fx.qa.httpload.metrics.WorkerStat;
import com.mk.fx.qa.httpload.report.ProgressListener;
import com.mk.fx.qa.httpload.report.ReportListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one load test: workers drain a shared request budget through the transport pool, each into
 * its own {@link WorkerStat}, while a {@link TrendRecorder} reports on the live state. When the
 * budget is exhausted the recorder produces the final report and the trend history.
 */
@Slf4j
public class HttpLoadEngine {

  private final TransportPool transports;
  private final RequestExecutor executor;
  private final ReportListener reportListener;
  private final ProgressListener progress;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public HttpLoadEngine(
      TransportPool transports,
      RequestExecutor executor,
      ReportListener reportListener,
      ProgressListener progress) {
    this.transports = Objects.requireNonNull(transports, "transports");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.reportListener = Objects.requireNonNull(reportListener, "reportListener");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  /**
   * Runs the plan to completion.
   *
   * @throws InterruptedException if interrupted while waiting for workers or the final report
   */
  public HttpLoadOutcome run(HttpLoadPlan plan) throws InterruptedException {
    Objects.requireNonNull(plan, "plan");
    cancelled.set(false);

    var expectedPerWorker =
        (int) Math.min(Integer.MAX_VALUE, plan.totalRequests() / plan.concurrency() + 1);
    List<WorkerStat> stats = new ArrayList<>(plan.concurrency());
    for (int i = 0; i < plan.concurrency(); i++) {
      stats.add(new WorkerStat(i, expectedPerWorker));
    }
    var budget = new RequestBudget(plan.totalRequests());

    var startedAt = System.nanoTime();
    var recorder =
        new TrendRecorder(
            plan.runId(),
            plan.reportInterval(),
            () ->
                LoadReport.of(
                    StatsAggregator.aggregate(stats),
                    Duration.ofNanos(System.nanoTime() - startedAt)),
            reportListener);

    recorder.start();
    ClosedLoadResult execution;
    try {
      execution =
          ClosedLoadExecutor.execute(
              plan.runId(),
              new ClosedLoadParameters(plan.concurrency(), plan.totalRequests()),
              budget,
              cancelled::get,
              (workerIndex, unitIndex) -> runUnit(plan, stats.get(workerIndex)));
    } catch (InterruptedException | RuntimeException e) {
      log.warn("Run {} aborted: {}", plan.runId(), e.toString());
      recorder.abort();
      throw e;
    }

    var finalReport = recorder.stop();
    var history = recorder.history().ensureNonEmpty();
    log.info(
        "Run {} finished: {} of {} workers completed, {} requests processed{}",
        plan.runId(),
        execution.completedWorkers(),
        execution.totalWorkers(),
        execution.processedUnits(),
        execution.cancelled() ? " (cancelled)" : "");
    return new HttpLoadOutcome(finalReport, history, execution);
  }

  /** Asks the workers to stop after their current request. */
  public void cancel() {
    cancelled.set(true);
  }

  private void runUnit(HttpLoadPlan plan, WorkerStat stat) {
    var unitStartedAt = System.nanoTime();
    var spec = plan.corpus().sample(plan.defaultUrl());
    var client = transports.client(transports.select());
    var result = executor.execute(client, transports.deadline(), spec, plan.method());
    stat.record(result, Duration.ofNanos(System.nanoTime() - unitStartedAt));
    progress.advance();
  }
}
