package com.mk.fx.qa.httpload.metrics;

import com.mk.fx.qa.httpload.report.ReportListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically turns the live worker state into a report and a trend sample.
 *
 * <p>State machine: {@code NEW -> RUNNING -> STOPPED}. While running, a single scheduler thread
 * fires every {@code interval}, obtains a report from the report source, appends a trend sample
 * when the report has latency data and passes the report to the listener. {@link #stop()} cancels
 * the timer and runs exactly one final cycle on the same thread before returning, so a final report
 * exists even when the timer never fired.
 *
 * <p>Samples are written only on the scheduler thread and handed out only once it has terminated.
 */
@Slf4j
public final class TrendRecorder {

  /** Lifecycle of a recorder. */
  public enum State {
    NEW,
    RUNNING,
    STOPPED
  }

  private final String runId;
  private final Duration interval;
  private final Supplier<LoadReport> reportSource;
  private final ReportListener listener;

  private final List<TrendSample> samples = new ArrayList<>();

  private volatile State state = State.NEW;
  private volatile TrendHistory history;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> ticker;

  /**
   * @param runId identifier used for the thread name and logs
   * @param interval wall-clock cadence of the periodic cycles
   * @param reportSource produces a report from the current worker state
   * @param listener receives every report, periodic and final
   */
  public TrendRecorder(
      String runId, Duration interval, Supplier<LoadReport> reportSource, ReportListener listener) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.reportSource = Objects.requireNonNull(reportSource, "reportSource");
    this.listener = Objects.requireNonNull(listener, "listener");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  /** Starts the periodic cycles. */
  public synchronized void start() {
    if (state != State.NEW) {
      throw new IllegalStateException("TrendRecorder already " + state);
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("trend-recorder-" + runId);
              t.setDaemon(true);
              return t;
            });
    var periodNanos = interval.toNanos();
    ticker =
        scheduler.scheduleAtFixedRate(
            this::periodicCycle, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
    state = State.RUNNING;
    log.debug("Run {} trend recorder started, interval {}", runId, interval);
  }

  /**
   * Stops the periodic cycles and runs the final one.
   *
   * @return the final report
   * @throws InterruptedException if interrupted while waiting for the final cycle
   * @throws IllegalStateException if the recorder is not running or the final cycle failed
   */
  public synchronized LoadReport stop() throws InterruptedException {
    if (state != State.RUNNING) {
      throw new IllegalStateException("TrendRecorder is " + state + ", expected RUNNING");
    }
    ticker.cancel(false);
    var finalCycle = scheduler.submit(() -> cycle(true));
    try {
      return finalCycle.get();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Final report cycle failed for run " + runId, e.getCause());
    } finally {
      scheduler.shutdown();
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Run {} trend recorder did not terminate within 5s", runId);
        scheduler.shutdownNow();
      }
      history = TrendHistory.of(samples);
      state = State.STOPPED;
      log.debug("Run {} trend recorder stopped with {} samples", runId, history.size());
    }
  }

  /**
   * Stops the periodic cycles without a final report, for runs that failed. The history of an
   * aborted recorder is empty. Does nothing unless the recorder is running.
   */
  public synchronized void abort() {
    if (state != State.RUNNING) {
      return;
    }
    ticker.cancel(false);
    scheduler.shutdownNow();
    history = TrendHistory.of(List.of());
    state = State.STOPPED;
    log.debug("Run {} trend recorder aborted", runId);
  }

  public State state() {
    return state;
  }

  /**
   * Returns the recorded trend series.
   *
   * @throws IllegalStateException unless the recorder has stopped
   */
  public TrendHistory history() {
    if (state != State.STOPPED) {
      throw new IllegalStateException("Trend history is available once stopped, recorder is " + state);
    }
    return history;
  }

  private void periodicCycle() {
    try {
      cycle(false);
    } catch (RuntimeException e) {
      // an escaping exception would cancel the schedule
      log.error("Run {} periodic report cycle failed", runId, e);
    }
  }

  private LoadReport cycle(boolean finalCycle) {
    var report = reportSource.get();
    TrendSample.from(report).ifPresent(samples::add);
    listener.onReport(report, finalCycle);
    return report;
  }
}
