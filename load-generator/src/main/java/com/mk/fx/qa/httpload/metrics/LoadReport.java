package com.mk.fx.qa.httpload.metrics;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Metrics of one report cycle derived from a {@link GlobalSnapshot}.
 *
 * @param snapshot the aggregated worker state
 * @param elapsed time since the run started
 * @param tps successful requests per elapsed second
 * @param qps attempted requests per elapsed second
 * @param percentiles latency percentiles, empty when no latency has been recorded yet
 */
public record LoadReport(
    GlobalSnapshot snapshot,
    Duration elapsed,
    double tps,
    double qps,
    Optional<LatencyPercentiles> percentiles) {

  public LoadReport {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(elapsed, "elapsed");
    Objects.requireNonNull(percentiles, "percentiles");
  }

  /** Builds the report, sorting the snapshot's latencies once for all three percentiles. */
  public static LoadReport of(GlobalSnapshot snapshot, Duration elapsed) {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(elapsed, "elapsed");
    var seconds = elapsed.toNanos() / 1_000_000_000.0;
    var tps = seconds > 0 ? snapshot.successRequests() / seconds : 0.0;
    var qps = seconds > 0 ? snapshot.totalRequests() / seconds : 0.0;
    Optional<LatencyPercentiles> percentiles =
        snapshot.hasLatencies()
            ? Optional.of(LatencyPercentiles.of(snapshot.sortedLatenciesNanos()))
            : Optional.empty();
    return new LoadReport(snapshot, elapsed, tps, qps, percentiles);
  }

  public boolean hasLatencyData() {
    return percentiles.isPresent();
  }
}
