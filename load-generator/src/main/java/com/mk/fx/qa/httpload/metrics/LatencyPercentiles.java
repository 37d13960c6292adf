package com.mk.fx.qa.httpload.metrics;

import java.time.Duration;

/** The p50, p95 and p99 latencies of one report cycle. */
public record LatencyPercentiles(Duration p50, Duration p95, Duration p99) {

  /** Computes the three percentiles from latencies sorted ascending. */
  public static LatencyPercentiles of(long[] sortedNanos) {
    return new LatencyPercentiles(
        Percentiles.percentile(sortedNanos, 50),
        Percentiles.percentile(sortedNanos, 95),
        Percentiles.percentile(sortedNanos, 99));
  }
}
