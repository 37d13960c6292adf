package com.mk.fx.qa.httpload.metrics;

import java.util.Optional;

/**
 * One trend observation. Latencies are whole milliseconds, truncated.
 *
 * @param tps successful requests per second
 * @param qps attempted requests per second
 * @param p50Ms p50 latency in milliseconds
 * @param p95Ms p95 latency in milliseconds
 * @param p99Ms p99 latency in milliseconds
 */
public record TrendSample(double tps, double qps, double p50Ms, double p95Ms, double p99Ms) {

  public static final TrendSample ZERO = new TrendSample(0, 0, 0, 0, 0);

  /** Builds a sample from a report, or nothing when the report has no latency data. */
  public static Optional<TrendSample> from(LoadReport report) {
    return report
        .percentiles()
        .map(
            p ->
                new TrendSample(
                    report.tps(),
                    report.qps(),
                    p.p50().toMillis(),
                    p.p95().toMillis(),
                    p.p99().toMillis()));
  }
}
