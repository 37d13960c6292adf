package com.mk.fx.qa.httpload.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The five trend series of a finished run, oldest sample first. Immutable.
 *
 * @param tps successful requests per second
 * @param qps attempted requests per second
 * @param p50Ms p50 latency in milliseconds
 * @param p95Ms p95 latency in milliseconds
 * @param p99Ms p99 latency in milliseconds
 */
public record TrendHistory(
    List<Double> tps, List<Double> qps, List<Double> p50Ms, List<Double> p95Ms, List<Double> p99Ms) {

  public TrendHistory {
    tps = List.copyOf(Objects.requireNonNull(tps, "tps"));
    qps = List.copyOf(Objects.requireNonNull(qps, "qps"));
    p50Ms = List.copyOf(Objects.requireNonNull(p50Ms, "p50Ms"));
    p95Ms = List.copyOf(Objects.requireNonNull(p95Ms, "p95Ms"));
    p99Ms = List.copyOf(Objects.requireNonNull(p99Ms, "p99Ms"));
  }

  /** Splits samples into the five parallel series, keeping their order. */
  public static TrendHistory of(List<TrendSample> samples) {
    var tps = new ArrayList<Double>(samples.size());
    var qps = new ArrayList<Double>(samples.size());
    var p50 = new ArrayList<Double>(samples.size());
    var p95 = new ArrayList<Double>(samples.size());
    var p99 = new ArrayList<Double>(samples.size());
    for (TrendSample sample : samples) {
      tps.add(sample.tps());
      qps.add(sample.qps());
      p50.add(sample.p50Ms());
      p95.add(sample.p95Ms());
      p99.add(sample.p99Ms());
    }
    return new TrendHistory(tps, qps, p50, p95, p99);
  }

  /** Returns a history in which every empty series holds a single zero sample. */
  public TrendHistory ensureNonEmpty() {
    return new TrendHistory(
        orZero(tps), orZero(qps), orZero(p50Ms), orZero(p95Ms), orZero(p99Ms));
  }

  /** Number of samples in the longest series. */
  public int size() {
    return Math.max(
        tps.size(),
        Math.max(qps.size(), Math.max(p50Ms.size(), Math.max(p95Ms.size(), p99Ms.size()))));
  }

  private static List<Double> orZero(List<Double> series) {
    return series.isEmpty() ? List.of(0.0) : series;
  }
}
