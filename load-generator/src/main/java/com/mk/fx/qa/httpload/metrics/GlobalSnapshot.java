package com.mk.fx.qa.httpload.metrics;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable sum of all worker statistics at one point in time. Counters are summed, status codes
 * merged by key and latencies concatenated in worker order.
 */
public final class GlobalSnapshot {

  private static final GlobalSnapshot EMPTY = new Builder().build();

  private final long totalRequests;
  private final long successRequests;
  private final long failedRequests;
  private final Duration totalTime;
  private final long[] latenciesNanos;
  private final SortedMap<Integer, Long> statusCodes;

  private GlobalSnapshot(Builder builder) {
    this.totalRequests = builder.totalRequests;
    this.successRequests = builder.successRequests;
    this.failedRequests = builder.failedRequests;
    this.totalTime = Duration.ofNanos(builder.totalTimeNanos);
    this.latenciesNanos = Arrays.copyOf(builder.latenciesNanos, builder.latencyCount);
    this.statusCodes = Collections.unmodifiableSortedMap(new TreeMap<>(builder.statusCodes));
  }

  public static GlobalSnapshot empty() {
    return EMPTY;
  }

  public long totalRequests() {
    return totalRequests;
  }

  public long successRequests() {
    return successRequests;
  }

  public long failedRequests() {
    return failedRequests;
  }

  /** Sum of the wall time every worker spent on its units. */
  public Duration totalTime() {
    return totalTime;
  }

  /** Status code to occurrence count, ordered by status code. */
  public SortedMap<Integer, Long> statusCodes() {
    return statusCodes;
  }

  public int latencyCount() {
    return latenciesNanos.length;
  }

  public boolean hasLatencies() {
    return latenciesNanos.length > 0;
  }

  /** Latencies in nanoseconds, in aggregation order. */
  public long[] latenciesNanos() {
    return latenciesNanos.clone();
  }

  /** Latencies in nanoseconds, sorted ascending. */
  public long[] sortedLatenciesNanos() {
    var sorted = latenciesNanos.clone();
    Arrays.sort(sorted);
    return sorted;
  }

  @Override
  public String toString() {
    return "GlobalSnapshot{total="
        + totalRequests
        + ", success="
        + successRequests
        + ", failed="
        + failedRequests
        + ", latencies="
        + latenciesNanos.length
        + ", statusCodes="
        + statusCodes
        + '}';
  }

  /** Accumulates worker records; used by {@link StatsAggregator}. */
  static final class Builder {
    private long totalRequests;
    private long successRequests;
    private long failedRequests;
    private long totalTimeNanos;
    private long[] latenciesNanos = new long[0];
    private int latencyCount;
    private final Map<Integer, Long> statusCodes = new TreeMap<>();

    Builder add(
        long total,
        long success,
        long failed,
        long timeNanos,
        long[] latencies,
        int latencyCountToCopy,
        Map<Integer, Long> codes) {
      totalRequests += total;
      successRequests += success;
      failedRequests += failed;
      totalTimeNanos += timeNanos;
      appendLatencies(latencies, latencyCountToCopy);
      codes.forEach((code, count) -> statusCodes.merge(code, count, Long::sum));
      return this;
    }

    private void appendLatencies(long[] source, int count) {
      if (count <= 0) {
        return;
      }
      var required = latencyCount + count;
      if (required > latenciesNanos.length) {
        latenciesNanos = Arrays.copyOf(latenciesNanos, Math.max(required, latenciesNanos.length * 2));
      }
      System.arraycopy(source, 0, latenciesNanos, latencyCount, count);
      latencyCount = required;
    }

    GlobalSnapshot build() {
      return new GlobalSnapshot(this);
    }
  }
}
