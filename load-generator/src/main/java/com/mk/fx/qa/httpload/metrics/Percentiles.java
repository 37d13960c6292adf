package com.mk.fx.qa.httpload.metrics;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Objects;

/**
 * Nearest-rank percentile estimation over a latency set sorted ascending.
 *
 * <p>The rank is {@code floor(n * p / 100)} clamped to {@code n - 1}; there is no interpolation
 * between neighbouring samples. With 100 samples {@code 1..100} this yields 51 for p50, 96 for p95
 * and 100 for p99.
 */
public final class Percentiles {

  private Percentiles() {
    throw new UnsupportedOperationException("Percentiles cannot be instantiated");
  }

  /**
   * Returns the nearest-rank percentile.
   *
   * @param sortedNanos latencies in nanoseconds, sorted ascending by the caller
   * @param percent percentile in {@code [0, 100]}
   * @return the selected latency, {@link Duration#ZERO} for an empty input
   * @throws IllegalArgumentException if {@code percent} is outside {@code [0, 100]}
   */
  public static Duration percentile(long[] sortedNanos, double percent) {
    Objects.requireNonNull(sortedNanos, "sortedNanos");
    if (Double.isNaN(percent) || percent < 0 || percent > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    if (sortedNanos.length == 0) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(sortedNanos[index(sortedNanos.length, percent)]);
  }

  @VisibleForTesting
  static int index(int size, double percent) {
    var index = (int) Math.floor(size * percent / 100.0);
    return Math.min(index, size - 1);
  }
}
