package com.mk.fx.qa.httpload.metrics;

import java.util.Collection;
import java.util.Objects;

/**
 * Folds worker records into a {@link GlobalSnapshot}.
 *
 * <p>Safe to call while workers are still recording: each record is copied under its own monitor,
 * so a counter increment is never seen without the latency it belongs to. Different records may be
 * copied at slightly different instants; the snapshot is not a single atomic cut across workers.
 */
public final class StatsAggregator {

  private StatsAggregator() {
    throw new UnsupportedOperationException("StatsAggregator cannot be instantiated");
  }

  public static GlobalSnapshot aggregate(Collection<WorkerStat> workerStats) {
    Objects.requireNonNull(workerStats, "workerStats");
    var builder = new GlobalSnapshot.Builder();
    for (WorkerStat stat : workerStats) {
      stat.copyInto(builder);
    }
    return builder.build();
  }
}
