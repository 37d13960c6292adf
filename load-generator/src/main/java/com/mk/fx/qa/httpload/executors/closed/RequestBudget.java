package com.mk.fx.qa.httpload.executors.closed;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed request budget claimed by atomic increment. Indices {@code 1..total} are each handed out
 * exactly once; every later claim observes exhaustion.
 */
public final class RequestBudget implements WorkClaim {

  private final long total;
  private final AtomicLong claimed = new AtomicLong();

  public RequestBudget(long total) {
    if (total < 0) {
      throw new IllegalArgumentException("Request budget must be >= 0");
    }
    this.total = total;
  }

  @Override
  public OptionalLong claimNext() {
    var index = claimed.incrementAndGet();
    return index <= total ? OptionalLong.of(index) : OptionalLong.empty();
  }

  public long total() {
    return total;
  }

  /** Number of units handed out so far, never above {@link #total()}. */
  public long claimedCount() {
    return Math.min(claimed.get(), total);
  }
}
