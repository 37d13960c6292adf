package com.mk.fx.qa.httpload.executors.closed;

import java.util.OptionalLong;

/**
 * Source of work units shared by all workers of a closed execution. Each successful claim hands out
 * a unit index that no other caller will ever receive.
 */
@FunctionalInterface
public interface WorkClaim {

  /**
   * Claims the next unit.
   *
   * @return the claimed one-based unit index, or empty once the budget is exhausted
   */
  OptionalLong claimNext();
}
