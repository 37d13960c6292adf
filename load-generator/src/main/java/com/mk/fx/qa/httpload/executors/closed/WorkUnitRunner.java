package com.mk.fx.qa.httpload.executors.closed;

/**
 * Callback used by {@link ClosedLoadExecutor} to process one claimed work unit on a worker thread.
 * Implementations absorb expected per-unit failures themselves. Throwing a runtime exception ends
 * the current worker, while other workers keep draining the budget.
 */
@FunctionalInterface
public interface WorkUnitRunner {
  /**
   * Processes one unit.
   *
   * @param workerIndex zero-based index of the worker that claimed the unit
   * @param unitIndex one-based index of the claimed unit
   * @throws InterruptedException if the worker is interrupted while processing
   */
  void run(int workerIndex, long unitIndex) throws InterruptedException;
}
