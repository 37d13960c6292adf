package com.mk.fx.qa.httpload.executors.closed;

/**
 * Represents the result of a closed load execution.
 *
 * @param totalWorkers The number of workers started.
 * @param completedWorkers The number of workers that ran until the budget was exhausted.
 * @param processedUnits The number of units processed by all workers.
 * @param cancelled Indicates if the execution was cancelled before the budget was exhausted.
 */
public record ClosedLoadResult(
    int totalWorkers, int completedWorkers, long processedUnits, boolean cancelled) {}
