package com.mk.fx.qa.httpload.service;

import com.mk.fx.qa.httpload.executors.closed.ClosedLoadResult;
import com.mk.fx.qa.httpload.metrics.LoadReport;
import com.mk.fx.qa.httpload.metrics.TrendHistory;

/**
 * Result of a finished run.
 *
 * @param finalReport report of the final cycle, covering every recorded request
 * @param history trend series, each holding at least one value
 * @param execution worker completion summary
 */
public record HttpLoadOutcome(
    LoadReport finalReport, TrendHistory history, ClosedLoadResult execution) {}
