package com.mk.fx.qa.httpload.report;

import com.mk.fx.qa.httpload.metrics.LoadReport;
import com.mk.fx.qa.httpload.metrics.TrendHistory;

/** Receives the reports of a run. Called from the trend recorder thread, then from the driver. */
public interface ReportListener {

  /**
   * Called once per report cycle.
   *
   * @param report metrics of the cycle
   * @param finalReport true for the single report produced after all workers finished
   */
  void onReport(LoadReport report, boolean finalReport);

  /** Called once at the end of the run with series that each hold at least one sample. */
  default void onTrendHistory(TrendHistory history) {}
}
