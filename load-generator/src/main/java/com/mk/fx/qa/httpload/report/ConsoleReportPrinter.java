package com.mk.fx.qa.httpload.report;

import com.mk.fx.qa.httpload.metrics.LatencyPercentiles;
import com.mk.fx.qa.httpload.metrics.LoadReport;
import com.mk.fx.qa.httpload.metrics.TrendHistory;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes reports to the log: a metrics table and the status-code breakdown per cycle, and line
 * charts of the trend series at the end of the run.
 */
@Slf4j
public class ConsoleReportPrinter implements ReportListener {

  static final String INSUFFICIENT_DATA = "Not enough data for statistics";

  private static final int RATE_CHART_HEIGHT = 10;
  private static final int LATENCY_CHART_HEIGHT = 5;

  @Override
  public void onReport(LoadReport report, boolean finalReport) {
    var snapshot = report.snapshot();
    if (report.percentiles().isEmpty()) {
      log.warn(
          "{}{} (requests={}, success={}, failed={})",
          finalReport ? "Final report: " : "",
          INSUFFICIENT_DATA,
          snapshot.totalRequests(),
          snapshot.successRequests(),
          snapshot.failedRequests());
      if (finalReport) {
        log.info("\n{}", renderStatusCodes(snapshot.statusCodes()));
      }
      return;
    }
    var sb = new StringBuilder();
    if (finalReport) {
      sb.append("Test completed! Final statistics:\n");
    }
    sb.append(renderTable(report, report.percentiles().get()));
    sb.append(renderStatusCodes(snapshot.statusCodes()));
    log.info("\n{}", sb);
  }

  @Override
  public void onTrendHistory(TrendHistory history) {
    var sb = new StringBuilder();
    appendChart(sb, "TPS Trend:", history.tps(), RATE_CHART_HEIGHT);
    appendChart(sb, "QPS Trend:", history.qps(), RATE_CHART_HEIGHT);
    sb.append("\nResponse Time Trend (ms):\n");
    appendChart(sb, "P50:", history.p50Ms(), LATENCY_CHART_HEIGHT);
    appendChart(sb, "P95:", history.p95Ms(), LATENCY_CHART_HEIGHT);
    appendChart(sb, "P99:", history.p99Ms(), LATENCY_CHART_HEIGHT);
    log.info("\n{}", sb);
  }

  static String renderTable(LoadReport report, LatencyPercentiles percentiles) {
    var snapshot = report.snapshot();
    return new MetricsTable()
        .row("Total Requests", Long.toString(snapshot.totalRequests()))
        .row("Success Requests", Long.toString(snapshot.successRequests()))
        .row("Failed Requests", Long.toString(snapshot.failedRequests()))
        .row("TPS", String.format(Locale.ROOT, "%.2f", report.tps()))
        .row("QPS", String.format(Locale.ROOT, "%.2f", report.qps()))
        .row("P50", percentiles.p50().toMillis() + " ms")
        .row("P95", percentiles.p95().toMillis() + " ms")
        .row("P99", percentiles.p99().toMillis() + " ms")
        .render();
  }

  static String renderStatusCodes(Map<Integer, Long> statusCodes) {
    var sb = new StringBuilder("HTTP Status Code Statistics:\n");
    if (statusCodes.isEmpty()) {
      sb.append("  (no responses received)\n");
    }
    statusCodes.forEach(
        (code, count) -> sb.append("  - ").append(code).append(": ").append(count).append(" times\n"));
    return sb.toString();
  }

  private static void appendChart(StringBuilder sb, String title, List<Double> series, int height) {
    sb.append('\n').append(title).append('\n');
    sb.append(AsciiLineChart.plot(series, height)).append('\n');
  }
}
