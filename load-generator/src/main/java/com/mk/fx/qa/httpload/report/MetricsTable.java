package com.mk.fx.qa.httpload.report;

import java.util.ArrayList;
import java.util.List;

/** Renders a two-column {@code Metric | Value} table with ASCII borders. */
final class MetricsTable {

  private static final String[] HEADER = {"METRIC", "VALUE"};

  private final List<String[]> rows = new ArrayList<>();

  MetricsTable row(String metric, String value) {
    rows.add(new String[] {metric, value});
    return this;
  }

  String render() {
    var widths = new int[] {HEADER[0].length(), HEADER[1].length()};
    for (String[] row : rows) {
      widths[0] = Math.max(widths[0], row[0].length());
      widths[1] = Math.max(widths[1], row[1].length());
    }
    var border = border(widths);
    var sb = new StringBuilder();
    sb.append(border);
    sb.append(line(HEADER, widths));
    sb.append(border);
    for (String[] row : rows) {
      sb.append(line(row, widths));
    }
    sb.append(border);
    return sb.toString();
  }

  private static String border(int[] widths) {
    return "+" + "-".repeat(widths[0] + 2) + "+" + "-".repeat(widths[1] + 2) + "+\n";
  }

  private static String line(String[] cells, int[] widths) {
    return "| "
        + pad(cells[0], widths[0])
        + " | "
        + pad(cells[1], widths[1])
        + " |\n";
  }

  private static String pad(String value, int width) {
    return value + " ".repeat(width - value.length());
  }
}
