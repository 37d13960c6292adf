package com.mk.fx.qa.httpload.report;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Plots a series as an ASCII line chart with a value axis on the left.
 *
 * <p>Each sample occupies one column; vertical moves between neighbouring samples are joined with
 * {@code |}. Series longer than {@link #MAX_WIDTH} are thinned to evenly spaced samples.
 */
public final class AsciiLineChart {

  static final int MAX_WIDTH = 100;

  private AsciiLineChart() {
    throw new UnsupportedOperationException("AsciiLineChart cannot be instantiated");
  }

  /**
   * Renders the chart.
   *
   * @param series values to plot, at least one
   * @param height number of rows above the lowest one
   * @return the chart, one line per row, without a trailing newline
   */
  public static String plot(List<Double> series, int height) {
    Objects.requireNonNull(series, "series");
    if (series.isEmpty()) {
      throw new IllegalArgumentException("series must contain at least one value");
    }
    if (height < 1) {
      throw new IllegalArgumentException("height must be >= 1");
    }

    var values = thin(series);
    var min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0);
    var max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0);
    var range = max - min;

    var grid = new char[height + 1][values.size()];
    for (char[] row : grid) {
      Arrays.fill(row, ' ');
    }

    var previousRow = -1;
    for (int x = 0; x < values.size(); x++) {
      var row = rowOf(values.get(x), min, range, height);
      grid[row][x] = '*';
      if (previousRow >= 0) {
        for (int r = Math.min(row, previousRow) + 1; r < Math.max(row, previousRow); r++) {
          grid[r][x] = '|';
        }
      }
      previousRow = row;
    }

    var labels = new String[height + 1];
    var labelWidth = 0;
    for (int row = 0; row <= height; row++) {
      var value = range == 0 ? min : min + range * row / height;
      labels[row] = String.format(Locale.ROOT, "%.2f", value);
      labelWidth = Math.max(labelWidth, labels[row].length());
    }

    var lines = new ArrayList<String>(height + 1);
    for (int row = height; row >= 0; row--) {
      var label = " ".repeat(labelWidth - labels[row].length()) + labels[row];
      lines.add(label + " |" + stripTrailing(grid[row]));
    }
    return String.join("\n", lines);
  }

  /** Row 0 is the bottom of the chart. A flat series is drawn on the bottom row. */
  @VisibleForTesting
  static int rowOf(double value, double min, double range, int height) {
    if (range == 0) {
      return 0;
    }
    var row = (int) Math.round((value - min) / range * height);
    return Math.max(0, Math.min(height, row));
  }

  private static List<Double> thin(List<Double> series) {
    if (series.size() <= MAX_WIDTH) {
      return series;
    }
    var thinned = new ArrayList<Double>(MAX_WIDTH);
    var stride = (series.size() - 1) / (double) (MAX_WIDTH - 1);
    for (int i = 0; i < MAX_WIDTH; i++) {
      thinned.add(series.get((int) Math.round(i * stride)));
    }
    return thinned;
  }

  private static String stripTrailing(char[] row) {
    return new String(row).stripTrailing();
  }
}
