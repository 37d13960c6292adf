package com.mk.fx.qa.httpload.report;

import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/** Logs run progress each time another tenth of the request budget has completed. */
@Slf4j
public final class LoggingProgressListener implements ProgressListener {

  private final String runId;
  private final long total;
  private final long step;
  private final AtomicLong completed = new AtomicLong();

  public LoggingProgressListener(String runId, long total) {
    this.runId = runId;
    this.total = total;
    this.step = Math.max(1, total / 10);
  }

  @Override
  public void advance() {
    var done = completed.incrementAndGet();
    if (done % step == 0 || done == total) {
      log.info(
          "Run {} progress: {}/{} ({}%)",
          runId, done, total, total > 0 ? done * 100 / total : 100);
    }
  }

  public long completed() {
    return completed.get();
  }
}
