package com.mk.fx.qa.httpload.metrics;

import com.mk.fx.qa.httpload.http.ExchangeResult;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statistics accumulated by exactly one worker.
 *
 * <p>The first thread that records into an instance becomes its owner and any other thread that
 * tries to record is rejected, so workers can never write into each other's records. Readers (the
 * aggregator) copy the record under its monitor, which is only ever contended by the owner and a
 * single reader, never by another worker.
 */
public final class WorkerStat {

  private static final int MAX_INITIAL_CAPACITY = 1 << 20;

  private final int workerIndex;

  private long totalRequests;
  private long successRequests;
  private long failedRequests;
  private long totalTimeNanos;
  private long[] responseTimesNanos;
  private int responseTimeCount;
  private final Map<Integer, Long> statusCodes = new HashMap<>();

  private Thread owner;

  /**
   * @param workerIndex zero-based index of the owning worker
   * @param expectedRequests capacity hint for the latency buffer
   */
  public WorkerStat(int workerIndex, int expectedRequests) {
    this.workerIndex = workerIndex;
    this.responseTimesNanos = new long[Math.max(16, Math.min(expectedRequests, MAX_INITIAL_CAPACITY))];
  }

  public int workerIndex() {
    return workerIndex;
  }

  /**
   * Records one completed unit of work.
   *
   * @param result classified outcome of the exchange
   * @param wallTime time spent on the whole unit, including request construction
   * @throws IllegalStateException if called from a thread other than the owning worker
   */
  public synchronized void record(ExchangeResult result, Duration wallTime) {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(wallTime, "wallTime");
    checkOwner();

    totalRequests++;
    if (result.success()) {
      successRequests++;
    } else {
      failedRequests++;
    }
    if (result.responded()) {
      statusCodes.merge(result.statusCode(), 1L, Long::sum);
      appendResponseTime(result.latency().toNanos());
    }
    totalTimeNanos += Math.max(0, wallTime.toNanos());
  }

  /** Adds this record's state to the builder as one consistent copy. */
  synchronized void copyInto(GlobalSnapshot.Builder builder) {
    builder.add(
        totalRequests,
        successRequests,
        failedRequests,
        totalTimeNanos,
        responseTimesNanos,
        responseTimeCount,
        statusCodes);
  }

  public synchronized long totalRequests() {
    return totalRequests;
  }

  public synchronized long successRequests() {
    return successRequests;
  }

  public synchronized long failedRequests() {
    return failedRequests;
  }

  public synchronized int responseTimeCount() {
    return responseTimeCount;
  }

  private void appendResponseTime(long nanos) {
    if (responseTimeCount == responseTimesNanos.length) {
      responseTimesNanos = Arrays.copyOf(responseTimesNanos, responseTimesNanos.length * 2);
    }
    responseTimesNanos[responseTimeCount++] = nanos;
  }

  private void checkOwner() {
    var current = Thread.currentThread();
    if (owner == null) {
      owner = current;
    } else if (owner != current) {
      throw new IllegalStateException(
          "WorkerStat "
              + workerIndex
              + " is owned by "
              + owner.getName()
              + ", rejected write from "
              + current.getName());
    }
  }
}
