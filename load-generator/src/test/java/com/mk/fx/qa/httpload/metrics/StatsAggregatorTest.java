package com.mk.fx.qa.httpload.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.httpload.http.ExchangeResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StatsAggregatorTest {

  private static WorkerStat stat(int index, int... statusCodes) {
    var stat = new WorkerStat(index, statusCodes.length);
    for (int i = 0; i < statusCodes.length; i++) {
      var result =
          statusCodes[i] == 0
              ? ExchangeResult.noResponse()
              : ExchangeResult.received(statusCodes[i], Duration.ofMillis(10L * (index + 1) + i));
      stat.record(result, Duration.ofMillis(1));
    }
    return stat;
  }

  @Test
  void aggregate_sumsCountersAndMergesStatusCodes() {
    var a = stat(0, 200, 200, 500);
    var b = stat(1, 200, 0, 404);

    var snapshot = StatsAggregator.aggregate(List.of(a, b));

    assertEquals(6, snapshot.totalRequests());
    assertEquals(3, snapshot.successRequests());
    assertEquals(3, snapshot.failedRequests());
    assertEquals(5, snapshot.latencyCount());
    assertEquals(Duration.ofMillis(6), snapshot.totalTime());
    assertThat(snapshot.statusCodes())
        .containsExactly(entry(200, 3L), entry(404, 1L), entry(500, 1L));
  }

  @Test
  void aggregate_isIndependentOfWorkerOrder() {
    var a = stat(0, 200, 201, 503);
    var b = stat(1, 0, 200);
    var c = stat(2, 302);

    var forward = StatsAggregator.aggregate(List.of(a, b, c));
    var reversed = StatsAggregator.aggregate(List.of(c, b, a));

    assertEquals(forward.totalRequests(), reversed.totalRequests());
    assertEquals(forward.successRequests(), reversed.successRequests());
    assertEquals(forward.failedRequests(), reversed.failedRequests());
    assertEquals(forward.statusCodes(), reversed.statusCodes());
    assertArrayEquals(forward.sortedLatenciesNanos(), reversed.sortedLatenciesNanos());
  }

  @Test
  void aggregate_ofNothing_isEmpty() {
    var snapshot = StatsAggregator.aggregate(List.of());

    assertEquals(0, snapshot.totalRequests());
    assertFalse(snapshot.hasLatencies());
    assertTrue(snapshot.statusCodes().isEmpty());
    assertEquals(GlobalSnapshot.empty().toString(), snapshot.toString());
  }

  @Test
  void snapshot_isDetachedFromLaterRecords() {
    var a = stat(0, 200);
    var snapshot = StatsAggregator.aggregate(List.of(a));

    a.record(ExchangeResult.received(200, Duration.ofMillis(1)), Duration.ofMillis(1));

    assertEquals(1, snapshot.totalRequests());
    assertEquals(1, snapshot.latencyCount());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.statusCodes().put(1, 1L));
  }

  @Test
  void concurrentAggregation_neverSeesTornRecords() throws Exception {
    int writers = 4;
    int recordsPerWriter = 20_000;
    List<WorkerStat> stats = new ArrayList<>();
    for (int i = 0; i < writers; i++) {
      stats.add(new WorkerStat(i, 16));
    }

    ExecutorService pool = Executors.newFixedThreadPool(writers);
    var start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (WorkerStat stat : stats) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < recordsPerWriter; i++) {
                    var result =
                        switch (i % 3) {
                          case 0 -> ExchangeResult.received(200, Duration.ofNanos(i + 1));
                          case 1 -> ExchangeResult.received(500, Duration.ofNanos(i + 1));
                          default -> ExchangeResult.noResponse();
                        };
                    stat.record(result, Duration.ofNanos(10));
                  }
                  return null;
                }));
      }

      start.countDown();
      long previousTotal = 0;
      int snapshots = 0;
      while (!futures.stream().allMatch(Future::isDone) || snapshots == 0) {
        var snapshot = StatsAggregator.aggregate(stats);
        assertConsistent(snapshot);
        assertTrue(snapshot.totalRequests() >= previousTotal);
        previousTotal = snapshot.totalRequests();

        var report = LoadReport.of(snapshot, Duration.ofMillis(1 + snapshots));
        assertTrue(report.tps() >= 0);
        assertTrue(report.qps() >= 0);
        assertTrue(report.tps() <= report.qps());
        snapshots++;
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    var last = StatsAggregator.aggregate(stats);
    assertConsistent(last);
    assertEquals((long) writers * recordsPerWriter, last.totalRequests());
    assertEquals(writers * (recordsPerWriter / 3 + 1), last.successRequests());
  }

  private static void assertConsistent(GlobalSnapshot snapshot) {
    assertEquals(
        snapshot.totalRequests(),
        snapshot.successRequests() + snapshot.failedRequests(),
        snapshot::toString);
    long responded = snapshot.statusCodes().values().stream().mapToLong(Long::longValue).sum();
    assertEquals(responded, snapshot.latencyCount(), snapshot::toString);
  }
}
