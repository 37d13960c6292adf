package com.mk.fx.qa.httpload.executors.closed;

import static java.util.concurrent.Executors.newFixedThreadPool;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes a "closed" load model where a fixed number of workers drain a shared {@link WorkClaim}.
 * Each worker repeatedly claims the next unit and processes it until the claim reports exhaustion,
 * so an uneven remainder of {@code totalRequests / workers} is spread over whichever workers are
 * free first.
 *
 * <p>Threading: Creates a fixed thread pool sized to the number of workers. Each worker runs on one
 * pool thread for its whole lifetime, and the only state shared between workers is the claim.
 * {@link #execute} returns after every worker has finished, which makes everything the workers
 * wrote visible to the caller.
 */
@Slf4j
public final class ClosedLoadExecutor {

  private ClosedLoadExecutor() {
    throw new UnsupportedOperationException("ClosedLoadExecutor cannot be instantiated");
  }

  /**
   * Runs a closed model execution.
   *
   * @param runId identifier used for thread names and logs
   * @param parameters execution parameters (workers, request budget)
   * @param claim shared source of work units
   * @param cancellationRequested supplier checked before every claim
   * @param unitRunner callback invoked for each claimed unit
   * @return summary result including worker completion and processed unit counts
   * @throws InterruptedException if interrupted while waiting for the workers
   */
  public static ClosedLoadResult execute(
      String runId,
      ClosedLoadParameters parameters,
      WorkClaim claim,
      BooleanSupplier cancellationRequested,
      WorkUnitRunner unitRunner)
      throws InterruptedException {
    validate(runId, parameters, claim, cancellationRequested, unitRunner);

    var workers = Math.max(1, parameters.workers());
    var cancellationObserved = new AtomicBoolean(false);
    var completedWorkers = new AtomicInteger();
    var processedUnits = new AtomicLong();

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-worker-" + runId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(workers, threadFactory);
    List<Future<?>> futures = new ArrayList<>(workers);

    try {
      log.info(
          "Run {} starting {} workers for {} requests",
          runId,
          workers,
          parameters.totalRequests());
      for (int workerIndex = 0; workerIndex < workers; workerIndex++) {
        final var currentWorker = workerIndex;
        futures.add(
            executor.submit(
                () ->
                    runWorker(
                        runId,
                        workers,
                        currentWorker,
                        claim,
                        cancellationRequested,
                        cancellationObserved,
                        completedWorkers,
                        processedUnits,
                        unitRunner)));
      }
      waitForWorkers(futures, runId);
    } finally {
      executor.shutdownNow();
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Run {} worker pool did not terminate within 30s", runId);
      }
    }

    return new ClosedLoadResult(
        workers, completedWorkers.get(), processedUnits.get(), cancellationObserved.get());
  }

  /** Validates mandatory inputs for a closed execution. */
  private static void validate(
      String runId,
      ClosedLoadParameters parameters,
      WorkClaim claim,
      BooleanSupplier cancellationRequested,
      WorkUnitRunner unitRunner) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(claim, "claim");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    Objects.requireNonNull(unitRunner, "unitRunner");
  }

  /** Claims and processes units until the claim is exhausted, honouring cancellation. */
  private static void runWorker(
      String runId,
      int totalWorkers,
      int workerIndex,
      WorkClaim claim,
      BooleanSupplier cancellationRequested,
      AtomicBoolean cancellationObserved,
      AtomicInteger completedWorkers,
      AtomicLong processedUnits,
      WorkUnitRunner unitRunner) {
    log.debug("Run {} worker {} started", runId, workerIndex + 1);
    long processed = 0;

    while (true) {
      if (shouldStop(cancellationRequested, cancellationObserved)) {
        log.info(
            "Run {} worker {} stopping due to cancellation ({} units processed)",
            runId,
            workerIndex + 1,
            processed);
        return;
      }

      var next = claim.claimNext();
      if (next.isEmpty()) {
        break;
      }

      try {
        unitRunner.run(workerIndex, next.getAsLong());
        processed++;
        processedUnits.incrementAndGet();
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        log.info(
            "Run {} worker {} interrupted at unit {} ({} units processed)",
            runId,
            workerIndex + 1,
            next.getAsLong(),
            processed);
        return;
      } catch (RuntimeException ex) {
        log.error(
            "Run {} worker {} unit {} failed: {} - stopping this worker ({} units processed)",
            runId,
            workerIndex + 1,
            next.getAsLong(),
            ex.getMessage(),
            processed,
            ex);
        // Stop this worker but let others continue
        return;
      }
    }

    var done = completedWorkers.incrementAndGet();
    log.debug(
        "Run {} worker {} finished after {} units (workers finished {}/{})",
        runId,
        workerIndex + 1,
        processed,
        done,
        totalWorkers);
  }

  /** Waits for all submitted workers to finish. */
  private static void waitForWorkers(List<Future<?>> futures, String runId)
      throws InterruptedException {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      } catch (CancellationException ignored) {
        log.debug("Run {} worker future cancelled", runId);
      } catch (ExecutionException ex) {
        // runWorker handles its own failures; reaching here means an Error escaped
        throw new IllegalStateException("Worker failed in run " + runId, ex.getCause());
      }
    }
  }

  /** Returns true if current thread is interrupted or external cancellation is signalled. */
  private static boolean shouldStop(BooleanSupplier cancelled, AtomicBoolean cancellationObserved) {
    var requested = Thread.currentThread().isInterrupted() || cancelled.getAsBoolean();
    if (requested) {
      cancellationObserved.set(true);
    }
    return requested;
  }
}
