package io.clusterprobe.aggregation;

import io.clusterprobe.metrics.MetricsProvider;
import io.clusterprobe.models.ExpectedResult;
import io.clusterprobe.models.Result;
import io.clusterprobe.store.JsonFileResultStore;
import io.clusterprobe.store.ResultStore;
import io.clusterprobe.transport.SubmissionHandler;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which expected results of a run have been filled.
 *
 * <p>Every slot starts pending and is filled at most once: the first matching result wins,
 * later results for the same slot and results matching no slot are dropped. All state sits
 * behind a single lock; waiters are woken on every fill.
 */
@Slf4j
public class Aggregator implements SubmissionHandler {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition filledCondition = lock.newCondition();

    // Guarded by lock. A null value marks a pending slot.
    private final Map<ExpectedResult, Result> slots = new LinkedHashMap<>();
    // Pending slots whose first result is being stored
    private final Set<ExpectedResult> claimed = new HashSet<>();
    private final List<Result> results = new ArrayList<>();
    private int pending;

    private final List<ExpectedResult> expectedResults;
    private final ResultStore resultStore;
    private final MetricsProvider metricsProvider;

    public Aggregator(Path outputDir, Collection<ExpectedResult> expectedResults, MetricsProvider metricsProvider) {
        this(expectedResults, new JsonFileResultStore(outputDir), metricsProvider);
    }

    public Aggregator(Collection<ExpectedResult> expectedResults, ResultStore resultStore,
                      MetricsProvider metricsProvider) {
        for (ExpectedResult expected : expectedResults) {
            slots.putIfAbsent(expected, null);
        }
        this.expectedResults = List.copyOf(slots.keySet());
        this.pending = slots.size();
        this.resultStore = resultStore;
        this.metricsProvider = metricsProvider;
        metricsProvider.setPendingResults(pending);
        log.info("Aggregator tracking {} expected results", pending);
    }

    /**
     * Fill the slot matching the result's (producer, locus, kind) if it is still pending.
     * The result is stored before the slot counts as filled, so waiters never see a complete
     * run whose last result is not yet persisted. Safe to call from any thread.
     */
    @Override
    public SubmissionOutcome handleSubmission(Result result) {
        ExpectedResult key = result.key();
        SubmissionOutcome outcome;
        boolean alreadyComplete;
        lock.lock();
        try {
            alreadyComplete = pending == 0;
            if (!slots.containsKey(key)) {
                outcome = SubmissionOutcome.UNEXPECTED;
            } else if (slots.get(key) != null || !claimed.add(key)) {
                outcome = SubmissionOutcome.DUPLICATE;
            } else {
                outcome = SubmissionOutcome.ACCEPTED;
            }
        } finally {
            lock.unlock();
        }

        metricsProvider.recordSubmission(outcome);
        switch (outcome) {
            case ACCEPTED:
                store(result);
                fill(key, result);
                break;
            case DUPLICATE:
                log.info("Dropping {}duplicate result from {} for {} ({})",
                    alreadyComplete ? "late " : "", result.getProducer(), result.getLocus(), result.getKind());
                break;
            default:
                log.info("Dropping {}unexpected result from {} for {} ({})",
                    alreadyComplete ? "late " : "", result.getProducer(), result.getLocus(), result.getKind());
                break;
        }
        return outcome;
    }

    private void fill(ExpectedResult key, Result result) {
        int remaining;
        lock.lock();
        try {
            claimed.remove(key);
            slots.put(key, result);
            results.add(result);
            remaining = --pending;
            metricsProvider.setPendingResults(remaining);
            filledCondition.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Received result from {} for {} ({}), error: {}, {} pending",
            result.getProducer(), result.getLocus(), result.getKind(), result.getError(), remaining);
    }

    /**
     * Feed results from the queue through the same fill logic until the queue is closed and
     * drained, or the calling thread is interrupted.
     */
    public void ingest(ResultQueue queue) {
        log.info("Starting result ingestion");
        try {
            Result result;
            while ((result = queue.take()) != null) {
                handleSubmission(result);
            }
            log.info("Result queue closed, ingestion finished");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Result ingestion interrupted");
        }
    }

    public boolean isComplete() {
        lock.lock();
        try {
            return pending == 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until every slot is filled. Interrupting the waiting thread is the stop signal.
     */
    public void awaitCompletion() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending > 0) {
                filledCondition.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until every slot is filled or the timeout elapses.
     *
     * @return true if the run is complete
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (pending > 0) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = filledCondition.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of filled results in the order they were accepted.
     */
    public List<Result> results() {
        lock.lock();
        try {
            return List.copyOf(results);
        } finally {
            lock.unlock();
        }
    }

    public List<ExpectedResult> expectedResults() {
        return expectedResults;
    }

    public List<ExpectedResult> pendingResults() {
        lock.lock();
        try {
            List<ExpectedResult> pendingSlots = new ArrayList<>();
            for (Map.Entry<ExpectedResult, Result> slot : slots.entrySet()) {
                if (slot.getValue() == null) {
                    pendingSlots.add(slot.getKey());
                }
            }
            return List.copyOf(pendingSlots);
        } finally {
            lock.unlock();
        }
    }

    private void store(Result result) {
        try {
            resultStore.save(result);
        } catch (Exception e) {
            log.error("Failed to store result from {} for {}: {}",
                result.getProducer(), result.getLocus(), e.getMessage(), e);
        }
    }
}
