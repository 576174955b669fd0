package io.clusterprobe.status;

import io.clusterprobe.aggregation.Aggregator;
import io.clusterprobe.models.Result;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Periodic status annotation for one run.
 *
 * <p>Each delay is the interval plus a random share of up to {@code jitterFactor} intervals,
 * drawn after the previous annotation finished. The loop stops on its own after the first
 * annotation that observes a complete run. Otherwise {@link #close()} cancels it and makes
 * the final annotation. Either way exactly one terminal annotation happens.
 */
@Slf4j
public class AnnotationLoop implements AutoCloseable {

    private final StatusAnnotator annotator;
    private final Aggregator aggregator;
    private final Duration interval;
    private final double jitterFactor;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    // Guarded by lock
    private ScheduledFuture<?> nextTick;
    private boolean stopped;
    private int annotations;

    AnnotationLoop(StatusAnnotator annotator, Aggregator aggregator, Duration interval, double jitterFactor,
                   ScheduledExecutorService scheduler) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("annotation interval must be positive: " + interval);
        }
        if (jitterFactor < 0) {
            throw new IllegalArgumentException("jitter factor must not be negative: " + jitterFactor);
        }
        this.annotator = annotator;
        this.aggregator = aggregator;
        this.interval = interval;
        this.jitterFactor = jitterFactor;
        this.scheduler = scheduler;
    }

    void start() {
        synchronized (lock) {
            nextTick = scheduler.schedule(this::tick, 0L, TimeUnit.NANOSECONDS);
        }
        log.info("Started status annotation for {} every {} (jitter {})",
            annotator.getTarget(), interval, jitterFactor);
    }

    private void tick() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            boolean complete = aggregator.isComplete();
            List<Result> results = aggregator.results();
            annotator.annotate(results);
            annotations++;
            if (complete) {
                stopped = true;
                log.info("Run complete, status annotation finished after {} updates", annotations);
                return;
            }
            try {
                nextTick = scheduler.schedule(this::tick, nextDelay().toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Annotation scheduler shut down, periodic status updates stopped");
            }
        }
    }

    Duration nextDelay() {
        return jitteredDelay(interval, jitterFactor, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * {@code interval + sample * jitterFactor * interval} for a sample in [0, 1).
     */
    static Duration jitteredDelay(Duration interval, double jitterFactor, double sample) {
        long base = interval.toNanos();
        return Duration.ofNanos(base + (long) (sample * jitterFactor * base));
    }

    public boolean isStopped() {
        synchronized (lock) {
            return stopped;
        }
    }

    int annotations() {
        synchronized (lock) {
            return annotations;
        }
    }

    /**
     * Cancel the schedule and write the final status, unless the loop already did. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (nextTick != null) {
                nextTick.cancel(false);
            }
            annotator.annotate(aggregator.results());
            annotations++;
            log.info("Status annotation stopped after {} updates", annotations);
        }
    }
}
