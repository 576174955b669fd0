package io.clusterprobe.orchestration;

import io.clusterprobe.aggregation.Aggregator;
import io.clusterprobe.aggregation.ResultQueue;
import io.clusterprobe.certs.CertificateAuthority;
import io.clusterprobe.certs.CertificateAuthorityException;
import io.clusterprobe.certs.ClientIdentity;
import io.clusterprobe.certs.ServerTlsConfig;
import io.clusterprobe.cluster.ClusterClient;
import io.clusterprobe.enums.RunState;
import io.clusterprobe.metrics.MetricsProvider;
import io.clusterprobe.models.AggregationConfig;
import io.clusterprobe.models.ExpectedResult;
import io.clusterprobe.models.Result;
import io.clusterprobe.models.RunTimeline;
import io.clusterprobe.status.AnnotationLoop;
import io.clusterprobe.status.StatusAnnotator;
import io.clusterprobe.transport.ResultTransport;
import io.clusterprobe.workloads.Workload;
import io.clusterprobe.workloads.WorkloadResults;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static io.clusterprobe.config.Constants.TRANSPORT_DRAIN_SECONDS;

/**
 * Runs one aggregation: dispatches workloads, collects their results over the mTLS
 * transport and decides when the run is over.
 *
 * <p>A run ends in exactly one of three ways. It completes once every expected result is
 * filled. It times out when the hard deadline passes first. It fails when the transport
 * stops underneath it. Before the hard deadline a grace deadline asks every workload to
 * clean up, after which the run keeps waiting.
 */
@Slf4j
public class Orchestrator {

    private static final int SCHEDULER_THREADS = 2;

    private final AggregationConfig config;
    private final ClusterClient clusterClient;
    private final MetricsProvider metricsProvider;

    private volatile RunState state = RunState.RUNNING;

    public Orchestrator(AggregationConfig config, ClusterClient clusterClient, MetricsProvider metricsProvider) {
        this.config = config;
        this.clusterClient = clusterClient;
        this.metricsProvider = metricsProvider;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Run the given workloads to completion.
     *
     * @return {@link RunState#COMPLETED} once every expected result has been filled
     * @throws AggregationSetupException if the run could not be set up
     * @throws RunTimeoutException if the hard deadline passed first
     * @throws TransportFailureException if the result transport stopped first
     */
    public RunState run(List<? extends Workload> workloads) throws AggregationException {
        long startNanos = System.nanoTime();
        state = RunState.RUNNING;
        if (workloads.isEmpty()) {
            log.info("No workloads requested, nothing to aggregate");
            state = RunState.COMPLETED;
            record("completed", startNanos);
            return state;
        }
        try {
            checkUniqueNames(workloads);
            RunState outcome = execute(workloads, startNanos);
            record(outcome.name().toLowerCase(Locale.ROOT), startNanos);
            return outcome;
        } catch (AggregationSetupException e) {
            log.error("Failed to set up aggregation run: {}", e.getMessage(), e);
            record("setup_failed", startNanos);
            throw e;
        } catch (AggregationException e) {
            record(state.name().toLowerCase(Locale.ROOT), startNanos);
            throw e;
        }
    }

    private RunState execute(List<? extends Workload> workloads, long startNanos) throws AggregationException {
        RunTimeline timeline = config.getTimeline();

        List<String> nodes;
        try {
            nodes = clusterClient.listNodes();
        } catch (Exception e) {
            throw new AggregationSetupException("couldn't list cluster nodes: " + e.getMessage(), e);
        }
        List<ExpectedResult> expected = expectedResults(workloads, nodes);
        log.info("Running {} workloads on {} nodes, expecting {} results", workloads.size(), nodes.size(), expected.size());

        ServerTlsConfig serverConfig;
        Map<String, ClientIdentity> identities = new LinkedHashMap<>();
        try {
            CertificateAuthority authority = CertificateAuthority.create();
            serverConfig = authority.serverConfig(config.getAdvertiseAddress());
            for (Workload workload : workloads) {
                identities.put(workload.getName(), authority.clientIdentity(workload.getName()));
            }
        } catch (CertificateAuthorityException e) {
            throw new AggregationSetupException("couldn't set up run certificates: " + e.getMessage(), e);
        }

        Aggregator aggregator = new Aggregator(config.getOutputDir(), expected, metricsProvider);
        ResultQueue queue = new ResultQueue(Math.max(1, expected.size()));
        BlockingQueue<RunEvent> events = new LinkedBlockingQueue<>();
        ExecutorService tasks = Executors.newCachedThreadPool(namedDaemon("run-task-"));
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(SCHEDULER_THREADS, namedDaemon("run-scheduler-"));
        ResultTransport transport = new ResultTransport(
            config.getBindAddress(), config.getBindPort(), serverConfig, aggregator, metricsProvider);
        StatusAnnotator annotator = new StatusAnnotator(
            expected, config.getNamespace(), config.getStatusTarget(), clusterClient, metricsProvider);

        Future<?> watcher = null;
        try {
            watcher = tasks.submit(() -> watchCompletion(aggregator, events));
            transport.termination().whenComplete((ignored, error) -> events.offer(RunEvent.transportTerminated(error)));
            transport.start();

            try (AnnotationLoop annotationLoop = annotator.start(
                    aggregator, timeline.getAnnotationInterval(), timeline.getJitterFactor(), scheduler)) {
                tasks.submit(() -> aggregator.ingest(queue));
                dispatch(workloads, nodes, expected, identities, queue, tasks);
                armDeadlines(timeline, startNanos, scheduler, events);
                return awaitTermination(events, workloads, aggregator, transport, watcher, timeline);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregationException("interrupted while running workloads", e);
        } finally {
            transport.close();
            if (watcher != null) {
                watcher.cancel(true);
            }
            queue.close();
            tasks.shutdownNow();
            scheduler.shutdownNow();
        }
    }

    private RunState awaitTermination(BlockingQueue<RunEvent> events, List<? extends Workload> workloads,
                                      Aggregator aggregator, ResultTransport transport, Future<?> watcher,
                                      RunTimeline timeline) throws AggregationException, InterruptedException {
        Set<RunEvent.Type> handled = EnumSet.noneOf(RunEvent.Type.class);
        while (true) {
            RunEvent event = events.take();
            if (!handled.add(event.getType())) {
                log.debug("Ignoring repeated {} event", event.getType());
                continue;
            }
            switch (event.getType()) {
                case GRACE_DEADLINE:
                    state = RunState.GRACEFULLY_STOPPING;
                    log.info("Grace deadline reached with {} results pending, cleaning up workloads",
                        aggregator.pendingResults().size());
                    WorkloadCleanup.cleanup(clusterClient, workloads);
                    log.info("Workload cleanup attempted, waiting for remaining results until the hard deadline");
                    state = RunState.RUNNING;
                    break;
                case HARD_DEADLINE:
                    state = RunState.TIMED_OUT;
                    transport.close();
                    watcher.cancel(true);
                    List<ExpectedResult> pending = aggregator.pendingResults();
                    log.error("Run timed out after {} with {} of {} results pending",
                        timeline.getTotalTimeout(), pending.size(), aggregator.expectedResults().size());
                    throw new RunTimeoutException(timeline.getTotalTimeout(), pending);
                case TRANSPORT_TERMINATED:
                    state = RunState.SERVER_FAILED;
                    watcher.cancel(true);
                    log.error("Result transport terminated before the run finished");
                    throw new TransportFailureException("result transport terminated", event.getCause());
                case COMPLETED:
                    state = RunState.COMPLETED;
                    log.info("All {} expected results received", aggregator.expectedResults().size());
                    // Let the exchange that delivered the last result send its acknowledgement
                    transport.stop(Duration.ofSeconds(TRANSPORT_DRAIN_SECONDS));
                    return state;
                default:
                    throw new IllegalStateException("unknown run event " + event.getType());
            }
        }
    }

    private void dispatch(List<? extends Workload> workloads, List<String> nodes, List<ExpectedResult> expected,
                          Map<String, ClientIdentity> identities, ResultQueue queue, ExecutorService tasks)
            throws InterruptedException {
        for (Workload workload : workloads) {
            try {
                log.info("Dispatching workload {}", workload.getName());
                workload.run(clusterClient, config.getAdvertiseAddress(), identities.get(workload.getName()));
            } catch (Exception e) {
                log.error("Failed to dispatch workload {}: {}", workload.getName(), e.getMessage(), e);
                List<Result> surrogates = WorkloadResults.errorResults(
                    workload, expected, "failed to dispatch workload: " + e.getMessage());
                for (Result surrogate : surrogates) {
                    queue.put(surrogate);
                }
                continue;
            }
            tasks.submit(() -> monitor(workload, nodes, queue));
        }
    }

    private void monitor(Workload workload, List<String> nodes, ResultQueue queue) {
        try {
            workload.monitor(clusterClient, nodes, queue);
        } catch (RuntimeException e) {
            if (queue.isClosed()) {
                log.debug("Monitor for workload {} stopped after the run ended", workload.getName());
            } else {
                log.error("Monitor for workload {} failed: {}", workload.getName(), e.getMessage(), e);
            }
        }
    }

    private static void watchCompletion(Aggregator aggregator, BlockingQueue<RunEvent> events) {
        try {
            aggregator.awaitCompletion();
            events.offer(RunEvent.of(RunEvent.Type.COMPLETED));
        } catch (InterruptedException e) {
            log.debug("Completion watcher stopped");
        }
    }

    private static void armDeadlines(RunTimeline timeline, long startNanos, ScheduledExecutorService scheduler,
                                     BlockingQueue<RunEvent> events) {
        if (!timeline.hasDeadline()) {
            log.info("No run timeout configured, waiting for all results");
            return;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        scheduler.schedule(() -> events.offer(RunEvent.of(RunEvent.Type.GRACE_DEADLINE)),
            remaining(timeline.graceDeadline(), elapsed), TimeUnit.NANOSECONDS);
        scheduler.schedule(() -> events.offer(RunEvent.of(RunEvent.Type.HARD_DEADLINE)),
            remaining(timeline.getTotalTimeout(), elapsed), TimeUnit.NANOSECONDS);
        log.info("Run deadlines armed: cleanup at {}, timeout at {}", timeline.graceDeadline(), timeline.getTotalTimeout());
    }

    private static long remaining(Duration deadline, Duration elapsed) {
        return Math.max(0L, deadline.minus(elapsed).toNanos());
    }

    /**
     * Union of every workload's expectations over the node set, first-seen order kept.
     */
    static List<ExpectedResult> expectedResults(List<? extends Workload> workloads, List<String> nodes) {
        Set<ExpectedResult> expected = new LinkedHashSet<>();
        for (Workload workload : workloads) {
            expected.addAll(workload.expectedResults(nodes));
        }
        return List.copyOf(expected);
    }

    private static void checkUniqueNames(List<? extends Workload> workloads) throws AggregationSetupException {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (Workload workload : workloads) {
            if (!seen.add(workload.getName())) {
                duplicates.add(workload.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new AggregationSetupException("workloads requested more than once: " + duplicates);
        }
    }

    private void record(String outcome, long startNanos) {
        metricsProvider.recordRun(outcome, System.nanoTime() - startNanos);
    }

    private static ThreadFactory namedDaemon(String prefix) {
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + t.getId());
            t.setDaemon(true);
            return t;
        };
    }
}
