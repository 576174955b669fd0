package io.clusterprobe.aggregation;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.clusterprobe.metrics.MetricsProvider;
import io.clusterprobe.models.ExpectedResult;
import io.clusterprobe.models.Result;
import io.clusterprobe.store.ResultStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.clusterprobe.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AggregatorTest {

    private static final List<ExpectedResult> EXPECTED = List.of(
        ExpectedResult.forNode("systemd-logs", "node-1", "systemd-logs"),
        ExpectedResult.forNode("systemd-logs", "node-2", "systemd-logs"),
        ExpectedResult.global("e2e", "e2e"));

    @Mock
    private ResultStore resultStore;

    private SimpleMeterRegistry registry;
    private MetricsProvider metricsProvider;
    private Aggregator aggregator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsProvider = new MetricsProvider(registry, "test");
        aggregator = new Aggregator(EXPECTED, resultStore, metricsProvider);
    }

    private static Result fill(ExpectedResult slot, String value) {
        return Result.builder()
            .producer(slot.getProducer())
            .locus(slot.getLocus())
            .kind(slot.getKind())
            .payload(JsonNodeFactory.instance.objectNode().put("value", value))
            .build();
    }

    @Test
    void testAllSlotsStartPending() {
        assertThat(aggregator.isComplete()).isFalse();
        assertThat(aggregator.pendingResults()).containsExactlyElementsOf(EXPECTED);
        assertThat(aggregator.expectedResults()).containsExactlyElementsOf(EXPECTED);
        assertThat(aggregator.results()).isEmpty();
        assertThat(registry.get(PENDING_RESULTS_METRIC_NAME).gauge().value()).isEqualTo(3.0);
    }

    @Test
    void testEmptyExpectationIsComplete() throws Exception {
        Aggregator empty = new Aggregator(List.of(), resultStore, metricsProvider);

        assertThat(empty.isComplete()).isTrue();
        assertThat(empty.awaitCompletion(Duration.ZERO)).isTrue();
    }

    @Test
    void testDuplicateExpectationsCollapse() {
        List<ExpectedResult> expected = new ArrayList<>(EXPECTED);
        expected.add(ExpectedResult.global("e2e", "e2e"));

        Aggregator collapsed = new Aggregator(expected, resultStore, metricsProvider);

        assertThat(collapsed.expectedResults()).hasSize(3);
    }

    @Test
    void testCompletesAfterEveryDistinctSubmission() {
        for (int i = 0; i < EXPECTED.size(); i++) {
            assertThat(aggregator.isComplete()).isFalse();
            assertThat(aggregator.handleSubmission(fill(EXPECTED.get(i), "v" + i)))
                .isEqualTo(SubmissionOutcome.ACCEPTED);
        }

        assertThat(aggregator.isComplete()).isTrue();
        assertThat(aggregator.pendingResults()).isEmpty();
        assertThat(aggregator.results()).extracting(Result::key).containsExactlyElementsOf(EXPECTED);
        assertThat(registry.get(PENDING_RESULTS_METRIC_NAME).gauge().value()).isEqualTo(0.0);
    }

    @Test
    void testAwaitCompletionReturnsOnlyAfterLastSubmission() throws Exception {
        CountDownLatch returned = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                aggregator.awaitCompletion();
                returned.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        aggregator.handleSubmission(fill(EXPECTED.get(0), "a"));
        aggregator.handleSubmission(fill(EXPECTED.get(1), "b"));
        assertThat(returned.await(200, TimeUnit.MILLISECONDS)).isFalse();

        aggregator.handleSubmission(fill(EXPECTED.get(2), "c"));

        assertThat(returned.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.join(5000);
    }

    @Test
    void testTimedAwaitReportsPendingRun() throws Exception {
        aggregator.handleSubmission(fill(EXPECTED.get(0), "a"));

        assertThat(aggregator.awaitCompletion(Duration.ofMillis(50))).isFalse();
    }

    @Test
    void testAwaitCompletionStopsOnInterrupt() throws Exception {
        AtomicBoolean interrupted = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                aggregator.awaitCompletion();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        waiter.start();

        waiter.interrupt();
        waiter.join(5000);

        assertThat(waiter.isAlive()).isFalse();
        assertThat(interrupted).isTrue();
        assertThat(aggregator.isComplete()).isFalse();
    }

    @Test
    void testFirstWriterWins() {
        ExpectedResult slot = EXPECTED.get(0);

        assertThat(aggregator.handleSubmission(fill(slot, "first"))).isEqualTo(SubmissionOutcome.ACCEPTED);
        assertThat(aggregator.handleSubmission(fill(slot, "second"))).isEqualTo(SubmissionOutcome.DUPLICATE);

        assertThat(aggregator.results()).hasSize(1);
        assertThat(aggregator.results().get(0).getPayload().get("value").asText()).isEqualTo("first");
        assertThat(aggregator.pendingResults()).hasSize(2);
    }

    @Test
    void testUnexpectedSubmissionIsDropped() {
        Result stray = Result.builder().producer("unknown").locus("node-9").kind("unknown").build();

        assertThat(aggregator.handleSubmission(stray)).isEqualTo(SubmissionOutcome.UNEXPECTED);

        assertThat(aggregator.results()).isEmpty();
        assertThat(aggregator.pendingResults()).hasSize(3);
    }

    @Test
    void testLateSubmissionAfterCompletionIsDropped() {
        for (ExpectedResult slot : EXPECTED) {
            aggregator.handleSubmission(fill(slot, "v"));
        }

        assertThat(aggregator.handleSubmission(fill(EXPECTED.get(2), "late"))).isEqualTo(SubmissionOutcome.DUPLICATE);
        assertThat(aggregator.results()).hasSize(3);
        assertThat(aggregator.isComplete()).isTrue();
    }

    @Test
    void testSubmissionOutcomesAreCounted() {
        aggregator.handleSubmission(fill(EXPECTED.get(0), "a"));
        aggregator.handleSubmission(fill(EXPECTED.get(0), "b"));
        aggregator.handleSubmission(Result.builder().producer("x").kind("x").build());

        assertThat(registry.get(SUBMISSIONS_METRIC_NAME).tag(OUTCOME_TAG, "accepted").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(SUBMISSIONS_METRIC_NAME).tag(OUTCOME_TAG, "duplicate").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(SUBMISSIONS_METRIC_NAME).tag(OUTCOME_TAG, "unexpected").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testOnlyAcceptedResultsAreStored() throws Exception {
        Result first = fill(EXPECTED.get(0), "first");
        aggregator.handleSubmission(first);
        aggregator.handleSubmission(fill(EXPECTED.get(0), "second"));

        verify(resultStore, times(1)).save(any(Result.class));
        verify(resultStore).save(first);
    }

    @Test
    void testStoreFailureDoesNotRejectResult() throws Exception {
        doThrow(new IOException("disk full")).when(resultStore).save(any(Result.class));

        assertThat(aggregator.handleSubmission(fill(EXPECTED.get(0), "a"))).isEqualTo(SubmissionOutcome.ACCEPTED);
        assertThat(aggregator.pendingResults()).hasSize(2);
    }

    @Test
    void testRunCompletesOnlyAfterLastResultIsStored() throws Exception {
        Aggregator single = new Aggregator(List.of(EXPECTED.get(2)), resultStore, metricsProvider);
        CountDownLatch saving = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            saving.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(resultStore).save(any(Result.class));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SubmissionOutcome> submitted = executor.submit(
                () -> single.handleSubmission(fill(EXPECTED.get(2), "last")));
            assertThat(saving.await(10, TimeUnit.SECONDS)).isTrue();

            assertThat(single.isComplete()).isFalse();
            assertThat(single.awaitCompletion(Duration.ofMillis(100))).isFalse();
            assertThat(single.results()).isEmpty();
            assertThat(single.handleSubmission(fill(EXPECTED.get(2), "racing"))).isEqualTo(SubmissionOutcome.DUPLICATE);

            release.countDown();
            assertThat(submitted.get(10, TimeUnit.SECONDS)).isEqualTo(SubmissionOutcome.ACCEPTED);
            assertThat(single.awaitCompletion(Duration.ofSeconds(10))).isTrue();
            assertThat(single.results()).hasSize(1);
            assertThat(single.results().get(0).getPayload().get("value").asText()).isEqualTo("last");
            verify(resultStore, times(1)).save(any(Result.class));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void testResultsSnapshotIsStable() {
        aggregator.handleSubmission(fill(EXPECTED.get(0), "a"));
        List<Result> snapshot = aggregator.results();

        aggregator.handleSubmission(fill(EXPECTED.get(1), "b"));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(fill(EXPECTED.get(2), "c")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testConcurrentSubmissionsFillEachSlotOnce() throws Exception {
        List<ExpectedResult> expected = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            expected.add(ExpectedResult.forNode("systemd-logs", "node-" + i, "systemd-logs"));
        }
        Aggregator concurrent = new Aggregator(expected, resultStore, metricsProvider);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<SubmissionOutcome>> outcomes = new ArrayList<>();
            for (int writer = 0; writer < 4; writer++) {
                String value = "writer-" + writer;
                for (ExpectedResult slot : expected) {
                    outcomes.add(executor.submit(() -> concurrent.handleSubmission(fill(slot, value))));
                }
            }
            int accepted = 0;
            for (Future<SubmissionOutcome> outcome : outcomes) {
                if (outcome.get(5, TimeUnit.SECONDS) == SubmissionOutcome.ACCEPTED) {
                    accepted++;
                }
            }

            assertThat(accepted).isEqualTo(expected.size());
            assertThat(concurrent.isComplete()).isTrue();
            assertThat(concurrent.results()).extracting(Result::key).doesNotHaveDuplicates();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testIngestAppliesQueuedResultsUntilClosed() throws Exception {
        ResultQueue queue = new ResultQueue(EXPECTED.size());
        Thread ingestion = new Thread(() -> aggregator.ingest(queue));
        ingestion.start();

        for (ExpectedResult slot : EXPECTED) {
            queue.put(fill(slot, "queued"));
        }
        assertThat(aggregator.awaitCompletion(Duration.ofSeconds(5))).isTrue();

        queue.close();
        ingestion.join(5000);
        assertThat(ingestion.isAlive()).isFalse();
    }

    @Test
    void testIngestStopsOnInterrupt() throws Exception {
        ResultQueue queue = new ResultQueue(1);
        Thread ingestion = new Thread(() -> aggregator.ingest(queue));
        ingestion.start();

        ingestion.interrupt();
        ingestion.join(5000);

        assertThat(ingestion.isAlive()).isFalse();
    }

    @Test
    void testOutputDirConstructorStoresResultsAsJson(@TempDir Path outputDir) throws Exception {
        Aggregator withFiles = new Aggregator(outputDir, EXPECTED, metricsProvider);

        withFiles.handleSubmission(fill(EXPECTED.get(2), "done"));

        assertThat(Files.exists(outputDir.resolve("plugins/e2e/results/global.json"))).isTrue();
    }
}
