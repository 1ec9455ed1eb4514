package com.docqueue.test;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.BaseProcessor;
import com.docqueue.core.ClaimedJob;
import com.docqueue.core.JobState;
import com.docqueue.core.JobStatusInfo;
import com.docqueue.core.ProcessingContext;
import com.docqueue.core.ProcessingException;
import com.docqueue.core.QueueException;
import com.docqueue.engine.Scheduler;
import com.docqueue.engine.Worker;
import com.docqueue.engine.WorkerOutcome;
import com.docqueue.store.JobStore;
import com.docqueue.store.QueueStats;
import com.docqueue.store.StatsCollector;
import org.json.JSONObject;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the filesystem queue.
 *
 * Tests cover:
 * - The submit, claim, finalize walk through the directories
 * - A single job contested by many claimants
 * - A full processing run with mixed outcomes, followed by a requeue
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class IntegrationTest {

    @TempDir
    Path tempDir;

    private JobStore store;
    private StatsCollector statsCollector;

    @BeforeEach
    public void setUp() throws QueueException {
        store = QueueTestSupport.newStore(tempDir);
        statsCollector = new StatsCollector(store.getLayout());
    }

    /**
     * Test 1: One job through the queue, checking the files after every step.
     */
    @Test
    @Order(1)
    public void testJobWalksThroughDirectories() throws Exception {
        assertTrue(store.claimNext(false).isEmpty());

        QueueTestSupport.submit(store, tempDir, "job-1", false);
        assertTrue(Files.exists(store.getRoot().resolve("jobs/job-1.pdf.job")));
        assertTrue(Files.exists(store.getRoot().resolve("jobs/job-1.metadata.job")));

        ClaimedJob claimed = store.claimNext(false).orElseThrow();
        assertEquals(new ClaimedJob("job-1", JobState.JOBS), claimed);
        assertTrue(Files.exists(store.getRoot().resolve("jobs/job-1.pdf.job.lock")));
        assertTrue(Files.exists(store.getRoot().resolve("jobs/job-1.metadata.job.lock")));

        store.finalizeJob("job-1", JobState.JOBS, JobState.COMPLETE);
        assertEquals(new JobStatusInfo(JobState.COMPLETE, false), store.status("job-1").orElseThrow());

        assertEquals(List.of("job-1.metadata.job", "job-1.pdf.job"), list("complete"));
        assertEquals(List.of(), list("jobs"));
    }

    /**
     * Test 2: Exactly one of many simultaneous claimants wins a single job.
     */
    @Test
    @Order(2)
    public void testSingleJobHasSingleWinner() throws Exception {
        for (int round = 0; round < 10; round++) {
            String uuid = "contested-" + round;
            QueueTestSupport.submit(store, tempDir, uuid, round % 2 == 0);

            int claimants = 6;
            ExecutorService pool = Executors.newFixedThreadPool(claimants);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Optional<ClaimedJob>>> results = new ArrayList<>();
            for (int i = 0; i < claimants; i++) {
                JobStore claimant = new JobStore(store.getLayout());
                boolean prefer = i % 2 == 0;
                results.add(pool.submit(() -> {
                    start.await();
                    return claimant.claimNext(prefer);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Optional<ClaimedJob>> result : results) {
                if (result.get(10, TimeUnit.SECONDS).isPresent()) {
                    winners++;
                }
            }
            pool.shutdown();

            assertEquals(1, winners, "round " + round);
            assertTrue(store.status(uuid).orElseThrow().isLocked());
            store.finalizeJob(uuid, store.status(uuid).orElseThrow().getState(), JobState.COMPLETE);
        }
    }

    /**
     * Test 3: A scheduler drains a mixed queue. Rejected jobs land in error with
     * a structured document and come back after a requeue.
     */
    @Test
    @Order(3)
    public void testProcessingRunAndRequeue() throws Exception {
        for (int i = 0; i < 12; i++) {
            String metadata = i % 4 == 0 ? "{\"reject\":true}" : "{}";
            Path source = QueueTestSupport.writeSource(tempDir, "doc-" + i, QueueTestSupport.PDF_CONTENT, metadata);
            store.submit("doc-" + i, source, QueueTestSupport.metadataOf(source), i % 3 == 0);
        }

        Scheduler scheduler = new Scheduler(new Worker(store, new PickyProcessor()), 3, 20, true);
        scheduler.start();
        try {
            awaitTerminal(12);
        } finally {
            scheduler.shutdown();
        }

        QueueStats stats = statsCollector.collect();
        assertEquals(9, stats.get(JobState.COMPLETE).getPairs());
        assertEquals(3, stats.get(JobState.ERROR).getPairs());
        assertEquals(0, stats.getTotalLocked());
        assertEquals(0, stats.getTotalOrphans());
        assertEquals(9, stats.get(JobState.COMPLETE).getUnlocked(ArtifactKind.REPORT));

        JSONObject error = new JSONObject(Files.readString(store.getRoot().resolve("error/doc-0.metadata.job")));
        assertEquals("rejected", error.getString("error"));
        assertFalse(Files.exists(store.getRoot().resolve("error/doc-0.report.html")));

        // Requeue the failures; their metadata is now the error document, which the processor accepts
        for (String uuid : new String[] {"doc-0", "doc-4", "doc-8"}) {
            store.move(uuid, JobState.ERROR, JobState.JOBS);
        }
        Worker worker = new Worker(store, new PickyProcessor());
        for (int i = 0; i < 3; i++) {
            assertEquals(WorkerOutcome.SUCCESS, worker.runOnce(false));
        }
        assertEquals(WorkerOutcome.EMPTY, worker.runOnce(false));
        assertEquals(12, statsCollector.collect().get(JobState.COMPLETE).getPairs());
    }

    /** Rejects jobs whose metadata asks for it, otherwise writes a small report. */
    private static final class PickyProcessor extends BaseProcessor {
        static final class Options {
            boolean reject;
        }

        PickyProcessor() {
            super("picky");
        }

        @Override
        public void process(ProcessingContext context) throws Exception {
            context.writeReport("<p>partial</p>");
            Options options = fromMetadata(context.readMetadata(), Options.class);
            if (options != null && options.reject) {
                throw new ProcessingException("rejected", "asked to fail");
            }
            context.writeReport("<p>" + context.getJobId() + "</p>");
            context.addResult("checked", true);
        }
    }

    private void awaitTerminal(long expected) throws Exception {
        long deadline = System.currentTimeMillis() + 15_000;
        while (System.currentTimeMillis() < deadline) {
            QueueStats stats = statsCollector.collect();
            if (stats.get(JobState.COMPLETE).getPairs() + stats.get(JobState.ERROR).getPairs() >= expected) {
                return;
            }
            Thread.sleep(25);
        }
        fail("queue was not drained in time");
    }

    private List<String> list(String directory) throws Exception {
        try (Stream<Path> entries = Files.list(store.getRoot().resolve(directory))) {
            List<String> names = new ArrayList<>();
            entries.map(p -> p.getFileName().toString()).sorted().forEach(names::add);
            return names;
        }
    }
}
