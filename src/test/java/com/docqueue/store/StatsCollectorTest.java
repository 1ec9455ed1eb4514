package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.JobState;
import com.docqueue.core.QueueErrorKind;
import com.docqueue.core.QueueException;
import com.docqueue.test.QueueTestSupport;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static com.docqueue.test.QueueTestSupport.file;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for queue statistics: counts, orphans, bytes and timestamps.
 */
public class StatsCollectorTest {

    @TempDir
    Path tempDir;

    private JobStore store;
    private StatsCollector collector;

    @BeforeEach
    public void setUp() throws QueueException {
        store = QueueTestSupport.newStore(tempDir);
        collector = new StatsCollector(store.getLayout());
    }

    @Test
    public void testEmptyQueue() throws QueueException {
        QueueStats stats = collector.collect();

        assertEquals(0, stats.getTotalFiles());
        assertEquals(0, stats.getTotalPairs());
        assertEquals(0, stats.getOldestMtime());
        assertEquals(0, stats.getNewestMtime());
        assertEquals(4, stats.getStates().size());
    }

    @Test
    public void testCountsPairsAndLocks() throws Exception {
        QueueTestSupport.submit(store, tempDir, "a", false);
        QueueTestSupport.submit(store, tempDir, "b", false);
        QueueTestSupport.submit(store, tempDir, "p", true);
        store.claimNext(false).orElseThrow();

        QueueStats stats = collector.collect();

        StateStats jobs = stats.get(JobState.JOBS);
        assertEquals(1, jobs.getUnlocked(ArtifactKind.PDF));
        assertEquals(1, jobs.getLocked(ArtifactKind.PDF));
        assertEquals(1, jobs.getLocked(ArtifactKind.METADATA));
        assertEquals(1, jobs.getPairs());
        assertEquals(1, jobs.getLockedPairs());
        assertEquals(4, jobs.getFiles());
        assertEquals(2, jobs.getLockedFiles());

        assertEquals(1, stats.get(JobState.PRIORITY).getPairs());
        assertEquals(6, stats.getTotalFiles());
        assertEquals(2, stats.getTotalLocked());
        assertEquals(2, stats.getTotalPairs());
        assertEquals(1, stats.getTotalLockedPairs());
        assertEquals(0, stats.getTotalOrphans());
    }

    /**
     * Each kind is matched against the primary in the same lock state.
     */
    @Test
    public void testOrphansPerKind() throws Exception {
        Files.writeString(file(store, "jobs", "x.pdf.job"), "%PDF");
        Files.writeString(file(store, "jobs", "y.metadata.job"), "{}");
        Files.writeString(file(store, "complete", "z.report.html"), "<p/>");
        Files.writeString(file(store, "error", "w.pdf.job.lock"), "%PDF");
        Files.writeString(file(store, "error", "w.metadata.job"), "{}");

        QueueStats stats = collector.collect();

        StateStats jobs = stats.get(JobState.JOBS);
        assertEquals(1, jobs.getOrphans(ArtifactKind.PDF));
        assertEquals(1, jobs.getOrphans(ArtifactKind.METADATA));
        assertEquals(0, jobs.getPairs());
        assertEquals(1, stats.get(JobState.COMPLETE).getOrphans(ArtifactKind.REPORT));

        StateStats error = stats.get(JobState.ERROR);
        assertEquals(2, error.getOrphanCount(), "lock states do not pair with each other");
        assertEquals(5, stats.getTotalOrphans());
    }

    @Test
    public void testReportWithPrimaryIsNotOrphan() throws Exception {
        QueueTestSupport.submit(store, tempDir, "a", false);
        Files.writeString(file(store, "jobs", "a.report.html"), "<p/>");

        assertEquals(0, collector.collect().getTotalOrphans());
    }

    @Test
    public void testBytesAndMtimeRange() throws Exception {
        Path pdf = file(store, "complete", "a.pdf.job");
        Path metadata = file(store, "complete", "a.metadata.job");
        Files.write(pdf, new byte[1000]);
        Files.write(metadata, new byte[24]);
        Files.setLastModifiedTime(pdf, FileTime.fromMillis(1_600_000_000_000L));
        Files.setLastModifiedTime(metadata, FileTime.fromMillis(1_700_000_000_500L));

        QueueStats stats = collector.collect();

        StateStats complete = stats.get(JobState.COMPLETE);
        assertEquals(1000, complete.getBytes(ArtifactKind.PDF));
        assertEquals(24, complete.getBytes(ArtifactKind.METADATA));
        assertEquals(1024, stats.getTotalBytes());
        assertEquals(1_600_000_000L, stats.getOldestMtime());
        assertEquals(1_700_000_000L, stats.getNewestMtime());
    }

    @Test
    public void testForeignFilesAndDirectoriesIgnored() throws Exception {
        Files.writeString(file(store, "jobs", "notes.txt"), "x");
        Files.writeString(file(store, "jobs", "a.pdf.job.tmp.42"), "x");
        Files.createDirectory(file(store, "jobs", "d.pdf.job"));

        assertEquals(0, collector.collect().getTotalFiles());
    }

    @Test
    public void testMissingStateDirectoryIsNotFound() throws Exception {
        Files.delete(store.getRoot().resolve("complete"));

        QueueException e = assertThrows(QueueException.class, collector::collect);

        assertEquals(QueueErrorKind.NOT_FOUND, e.getKind());
    }

    @Test
    public void testJsonDocument() throws Exception {
        QueueTestSupport.submit(store, tempDir, "a", true);

        JSONObject json = collector.collect().toJson();

        assertEquals(store.getRoot().toString(), json.getString("root"));
        assertEquals(2, json.getJSONObject("totals").getLong("files"));
        assertEquals(1, json.getJSONObject("totals").getLong("pairs"));
        JSONObject priority = json.getJSONObject("states").getJSONObject("priority");
        assertEquals(1, priority.getLong("pdf"));
        assertEquals(0, priority.getLong("pdf_locked"));
        assertEquals(QueueTestSupport.PDF_CONTENT.length(), priority.getLong("pdf_bytes"));
        assertTrue(json.getJSONObject("states").has("complete"));
    }
}
