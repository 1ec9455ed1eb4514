package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.JobState;
import com.docqueue.core.QueueErrorKind;
import com.docqueue.core.QueueException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for path naming and identifier validation.
 */
public class PathResolverTest {

    private final PathResolver resolver = new PathResolver();
    private final Path root = Paths.get("/var/queue");

    @Test
    public void testResolveNamesFollowLayout() throws QueueException {
        assertEquals(Paths.get("/var/queue/jobs/a1.pdf.job"),
                resolver.resolve(root, "a1", JobState.JOBS, ArtifactKind.PDF, false));
        assertEquals(Paths.get("/var/queue/priority_jobs/a1.metadata.job.lock"),
                resolver.resolve(root, "a1", JobState.PRIORITY, ArtifactKind.METADATA, true));
        assertEquals(Paths.get("/var/queue/complete/a1.report.html"),
                resolver.resolve(root, "a1", JobState.COMPLETE, ArtifactKind.REPORT, false));
        assertEquals(Paths.get("/var/queue/error/a1.report.html.lock"),
                resolver.resolve(root, "a1", JobState.ERROR, ArtifactKind.REPORT, true));
    }

    @Test
    public void testPairResolvesAllThreeArtifacts() throws QueueException {
        JobPaths paths = resolver.pair(root, "doc-7", JobState.JOBS, true);

        assertEquals("doc-7.pdf.job.lock", paths.getPdf().getFileName().toString());
        assertEquals("doc-7.metadata.job.lock", paths.getMetadata().getFileName().toString());
        assertEquals("doc-7.report.html.lock", paths.getReport().getFileName().toString());
        assertEquals(paths.getPdf(), paths.get(ArtifactKind.PDF));
    }

    @Test
    public void testRejectsUnsafeIds() {
        String[] bad = {"", ".", "..", "a/b", "../x", "a b", "x\u0000", "ä", "a\\b"};
        for (String id : bad) {
            QueueException e = assertThrows(QueueException.class,
                    () -> resolver.resolve(root, id, JobState.JOBS, ArtifactKind.PDF, false),
                    "id should be rejected: " + id);
            assertEquals(QueueErrorKind.INVALID_ARGUMENT, e.getKind());
        }
    }

    @Test
    public void testRejectsNullArguments() {
        assertThrows(QueueException.class,
                () -> resolver.resolve(null, "a", JobState.JOBS, ArtifactKind.PDF, false));
        assertThrows(QueueException.class,
                () -> resolver.resolve(root, null, JobState.JOBS, ArtifactKind.PDF, false));
        assertThrows(QueueException.class,
                () -> resolver.resolve(root, "a", null, ArtifactKind.PDF, false));
        assertThrows(QueueException.class,
                () -> resolver.resolve(root, "a", JobState.JOBS, null, false));
    }

    @Test
    public void testIdLengthLimit() throws QueueException {
        String longest = "a".repeat(PathResolver.MAX_ID_LENGTH);
        assertNotNull(resolver.resolve(root, longest, JobState.JOBS, ArtifactKind.PDF, false));

        String tooLong = longest + "a";
        assertThrows(QueueException.class,
                () -> resolver.resolve(root, tooLong, JobState.JOBS, ArtifactKind.PDF, false));
    }

    /**
     * A path that would reach the configured limit is rejected, never truncated.
     */
    @Test
    public void testOverflowIsRejectedNotTruncated() throws QueueException {
        // "/q/jobs/" + "abc" + ".pdf.job.lock" = 8 + 3 + 13 = 24 bytes
        Path shortRoot = Paths.get("/q");
        PathResolver exact = new PathResolver(25);
        Path ok = exact.resolve(shortRoot, "abc", JobState.JOBS, ArtifactKind.PDF, true);
        assertEquals("abc.pdf.job.lock", ok.getFileName().toString());

        PathResolver tight = new PathResolver(24);
        QueueException e = assertThrows(QueueException.class,
                () -> tight.resolve(shortRoot, "abc", JobState.JOBS, ArtifactKind.PDF, true));
        assertEquals(QueueErrorKind.INVALID_ARGUMENT, e.getKind());
    }

    @Test
    public void testDeepRootOverflowsDefaultLimit() {
        Path deep = Paths.get("/" + "d".repeat(4090));
        assertThrows(QueueException.class,
                () -> resolver.resolve(deep, "a", JobState.JOBS, ArtifactKind.PDF, false));
    }

    @Test
    public void testIdFromFileName() {
        assertEquals("a1", resolver.idFromFileName("a1.pdf.job", ArtifactKind.PDF, false));
        assertEquals("a1", resolver.idFromFileName("a1.pdf.job.lock", ArtifactKind.PDF, true));
        assertNull(resolver.idFromFileName("a1.pdf.job.lock", ArtifactKind.PDF, false));
        assertNull(resolver.idFromFileName("a1.metadata.job", ArtifactKind.PDF, false));
        assertNull(resolver.idFromFileName("a1.pdf.job.tmp.123", ArtifactKind.PDF, false));
    }

    @Test
    public void testNonPositiveLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PathResolver(0));
    }
}
