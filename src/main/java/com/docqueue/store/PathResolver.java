package com.docqueue.store;

import com.docqueue.core.ArtifactKind;
import com.docqueue.core.JobState;
import com.docqueue.core.QueueException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Maps (root, job id, state, kind, locked) to artifact file paths.
 *
 * <p>Layout: {@code <root>/<state-dir>/<uuid><kind-suffix>[.lock]}. The resolver
 * performs no I/O. Every higher component goes through it, so the naming
 * convention lives in one place.</p>
 *
 * <p><b>Length bound:</b> a resolved path whose UTF-8 encoding is as long as or
 * longer than {@link #getMaxPathLength()} is rejected with INVALID_ARGUMENT. The
 * default of 4096 mirrors PATH_MAX including its terminator. Paths are never
 * truncated.</p>
 *
 * <p><b>Identifiers:</b> a job id is 1 to 127 characters from
 * {@code [A-Za-z0-9._-]}, and is neither "." nor "..", so it can never contain
 * a separator or climb out of its state directory.</p>
 */
public class PathResolver {
    public static final int DEFAULT_MAX_PATH_LENGTH = 4096;
    public static final int MAX_ID_LENGTH = 127;

    private final int maxPathLength;

    public PathResolver() {
        this(DEFAULT_MAX_PATH_LENGTH);
    }

    /**
     * @param maxPathLength exclusive upper bound on resolved path length, in bytes
     * @throws IllegalArgumentException if the bound is not positive
     */
    public PathResolver(int maxPathLength) {
        if (maxPathLength <= 0) {
            throw new IllegalArgumentException("maxPathLength must be positive: " + maxPathLength);
        }
        this.maxPathLength = maxPathLength;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    /**
     * Resolve one artifact path.
     *
     * @param root the queue root
     * @param uuid the job identifier
     * @param state the state directory
     * @param kind the artifact kind
     * @param locked whether to return the locked name
     * @return the artifact path
     * @throws QueueException INVALID_ARGUMENT on a null input, an unsafe id, or an over-long path
     */
    public Path resolve(Path root, String uuid, JobState state, ArtifactKind kind, boolean locked)
            throws QueueException {
        if (kind == null) {
            throw QueueException.invalidArgument("artifact kind is required");
        }
        validateId(uuid);
        Path directory = stateDirectory(root, state);
        return checkLength(directory.resolve(kind.fileName(uuid, locked)));
    }

    /**
     * Resolve the primary, metadata and report paths of a job together.
     *
     * @param root the queue root
     * @param uuid the job identifier
     * @param state the state directory
     * @param locked whether to return the locked names
     * @return all three paths
     * @throws QueueException INVALID_ARGUMENT as for {@link #resolve}
     */
    public JobPaths pair(Path root, String uuid, JobState state, boolean locked) throws QueueException {
        return new JobPaths(
                resolve(root, uuid, state, ArtifactKind.PDF, locked),
                resolve(root, uuid, state, ArtifactKind.METADATA, locked),
                resolve(root, uuid, state, ArtifactKind.REPORT, locked));
    }

    /**
     * Resolve the directory of a state.
     *
     * @param root the queue root
     * @param state the state
     * @return {@code <root>/<state-dir>}
     * @throws QueueException INVALID_ARGUMENT on null input or an over-long path
     */
    public Path stateDirectory(Path root, JobState state) throws QueueException {
        if (root == null) {
            throw QueueException.invalidArgument("queue root is required");
        }
        if (state == null) {
            throw QueueException.invalidArgument("state is required");
        }
        return checkLength(root.resolve(state.getDirectoryName()));
    }

    /**
     * Extract the job id from a directory entry name.
     *
     * @param fileName bare file name, e.g. "job-1.pdf.job"
     * @param kind the artifact kind the name is expected to have
     * @param locked whether the lock suffix is expected
     * @return the id, or null if the name does not carry that suffix
     */
    public String idFromFileName(String fileName, ArtifactKind kind, boolean locked) {
        String suffix = kind.suffix(locked);
        if (fileName == null || !fileName.endsWith(suffix)) {
            return null;
        }
        return fileName.substring(0, fileName.length() - suffix.length());
    }

    /**
     * Check that a job id is path-safe.
     *
     * @param uuid the candidate id
     * @throws QueueException INVALID_ARGUMENT if the id is null, empty, too long,
     *                        "." or "..", or has characters outside [A-Za-z0-9._-]
     */
    public void validateId(String uuid) throws QueueException {
        if (!isValidId(uuid)) {
            throw QueueException.invalidArgument("invalid job id: " + describe(uuid));
        }
    }

    public boolean isValidId(String uuid) {
        if (uuid == null || uuid.isEmpty() || uuid.length() > MAX_ID_LENGTH) {
            return false;
        }
        if (uuid.equals(".") || uuid.equals("..")) {
            return false;
        }
        for (int i = 0; i < uuid.length(); i++) {
            char ch = uuid.charAt(i);
            boolean allowed = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9') || ch == '.' || ch == '_' || ch == '-';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    private Path checkLength(Path path) throws QueueException {
        int length = path.toString().getBytes(StandardCharsets.UTF_8).length;
        if (length >= maxPathLength) {
            throw QueueException.invalidArgument("path length " + length
                    + " exceeds limit of " + (maxPathLength - 1) + " bytes");
        }
        return path;
    }

    private static String describe(String uuid) {
        if (uuid == null) {
            return "<null>";
        }
        return uuid.length() > 32 ? uuid.substring(0, 32) + "... (" + uuid.length() + " chars)" : "'" + uuid + "'";
    }
}
