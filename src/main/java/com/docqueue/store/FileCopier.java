package com.docqueue.store;

import com.docqueue.core.QueueException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copies a file into the queue so that the destination name only ever refers
 * to complete content.
 *
 * <p>The data is streamed in fixed-size chunks into a temporary sibling of the
 * destination, forced to disk, and then renamed onto the destination. A reader
 * that lists the directory therefore sees either nothing or the whole file.
 * Temporary names ({@code <dest>.tmp.<random>}) never carry a queue suffix, so
 * claims ignore them.</p>
 */
public class FileCopier {
    private static final Logger logger = Logger.getLogger(FileCopier.class.getName());

    public static final int CHUNK_SIZE = 1024 * 1024;

    /**
     * Copy {@code source} to {@code destination}, replacing any existing file.
     *
     * @param source the file to copy
     * @param destination the final name
     * @throws QueueException NOT_FOUND if the source is missing, IO on any other failure
     */
    public void copy(Path source, Path destination) throws QueueException {
        Path directory = destination.toAbsolutePath().getParent();
        Path temp;
        try {
            temp = Files.createTempFile(directory, destination.getFileName() + ".tmp.", "");
        } catch (IOException e) {
            throw QueueException.io("failed to create temporary file next to " + destination, e);
        }

        try {
            streamInto(source, temp);
            copyPermissions(source, temp);
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchFileException e) {
            deleteQuietly(temp);
            throw QueueException.notFound("source file not found: " + source);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw QueueException.io("failed to copy " + source + " to " + destination, e);
        }

        syncDirectory(directory);
    }

    private void streamInto(Path source, Path temp) throws IOException {
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(source);
             FileChannel out = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                ByteBuffer chunk = ByteBuffer.wrap(buffer, 0, read);
                while (chunk.hasRemaining()) {
                    out.write(chunk);
                }
            }
            out.force(true);
        }
    }

    private void copyPermissions(Path source, Path temp) throws IOException {
        PosixFileAttributeView sourceView = Files.getFileAttributeView(source, PosixFileAttributeView.class);
        PosixFileAttributeView targetView = Files.getFileAttributeView(temp, PosixFileAttributeView.class);
        if (sourceView == null || targetView == null) {
            return;
        }
        Set<PosixFilePermission> permissions = sourceView.readAttributes().permissions();
        targetView.setPermissions(permissions);
    }

    // Directory fsync is not available on every platform; the data itself is already forced
    private void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            logger.log(Level.FINE, "Directory sync not supported for " + directory, e);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to remove temporary file " + temp, e);
        }
    }
}
