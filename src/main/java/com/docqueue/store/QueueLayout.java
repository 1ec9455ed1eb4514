package com.docqueue.store;

import com.docqueue.core.JobState;
import com.docqueue.core.QueueException;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

// Directory layout of a queue root: one directory per JobState
public class QueueLayout {
    private static final Logger logger = Logger.getLogger(QueueLayout.class.getName());

    private final Path root;
    private final PathResolver resolver;

    public QueueLayout(Path root, PathResolver resolver) {
        this.root = root;
        this.resolver = resolver;
    }

    public Path getRoot() {
        return root;
    }

    public PathResolver getResolver() {
        return resolver;
    }

    // Create the root and all four state directories; safe to call repeatedly
    public void initialize() throws QueueException {
        if (root == null || root.toString().isEmpty()) {
            throw QueueException.invalidArgument("queue root is required");
        }
        try {
            Files.createDirectories(root);
        } catch (FileAlreadyExistsException e) {
            throw QueueException.io("queue root exists and is not a directory: " + root, e);
        } catch (IOException e) {
            throw QueueException.io("failed to create queue root " + root, e);
        }
        for (JobState state : JobState.values()) {
            ensureStateDirectory(state);
        }
        logger.info("Queue layout initialized at " + root);
    }

    // Create a single state directory if missing
    public Path ensureStateDirectory(JobState state) throws QueueException {
        Path directory = resolver.stateDirectory(root, state);
        if (Files.isDirectory(directory)) {
            return directory;
        }
        try {
            Files.createDirectory(directory);
            logger.fine("Created state directory " + directory);
        } catch (FileAlreadyExistsException e) {
            // Lost a race with another process creating it, or a file is squatting the name
            if (!Files.isDirectory(directory)) {
                throw QueueException.io("state path exists and is not a directory: " + directory, e);
            }
        } catch (IOException e) {
            throw QueueException.io("failed to create state directory " + directory, e);
        }
        return directory;
    }
}
