package com.docqueue.core;

import java.nio.file.Path;

/**
 * Thrown when one file of a job pair exists without its sibling in the same
 * lock state, e.g. after a process died between the two renames of a claim.
 *
 * <p>This is an IO-class failure. Nothing in the queue repairs it; an operator
 * has to inspect the files and move or delete them.</p>
 */
public class InconsistentPairException extends QueueException {

    private final Path presentFile;
    private final Path missingFile;

    public InconsistentPairException(Path presentFile, Path missingFile) {
        super(QueueErrorKind.IO, "Inconsistent job pair: " + presentFile.getFileName()
                + " exists but " + missingFile.getFileName() + " does not");
        this.presentFile = presentFile;
        this.missingFile = missingFile;
    }

    public Path getPresentFile() {
        return presentFile;
    }

    public Path getMissingFile() {
        return missingFile;
    }
}
