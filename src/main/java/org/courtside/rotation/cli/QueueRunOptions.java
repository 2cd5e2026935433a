package org.courtside.rotation.cli;

import org.courtside.rotation.scheduler.QueueConfig;

import java.nio.file.Path;

/**
 * Parsed command-line options for {@link QueueRunner}.
 */
public record QueueRunOptions(Path input, QueueConfig config) {

    public QueueRunOptions {
        if (input == null) {
            throw new IllegalArgumentException("--input is required");
        }
    }
}
