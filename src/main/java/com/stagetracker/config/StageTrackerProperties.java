package com.stagetracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from the {@code stage-tracker.*} properties
 */
@Data
@ConfigurationProperties(prefix = "stage-tracker")
public class StageTrackerProperties {
    /**
     * Root directory holding one subdirectory per stage
     */
    private Path dataDirectory = Path.of("data");

    /**
     * Maximum queued move requests before submitters block
     */
    private int queueCapacity = 100;

    /**
     * How long the move processor waits on an empty queue before
     * re-checking for shutdown
     */
    private Duration pollInterval = Duration.ofMillis(200);

    /**
     * Create missing stage directories at startup
     */
    private boolean createDirectories = true;
}
