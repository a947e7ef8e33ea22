package com.stagetracker.storage;

import com.stagetracker.core.StageIndex;
import com.stagetracker.model.Stage;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Scans the stage directories once at startup and loads what it finds
 * into the {@link StageIndex}.
 */
@Slf4j
@RequiredArgsConstructor
public class StageIndexSeeder {
    private final StageIndex index;
    private final StageStorage storage;
    private final boolean createDirectories;

    @PostConstruct
    public void seed() {
        if (createDirectories) {
            try {
                storage.createDirectories();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create stage directories under " + storage.getRoot(), e);
            }
        }
        // REVIEW is seeded first; an ID duplicated into a terminal stage stays in review
        for (Stage stage : Stage.values()) {
            index.seed(stage, storage.listIds(stage));
        }
        log.info("Stage index ready: review={}, accept={}, reject={}",
                index.size(Stage.REVIEW), index.size(Stage.ACCEPT), index.size(Stage.REJECT));
    }
}
