package com.stagetracker.storage;

import com.google.common.collect.ImmutableSet;
import com.stagetracker.model.Stage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem layout of the stage directories: one file per item, named by
 * its ID, inside the directory of the item's current stage.
 */
@Slf4j
public class StageStorage {
    private final Path root;

    public StageStorage(Path root) {
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    public Path stageDirectory(Stage stage) {
        return root.resolve(stage.getDirectoryName());
    }

    public Path itemPath(Stage stage, long id) {
        return stageDirectory(stage).resolve(Long.toString(id));
    }

    /**
     * Create any missing stage directories
     */
    public void createDirectories() throws IOException {
        for (Stage stage : Stage.values()) {
            Files.createDirectories(stageDirectory(stage));
        }
    }

    public byte[] read(Stage stage, long id) throws IOException {
        return Files.readAllBytes(itemPath(stage, id));
    }

    /**
     * Rename an item's file from one stage directory to another
     */
    public void move(long id, Stage from, Stage to) throws IOException {
        Files.move(itemPath(from, id), itemPath(to, id));
    }

    /**
     * IDs of the files found in a stage directory. Names that are not a
     * positive integer are skipped. An unreadable directory yields no IDs.
     */
    public ImmutableSet<Long> listIds(Stage stage) {
        Path dir = stageDirectory(stage);
        ImmutableSet.Builder<Long> ids = ImmutableSet.builder();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                Long id = parseId(name);
                if (id == null) {
                    log.warn("Skipping file with non-numeric name: {}", entry);
                    continue;
                }
                ids.add(id);
            }
        } catch (IOException e) {
            log.error("Failed to read stage directory {}", dir, e);
        }
        return ids.build();
    }

    private static Long parseId(String name) {
        try {
            long id = Long.parseLong(name);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
