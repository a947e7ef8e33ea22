package com.stagetracker.storage;

import com.stagetracker.model.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StageStorageTest {

    @TempDir
    Path dataDir;

    private StageStorage storage;

    @BeforeEach
    void setUp() {
        storage = new StageStorage(dataDir);
    }

    @Test
    void testLayoutUsesStageDirectoryAndIdAsFileName() {
        assertEquals(dataDir.resolve("review").resolve("42"), storage.itemPath(Stage.REVIEW, 42));
        assertEquals(dataDir.resolve("reject"), storage.stageDirectory(Stage.REJECT));
    }

    @Test
    void testListIdsSkipsNamesThatAreNotPositiveIntegers() throws IOException {
        storage.createDirectories();
        Path review = storage.stageDirectory(Stage.REVIEW);
        Files.writeString(review.resolve("101"), "a");
        Files.writeString(review.resolve("102"), "b");
        Files.writeString(review.resolve("0"), "zero");
        Files.writeString(review.resolve("-4"), "negative");
        Files.writeString(review.resolve("notes.txt"), "text");

        assertEquals(Set.of(101L, 102L), storage.listIds(Stage.REVIEW));
    }

    @Test
    void testListIdsOfMissingDirectoryIsEmpty() {
        assertTrue(storage.listIds(Stage.ACCEPT).isEmpty());
    }

    @Test
    void testMoveRenamesBetweenStageDirectories() throws IOException {
        storage.createDirectories();
        Files.writeString(storage.itemPath(Stage.REVIEW, 8), "payload");

        storage.move(8, Stage.REVIEW, Stage.REJECT);

        assertFalse(Files.exists(storage.itemPath(Stage.REVIEW, 8)));
        assertArrayEquals("payload".getBytes(), storage.read(Stage.REJECT, 8));
    }

    @Test
    void testMoveOfMissingFileFails() throws IOException {
        storage.createDirectories();

        assertThrows(NoSuchFileException.class, () -> storage.move(9, Stage.REVIEW, Stage.ACCEPT));
    }
}
