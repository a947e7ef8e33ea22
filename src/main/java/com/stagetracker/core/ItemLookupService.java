package com.stagetracker.core;

import com.stagetracker.model.Item;
import com.stagetracker.model.Stage;
import com.stagetracker.storage.StageStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read path for items: validates membership in the index, then loads the
 * file from the stage directory. Never mutates the index.
 */
@Slf4j
@RequiredArgsConstructor
public class ItemLookupService {
    private final StageIndex index;
    private final StageStorage storage;

    /**
     * Load an item from the given stage.
     *
     * @throws ItemNotFoundException if the item is not in that stage
     * @throws ItemReadException if the file could not be read
     */
    public Item load(long id, Stage stage) {
        if (!index.contains(stage, id)) {
            throw new ItemNotFoundException(id, stage);
        }
        try {
            return new Item(id, stage, storage.read(stage, id));
        } catch (IOException e) {
            throw new ItemReadException(id, e);
        }
    }

    /**
     * Some item still waiting for review, if any
     */
    public Optional<Long> nextForReview() {
        OptionalLong id = index.pickAny(Stage.REVIEW);
        return id.isPresent() ? Optional.of(id.getAsLong()) : Optional.empty();
    }
}
