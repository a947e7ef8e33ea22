package com.stagetracker.core;

import com.stagetracker.model.Stage;
import lombok.Getter;

/**
 * The item is not a member of the stage it was looked up in
 */
@Getter
public class ItemNotFoundException extends RuntimeException {
    private final long itemId;
    private final Stage stage;

    public ItemNotFoundException(long itemId, Stage stage) {
        super("entry not present: " + itemId + " in " + stage);
        this.itemId = itemId;
        this.stage = stage;
    }
}
