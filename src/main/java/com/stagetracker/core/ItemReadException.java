package com.stagetracker.core;

import lombok.Getter;

import java.io.IOException;

/**
 * Reading an item's file failed, including the file vanishing because a
 * concurrent move renamed it after the membership check.
 */
@Getter
public class ItemReadException extends RuntimeException {
    private final long itemId;

    public ItemReadException(long itemId, IOException cause) {
        super("Failed to read item " + itemId + ": " + cause.getMessage(), cause);
        this.itemId = itemId;
    }
}
