package com.stagetracker.model;

import com.google.common.base.Preconditions;
import lombok.Value;

import java.time.Instant;

/**
 * An instruction to move one item between stages. Created by a request
 * handler, consumed once by the move processor, then discarded.
 */
@Value
public class MoveRequest {
    /**
     * Item being moved
     */
    long itemId;

    /**
     * Stage the item is expected to be in
     */
    Stage source;

    /**
     * Stage the item should end up in
     */
    Stage destination;

    /**
     * When the request was created
     */
    Instant receivedTime;

    public MoveRequest(long itemId, Stage source, Stage destination, Instant receivedTime) {
        Preconditions.checkArgument(itemId > 0, "item id must be positive: %s", itemId);
        this.itemId = itemId;
        this.source = Preconditions.checkNotNull(source, "source");
        this.destination = Preconditions.checkNotNull(destination, "destination");
        this.receivedTime = Preconditions.checkNotNull(receivedTime, "receivedTime");
        Preconditions.checkArgument(source != destination,
                "source and destination must differ: %s", source);
    }

    /**
     * Move an item out of review into the given stage
     */
    public static MoveRequest fromReview(long itemId, Stage destination) {
        return new MoveRequest(itemId, Stage.REVIEW, destination, Instant.now());
    }
}
