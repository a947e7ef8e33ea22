package com.stagetracker.model;

/**
 * Result of applying a single move request
 */
public enum MoveOutcome {
    /**
     * Index updated and file renamed
     */
    APPLIED,

    /**
     * Item was not in the source stage; nothing changed
     */
    STALE,

    /**
     * Index updated but the file rename failed. The file stays in the
     * source directory until an operator reconciles it.
     */
    STORAGE_FAILED
}
