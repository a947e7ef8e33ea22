package com.stagetracker.model;

/**
 * Workflow stages an item moves through. Each stage owns one directory
 * under the data root, named by {@link #getDirectoryName()}.
 */
public enum Stage {
    /**
     * Entry stage, every item starts here
     */
    REVIEW("review"),

    /**
     * Terminal stage for accepted items
     */
    ACCEPT("accept"),

    /**
     * Terminal stage for rejected items
     */
    REJECT("reject");

    private final String directoryName;

    Stage(String directoryName) {
        this.directoryName = directoryName;
    }

    public String getDirectoryName() {
        return directoryName;
    }
}
