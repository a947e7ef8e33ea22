package com.stagetracker.model;

import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * An item's stored content as read from its stage directory
 */
@Value
public class Item {
    long id;
    Stage stage;
    byte[] body;

    public String getTitle() {
        return "Job";
    }

    public String getBodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
