package com.stagetracker.web;

import com.stagetracker.model.Stage;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class StatusResponse {
    Map<Stage, Integer> stages;
    int pendingMoves;
    long processedMoves;
    boolean shuttingDown;
}
