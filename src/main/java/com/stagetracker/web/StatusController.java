package com.stagetracker.web;

import com.stagetracker.core.MoveProcessor;
import com.stagetracker.core.MoveRequestQueue;
import com.stagetracker.core.StageIndex;
import com.stagetracker.model.Stage;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.Map;

/**
 * JSON view of stage sizes and move queue depth
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatusController {
    private final StageIndex stageIndex;
    private final MoveRequestQueue moveQueue;
    private final MoveProcessor moveProcessor;

    @GetMapping("/status")
    public StatusResponse status() {
        Map<Stage, Integer> stages = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            stages.put(stage, stageIndex.size(stage));
        }
        return StatusResponse.builder()
                .stages(stages)
                .pendingMoves(moveQueue.pending())
                .processedMoves(moveProcessor.processedCount())
                .shuttingDown(moveProcessor.isShutdown())
                .build();
    }
}
