package com.stagetracker.web;

import com.stagetracker.core.MoveProcessor;
import com.stagetracker.core.MoveRequestQueue;
import com.stagetracker.core.StageIndex;
import com.stagetracker.model.Stage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StatusController.class)
class StatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StageIndex stageIndex;

    @MockBean
    private MoveRequestQueue moveQueue;

    @MockBean
    private MoveProcessor moveProcessor;

    @Test
    void testStatusReportsStageSizesAndQueueDepth() throws Exception {
        when(stageIndex.size(Stage.REVIEW)).thenReturn(4);
        when(stageIndex.size(Stage.ACCEPT)).thenReturn(2);
        when(stageIndex.size(Stage.REJECT)).thenReturn(1);
        when(moveQueue.pending()).thenReturn(3);
        when(moveProcessor.processedCount()).thenReturn(10L);

        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stages.REVIEW").value(4))
                .andExpect(jsonPath("$.stages.ACCEPT").value(2))
                .andExpect(jsonPath("$.stages.REJECT").value(1))
                .andExpect(jsonPath("$.pendingMoves").value(3))
                .andExpect(jsonPath("$.processedMoves").value(10))
                .andExpect(jsonPath("$.shuttingDown").value(false));
    }
}
