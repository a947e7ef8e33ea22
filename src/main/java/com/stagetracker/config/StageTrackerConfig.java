package com.stagetracker.config;

import com.stagetracker.core.ItemLookupService;
import com.stagetracker.core.MoveProcessor;
import com.stagetracker.core.MoveRequestQueue;
import com.stagetracker.core.StageIndex;
import com.stagetracker.storage.StageIndexSeeder;
import com.stagetracker.storage.StageStorage;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stage index, move queue, processor and storage together.
 * Every component gets its collaborators from here; there is no shared
 * static state.
 */
@Configuration
@EnableConfigurationProperties(StageTrackerProperties.class)
public class StageTrackerConfig {

    @Bean
    public StageStorage stageStorage(StageTrackerProperties properties) {
        return new StageStorage(properties.getDataDirectory());
    }

    @Bean
    public StageIndex stageIndex() {
        return new StageIndex();
    }

    /**
     * Populated before the processor starts and before any request is served
     */
    @Bean
    public StageIndexSeeder stageIndexSeeder(StageIndex stageIndex, StageStorage stageStorage,
                                             StageTrackerProperties properties) {
        return new StageIndexSeeder(stageIndex, stageStorage, properties.isCreateDirectories());
    }

    @Bean
    public MoveRequestQueue moveRequestQueue(StageTrackerProperties properties) {
        return new MoveRequestQueue(properties.getQueueCapacity());
    }

    @Bean
    public MoveProcessor moveProcessor(StageIndex stageIndex, MoveRequestQueue moveRequestQueue,
                                       StageStorage stageStorage, StageTrackerProperties properties,
                                       StageIndexSeeder stageIndexSeeder) {
        return new MoveProcessor(stageIndex, moveRequestQueue, stageStorage, properties.getPollInterval());
    }

    @Bean
    public ItemLookupService itemLookupService(StageIndex stageIndex, StageStorage stageStorage) {
        return new ItemLookupService(stageIndex, stageStorage);
    }
}
