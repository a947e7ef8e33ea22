package com.stagetracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StageTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StageTrackerApplication.class, args);
    }
}
