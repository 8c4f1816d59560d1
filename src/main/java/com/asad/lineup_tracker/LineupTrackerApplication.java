package com.asad.lineup_tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LineupTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineupTrackerApplication.class, args);
    }
}
