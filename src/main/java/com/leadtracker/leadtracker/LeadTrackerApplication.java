package com.leadtracker.leadtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeadTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadTrackerApplication.class, args);
    }
}
