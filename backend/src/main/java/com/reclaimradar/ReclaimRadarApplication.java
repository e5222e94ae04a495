package com.reclaimradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReclaimRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReclaimRadarApplication.class, args);
    }
}
