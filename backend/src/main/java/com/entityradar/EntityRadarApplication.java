package com.entityradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EntityRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(EntityRadarApplication.class, args);
    }
}
