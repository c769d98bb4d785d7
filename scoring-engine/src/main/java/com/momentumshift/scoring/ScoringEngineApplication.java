package com.momentumshift.scoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScoringEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoringEngineApplication.class, args);
    }
}
