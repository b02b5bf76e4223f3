package com.example.estimations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Real-time planning poker. All game state lives in memory for the lifetime of the process.
 */
@SpringBootApplication
public class EstimationsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstimationsApplication.class, args);
    }
}
