package com.pacer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Pacer - client-side request optimization for rate-limited HTTP APIs.
 */
@SpringBootApplication
public class PacerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PacerApplication.class, args);
    }
}
