package com.intention;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Intention - template-driven model calls with caching,
 * rate limiting, budgets and retries.
 */
@SpringBootApplication
@EnableScheduling
public class IntentionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntentionApplication.class, args);
    }
}
