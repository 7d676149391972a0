package com.swipeengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Main application class for the swipe engine - embedding refresh and clustering batch service.
 */
@SpringBootApplication
@EnableCaching
public class SwipeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwipeEngineApplication.class, args);
    }
}
