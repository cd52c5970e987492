package com.project.water.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the water detection service. Only bootstraps Spring Boot; the raster engine is
 * initialized as a bean during startup, so a failed engine start aborts the application.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
