package com.project.water.detection.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service description and liveness probe. Thin controller, no dependencies.
 */
@RestController
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    static final String SERVICE_ID = "sar-water-detection-api";

    @GetMapping("/")
    public Map<String, Object> index() {
        log.debug("Serving service info");
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("service", "SAR Water Detection API");
        info.put("version", "1.0.0");
        info.put("endpoints", Map.of(
                "health", "/health",
                "detect_water", "/detect-water (POST)"));
        return info;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", SERVICE_ID);
    }
}
