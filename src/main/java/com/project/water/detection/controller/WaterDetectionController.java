package com.project.water.detection.controller;

import com.project.water.detection.DTOs.WaterDetectionRequest;
import com.project.water.detection.DTOs.WaterDetectionResponse;
import com.project.water.detection.service.WaterDetectionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class WaterDetectionController {
    private static final Logger log = LoggerFactory.getLogger(WaterDetectionController.class);

    private final WaterDetectionService detectionService;

    public WaterDetectionController(WaterDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @PostMapping(value = "/detect-water", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public WaterDetectionResponse detectWater(@Valid @RequestBody WaterDetectionRequest request) {
        log.info("Water detection requested (vv_threshold={}, slope_max={}, min_area_pixels={})",
                request.vvThreshold(), request.slopeMax(), request.minAreaPixels());
        return detectionService.detect(request);
    }
}
