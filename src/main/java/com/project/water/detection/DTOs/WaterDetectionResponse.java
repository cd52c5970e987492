package com.project.water.detection.DTOs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param waterPolygons GeoJSON FeatureCollection, one feature per kept water polygon
 * @param metadata      acquisition, area and parameter details
 */
public record WaterDetectionResponse(JsonNode waterPolygons, DetectionMetadata metadata) {}
