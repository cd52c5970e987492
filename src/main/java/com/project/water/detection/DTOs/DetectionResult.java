package com.project.water.detection.DTOs;

import java.util.List;

public record DetectionResult(List<WaterPolygon> polygons, double totalAreaKm2) {

    public DetectionResult {
        polygons = List.copyOf(polygons);
    }

    public static DetectionResult empty() {
        return new DetectionResult(List.of(), 0.0);
    }

    public static DetectionResult of(List<WaterPolygon> polygons) {
        double totalM2 = polygons.stream().mapToDouble(WaterPolygon::areaM2).sum();
        return new DetectionResult(polygons, totalM2 / 1_000_000.0);
    }

    public boolean isEmpty() {
        return polygons.isEmpty();
    }
}
