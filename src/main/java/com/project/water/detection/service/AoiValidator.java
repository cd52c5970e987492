package com.project.water.detection.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.water.detection.DTOs.ValidatedAoi;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.Geodesy;
import com.project.water.detection.exceptions.AoiValidationException;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Parses and checks a GeoJSON AOI before any imagery is touched: it must be a valid, non-empty
 * Polygon or MultiPolygon no larger than the configured area cap.
 */
@Service
public class AoiValidator {
    private static final Logger log = LoggerFactory.getLogger(AoiValidator.class);

    private final ObjectMapper objectMapper;
    private final DetectionSettings settings;
    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);

    public AoiValidator(ObjectMapper objectMapper, DetectionSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public ValidatedAoi validate(Map<String, Object> geojson) {
        if (geojson == null || geojson.isEmpty()) {
            throw new AoiValidationException("Invalid geometry provided");
        }
        Geometry geometry = parse(geojson);
        if (!(geometry instanceof Polygon || geometry instanceof MultiPolygon)) {
            throw new AoiValidationException("Invalid geometry provided: expected Polygon or MultiPolygon, got "
                    + geometry.getGeometryType());
        }
        if (geometry.isEmpty() || !geometry.isValid()) {
            throw new AoiValidationException("Invalid geometry provided");
        }

        double areaKm2 = Geodesy.area(geometry) / 1_000_000.0;
        log.info("AOI area: {} km2", String.format("%.2f", areaKm2));
        if (areaKm2 > settings.aoiMaxAreaKm2()) {
            throw new AoiValidationException(String.format("AOI too large (%.2f km²). Maximum allowed: %.0f km²",
                    areaKm2, settings.aoiMaxAreaKm2()));
        }
        return new ValidatedAoi(geometry, areaKm2);
    }

    private Geometry parse(Map<String, Object> geojson) {
        try {
            String json = objectMapper.writeValueAsString(geojson);
            return new GeoJsonReader(geometryFactory).read(json);
        } catch (JsonProcessingException | ParseException | RuntimeException e) {
            log.warn("Geometry validation error: {}", e.getMessage());
            throw new AoiValidationException("Invalid geometry provided", e);
        }
    }
}
