package com.project.water.detection.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.water.detection.DTOs.DetectionResult;
import com.project.water.detection.DTOs.WaterPolygon;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.springframework.stereotype.Component;

/** Renders detection results as a GeoJSON FeatureCollection. */
@Component
public class GeoJsonMapper {

    private final ObjectMapper objectMapper;

    public GeoJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode toFeatureCollection(DetectionResult result) {
        GeoJsonWriter writer = new GeoJsonWriter();
        writer.setEncodeCRS(false);

        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");
        for (WaterPolygon polygon : result.polygons()) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            feature.set("geometry", readTree(writer.write(polygon.geometry())));
            feature.putObject("properties").put("area_m2", polygon.areaM2());
        }
        return collection;
    }

    public JsonNode emptyCollection() {
        return toFeatureCollection(DetectionResult.empty());
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamComputeException(PipelineStage.VECTORIZATION, "Failed to encode water polygon", e);
        }
    }
}
