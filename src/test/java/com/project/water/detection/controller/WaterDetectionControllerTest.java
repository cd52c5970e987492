package com.project.water.detection.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.water.detection.SyntheticScenes;
import com.project.water.detection.engine.local.LocalRasterEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class WaterDetectionControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired LocalRasterEngine rasterEngine;

    @Test
    void health_reportsOk() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("sar-water-detection-api"));
    }

    @Test
    void root_describesService() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints.detect_water").value("/detect-water (POST)"));
    }

    @Test
    void detect_missingGeometry_isBadRequest() throws Exception {
        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("geometry is required")));
    }

    @Test
    void detect_outOfDomainThreshold_isBadRequest() throws Exception {
        Map<String, Object> body = body(SyntheticScenes.geoJson(SyntheticScenes.footprint(SyntheticScenes.GRID)));
        body.put("vv_threshold", 5.0);

        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content(json(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("vv_threshold")));
    }

    @Test
    void detect_malformedJson_isBadRequest() throws Exception {
        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content("{\"geometry\": "))
                .andExpect(status().isBadRequest());
    }

    @Test
    void detect_nonPolygonGeometry_isBadRequest() throws Exception {
        Map<String, Object> point = Map.of("type", "Point", "coordinates", new double[]{10.0, 45.0});

        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content(json(body(point))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("Invalid geometry")));
    }

    @Test
    void detect_oversizedAoi_isBadRequest() throws Exception {
        Map<String, Object> body = body(SyntheticScenes.geoJson(SyntheticScenes.box(0, 0, 1, 1)));

        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content(json(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("Maximum allowed: 2500")));
    }

    @Test
    void detect_noImagery_isOkWithWarning() throws Exception {
        Map<String, Object> body = body(SyntheticScenes.geoJson(SyntheticScenes.box(100, 10, 100.01, 10.01)));

        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content(json(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.water_polygons.type").value("FeatureCollection"))
                .andExpect(jsonPath("$.water_polygons.features").isEmpty())
                .andExpect(jsonPath("$.metadata.water_area_km2").value(0.0))
                .andExpect(jsonPath("$.metadata.water_percentage").value(0.0))
                .andExpect(jsonPath("$.metadata.warning").value(containsString("No Sentinel-1 imagery")));
    }

    @Test
    void detect_registeredLakeScene_returnsWaterPolygon() throws Exception {
        rasterEngine.register(SyntheticScenes.lakeScene("S1A_HTTP_LAKE", Instant.now().minus(Duration.ofDays(1))));
        Map<String, Object> body = body(SyntheticScenes.geoJson(SyntheticScenes.footprint(SyntheticScenes.GRID)));

        mvc.perform(post("/detect-water").contentType(MediaType.APPLICATION_JSON).content(json(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.water_polygons.features", hasSize(1)))
                .andExpect(jsonPath("$.water_polygons.features[0].properties.area_m2").isNumber())
                .andExpect(jsonPath("$.metadata.scene_id").value("S1A_HTTP_LAKE"))
                .andExpect(jsonPath("$.metadata.threshold.provenance").value("auto"))
                .andExpect(jsonPath("$.metadata.parameters_used.vv_threshold_mode").value("auto"))
                .andExpect(jsonPath("$.metadata.criterion_pixel_counts.combined").isNumber());
    }

    @Test
    void unknownRoute_isForbidden() throws Exception {
        mvc.perform(get("/admin"))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void unknownRoute_isForbiddenEvenWhenAuthenticated() throws Exception {
        mvc.perform(get("/admin"))
                .andExpect(status().isForbidden());
    }

    @Test
    void corsPreflight_allowsConfiguredOrigin() throws Exception {
        mvc.perform(options("/detect-water")
                        .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"));
    }

    private static Map<String, Object> body(Map<String, Object> geometry) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("geometry", geometry);
        return body;
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }
}
