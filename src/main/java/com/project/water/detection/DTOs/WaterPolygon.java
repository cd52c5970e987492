package com.project.water.detection.DTOs;

import org.locationtech.jts.geom.Geometry;

/** Water outline in WGS84 with its geodesic area, measured before simplification. */
public record WaterPolygon(Geometry geometry, double areaM2) {}
