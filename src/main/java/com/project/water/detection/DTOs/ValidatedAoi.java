package com.project.water.detection.DTOs;

import org.locationtech.jts.geom.Geometry;

/** Parsed, valid AOI in WGS84 and its geodesic area. */
public record ValidatedAoi(Geometry geometry, double areaKm2) {}
