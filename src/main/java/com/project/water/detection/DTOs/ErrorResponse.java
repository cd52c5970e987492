package com.project.water.detection.DTOs;

public record ErrorResponse(String detail) {}
