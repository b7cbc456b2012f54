package com.scholary.vidsub.api;

public record HealthResponse(String status) {}
