package com.telelink.scoring.dto;

public record HealthStatus(String status, String service, String apiVersion, String modelFormat, ModelVersions models) {}
