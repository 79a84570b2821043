package com.telelink.scoring.dto;

public record ModelVersions(String churnModel, String clvModel, String featureSpec) {}
