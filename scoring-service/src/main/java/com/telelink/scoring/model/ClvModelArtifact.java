package com.telelink.scoring.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/** JSON form of a linear CLV model: one coefficient per regressor feature plus intercept. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClvModelArtifact(
    String modelType,
    String version,
    String featureSpecVersion,
    Double intercept,
    Map<String, Double> coefficients) {

  public static final String MODEL_TYPE = "linear-regressor";
}
