package com.telelink.scoring.service;

public record RiskAssessment(RiskLevel riskLevel, double confidenceScore) {

  public ConfidenceLevel confidenceLevel() {
    return ConfidenceLevel.of(confidenceScore);
  }
}
