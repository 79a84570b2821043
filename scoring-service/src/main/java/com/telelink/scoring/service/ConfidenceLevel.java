package com.telelink.scoring.service;

/** Coarse label for a confidence score. */
public enum ConfidenceLevel {
  LOW,
  MODERATE,
  HIGH,
  VERY_HIGH;

  public static ConfidenceLevel of(double confidenceScore) {
    if (confidenceScore >= 0.8) return VERY_HIGH;
    if (confidenceScore >= 0.6) return HIGH;
    if (confidenceScore >= 0.3) return MODERATE;
    return LOW;
  }
}
