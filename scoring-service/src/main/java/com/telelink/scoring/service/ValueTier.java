package com.telelink.scoring.service;

public enum ValueTier {
  STANDARD,
  HIGH_VALUE;

  public static ValueTier of(double clvEstimate, double highValueThreshold) {
    return clvEstimate > highValueThreshold ? HIGH_VALUE : STANDARD;
  }
}
