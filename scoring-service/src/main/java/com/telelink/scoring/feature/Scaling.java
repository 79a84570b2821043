package com.telelink.scoring.feature;

/**
 * Training-time standardisation parameters for one numeric feature.
 */
public record Scaling(double mean, double std) {

  public Scaling {
    if (!Double.isFinite(mean)) {
      throw new IllegalArgumentException("scaling mean must be finite");
    }
    if (!Double.isFinite(std) || std <= 0.0) {
      throw new IllegalArgumentException("scaling std must be finite and positive");
    }
  }

  public double apply(double value) {
    return (value - mean) / std;
  }
}
