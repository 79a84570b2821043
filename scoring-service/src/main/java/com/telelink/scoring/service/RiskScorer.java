package com.telelink.scoring.service;

import com.telelink.scoring.config.ScoringProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bands a churn probability and scores how far it sits from the nearest band boundary.
 *
 * <p>Bands are LOW = [0, low], MEDIUM = (low, medium], HIGH = (medium, 1]. Confidence is the
 * distance to the nearest cut point divided by that cut point's outer span ({@code low} for the
 * lower one, {@code 1 - medium} for the upper one), capped at 1: it is 0 on a cut point, 1 at
 * probabilities 0 and 1, and grows at the same rate on both sides of each cut point.
 */
@Component
public class RiskScorer {

  private final double lowUpperBound;
  private final double mediumUpperBound;

  @Autowired
  public RiskScorer(ScoringProperties props) {
    this(props.getRisk().getLowUpperBound(), props.getRisk().getMediumUpperBound());
  }

  public RiskScorer(double lowUpperBound, double mediumUpperBound) {
    if (!(lowUpperBound > 0.0 && lowUpperBound < mediumUpperBound && mediumUpperBound < 1.0)) {
      throw new IllegalArgumentException("risk cut points must satisfy 0 < low < medium < 1, got "
          + lowUpperBound + " and " + mediumUpperBound);
    }
    this.lowUpperBound = lowUpperBound;
    this.mediumUpperBound = mediumUpperBound;
  }

  public RiskAssessment score(double probability) {
    return new RiskAssessment(band(probability), confidence(probability));
  }

  public RiskLevel band(double probability) {
    requireProbability(probability);
    if (probability > mediumUpperBound) return RiskLevel.HIGH;
    if (probability > lowUpperBound) return RiskLevel.MEDIUM;
    return RiskLevel.LOW;
  }

  public double confidence(double probability) {
    requireProbability(probability);
    double midpoint = (lowUpperBound + mediumUpperBound) / 2;
    double distance;
    double span;
    if (probability <= midpoint) {
      distance = Math.abs(probability - lowUpperBound);
      span = lowUpperBound;
    } else {
      distance = Math.abs(probability - mediumUpperBound);
      span = 1.0 - mediumUpperBound;
    }
    return Math.min(1.0, distance / span);
  }

  public double lowUpperBound() {
    return lowUpperBound;
  }

  public double mediumUpperBound() {
    return mediumUpperBound;
  }

  private static void requireProbability(double p) {
    if (!(p >= 0.0 && p <= 1.0)) {
      throw new IllegalArgumentException("probability must lie in [0, 1], got " + p);
    }
  }
}
