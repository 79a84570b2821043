package com.telelink.scoring.model;

import com.telelink.scoring.feature.FeatureVector;

import java.util.List;
import java.util.Map;

/**
 * Ordinary linear CLV model. Lifetime value cannot be negative, so raw outputs below zero are
 * clamped to zero.
 */
public final class LinearClvRegressor implements ClvRegressor {

  private final String version;
  private final String featureSpecVersion;
  private final double[] coefficients;
  private final double intercept;

  LinearClvRegressor(String version, String featureSpecVersion, double[] coefficients, double intercept) {
    this.version = version;
    this.featureSpecVersion = featureSpecVersion;
    this.coefficients = coefficients.clone();
    this.intercept = intercept;
  }

  /**
   * Orders the artifact's coefficients by the regressor view. The artifact must cover exactly
   * the view's features.
   *
   * @throws IllegalArgumentException if the artifact is structurally invalid
   */
  public static LinearClvRegressor fromArtifact(ClvModelArtifact artifact, List<String> viewFeatures) {
    if (!ClvModelArtifact.MODEL_TYPE.equals(artifact.modelType())) {
      throw new IllegalArgumentException("unsupported CLV model type '" + artifact.modelType() + "'");
    }
    if (artifact.version() == null || artifact.version().isBlank()) {
      throw new IllegalArgumentException("version is required");
    }
    if (artifact.featureSpecVersion() == null || artifact.featureSpecVersion().isBlank()) {
      throw new IllegalArgumentException("featureSpecVersion is required");
    }
    if (artifact.intercept() == null || !Double.isFinite(artifact.intercept())) {
      throw new IllegalArgumentException("intercept must be finite");
    }
    Map<String, Double> coef = artifact.coefficients() == null ? Map.of() : artifact.coefficients();
    for (String name : coef.keySet()) {
      if (!viewFeatures.contains(name)) {
        throw new IllegalArgumentException("coefficient for '" + name + "', not in the regressor view");
      }
    }
    double[] ordered = new double[viewFeatures.size()];
    for (int i = 0; i < ordered.length; i++) {
      Double c = coef.get(viewFeatures.get(i));
      if (c == null || !Double.isFinite(c)) {
        throw new IllegalArgumentException("missing or non-finite coefficient for '" + viewFeatures.get(i) + "'");
      }
      ordered[i] = c;
    }
    return new LinearClvRegressor(artifact.version(), artifact.featureSpecVersion(), ordered, artifact.intercept());
  }

  @Override
  public String version() {
    return version;
  }

  @Override
  public String featureSpecVersion() {
    return featureSpecVersion;
  }

  @Override
  public double predict(FeatureVector features) {
    return Math.max(0.0, rawPredict(features));
  }

  double rawPredict(FeatureVector features) {
    if (features.size() != coefficients.length) {
      throw new IllegalArgumentException("expected " + coefficients.length + " features, got " + features.size());
    }
    double y = intercept;
    for (int i = 0; i < coefficients.length; i++) {
      y += coefficients[i] * features.get(i);
    }
    return y;
  }
}
