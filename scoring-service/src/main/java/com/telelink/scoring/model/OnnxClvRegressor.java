package com.telelink.scoring.model;

import com.telelink.scoring.exception.InferenceException;
import com.telelink.scoring.feature.FeatureVector;

public final class OnnxClvRegressor implements ClvRegressor {

  static final String VARIABLE = "variable";

  private final OnnxModels.Handle model;

  OnnxClvRegressor(OnnxModels.Handle model) {
    this.model = model;
  }

  @Override
  public String version() {
    return model.version;
  }

  @Override
  public String featureSpecVersion() {
    return model.featureSpecVersion;
  }

  @Override
  public double predict(FeatureVector features) {
    double y = model.run(features, "CLV")[0][0];
    if (Double.isNaN(y)) {
      throw new InferenceException("CLV model " + model.version + " produced NaN");
    }
    return Math.max(0.0, y);
  }

  @Override
  public void close() {
    model.close();
  }
}
