package com.telelink.scoring.model;

import com.telelink.scoring.exception.InferenceException;
import com.telelink.scoring.exception.ModelLoadException;
import com.telelink.scoring.feature.FeatureVector;

public final class OnnxChurnClassifier implements ChurnClassifier {

  static final String PROBABILITIES = "probabilities";

  private final OnnxModels.Handle model;
  private final double decisionThreshold;

  OnnxChurnClassifier(OnnxModels.Handle model) {
    this.model = model;
    String raw = model.metadata.get(OnnxModels.META_DECISION_THRESHOLD);
    if (raw == null) {
      model.close();
      throw new ModelLoadException("churn ONNX model lacks '" + OnnxModels.META_DECISION_THRESHOLD + "' metadata");
    }
    try {
      this.decisionThreshold = Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      model.close();
      throw new ModelLoadException("churn ONNX model has unreadable decision threshold '" + raw + "'", e);
    }
    if (!(decisionThreshold > 0.0 && decisionThreshold < 1.0)) {
      model.close();
      throw new ModelLoadException("churn ONNX decision threshold must lie strictly between 0 and 1");
    }
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
  public double decisionThreshold() {
    return decisionThreshold;
  }

  @Override
  public double predict(FeatureVector features) {
    float[][] v = model.run(features, "churn");
    double p = v[0].length >= 2 ? v[0][1] : v[0][0];
    if (!(p >= 0.0 && p <= 1.0)) {
      throw new InferenceException("churn model " + model.version + " produced probability " + p);
    }
    return p;
  }

  @Override
  public void close() {
    model.close();
  }
}
