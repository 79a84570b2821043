package com.telelink.scoring.model;

import com.telelink.scoring.feature.FeatureVector;

/**
 * Churn probability model over the classifier view of a {@link FeatureVector}.
 * Implementations are immutable and safe for concurrent use.
 */
public interface ChurnClassifier extends AutoCloseable {

  String version();

  /** Version of the feature spec the model was trained against. */
  String featureSpecVersion();

  /** Operating point chosen during tuning for the binary churn label. */
  double decisionThreshold();

  /** @return probability of churn, in [0, 1] */
  double predict(FeatureVector features);

  default boolean isChurn(double probability) {
    return probability >= decisionThreshold();
  }

  @Override
  default void close() {}
}
