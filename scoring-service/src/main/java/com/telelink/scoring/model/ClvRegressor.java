package com.telelink.scoring.model;

import com.telelink.scoring.feature.FeatureVector;

/**
 * Customer lifetime value model over the regressor view of a {@link FeatureVector}.
 * Implementations are immutable and safe for concurrent use.
 */
public interface ClvRegressor extends AutoCloseable {

  String version();

  String featureSpecVersion();

  /** @return estimated lifetime value in USD; negative raw outputs are reported as 0 */
  double predict(FeatureVector features);

  @Override
  default void close() {}
}
