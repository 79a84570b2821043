package com.telelink.scoring.model;

import com.telelink.scoring.dto.ModelVersions;
import com.telelink.scoring.feature.FeatureSpec;

import java.util.Objects;

/**
 * The models and feature spec loaded at startup. Built once, never mutated, and shared by
 * every scoring call.
 */
public record ModelRegistry(ModelFormat format, FeatureSpec featureSpec, ChurnClassifier churnClassifier,
                            ClvRegressor clvRegressor) implements AutoCloseable {

  public ModelRegistry {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(featureSpec, "featureSpec");
    Objects.requireNonNull(churnClassifier, "churnClassifier");
    Objects.requireNonNull(clvRegressor, "clvRegressor");
  }

  public ModelVersions versions() {
    return new ModelVersions(churnClassifier.version(), clvRegressor.version(), featureSpec.getVersion());
  }

  @Override
  public void close() {
    try {
      churnClassifier.close();
    } finally {
      clvRegressor.close();
    }
  }
}
