package com.telelink.scoring.model;

import ai.onnxruntime.OrtEnvironment;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telelink.scoring.config.ScoringProperties;
import com.telelink.scoring.exception.ModelLoadException;
import com.telelink.scoring.feature.FeatureSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the feature spec and both model artifacts and checks that they were built together.
 * Any failure is a {@link ModelLoadException}; nothing is retried.
 */
@Component
public class ModelRegistryLoader {

  private static final Logger log = LoggerFactory.getLogger(ModelRegistryLoader.class);

  private final ResourceLoader resources;
  private final ObjectMapper mapper;

  public ModelRegistryLoader(ResourceLoader resources, ObjectMapper mapper) {
    this.resources = resources;
    this.mapper = mapper;
  }

  public ModelRegistry load(ScoringProperties.Models cfg) {
    FeatureSpec spec = readJson(cfg.getFeatureSpec(), FeatureSpec.class, "feature spec");
    log.info("Loaded feature spec {} ({} features, {} classifier / {} regressor)", spec.getVersion(),
        spec.featureNames().size(), spec.getClassifierFeatures().size(), spec.getRegressorFeatures().size());

    ChurnClassifier churn;
    ClvRegressor clv;
    if (cfg.getFormat() == ModelFormat.ONNX) {
      byte[] churnBytes = readBytes(cfg.getChurn(), "churn model");
      byte[] clvBytes = readBytes(cfg.getClv(), "CLV model");
      OrtEnvironment env = OrtEnvironment.getEnvironment();
      churn = new OnnxChurnClassifier(OnnxModels.open(env, churnBytes, spec.getClassifierFeatures().size(),
          OnnxChurnClassifier.PROBABILITIES, "churn"));
      try {
        clv = new OnnxClvRegressor(OnnxModels.open(env, clvBytes, spec.getRegressorFeatures().size(),
            OnnxClvRegressor.VARIABLE, "CLV"));
      } catch (ModelLoadException e) {
        churn.close();
        throw e;
      }
    } else {
      ChurnModelArtifact churnArtifact = readJson(cfg.getChurn(), ChurnModelArtifact.class, "churn model");
      ClvModelArtifact clvArtifact = readJson(cfg.getClv(), ClvModelArtifact.class, "CLV model");
      try {
        churn = TreeEnsembleChurnClassifier.fromArtifact(churnArtifact, spec.getClassifierFeatures());
      } catch (IllegalArgumentException e) {
        throw new ModelLoadException("Invalid churn model " + cfg.getChurn() + ": " + e.getMessage(), e);
      }
      try {
        clv = LinearClvRegressor.fromArtifact(clvArtifact, spec.getRegressorFeatures());
      } catch (IllegalArgumentException e) {
        throw new ModelLoadException("Invalid CLV model " + cfg.getClv() + ": " + e.getMessage(), e);
      }
    }

    ModelRegistry registry = new ModelRegistry(cfg.getFormat(), spec, churn, clv);
    try {
      requireSameSpec("churn model " + churn.version(), churn.featureSpecVersion(), spec);
      requireSameSpec("CLV model " + clv.version(), clv.featureSpecVersion(), spec);
    } catch (ModelLoadException e) {
      registry.close();
      throw e;
    }
    log.info("Loaded {} churn model {} (decision threshold {}) and CLV model {}", cfg.getFormat(),
        churn.version(), churn.decisionThreshold(), clv.version());
    return registry;
  }

  private static void requireSameSpec(String what, String declared, FeatureSpec spec) {
    if (!spec.getVersion().equals(declared)) {
      throw new ModelLoadException(what + " was trained with feature spec " + declared
          + " but feature spec " + spec.getVersion() + " is loaded");
    }
  }

  private <T> T readJson(String location, Class<T> type, String what) {
    Resource resource = existing(location, what);
    try (InputStream in = resource.getInputStream()) {
      T value = mapper.readValue(in, type);
      if (value == null) {
        throw new ModelLoadException(what + " at " + location + " is empty");
      }
      return value;
    } catch (IOException e) {
      throw new ModelLoadException("Unable to read " + what + " at " + location + ": " + e.getMessage(), e);
    }
  }

  private byte[] readBytes(String location, String what) {
    Resource resource = existing(location, what);
    try (InputStream in = resource.getInputStream()) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new ModelLoadException("Unable to read " + what + " at " + location, e);
    }
  }

  private Resource existing(String location, String what) {
    if (location == null || location.isBlank()) {
      throw new ModelLoadException("No location configured for " + what);
    }
    Resource resource = resources.getResource(location);
    if (!resource.exists()) {
      throw new ModelLoadException(what + " not found at " + location);
    }
    return resource;
  }
}
