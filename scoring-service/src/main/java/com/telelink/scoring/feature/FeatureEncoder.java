package com.telelink.scoring.feature;

import com.telelink.scoring.dto.CustomerRecord;
import com.telelink.scoring.exception.RecordValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link CustomerRecord} into the classifier and regressor inputs described by a
 * {@link FeatureSpec}. Stateless apart from the spec it was built with.
 */
public class FeatureEncoder {

  private final FeatureSpec spec;

  public FeatureEncoder(FeatureSpec spec) {
    this.spec = spec;
  }

  public FeatureSpec spec() {
    return spec;
  }

  /**
   * Validates and encodes {@code record} in one pass.
   *
   * @throws RecordValidationException listing every missing, negative, non-finite or
   *     out-of-vocabulary field of the record
   */
  public EncodedFeatures encode(CustomerRecord record) {
    if (record == null) {
      throw RecordValidationException.of("record", "must not be null");
    }
    Map<String, String> violations = new LinkedHashMap<>();
    double[] full = new double[spec.featureNames().size()];

    for (RawFeature f : RawFeature.values()) {
      Object raw = f.extract(record);
      if (raw == null) {
        violations.put(f.fieldName(), "must not be null");
        continue;
      }
      double value;
      if (f.isFlag()) {
        value = ((Boolean) raw) ? 1.0 : 0.0;
      } else {
        value = ((Number) raw).doubleValue();
        if (!Double.isFinite(value)) {
          violations.put(f.fieldName(), "must be a finite number");
          continue;
        }
        if (value < 0) {
          violations.put(f.fieldName(), "must be greater than or equal to 0");
          continue;
        }
        Scaling s = spec.getScaling().get(f.featureName());
        if (s != null) {
          value = s.apply(value);
        }
      }
      full[spec.indexOf(f.featureName())] = value;
    }

    oneHot(full, violations, "state", record.state(), FeatureSpec.STATE_PREFIX);
    oneHot(full, violations, "areaCode", record.areaCode(), FeatureSpec.AREA_CODE_PREFIX);

    if (!violations.isEmpty()) {
      throw new RecordValidationException(violations);
    }
    return new EncodedFeatures(
        view(full, spec.getClassifierFeatures(), spec.classifierIndices()),
        view(full, spec.getRegressorFeatures(), spec.regressorIndices()));
  }

  private void oneHot(double[] full, Map<String, String> violations, String field, String value, String prefix) {
    if (value == null) {
      violations.put(field, "must not be null");
      return;
    }
    int i = spec.indexOf(prefix + value);
    if (i < 0) {
      violations.put(field, "'" + value + "' is not in the training vocabulary");
      return;
    }
    full[i] = 1.0;
  }

  private FeatureVector view(double[] full, List<String> names, int[] indices) {
    double[] v = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      v[i] = full[indices[i]];
    }
    return FeatureVector.of(spec.getVersion(), names, v);
  }
}
