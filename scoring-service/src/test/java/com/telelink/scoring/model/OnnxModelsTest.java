package com.telelink.scoring.model;

import com.telelink.scoring.exception.ModelLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OnnxModelsTest {

  private static Map<String, Boolean> outputs(Object... nameAndFloat) {
    Map<String, Boolean> m = new LinkedHashMap<>();
    for (int i = 0; i < nameAndFloat.length; i += 2) {
      m.put((String) nameAndFloat[i], (Boolean) nameAndFloat[i + 1]);
    }
    return m;
  }

  @Test
  @DisplayName("should read probabilities from a classifier exported without zipmap")
  void classifierWithoutZipmap() {
    assertThat(OnnxModels.selectOutput(outputs("label", false, "probabilities", true),
        OnnxChurnClassifier.PROBABILITIES, "churn"))
        .isEqualTo("probabilities");
  }

  @Test
  @DisplayName("should reject a classifier whose probabilities are not a float tensor")
  void probabilitiesAsSequence() {
    assertThatThrownBy(() -> OnnxModels.selectOutput(outputs("label", false, "probabilities", false),
        OnnxChurnClassifier.PROBABILITIES, "churn"))
        .isInstanceOf(ModelLoadException.class)
        .hasMessageContaining("zipmap");
  }

  @Test
  @DisplayName("should reject a zipmap export at load time")
  void zipmapExport() {
    assertThatThrownBy(() -> OnnxModels.selectOutput(outputs("output_label", false, "output_probability", false),
        OnnxChurnClassifier.PROBABILITIES, "churn"))
        .isInstanceOf(ModelLoadException.class)
        .hasMessageContaining("output_probability");
  }

  @Test
  @DisplayName("should fall back to the only float tensor output")
  void singleFloatOutput() {
    assertThat(OnnxModels.selectOutput(outputs("predictions", true), OnnxClvRegressor.VARIABLE, "CLV"))
        .isEqualTo("predictions");
  }

  @Test
  @DisplayName("should not guess between several float tensor outputs")
  void ambiguousOutputs() {
    assertThatThrownBy(() -> OnnxModels.selectOutput(outputs("a", true, "b", true),
        OnnxClvRegressor.VARIABLE, "CLV"))
        .isInstanceOf(ModelLoadException.class)
        .hasMessageContaining("2 float tensor outputs");
  }
}
