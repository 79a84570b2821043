package com.telelink.scoring.feature;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureSpecTest {

  private static final Map<String, List<String>> VOCAB =
      Map.of("state", List.of("CA", "NY"), "area_code", List.of("408", "415", "510"));

  @Test
  @DisplayName("should order raw features, then states, then area codes")
  void featureSpaceIsRawFeaturesThenStatesThenAreaCodes() {
    FeatureSpec spec = new FeatureSpec("v1", VOCAB, null, List.of("account_length"), List.of("state=NY"));

    List<String> names = spec.featureNames();
    assertThat(names).hasSize(RawFeature.values().length + 2 + 3);
    assertThat(names.get(0)).isEqualTo("account_length");
    assertThat(names.subList(RawFeature.values().length, names.size()))
        .containsExactly("state=CA", "state=NY", "area_code=408", "area_code=415", "area_code=510");
    assertThat(spec.getScaling()).isEmpty();
  }

  @Test
  @DisplayName("should reject a blank version")
  void rejectsBlankVersion() {
    assertThatThrownBy(() -> new FeatureSpec(" ", VOCAB, null, List.of("account_length"), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("version");
  }

  @Test
  @DisplayName("should reject empty or repeated vocabularies")
  void rejectsEmptyOrDuplicatedVocabulary() {
    assertThatThrownBy(() -> new FeatureSpec("v1", Map.of("state", List.of("CA"), "area_code", List.of()),
        null, List.of("account_length"), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("area_code");
    assertThatThrownBy(() -> new FeatureSpec("v1", Map.of("state", List.of("CA", "CA"), "area_code", List.of("408")),
        null, List.of("account_length"), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("repeats");
  }

  @Test
  @DisplayName("should reject scaling for flags and unknown features")
  void rejectsScalingOfFlagsAndUnknownFeatures() {
    assertThatThrownBy(() -> new FeatureSpec("v1", VOCAB, Map.of("voice_mail_plan", new Scaling(0.5, 0.5)),
        List.of("account_length"), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("voice_mail_plan");
    assertThatThrownBy(() -> new FeatureSpec("v1", VOCAB, Map.of("total_charge", new Scaling(0.5, 0.5)),
        List.of("account_length"), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("total_charge");
  }

  @Test
  @DisplayName("should reject a zero standard deviation")
  void rejectsZeroStandardDeviation() {
    assertThatThrownBy(() -> new Scaling(10.0, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should reject unknown or repeated view features")
  void rejectsUnknownOrRepeatedViewFeatures() {
    assertThatThrownBy(() -> new FeatureSpec("v1", VOCAB, null, List.of("state=TX"), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("state=TX");
    assertThatThrownBy(() -> new FeatureSpec("v1", VOCAB, null, List.of("account_length"),
        List.of("account_length", "account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("repeats");
    assertThatThrownBy(() -> new FeatureSpec("v1", VOCAB, null, List.of(), List.of("account_length")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("classifierFeatures");
  }

  @Test
  @DisplayName("should read the bundled feature spec")
  void bundledSpecDeserialises() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/models/feature-spec.json")) {
      FeatureSpec spec = new ObjectMapper().readValue(in, FeatureSpec.class);

      assertThat(spec.getVersion()).isEqualTo("telecom-churn-fs-2.0.0");
      assertThat(spec.getStates()).hasSize(51).contains("CA", "DC", "WY");
      assertThat(spec.getAreaCodes()).containsExactly("408", "415", "510");
      assertThat(spec.getScaling().get("total_day_charge")).isEqualTo(new Scaling(30.56, 9.26));
    }
  }
}
