package com.telelink.scoring.model;

import com.telelink.scoring.feature.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearClvRegressorTest {

  private static final List<String> VIEW = List.of("total_day_charge", "customer_service_calls");

  private static LinearClvRegressor regressor(double intercept) {
    Map<String, Double> coef = new LinkedHashMap<>();
    coef.put("customer_service_calls", -2000.0);
    coef.put("total_day_charge", 5000.0);
    return LinearClvRegressor.fromArtifact(
        new ClvModelArtifact(ClvModelArtifact.MODEL_TYPE, "clv-test", "fs-test", intercept, coef), VIEW);
  }

  @Test
  @DisplayName("should apply coefficients in view order")
  void ordersCoefficientsByView() {
    FeatureVector x = FeatureVector.of("fs-test", VIEW, 1.5, 2.0);

    assertThat(regressor(30_000).predict(x)).isCloseTo(30_000 + 5000 * 1.5 - 2000 * 2.0, within(1e-9));
  }

  @Test
  @DisplayName("should clamp a negative estimate to exactly zero")
  void clampsNegativeOutputToExactlyZero() {
    LinearClvRegressor model = regressor(1_000);
    FeatureVector x = FeatureVector.of("fs-test", VIEW, -3.0, 4.0);

    assertThat(model.rawPredict(x)).isNegative();
    assertThat(model.predict(x)).isEqualTo(0.0);
  }

  @Test
  @DisplayName("should pass zero and positive estimates through")
  void keepsZeroAndPositiveOutputs() {
    FeatureVector x = FeatureVector.of("fs-test", VIEW, 0.0, 0.0);

    assertThat(regressor(0).predict(x)).isEqualTo(0.0);
    assertThat(regressor(12.5).predict(x)).isEqualTo(12.5);
  }

  @Test
  @DisplayName("should require a coefficient for every view feature and no others")
  void requiresExactlyTheViewFeatures() {
    ClvModelArtifact missing = new ClvModelArtifact(ClvModelArtifact.MODEL_TYPE, "clv-test", "fs-test", 0.0,
        Map.of("total_day_charge", 1.0));
    ClvModelArtifact extra = new ClvModelArtifact(ClvModelArtifact.MODEL_TYPE, "clv-test", "fs-test", 0.0,
        Map.of("total_day_charge", 1.0, "customer_service_calls", 1.0, "account_length", 1.0));

    assertThatThrownBy(() -> LinearClvRegressor.fromArtifact(missing, VIEW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("customer_service_calls");
    assertThatThrownBy(() -> LinearClvRegressor.fromArtifact(extra, VIEW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("account_length");
  }

  @Test
  @DisplayName("should reject a non-finite intercept")
  void requiresFiniteIntercept() {
    ClvModelArtifact artifact = new ClvModelArtifact(ClvModelArtifact.MODEL_TYPE, "clv-test", "fs-test",
        Double.NaN, Map.of("total_day_charge", 1.0, "customer_service_calls", 1.0));

    assertThatThrownBy(() -> LinearClvRegressor.fromArtifact(artifact, VIEW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("intercept");
  }
}
