package com.telelink.scoring.config;

import com.telelink.scoring.model.ModelFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Scoring pipeline settings, bound from {@code scoring.*}.
 */
@ConfigurationProperties(prefix = "scoring")
@Validated
public class ScoringProperties {

  @Valid
  private Models models = new Models();

  @Valid
  private Risk risk = new Risk();

  @Valid
  private Value value = new Value();

  @Valid
  private Batch batch = new Batch();

  @Valid
  private Cors cors = new Cors();

  public Models getModels() { return models; }
  public void setModels(Models models) { this.models = models; }
  public Risk getRisk() { return risk; }
  public void setRisk(Risk risk) { this.risk = risk; }
  public Value getValue() { return value; }
  public void setValue(Value value) { this.value = value; }
  public Batch getBatch() { return batch; }
  public void setBatch(Batch batch) { this.batch = batch; }
  public Cors getCors() { return cors; }
  public void setCors(Cors cors) { this.cors = cors; }

  /** Artifact locations, as Spring resource strings. Versioned together. */
  public static class Models {
    @NotNull
    private ModelFormat format = ModelFormat.JSON;
    @NotBlank
    private String featureSpec = "classpath:models/feature-spec.json";
    @NotBlank
    private String churn = "classpath:models/churn-model.json";
    @NotBlank
    private String clv = "classpath:models/clv-model.json";

    public ModelFormat getFormat() { return format; }
    public void setFormat(ModelFormat format) { this.format = format; }
    public String getFeatureSpec() { return featureSpec; }
    public void setFeatureSpec(String featureSpec) { this.featureSpec = featureSpec; }
    public String getChurn() { return churn; }
    public void setChurn(String churn) { this.churn = churn; }
    public String getClv() { return clv; }
    public void setClv(String clv) { this.clv = clv; }
  }

  /** Risk band cut points on the churn probability. */
  public static class Risk {
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double lowUpperBound = 0.2;
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double mediumUpperBound = 0.4;

    public double getLowUpperBound() { return lowUpperBound; }
    public void setLowUpperBound(double lowUpperBound) { this.lowUpperBound = lowUpperBound; }
    public double getMediumUpperBound() { return mediumUpperBound; }
    public void setMediumUpperBound(double mediumUpperBound) { this.mediumUpperBound = mediumUpperBound; }
  }

  public static class Value {
    /** CLV in USD above which a customer is reported as high value. */
    @PositiveOrZero
    private double highValueThreshold = 30_000;

    public double getHighValueThreshold() { return highValueThreshold; }
    public void setHighValueThreshold(double highValueThreshold) { this.highValueThreshold = highValueThreshold; }
  }

  public static class Batch {
    @Min(1)
    private int maxSize = 500;

    public int getMaxSize() { return maxSize; }
    public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
  }

  public static class Cors {
    @NotEmpty
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
  }
}
