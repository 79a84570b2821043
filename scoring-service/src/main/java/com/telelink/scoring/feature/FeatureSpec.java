package com.telelink.scoring.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned description of how a customer record becomes model input: the frozen category
 * vocabularies, the training-time scaling table and the feature subset each model consumes.
 * Shared by the classifier and the regressor so both see the same encoding.
 *
 * <p>The full feature space is every {@link RawFeature}, then one {@code state=XX} column per
 * state and one {@code area_code=NNN} column per area code, in vocabulary order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FeatureSpec {

  public static final String STATE_PREFIX = "state=";
  public static final String AREA_CODE_PREFIX = "area_code=";

  private final String version;
  private final List<String> states;
  private final List<String> areaCodes;
  private final Map<String, Scaling> scaling;
  private final List<String> classifierFeatures;
  private final List<String> regressorFeatures;

  private final List<String> featureNames;
  private final Map<String, Integer> featureIndex;
  private final int[] classifierIndices;
  private final int[] regressorIndices;

  @JsonCreator
  public FeatureSpec(
      @JsonProperty("version") String version,
      @JsonProperty("vocabularies") Map<String, List<String>> vocabularies,
      @JsonProperty("scaling") Map<String, Scaling> scaling,
      @JsonProperty("classifierFeatures") List<String> classifierFeatures,
      @JsonProperty("regressorFeatures") List<String> regressorFeatures) {
    if (version == null || version.isBlank()) {
      throw new IllegalArgumentException("feature spec version is required");
    }
    if (vocabularies == null) {
      throw new IllegalArgumentException("vocabularies are required");
    }
    this.version = version;
    this.states = vocabulary("state", vocabularies.get("state"));
    this.areaCodes = vocabulary("area_code", vocabularies.get("area_code"));

    List<String> names = new ArrayList<>();
    for (RawFeature f : RawFeature.values()) {
      names.add(f.featureName());
    }
    states.forEach(s -> names.add(STATE_PREFIX + s));
    areaCodes.forEach(a -> names.add(AREA_CODE_PREFIX + a));
    this.featureNames = Collections.unmodifiableList(names);
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < names.size(); i++) {
      index.put(names.get(i), i);
    }
    this.featureIndex = Collections.unmodifiableMap(index);

    Map<String, Scaling> sc = new LinkedHashMap<>(scaling == null ? Map.of() : scaling);
    for (Map.Entry<String, Scaling> e : sc.entrySet()) {
      RawFeature raw = rawFeature(e.getKey());
      if (raw == null || raw.isFlag()) {
        throw new IllegalArgumentException("scaling entry '" + e.getKey() + "' does not name a numeric feature");
      }
      if (e.getValue() == null) {
        throw new IllegalArgumentException("scaling entry '" + e.getKey() + "' has no parameters");
      }
    }
    this.scaling = Collections.unmodifiableMap(sc);

    this.classifierFeatures = List.copyOf(view("classifierFeatures", classifierFeatures));
    this.regressorFeatures = List.copyOf(view("regressorFeatures", regressorFeatures));
    this.classifierIndices = indicesOf(this.classifierFeatures);
    this.regressorIndices = indicesOf(this.regressorFeatures);
  }

  private static List<String> vocabulary(String name, List<String> values) {
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("vocabulary '" + name + "' must not be empty");
    }
    Set<String> seen = new HashSet<>();
    for (String v : values) {
      if (v == null || v.isBlank()) {
        throw new IllegalArgumentException("vocabulary '" + name + "' contains a blank entry");
      }
      if (!seen.add(v)) {
        throw new IllegalArgumentException("vocabulary '" + name + "' repeats '" + v + "'");
      }
    }
    return List.copyOf(values);
  }

  private List<String> view(String name, List<String> features) {
    if (features == null || features.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
    Set<String> seen = new HashSet<>();
    for (String f : features) {
      if (!featureIndex.containsKey(f)) {
        throw new IllegalArgumentException(name + " references unknown feature '" + f + "'");
      }
      if (!seen.add(f)) {
        throw new IllegalArgumentException(name + " repeats feature '" + f + "'");
      }
    }
    return features;
  }

  private int[] indicesOf(List<String> features) {
    int[] idx = new int[features.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = featureIndex.get(features.get(i));
    }
    return idx;
  }

  private static RawFeature rawFeature(String featureName) {
    for (RawFeature f : RawFeature.values()) {
      if (f.featureName().equals(featureName)) {
        return f;
      }
    }
    return null;
  }

  public String getVersion() {
    return version;
  }

  public List<String> getStates() {
    return states;
  }

  public List<String> getAreaCodes() {
    return areaCodes;
  }

  public Map<String, Scaling> getScaling() {
    return scaling;
  }

  public List<String> getClassifierFeatures() {
    return classifierFeatures;
  }

  public List<String> getRegressorFeatures() {
    return regressorFeatures;
  }

  /** Names of the full feature space, in encoding order. */
  public List<String> featureNames() {
    return featureNames;
  }

  int indexOf(String featureName) {
    Integer i = featureIndex.get(featureName);
    return i == null ? -1 : i;
  }

  int[] classifierIndices() {
    return classifierIndices;
  }

  int[] regressorIndices() {
    return regressorIndices;
  }
}
