package com.telelink.scoring.feature;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered, named model input produced by {@link FeatureEncoder}. Lives for one scoring call.
 */
public final class FeatureVector {

  private final String specVersion;
  private final List<String> names;
  private final double[] values;

  private FeatureVector(String specVersion, List<String> names, double[] values) {
    this.specVersion = specVersion;
    this.names = names;
    this.values = values;
  }

  public static FeatureVector of(String specVersion, List<String> names, double... values) {
    if (names.size() != values.length) {
      throw new IllegalArgumentException("names and values differ in length");
    }
    return new FeatureVector(specVersion, List.copyOf(names), values.clone());
  }

  public String specVersion() {
    return specVersion;
  }

  public List<String> names() {
    return names;
  }

  public int size() {
    return values.length;
  }

  public double get(int i) {
    return values[i];
  }

  public double get(String name) {
    int i = names.indexOf(name);
    if (i < 0) {
      throw new IllegalArgumentException("no feature named " + name);
    }
    return values[i];
  }

  public double[] toArray() {
    return values.clone();
  }

  public float[] toFloatArray() {
    float[] ff = new float[values.length];
    for (int i = 0; i < values.length; i++) {
      ff[i] = (float) values[i];
    }
    return ff;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FeatureVector)) return false;
    FeatureVector that = (FeatureVector) o;
    return specVersion.equals(that.specVersion) && names.equals(that.names) && Arrays.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * specVersion.hashCode() + names.hashCode()) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "FeatureVector{spec=" + specVersion + ", size=" + values.length + "}";
  }
}
