package com.telelink.scoring.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON form of a tree-ensemble churn model. Trees use a flat node layout: internal nodes carry
 * {@code feature}, {@code threshold}, {@code left} and {@code right}; leaves carry
 * {@code value}, the churn probability of that leaf.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChurnModelArtifact(
    String modelType,
    String version,
    String featureSpecVersion,
    Double decisionThreshold,
    List<Tree> trees) {

  public static final String MODEL_TYPE = "tree-ensemble-classifier";

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Tree(List<Node> nodes) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Node(String feature, Double threshold, Integer left, Integer right, Double value) {

    public boolean isLeaf() {
      return feature == null;
    }
  }
}
