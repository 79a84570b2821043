package com.telelink.scoring.model;

import com.telelink.scoring.feature.FeatureVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Random-forest style classifier: the churn probability is the mean of the leaf probabilities
 * reached in each tree. A sample goes left when {@code x <= threshold}.
 */
public final class TreeEnsembleChurnClassifier implements ChurnClassifier {

  private final String version;
  private final String featureSpecVersion;
  private final double decisionThreshold;
  private final int featureCount;
  private final List<DecisionTree> trees;

  TreeEnsembleChurnClassifier(String version, String featureSpecVersion, double decisionThreshold,
                              int featureCount, List<DecisionTree> trees) {
    this.version = version;
    this.featureSpecVersion = featureSpecVersion;
    this.decisionThreshold = decisionThreshold;
    this.featureCount = featureCount;
    this.trees = List.copyOf(trees);
  }

  /**
   * Resolves the artifact's feature names against the classifier view.
   *
   * @throws IllegalArgumentException if the artifact is structurally invalid
   */
  public static TreeEnsembleChurnClassifier fromArtifact(ChurnModelArtifact artifact, List<String> viewFeatures) {
    if (!ChurnModelArtifact.MODEL_TYPE.equals(artifact.modelType())) {
      throw new IllegalArgumentException("unsupported churn model type '" + artifact.modelType() + "'");
    }
    requireText(artifact.version(), "version");
    requireText(artifact.featureSpecVersion(), "featureSpecVersion");
    Double threshold = artifact.decisionThreshold();
    if (threshold == null || !(threshold > 0.0 && threshold < 1.0)) {
      throw new IllegalArgumentException("decisionThreshold must lie strictly between 0 and 1");
    }
    if (artifact.trees() == null || artifact.trees().isEmpty()) {
      throw new IllegalArgumentException("ensemble has no trees");
    }
    List<DecisionTree> trees = new ArrayList<>();
    for (int t = 0; t < artifact.trees().size(); t++) {
      ChurnModelArtifact.Tree tree = artifact.trees().get(t);
      if (tree == null || tree.nodes() == null) {
        throw new IllegalArgumentException("tree " + t + " has no nodes");
      }
      trees.add(DecisionTree.build(t, tree.nodes(), viewFeatures));
    }
    return new TreeEnsembleChurnClassifier(artifact.version(), artifact.featureSpecVersion(), threshold,
        viewFeatures.size(), trees);
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
  }

  @Override
  public String version() {
    return version;
  }

  @Override
  public String featureSpecVersion() {
    return featureSpecVersion;
  }

  @Override
  public double decisionThreshold() {
    return decisionThreshold;
  }

  public int treeCount() {
    return trees.size();
  }

  @Override
  public double predict(FeatureVector features) {
    if (features.size() != featureCount) {
      throw new IllegalArgumentException("expected " + featureCount + " features, got " + features.size());
    }
    double sum = 0.0;
    for (DecisionTree tree : trees) {
      sum += tree.leafValue(features);
    }
    return sum / trees.size();
  }

  /** One tree in array form. Children always follow their parent, so traversal terminates. */
  static final class DecisionTree {
    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] value;

    private DecisionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {
      this.feature = feature;
      this.threshold = threshold;
      this.left = left;
      this.right = right;
      this.value = value;
    }

    static DecisionTree build(int treeIndex, List<ChurnModelArtifact.Node> nodes, List<String> viewFeatures) {
      int n = nodes.size();
      if (n == 0) {
        throw new IllegalArgumentException("tree " + treeIndex + " has no nodes");
      }
      int[] feature = new int[n];
      double[] threshold = new double[n];
      int[] left = new int[n];
      int[] right = new int[n];
      double[] value = new double[n];
      for (int i = 0; i < n; i++) {
        ChurnModelArtifact.Node node = nodes.get(i);
        String where = "tree " + treeIndex + " node " + i;
        if (node == null) {
          throw new IllegalArgumentException(where + " is null");
        }
        if (node.isLeaf()) {
          Double v = node.value();
          if (v == null || !(v >= 0.0 && v <= 1.0)) {
            throw new IllegalArgumentException(where + ": leaf value must be a probability");
          }
          feature[i] = -1;
          value[i] = v;
          continue;
        }
        int f = viewFeatures.indexOf(node.feature());
        if (f < 0) {
          throw new IllegalArgumentException(where + " splits on '" + node.feature() + "', not in the classifier view");
        }
        if (node.threshold() == null || !Double.isFinite(node.threshold())) {
          throw new IllegalArgumentException(where + ": threshold must be finite");
        }
        if (node.left() == null || node.right() == null
            || node.left() <= i || node.right() <= i || node.left() >= n || node.right() >= n) {
          throw new IllegalArgumentException(where + ": children must reference later nodes");
        }
        feature[i] = f;
        threshold[i] = node.threshold();
        left[i] = node.left();
        right[i] = node.right();
      }
      return new DecisionTree(feature, threshold, left, right, value);
    }

    double leafValue(FeatureVector x) {
      int i = 0;
      while (feature[i] >= 0) {
        i = x.get(feature[i]) <= threshold[i] ? left[i] : right[i];
      }
      return value[i];
    }
  }
}
