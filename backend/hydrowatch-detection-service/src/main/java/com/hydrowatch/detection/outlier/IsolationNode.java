package com.hydrowatch.detection.outlier;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Node of an isolation tree. Leaves have no children and record how many training points
 * reached them; internal nodes send {@code x[feature] < split} left.
 */
public record IsolationNode(int feature, double split, int size, IsolationNode left, IsolationNode right) {

  public static IsolationNode leaf(int size) {
    return new IsolationNode(-1, 0.0, size, null, null);
  }

  @JsonIgnore
  public boolean isLeaf() {
    return left == null;
  }

  /** True when every internal node splits on a valid feature and has two children. */
  public boolean wellFormed(int featureCount) {
    if (isLeaf()) return right == null && size >= 0;
    return right != null && feature >= 0 && feature < featureCount && Double.isFinite(split)
        && left.wellFormed(featureCount) && right.wellFormed(featureCount);
  }
}
