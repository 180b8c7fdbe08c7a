package com.hydrowatch.detection.maintenance;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** Node of a regression tree; leaves carry the mean target of the rows that reached them. */
public record RegressionNode(int feature, double threshold, double value, RegressionNode left, RegressionNode right) {

  public static RegressionNode leaf(double value) {
    return new RegressionNode(-1, 0.0, value, null, null);
  }

  @JsonIgnore
  public boolean isLeaf() {
    return left == null;
  }

  public boolean wellFormed(int featureCount) {
    if (isLeaf()) return right == null && Double.isFinite(value);
    return right != null && feature >= 0 && feature < featureCount && Double.isFinite(threshold)
        && left.wellFormed(featureCount) && right.wellFormed(featureCount);
  }
}
