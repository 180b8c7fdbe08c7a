package com.hydrowatch.detection.maintenance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Bagged regression trees. Each tree is grown on a bootstrap sample with variance-reduction
 * splits over every feature; the forest prediction is the mean of the tree predictions.
 */
public final class RegressionForest {

  public record Settings(int trees, int maxDepth, int minSamplesLeaf, long seed) {
    public Settings {
      if (trees < 1) throw new IllegalArgumentException("trees must be >= 1");
      if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
      if (minSamplesLeaf < 1) throw new IllegalArgumentException("minSamplesLeaf must be >= 1");
    }

    public static Settings defaults() {
      return new Settings(100, 10, 2, 42L);
    }
  }

  public record Snapshot(int featureCount, List<RegressionNode> trees) {}

  private final int featureCount;
  private final List<RegressionNode> trees;

  private RegressionForest(int featureCount, List<RegressionNode> trees) {
    this.featureCount = featureCount;
    this.trees = List.copyOf(trees);
  }

  public static RegressionForest fit(double[][] x, double[] y, Settings settings) {
    if (x.length == 0 || x.length != y.length) {
      throw new IllegalArgumentException("need matching, non-empty feature rows and targets");
    }
    Random rng = new Random(settings.seed());
    List<RegressionNode> trees = new ArrayList<>(settings.trees());
    for (int t = 0; t < settings.trees(); t++) {
      Integer[] sample = new Integer[x.length];
      for (int i = 0; i < sample.length; i++) sample[i] = rng.nextInt(x.length);
      trees.add(grow(x, y, sample, 0, settings));
    }
    return new RegressionForest(x[0].length, trees);
  }

  public static RegressionForest fromSnapshot(Snapshot snapshot) {
    return new RegressionForest(snapshot.featureCount(), snapshot.trees());
  }

  public Snapshot snapshot() {
    return new Snapshot(featureCount, trees);
  }

  public double predict(double[] features) {
    if (features.length != featureCount) {
      throw new IllegalArgumentException("expected " + featureCount + " features, got " + features.length);
    }
    double total = 0.0;
    for (RegressionNode tree : trees) {
      RegressionNode node = tree;
      while (!node.isLeaf()) {
        node = features[node.feature()] <= node.threshold() ? node.left() : node.right();
      }
      total += node.value();
    }
    return total / trees.size();
  }

  public int featureCount() {
    return featureCount;
  }

  private static RegressionNode grow(double[][] x, double[] y, Integer[] rows, int depth, Settings settings) {
    double mean = 0.0;
    for (int r : rows) mean += y[r];
    mean /= rows.length;

    if (depth >= settings.maxDepth() || rows.length < 2 * settings.minSamplesLeaf()) {
      return RegressionNode.leaf(mean);
    }

    int bestFeature = -1;
    int bestCut = -1;
    double bestThreshold = 0.0;
    double bestScore = Double.NEGATIVE_INFINITY;
    Integer[] bestOrder = null;

    double total = mean * rows.length;
    for (int f = 0; f < x[rows[0]].length; f++) {
      final int feature = f;
      Integer[] order = rows.clone();
      Arrays.sort(order, Comparator.comparingDouble(r -> x[r][feature]));
      double leftSum = 0.0;
      for (int cut = 1; cut < order.length; cut++) {
        leftSum += y[order[cut - 1]];
        if (cut < settings.minSamplesLeaf() || order.length - cut < settings.minSamplesLeaf()) continue;
        double lo = x[order[cut - 1]][feature];
        double hi = x[order[cut]][feature];
        if (lo == hi) continue;
        double rightSum = total - leftSum;
        // maximising this is equivalent to minimising the children's squared error
        double score = leftSum * leftSum / cut + rightSum * rightSum / (order.length - cut);
        if (score > bestScore) {
          bestScore = score;
          bestFeature = feature;
          bestCut = cut;
          bestThreshold = (lo + hi) / 2.0;
          bestOrder = order;
        }
      }
    }
    if (bestFeature < 0 || bestScore <= total * total / rows.length + 1e-12) {
      return RegressionNode.leaf(mean);
    }

    Integer[] left = Arrays.copyOfRange(bestOrder, 0, bestCut);
    Integer[] right = Arrays.copyOfRange(bestOrder, bestCut, bestOrder.length);
    return new RegressionNode(bestFeature, bestThreshold, mean,
        grow(x, y, left, depth + 1, settings),
        grow(x, y, right, depth + 1, settings));
  }
}
