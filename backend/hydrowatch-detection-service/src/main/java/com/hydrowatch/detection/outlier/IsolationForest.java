package com.hydrowatch.detection.outlier;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Ensemble of randomised isolation trees. Each tree is grown on a random subsample by
 * axis-aligned splits at a uniform random value between the node's min and max of a random
 * feature. Points that isolate in few splits are anomalous.
 *
 * <p>{@link #score(double[])} returns {@code 2^(-E[h(x)] / c(psi))} in (0, 1]; higher is more
 * anomalous. The decision threshold is the training-score percentile at
 * {@code 1 - contamination}, so roughly that fraction of the training data scores above it.
 */
public final class IsolationForest {

  private static final double EULER_GAMMA = 0.5772156649;

  public record Settings(int trees, int maxSamples, double contamination, long seed) {
    public Settings {
      if (trees < 1) throw new IllegalArgumentException("trees must be >= 1");
      if (maxSamples < 2) throw new IllegalArgumentException("maxSamples must be >= 2");
      if (contamination <= 0 || contamination > 0.5) {
        throw new IllegalArgumentException("contamination must be in (0, 0.5]");
      }
    }

    public static Settings defaults() {
      return new Settings(100, 256, 0.1, 42L);
    }
  }

  public record Snapshot(int sampleSize, double threshold, List<IsolationNode> trees) {}

  private final List<IsolationNode> trees;
  private final int sampleSize;
  private final double threshold;

  private IsolationForest(List<IsolationNode> trees, int sampleSize, double threshold) {
    this.trees = List.copyOf(trees);
    this.sampleSize = sampleSize;
    this.threshold = threshold;
  }

  /**
   * Grows the forest on already-normalised rows. Requires at least two rows of equal width.
   */
  public static IsolationForest fit(double[][] data, Settings settings) {
    if (data.length < 2) {
      throw new IllegalArgumentException("need at least 2 rows, got " + data.length);
    }
    Random rng = new Random(settings.seed());
    int psi = Math.min(settings.maxSamples(), data.length);
    int maxDepth = (int) Math.ceil(log2(psi));

    List<IsolationNode> trees = new ArrayList<>(settings.trees());
    for (int t = 0; t < settings.trees(); t++) {
      int[] sample = subsample(data.length, psi, rng);
      trees.add(grow(data, sample, 0, sample.length, 0, maxDepth, rng));
    }

    IsolationForest unthresholded = new IsolationForest(trees, psi, Double.NaN);
    double[] trainingScores = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      trainingScores[i] = unthresholded.score(data[i]);
    }
    double threshold = new Percentile()
        .withEstimationType(Percentile.EstimationType.R_7)
        .evaluate(trainingScores, 100.0 * (1.0 - settings.contamination()));
    return new IsolationForest(trees, psi, threshold);
  }

  public static IsolationForest fromSnapshot(Snapshot snapshot) {
    return new IsolationForest(snapshot.trees(), snapshot.sampleSize(), snapshot.threshold());
  }

  public Snapshot snapshot() {
    return new Snapshot(sampleSize, threshold, trees);
  }

  public double score(double[] point) {
    double total = 0.0;
    for (IsolationNode tree : trees) {
      total += pathLength(tree, point);
    }
    double mean = total / trees.size();
    return Math.pow(2.0, -mean / averagePathLength(sampleSize));
  }

  public boolean isOutlier(double score) {
    return score > threshold;
  }

  public double threshold() {
    return threshold;
  }

  public int treeCount() {
    return trees.size();
  }

  private static double pathLength(IsolationNode node, double[] point) {
    int depth = 0;
    while (!node.isLeaf()) {
      node = point[node.feature()] < node.split() ? node.left() : node.right();
      depth++;
    }
    return depth + averagePathLength(node.size());
  }

  /** Average path length of an unsuccessful search in a binary search tree of n points. */
  static double averagePathLength(int n) {
    if (n <= 1) return 0.0;
    if (n == 2) return 1.0;
    return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
  }

  // idx[from, to) holds the rows reaching this node; it is partitioned in place.
  private static IsolationNode grow(double[][] data, int[] idx, int from, int to, int depth, int maxDepth,
                                    Random rng) {
    int size = to - from;
    if (depth >= maxDepth || size <= 1) return IsolationNode.leaf(size);

    int width = data[idx[from]].length;
    List<Integer> candidates = new ArrayList<>(width);
    double[] min = new double[width];
    double[] max = new double[width];
    for (int f = 0; f < width; f++) {
      min[f] = Double.POSITIVE_INFINITY;
      max[f] = Double.NEGATIVE_INFINITY;
      for (int i = from; i < to; i++) {
        double v = data[idx[i]][f];
        if (v < min[f]) min[f] = v;
        if (v > max[f]) max[f] = v;
      }
      if (max[f] > min[f]) candidates.add(f);
    }
    if (candidates.isEmpty()) return IsolationNode.leaf(size);

    int feature = candidates.get(rng.nextInt(candidates.size()));
    double split = min[feature] + rng.nextDouble() * (max[feature] - min[feature]);
    if (split <= min[feature]) split = (min[feature] + max[feature]) / 2.0;

    int mid = from;
    for (int i = from; i < to; i++) {
      if (data[idx[i]][feature] < split) {
        int tmp = idx[mid];
        idx[mid] = idx[i];
        idx[i] = tmp;
        mid++;
      }
    }
    IsolationNode left = grow(data, idx, from, mid, depth + 1, maxDepth, rng);
    IsolationNode right = grow(data, idx, mid, to, depth + 1, maxDepth, rng);
    return new IsolationNode(feature, split, size, left, right);
  }

  private static int[] subsample(int n, int size, Random rng) {
    int[] all = new int[n];
    for (int i = 0; i < n; i++) all[i] = i;
    for (int i = 0; i < size; i++) {
      int j = i + rng.nextInt(n - i);
      int tmp = all[i];
      all[i] = all[j];
      all[j] = tmp;
    }
    int[] out = new int[size];
    System.arraycopy(all, 0, out, 0, size);
    return out;
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2.0);
  }
}
