package com.hydrowatch.detection.outlier;

import com.hydrowatch.detection.exception.DetectionException;
import com.hydrowatch.detection.exception.InvalidInputException;
import com.hydrowatch.detection.model.SensorReadings;
import com.hydrowatch.detection.persistence.ModelStore;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normaliser plus isolation forest over (flow_rate, pressure, turbidity, temperature), shared
 * by all requests. Scoring takes the read lock. Refitting builds the new state without holding
 * any lock and swaps it in under the write lock, so a scorer sees either the old model or the new
 * one, never a mix.
 */
public class OutlierModel {

  private static final Logger log = LoggerFactory.getLogger(OutlierModel.class);

  private record Fitted(StandardScaler scaler, IsolationForest forest) {}

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final IsolationForest.Settings settings;
  private final ModelStore store;
  private Fitted fitted;

  public OutlierModel(IsolationForest.Settings settings, ModelStore store) {
    this.settings = settings;
    this.store = store;
  }

  /**
   * Restores the persisted model, or fits on {@link ReferenceSamples} and persists that when
   * nothing usable is stored.
   */
  public static OutlierModel loadOrBootstrap(IsolationForest.Settings settings, ModelStore store) {
    OutlierModel model = new OutlierModel(settings, store);
    Optional<OutlierModelSnapshot> persisted = store.loadOutlierModel();
    if (persisted.isPresent()) {
      String problem = problemWith(persisted.get());
      if (problem == null) {
        model.restore(persisted.get());
        log.info("Outlier model restored from store ({} trees)", persisted.get().forest().trees().size());
        return model;
      }
      log.warn("Ignoring persisted outlier model: {}", problem);
    }
    model.fit(ReferenceSamples.normalOperation());
    log.info("Outlier model bootstrapped on {} reference samples", ReferenceSamples.SIZE);
    model.persist();
    return model;
  }

  /**
   * Refits normaliser and forest from scratch.
   *
   * @throws InvalidInputException when rows are empty, ragged or not finite
   */
  public void fit(double[][] rows) {
    validate(rows);
    StandardScaler scaler = StandardScaler.fit(rows);
    Fitted next = new Fitted(scaler, IsolationForest.fit(scaler.transform(rows), settings));
    lock.writeLock().lock();
    try {
      fitted = next;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Retrains on the given rows and persists the result. On any failure the previous model stays
   * in place and {@code false} is returned.
   */
  public boolean update(List<double[]> rows) {
    try {
      fit(rows == null ? new double[0][] : rows.toArray(new double[0][]));
    } catch (RuntimeException e) {
      log.warn("Outlier model retrain rejected: {}", e.getMessage());
      return false;
    }
    log.info("Outlier model retrained on {} rows", rows.size());
    persist();
    return true;
  }

  public OutlierVerdict score(SensorReadings readings) {
    lock.readLock().lock();
    try {
      if (fitted == null) {
        throw new DetectionException("Outlier model has not been fitted");
      }
      double score = fitted.forest().score(fitted.scaler().transform(readings.toFeatures()));
      return new OutlierVerdict(fitted.forest().isOutlier(score), score);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isFitted() {
    lock.readLock().lock();
    try {
      return fitted != null;
    } finally {
      lock.readLock().unlock();
    }
  }

  public OutlierModelSnapshot snapshot() {
    lock.readLock().lock();
    try {
      if (fitted == null) {
        throw new DetectionException("Outlier model has not been fitted");
      }
      return new OutlierModelSnapshot(fitted.scaler().mean(), fitted.scaler().scale(), fitted.forest().snapshot());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns why a stored snapshot cannot be scored with, or {@code null} when it can. */
  static String problemWith(OutlierModelSnapshot snapshot) {
    if (!hasFeatureWidth(snapshot.mean())) return "mean must hold " + SensorReadings.FEATURE_COUNT + " finite values";
    if (!hasFeatureWidth(snapshot.scale())) return "scale must hold " + SensorReadings.FEATURE_COUNT + " finite values";
    for (double s : snapshot.scale()) {
      if (s <= 0) return "scale values must be positive";
    }
    IsolationForest.Snapshot forest = snapshot.forest();
    if (forest == null || forest.trees() == null || forest.trees().isEmpty()) return "forest has no trees";
    if (forest.sampleSize() < 2) return "forest sample size must be at least 2";
    if (!Double.isFinite(forest.threshold())) return "forest threshold is not finite";
    for (IsolationNode tree : forest.trees()) {
      if (tree == null || !tree.wellFormed(SensorReadings.FEATURE_COUNT)) return "forest contains a malformed tree";
    }
    return null;
  }

  private static boolean hasFeatureWidth(double[] values) {
    if (values == null || values.length != SensorReadings.FEATURE_COUNT) return false;
    for (double v : values) {
      if (!Double.isFinite(v)) return false;
    }
    return true;
  }

  private void restore(OutlierModelSnapshot snapshot) {
    Fitted restored = new Fitted(new StandardScaler(snapshot.mean(), snapshot.scale()),
        IsolationForest.fromSnapshot(snapshot.forest()));
    lock.writeLock().lock();
    try {
      fitted = restored;
    } finally {
      lock.writeLock().unlock();
    }
  }

  // Persistence failures are logged only; scoring continues on the in-memory model.
  private void persist() {
    try {
      store.saveOutlierModel(snapshot());
    } catch (IOException e) {
      log.warn("Failed to persist outlier model: {}", e.getMessage());
    }
  }

  private static void validate(double[][] rows) {
    if (rows == null || rows.length < 2) {
      throw new InvalidInputException("at least 2 training rows are required");
    }
    for (int i = 0; i < rows.length; i++) {
      if (rows[i] == null || rows[i].length != SensorReadings.FEATURE_COUNT) {
        throw new InvalidInputException("row " + i + " must have " + SensorReadings.FEATURE_COUNT + " values");
      }
      for (double v : rows[i]) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
          throw new InvalidInputException("row " + i + " contains a non-finite value");
        }
      }
    }
  }
}
