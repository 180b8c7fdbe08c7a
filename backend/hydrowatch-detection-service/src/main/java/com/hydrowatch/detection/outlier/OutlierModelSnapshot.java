package com.hydrowatch.detection.outlier;

/** Persistable form of a fitted outlier model. */
public record OutlierModelSnapshot(double[] mean, double[] scale, IsolationForest.Snapshot forest) {}
