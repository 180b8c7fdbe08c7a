package com.hydrowatch.detection.persistence;

import com.hydrowatch.detection.maintenance.RegressionForest;
import com.hydrowatch.detection.outlier.OutlierModelSnapshot;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Keeps models for the life of the process only. Used when file persistence is disabled. */
public class InMemoryModelStore implements ModelStore {

  private final AtomicReference<OutlierModelSnapshot> outlier = new AtomicReference<>();
  private final AtomicReference<RegressionForest.Snapshot> maintenance = new AtomicReference<>();

  @Override
  public Optional<OutlierModelSnapshot> loadOutlierModel() {
    return Optional.ofNullable(outlier.get());
  }

  @Override
  public void saveOutlierModel(OutlierModelSnapshot snapshot) {
    outlier.set(snapshot);
  }

  @Override
  public Optional<RegressionForest.Snapshot> loadMaintenanceModel() {
    return Optional.ofNullable(maintenance.get());
  }

  @Override
  public void saveMaintenanceModel(RegressionForest.Snapshot snapshot) {
    maintenance.set(snapshot);
  }
}
