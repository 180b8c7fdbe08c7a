package com.hydrowatch.detection.persistence;

import com.hydrowatch.detection.maintenance.RegressionForest;
import com.hydrowatch.detection.outlier.OutlierModelSnapshot;
import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage for trained model parameters. Loads return empty when nothing usable is
 * stored, which makes the caller fit a bootstrap model instead.
 */
public interface ModelStore {

  Optional<OutlierModelSnapshot> loadOutlierModel();

  void saveOutlierModel(OutlierModelSnapshot snapshot) throws IOException;

  Optional<RegressionForest.Snapshot> loadMaintenanceModel();

  void saveMaintenanceModel(RegressionForest.Snapshot snapshot) throws IOException;
}
