package com.hydrowatch.detection.persistence;

import static org.junit.jupiter.api.Assertions.*;

import com.hydrowatch.detection.maintenance.MaintenanceEstimator;
import com.hydrowatch.detection.maintenance.RegressionForest;
import com.hydrowatch.detection.model.SensorReadings;
import com.hydrowatch.detection.outlier.IsolationForest;
import com.hydrowatch.detection.outlier.OutlierModel;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileModelStore Tests")
class FileModelStoreTest {

  @TempDir
  Path dir;

  @Test
  @DisplayName("Empty directory has no models")
  void emptyDirectory() {
    FileModelStore store = new FileModelStore(dir.resolve("missing"));
    assertTrue(store.loadOutlierModel().isEmpty());
    assertTrue(store.loadMaintenanceModel().isEmpty());
  }

  @Test
  @DisplayName("Bootstrapped outlier model survives a restart")
  void outlierModelRoundTrip() {
    FileModelStore store = new FileModelStore(dir);
    OutlierModel first = OutlierModel.loadOrBootstrap(IsolationForest.Settings.defaults(), store);
    assertTrue(Files.isRegularFile(dir.resolve(FileModelStore.OUTLIER_FILE)));

    OutlierModel second = OutlierModel.loadOrBootstrap(IsolationForest.Settings.defaults(), new FileModelStore(dir));
    SensorReadings probe = new SensorReadings(10.0, 1.2, 1.5, 23.0);
    assertEquals(first.score(probe), second.score(probe));
  }

  @Test
  @DisplayName("Bootstrapped maintenance model survives a restart")
  void maintenanceModelRoundTrip() {
    FileModelStore store = new FileModelStore(dir);
    MaintenanceEstimator.loadOrBootstrap(new RegressionForest.Settings(5, 6, 2, 42L), store);
    assertTrue(Files.isRegularFile(dir.resolve(FileModelStore.MAINTENANCE_FILE)));
    RegressionForest.Snapshot snapshot = store.loadMaintenanceModel().orElseThrow();
    assertEquals(6, snapshot.featureCount());
    assertEquals(5, snapshot.trees().size());
  }

  @Test
  @DisplayName("Unreadable files are ignored")
  void corruptFile() throws Exception {
    Files.writeString(dir.resolve(FileModelStore.OUTLIER_FILE), "{not json");
    assertTrue(new FileModelStore(dir).loadOutlierModel().isEmpty());
  }

  @Test
  @DisplayName("Files that parse but hold no usable model fall back to a fresh fit")
  void emptyObjectFiles() throws Exception {
    Files.writeString(dir.resolve(FileModelStore.OUTLIER_FILE), "{}");
    Files.writeString(dir.resolve(FileModelStore.MAINTENANCE_FILE), "{}");
    FileModelStore store = new FileModelStore(dir);

    OutlierModel outlier = OutlierModel.loadOrBootstrap(IsolationForest.Settings.defaults(), store);
    MaintenanceEstimator.loadOrBootstrap(new RegressionForest.Settings(5, 6, 2, 42L), store);

    assertTrue(outlier.isFitted());
    assertFalse(outlier.score(new SensorReadings(22.5, 4.5, 1.5, 23.0)).outlier());
    assertEquals(SensorReadings.FEATURE_COUNT, store.loadOutlierModel().orElseThrow().mean().length);
    assertEquals(5, store.loadMaintenanceModel().orElseThrow().trees().size());
  }

  @Test
  @DisplayName("Saving leaves no temporary files behind")
  void noTempFiles() throws Exception {
    FileModelStore store = new FileModelStore(dir);
    OutlierModel.loadOrBootstrap(IsolationForest.Settings.defaults(), store);
    try (var files = Files.list(dir)) {
      assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
    }
  }
}
