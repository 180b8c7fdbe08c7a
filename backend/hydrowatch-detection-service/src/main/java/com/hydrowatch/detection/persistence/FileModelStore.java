package com.hydrowatch.detection.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydrowatch.detection.maintenance.RegressionForest;
import com.hydrowatch.detection.outlier.OutlierModelSnapshot;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each model as a JSON document in one directory. Writes go to a temporary file that is
 * moved over the target, so a crash mid-write leaves the previous file intact.
 */
public class FileModelStore implements ModelStore {

  private static final Logger log = LoggerFactory.getLogger(FileModelStore.class);

  static final String OUTLIER_FILE = "outlier-model.json";
  static final String MAINTENANCE_FILE = "maintenance-model.json";

  private final Path directory;
  private final ObjectMapper mapper;

  public FileModelStore(Path directory) {
    this(directory, new ObjectMapper());
  }

  public FileModelStore(Path directory, ObjectMapper mapper) {
    this.directory = directory;
    this.mapper = mapper;
  }

  @Override
  public Optional<OutlierModelSnapshot> loadOutlierModel() {
    return read(OUTLIER_FILE, OutlierModelSnapshot.class);
  }

  @Override
  public void saveOutlierModel(OutlierModelSnapshot snapshot) throws IOException {
    write(OUTLIER_FILE, snapshot);
  }

  @Override
  public Optional<RegressionForest.Snapshot> loadMaintenanceModel() {
    return read(MAINTENANCE_FILE, RegressionForest.Snapshot.class);
  }

  @Override
  public void saveMaintenanceModel(RegressionForest.Snapshot snapshot) throws IOException {
    write(MAINTENANCE_FILE, snapshot);
  }

  public Path directory() {
    return directory;
  }

  private <T> Optional<T> read(String name, Class<T> type) {
    Path file = directory.resolve(name);
    if (!Files.isRegularFile(file)) return Optional.empty();
    try {
      return Optional.of(mapper.readValue(file.toFile(), type));
    } catch (IOException e) {
      log.warn("Ignoring unreadable model file {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private void write(String name, Object value) throws IOException {
    Files.createDirectories(directory);
    Path target = directory.resolve(name);
    Path tmp = Files.createTempFile(directory, name, ".tmp");
    try {
      mapper.writeValue(tmp.toFile(), value);
      try {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Wrote model file {}", target);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
