package com.ospicorp.anomalydetection.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalydetection.series.ModelState;
import com.ospicorp.anomalydetection.series.TimeSeries;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores artifacts as JSON files under {@code {root}/{series_id}/}. Model states and training
 * data may live under different roots.
 */
public class LocalArtifactStorage implements ArtifactStorage {
  private static final Logger log = LoggerFactory.getLogger(LocalArtifactStorage.class);

  private final Path modelFolder;
  private final Path dataFolder;
  private final ObjectMapper mapper;

  public LocalArtifactStorage(Path modelFolder, Path dataFolder, ObjectMapper mapper) {
    this.modelFolder = modelFolder;
    this.dataFolder = dataFolder;
    this.mapper = mapper;
  }

  @Override
  public String saveState(String seriesId, int version, ModelState state) {
    Path target = modelFolder.resolve(seriesId).resolve(ArtifactStorage.modelFileName(seriesId, version));
    write(target, state);
    return target.toString();
  }

  @Override
  public String saveData(String seriesId, int version, TimeSeries payload) {
    Path target = dataFolder.resolve(seriesId).resolve(ArtifactStorage.dataFileName(seriesId, version));
    write(target, payload);
    return target.toString();
  }

  @Override
  public ModelState loadState(String path) {
    return read(path, ModelState.class);
  }

  @Override
  public TimeSeries loadData(String path) {
    return read(path, TimeSeries.class);
  }

  @Override
  public boolean delete(String path) {
    try {
      return Files.deleteIfExists(Path.of(path));
    } catch (IOException ex) {
      throw new ArtifactStorageException("Failed to delete artifact " + path, ex);
    }
  }

  // Written to a sibling temp file first so a reader never sees a half-written artifact.
  private void write(Path target, Object payload) {
    Path tmp = null;
    try {
      Files.createDirectories(target.getParent());
      tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      mapper.writeValue(tmp.toFile(), payload);
      try {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Wrote artifact {}", target);
    } catch (IOException ex) {
      deleteQuietly(tmp);
      throw new ArtifactStorageException("Failed to write artifact " + target, ex);
    }
  }

  private <T> T read(String path, Class<T> type) {
    Path file = Path.of(path);
    if (!Files.isRegularFile(file)) {
      throw new ArtifactNotFoundException(path, null);
    }
    try {
      return mapper.readValue(file.toFile(), type);
    } catch (NoSuchFileException ex) {
      throw new ArtifactNotFoundException(path, ex);
    } catch (IOException ex) {
      throw new ArtifactStorageException("Failed to read artifact " + path, ex);
    }
  }

  private void deleteQuietly(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException ex) {
      log.warn("Unable to remove temporary artifact {}: {}", tmp, ex.getMessage());
    }
  }
}
