package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.EntityNotFoundException;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.domain.Target;
import com.streamfirst.mosaic.domain.TargetId;
import com.streamfirst.mosaic.domain.ValidationException;
import com.streamfirst.mosaic.ports.FileStoragePort;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Stores uploaded target images and keeps their records. */
@Slf4j
@RequiredArgsConstructor
public class TargetRegistry {

  private final MosaicStateStore store;
  private final FileStoragePort storage;
  private final Clock clock;
  private final MosaicSettings settings;

  /**
   * Stores an uploaded image as a new target.
   *
   * @throws ValidationException if the file type is not accepted or the data is not an image
   */
  public Target register(SessionId sessionId, String fileName, InputStream data) {
    store.touchSession(sessionId, clock.instant());
    String extension = LibraryIndexer.extensionOf(fileName.replace('\\', '/'));
    if (!settings.isAllowedExtension(extension)) {
      throw new ValidationException("Unsupported target file type: " + fileName);
    }

    byte[] bytes;
    try {
      bytes = data.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read upload " + fileName, e);
    }
    TargetId id = TargetId.random();
    StoragePath path = StorageLayout.targetPath(id, extension);
    storage.write(path, bytes);

    Dimension size;
    try {
      size = TileImages.readDimensions(bytes);
    } catch (IOException | RuntimeException e) {
      storage.deleteRecursively(StorageLayout.targetDir(id));
      throw new ValidationException("Target is not a readable image: " + fileName);
    }
    Target target =
        new Target(id, sessionId, fileName, path, size.width, size.height, clock.instant());
    store.saveTarget(target);
    log.info("Target {} registered: {} ({}x{})", id, fileName, size.width, size.height);
    return target;
  }

  public List<Target> list(SessionId sessionId) {
    store.touchSession(sessionId, clock.instant());
    return store.listTargets(sessionId);
  }

  public Target get(SessionId sessionId, TargetId id) {
    store.touchSession(sessionId, clock.instant());
    return store
        .findTarget(id)
        .filter(target -> target.sessionId().equals(sessionId))
        .orElseThrow(() -> new EntityNotFoundException("Target not found: " + id));
  }

  /** Raw bytes of the uploaded image. */
  public byte[] read(SessionId sessionId, TargetId id) {
    return storage.read(get(sessionId, id).storagePath());
  }

  public BufferedImage openImage(SessionId sessionId, TargetId id) {
    try {
      return TileImages.decode(read(sessionId, id));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot decode target " + id, e);
    }
  }

  public void delete(SessionId sessionId, TargetId id) {
    get(sessionId, id);
    store.deleteTarget(id);
    log.info("Target {} deleted", id);
  }
}
