package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.domain.TargetId;

/**
 * Where each kind of file lives below the storage root.
 */
public final class StorageLayout {

  private StorageLayout() {}

  public static StoragePath libraryDir(LibraryId id) {
    return StoragePath.of("libraries", id.value());
  }

  public static StoragePath archivePath(LibraryId id) {
    return libraryDir(id).resolve("source.zip");
  }

  public static StoragePath thumbnailPath(LibraryId id, int tileIndex) {
    return libraryDir(id).resolve(String.format("thumbs/t_%07d.jpg", tileIndex));
  }

  public static StoragePath targetDir(TargetId id) {
    return StoragePath.of("targets", id.value());
  }

  public static StoragePath targetPath(TargetId id, String extension) {
    return targetDir(id).resolve("target" + extension);
  }

  public static StoragePath resultPath(JobId id) {
    return StoragePath.of("results", id.value() + ".jpg");
  }
}
