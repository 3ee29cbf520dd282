package com.streamfirst.mosaic.application;

import com.streamfirst.mosaic.domain.BucketIndex;
import com.streamfirst.mosaic.domain.ContentException;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibrarySnapshot;
import com.streamfirst.mosaic.domain.LibraryStatus;
import com.streamfirst.mosaic.domain.ResourceExceededException;
import com.streamfirst.mosaic.domain.Rgb;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.domain.Tile;
import com.streamfirst.mosaic.domain.TileLibrary;
import com.streamfirst.mosaic.ports.FileStoragePort;
import com.streamfirst.mosaic.ports.LibrarySnapshotPort;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an uploaded ZIP archive into a ready tile library.
 *
 * <p>Every acceptable image entry becomes a square JPEG thumbnail in storage plus its average
 * color in the library's bucket index. Unsafe paths, foreign extensions, oversized and undecodable
 * entries are skipped. The library ends READY with at least {@link TileLibrary#MIN_READY_TILES}
 * tiles, or ERROR with the failure message. The source archive is always deleted afterwards.
 */
@Slf4j
@RequiredArgsConstructor
public class LibraryIndexer {

  private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");
  private static final int MAX_PROGRESS = 99;

  private final MosaicStateStore store;
  private final FileStoragePort storage;
  private final LibrarySnapshotPort snapshots;
  private final MosaicSettings settings;

  /**
   * Indexes the archive of a queued library. Never throws; failures end up on the library record.
   *
   * @param id library to fill
   * @param archive location of the uploaded ZIP
   * @param cancellation checked before every entry; a cancelled run leaves the record untouched
   */
  public void index(LibraryId id, StoragePath archive, CancellationToken cancellation) {
    try {
      if (cancellation.isCancelled()) {
        log.info("Indexing of library {} cancelled before start", id);
        return;
      }
      Optional<TileLibrary> started =
          store.updateLibrary(
              id, library -> library.withStatus(LibraryStatus.PROCESSING).withMessage("Indexing"));
      if (started.isEmpty()) {
        log.info("Library {} was deleted before indexing started", id);
        return;
      }
      log.info("Indexing library {} from {}", id, archive);

      Run run = new Run(id, storage.size(archive));
      try (CountingInputStream counted = new CountingInputStream(storage.openStream(archive));
          ZipInputStream zip = new ZipInputStream(counted)) {
        ZipEntry entry;
        int entries = 0;
        while ((entry = zip.getNextEntry()) != null) {
          if (cancellation.isCancelled()) {
            log.info("Indexing of library {} cancelled after {} entries", id, entries);
            discardIfDeleted(id);
            return;
          }
          if (entry.isDirectory()) {
            continue;
          }
          if (entries >= settings.getMaxArchiveEntries()) {
            log.warn(
                "Archive of library {} has more than {} entries, ignoring the rest",
                id,
                settings.getMaxArchiveEntries());
            break;
          }
          entries++;
          try {
            run.accept(entry, zip);
          } catch (ResourceExceededException e) {
            log.warn("Library {}: {}, keeping {} tiles", id, e.getMessage(), run.tiles.size());
            break;
          }
          if (entries % settings.getProgressInterval() == 0) {
            int progress = run.progress(counted.count);
            int accepted = run.tiles.size();
            store.updateLibrary(
                id,
                library ->
                    library
                        .withProgress(Math.max(library.getProgress(), progress))
                        .withMessage("Processed " + accepted + " images"));
          }
        }
      }
      if (cancellation.isCancelled()) {
        log.info("Indexing of library {} cancelled", id);
        discardIfDeleted(id);
        return;
      }

      List<Tile> tiles = run.tiles;
      if (tiles.size() < TileLibrary.MIN_READY_TILES) {
        throw new ContentException(
            "Too few valid images ("
                + tiles.size()
                + "), at least "
                + TileLibrary.MIN_READY_TILES
                + " required");
      }
      BucketIndex index = run.buckets.build();
      snapshots.save(
          id,
          new LibrarySnapshot(
              tiles.stream().map(Tile::storagePath).toList(),
              tiles.stream().map(Tile::avgColor).toList(),
              index.asMap()));
      if (store.updateLibrary(id, library -> library.ready(tiles, index)).isEmpty()) {
        log.info("Library {} was deleted while indexing, dropping its files", id);
        storage.deleteRecursively(StorageLayout.libraryDir(id));
        return;
      }
      log.info("Library {} ready with {} tiles in {} buckets", id, tiles.size(), index.bucketCount());
    } catch (Exception e) {
      log.error("Indexing of library {} failed", id, e);
      recordFailure(id, e);
    } catch (Error e) {
      log.error("Indexing of library {} aborted", id, e);
      recordFailure(id, e);
      throw e;
    } finally {
      try {
        storage.delete(archive);
      } catch (UncheckedIOException e) {
        log.warn("Failed to delete archive {}", archive, e);
      }
    }
  }

  /** Moves the library to ERROR unless it already finished. */
  void recordFailure(LibraryId id, Throwable cause) {
    String reason = Failures.describe(cause);
    try {
      store.updateLibrary(
          id, library -> library.getStatus().isTerminal() ? library : library.failed(reason));
    } catch (RuntimeException e) {
      log.error("Cannot record failure of library {}", id, e);
    }
  }

  // thumbnails written after a concurrent delete would otherwise stay behind
  private void discardIfDeleted(LibraryId id) {
    if (!store.libraryExists(id)) {
      storage.deleteRecursively(StorageLayout.libraryDir(id));
    }
  }

  /**
   * Normalizes an archive entry name to forward slashes, or returns empty when the name is
   * absolute, carries a drive prefix or climbs out with {@code ..}.
   */
  static Optional<String> safeEntryName(String rawName) {
    String name = rawName.replace('\\', '/');
    if (name.isEmpty() || name.startsWith("/") || DRIVE_PREFIX.matcher(name).matches()) {
      return Optional.empty();
    }
    for (String segment : name.split("/")) {
      if (segment.equals("..")) {
        return Optional.empty();
      }
    }
    return Optional.of(name);
  }

  /** Lowercase extension including the dot, or an empty string. */
  static String extensionOf(String name) {
    int slash = name.lastIndexOf('/');
    int dot = name.lastIndexOf('.');
    if (dot <= slash) {
      return "";
    }
    return name.substring(dot).toLowerCase(Locale.ROOT);
  }

  /** State of one indexing run. */
  private final class Run {

    private final LibraryId id;
    private final long archiveBytes;
    private final List<Tile> tiles = new ArrayList<>();
    private final BucketIndex.Builder buckets = new BucketIndex.Builder(settings.getQuantization());
    private long thumbnailBytes;

    Run(LibraryId id, long archiveBytes) {
      this.id = id;
      this.archiveBytes = archiveBytes;
    }

    void accept(ZipEntry entry, InputStream data) throws IOException {
      if (entry.isDirectory()) {
        return;
      }
      Optional<String> name = safeEntryName(entry.getName());
      if (name.isEmpty()) {
        log.debug("Library {}: skipping unsafe entry {}", id, entry.getName());
        return;
      }
      if (name.get().endsWith("/") || !settings.isAllowedExtension(extensionOf(name.get()))) {
        log.debug("Library {}: skipping {}", id, name.get());
        return;
      }
      if (entry.getSize() > settings.getMaxEntryBytes()) {
        log.debug("Library {}: skipping oversized {} ({} bytes)", id, name.get(), entry.getSize());
        return;
      }
      byte[] bytes = readLimited(data, settings.getMaxEntryBytes());
      if (bytes == null) {
        log.debug("Library {}: skipping oversized {}", id, name.get());
        return;
      }

      BufferedImage image;
      try {
        image = TileImages.decode(bytes);
      } catch (IOException | RuntimeException e) {
        log.debug("Library {}: skipping undecodable {}: {}", id, name.get(), e.getMessage());
        return;
      }

      BufferedImage thumbnail = TileImages.thumbnail(image, settings.getThumbnailSize());
      Rgb color = TileImages.averageColor(thumbnail);
      byte[] jpeg = TileImages.encodeJpeg(thumbnail, settings.getThumbnailQuality());
      if (thumbnailBytes + jpeg.length > settings.getMaxThumbnailBytes()) {
        throw new ResourceExceededException(
            "Thumbnail storage limit of " + settings.getMaxThumbnailBytes() + " bytes reached");
      }

      int index = tiles.size();
      StoragePath path = StorageLayout.thumbnailPath(id, index);
      try {
        storage.write(path, jpeg);
      } catch (UncheckedIOException e) {
        log.warn("Library {}: cannot store thumbnail of {}", id, name.get(), e);
        return;
      }
      thumbnailBytes += jpeg.length;
      Tile tile = new Tile(index, path, color);
      tiles.add(tile);
      buckets.add(tile);
    }

    int progress(long consumed) {
      if (archiveBytes <= 0) {
        return 0;
      }
      return (int) Math.min(MAX_PROGRESS, consumed * 100 / archiveBytes);
    }
  }

  /** Reads the rest of a stream, or returns null once more than {@code limit} bytes arrive. */
  private static byte[] readLimited(InputStream in, long limit) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    long total = 0;
    int n;
    while ((n = in.read(buffer)) != -1) {
      total += n;
      if (total > limit) {
        return null;
      }
      out.write(buffer, 0, n);
    }
    return out.toByteArray();
  }

  private static final class CountingInputStream extends FilterInputStream {

    private long count;

    CountingInputStream(InputStream in) {
      super(in);
    }

    @Override
    public int read() throws IOException {
      int b = super.read();
      if (b != -1) {
        count++;
      }
      return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      int n = super.read(b, off, len);
      if (n > 0) {
        count += n;
      }
      return n;
    }

    @Override
    public long skip(long n) throws IOException {
      long skipped = super.skip(n);
      count += skipped;
      return skipped;
    }
  }
}
