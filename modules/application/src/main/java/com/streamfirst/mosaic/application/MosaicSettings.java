package com.streamfirst.mosaic.application;

import java.time.Duration;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Limits and tunables of the indexing, matching and housekeeping machinery. Defaults match a
 * single-node deployment; override through the builder.
 */
@Value
@Builder(toBuilder = true)
public class MosaicSettings {

  /** Lowercase file extensions accepted for tiles and targets */
  @NonNull @Builder.Default
  Set<String> allowedExtensions = Set.of(".jpg", ".jpeg", ".png", ".webp");

  /** Entries read from one archive before it is truncated */
  @Builder.Default int maxArchiveEntries = 200_000;

  /** Entries larger than this are skipped */
  @Builder.Default long maxEntryBytes = 200L * 1024 * 1024;

  /** Once this many thumbnail bytes are written, no further entries are accepted */
  @Builder.Default long maxThumbnailBytes = 20L * 1024 * 1024 * 1024;

  /** Edge length of the normalized square thumbnails */
  @Builder.Default int thumbnailSize = 64;

  /** Width of one color bucket along each channel */
  @Builder.Default int quantization = 8;

  /** Entries between two indexing progress updates */
  @Builder.Default int progressInterval = 200;

  /** Candidate count at which the bucket search stops growing */
  @Builder.Default int candidateCap = 2000;

  /** Largest Chebyshev radius, in buckets, the search grows to */
  @Builder.Default int maxSearchRadius = 8;

  /** Decoded tiles kept per composition */
  @Builder.Default int tileCacheSize = 512;

  @Builder.Default float thumbnailQuality = 0.85f;

  @Builder.Default float resultQuality = 0.92f;

  /** Idle time after which a session and everything it owns is deleted */
  @NonNull @Builder.Default Duration sessionTtl = Duration.ofMinutes(15);

  @NonNull @Builder.Default Duration sweepInterval = Duration.ofSeconds(60);

  public static MosaicSettings defaults() {
    return MosaicSettings.builder().build();
  }

  public boolean isAllowedExtension(String extension) {
    return allowedExtensions.contains(extension);
  }
}
