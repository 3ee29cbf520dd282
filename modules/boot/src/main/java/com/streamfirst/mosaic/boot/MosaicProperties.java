package com.streamfirst.mosaic.boot;

import com.streamfirst.mosaic.application.MosaicSettings;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code mosaic.*} namespace of {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "mosaic")
public class MosaicProperties {

    /** Directory holding libraries, targets and results */
    private String storageRoot = "./data";

    private int workerThreads = 4;

    /** Tasks waiting for a worker before submissions are rejected */
    private int queueCapacity = 64;

    private Duration sessionTtl = Duration.ofMinutes(15);

    private Duration sweepInterval = Duration.ofSeconds(60);

    private int maxArchiveEntries = 200_000;

    private long maxEntryBytes = 200L * 1024 * 1024;

    private long maxThumbnailBytes = 20L * 1024 * 1024 * 1024;

    private int thumbnailSize = 64;

    private int quantization = 8;

    private int candidateCap = 2000;

    private int maxSearchRadius = 8;

    private int tileCacheSize = 512;

    public MosaicSettings toSettings() {
        return MosaicSettings.builder()
                .maxArchiveEntries(maxArchiveEntries)
                .maxEntryBytes(maxEntryBytes)
                .maxThumbnailBytes(maxThumbnailBytes)
                .thumbnailSize(thumbnailSize)
                .quantization(quantization)
                .candidateCap(candidateCap)
                .maxSearchRadius(maxSearchRadius)
                .tileCacheSize(tileCacheSize)
                .sessionTtl(sessionTtl)
                .sweepInterval(sweepInterval)
                .build();
    }
}
