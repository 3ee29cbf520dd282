package com.streamfirst.mosaic.adapters;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.mosaic.domain.BucketKey;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibrarySnapshot;
import com.streamfirst.mosaic.domain.Rgb;
import com.streamfirst.mosaic.domain.StoragePath;
import com.streamfirst.mosaic.ports.FileStoragePort;
import com.streamfirst.mosaic.ports.LibrarySnapshotPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Stores library snapshots as {@code libraries/<id>/meta.json}:
 * <pre>
 * {"tile_paths": [...], "tile_avgs": [[r,g,b], ...], "index": {"r,g,b": [i, ...], ...}}
 * </pre>
 * Bucket keys are written in their canonical text form, three integers joined by commas.
 */
@Slf4j
public class JsonLibrarySnapshotAdapter implements LibrarySnapshotPort {

    static final String KEY_DELIMITER = ",";

    private final FileStoragePort storage;
    private final ObjectMapper mapper;

    public JsonLibrarySnapshotAdapter(FileStoragePort storage) {
        this(storage, new ObjectMapper());
    }

    public JsonLibrarySnapshotAdapter(FileStoragePort storage, ObjectMapper mapper) {
        this.storage = storage;
        this.mapper = mapper;
    }

    /**
     * The snapshot location of a library.
     */
    public static StoragePath pathFor(LibraryId id) {
        return StoragePath.of("libraries", id.value(), "meta.json");
    }

    @Override
    public void save(LibraryId id, LibrarySnapshot snapshot) {
        Map<String, List<Integer>> index = new TreeMap<>();
        snapshot.buckets().forEach((key, members) -> index.put(encodeKey(key), members));
        SnapshotDocument document = new SnapshotDocument(
                snapshot.tilePaths().stream().map(StoragePath::toString).toList(),
                snapshot.tileColors().stream().map(c -> new int[] {c.r(), c.g(), c.b()}).toList(),
                index);
        try {
            storage.write(pathFor(id), mapper.writeValueAsBytes(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize snapshot of library " + id, e);
        }
        log.info("Stored snapshot of library {} ({} tiles, {} buckets)",
                id, snapshot.tilePaths().size(), index.size());
    }

    @Override
    public Optional<LibrarySnapshot> load(LibraryId id) {
        StoragePath path = pathFor(id);
        if (!storage.exists(path)) {
            log.debug("No snapshot stored for library {}", id);
            return Optional.empty();
        }
        SnapshotDocument document;
        try {
            document = mapper.readValue(storage.read(path), SnapshotDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt snapshot for library " + id, e);
        }
        Map<BucketKey, List<Integer>> buckets = new LinkedHashMap<>();
        document.index().forEach((key, members) -> buckets.put(decodeKey(key), members));
        LibrarySnapshot snapshot = new LibrarySnapshot(
                document.tilePaths().stream().map(StoragePath::of).toList(),
                document.tileAvgs().stream().map(JsonLibrarySnapshotAdapter::toRgb).toList(),
                buckets);
        log.info("Loaded snapshot of library {} ({} tiles)", id, snapshot.tilePaths().size());
        return Optional.of(snapshot);
    }

    @Override
    public void delete(LibraryId id) {
        storage.delete(pathFor(id));
    }

    static String encodeKey(BucketKey key) {
        return key.r() + KEY_DELIMITER + key.g() + KEY_DELIMITER + key.b();
    }

    static BucketKey decodeKey(String text) {
        String[] parts = text.split(KEY_DELIMITER);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed bucket key: '" + text + "'");
        }
        try {
            return new BucketKey(
                    Integer.parseInt(parts[0].trim()),
                    Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed bucket key: '" + text + "'", e);
        }
    }

    private static Rgb toRgb(int[] channels) {
        if (channels.length != 3) {
            throw new IllegalArgumentException("Average color needs 3 channels, got " + channels.length);
        }
        return new Rgb(channels[0], channels[1], channels[2]);
    }

    record SnapshotDocument(
            @JsonProperty("tile_paths") List<String> tilePaths,
            @JsonProperty("tile_avgs") List<int[]> tileAvgs,
            @JsonProperty("index") Map<String, List<Integer>> index) {
        SnapshotDocument {
            tilePaths = tilePaths == null ? List.of() : tilePaths;
            tileAvgs = tileAvgs == null ? List.of() : tileAvgs;
            index = index == null ? Map.of() : index;
        }
    }
}
