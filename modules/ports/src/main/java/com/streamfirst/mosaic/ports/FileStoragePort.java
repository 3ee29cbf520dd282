package com.streamfirst.mosaic.ports;

import com.streamfirst.mosaic.domain.StoragePath;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Port for the binary files behind the engine: uploaded archives and targets, thumbnails,
 * snapshots and rendered results. Paths are relative to the storage root.
 * I/O failures surface as {@link UncheckedIOException}.
 */
public interface FileStoragePort {

    /**
     * Writes data to a file, replacing any existing content and creating parent directories.
     *
     * @param path the file path
     * @param data the data to write
     * @return number of bytes written
     */
    long write(StoragePath path, byte[] data);

    /**
     * Writes streaming data to a file.
     *
     * @param path the file path
     * @param data the input stream; not closed by this method
     * @return number of bytes written
     */
    long write(StoragePath path, InputStream data);

    /**
     * Reads entire file content into memory.
     *
     * @throws UncheckedIOException if the file is missing or unreadable
     */
    byte[] read(StoragePath path);

    /**
     * Opens a stream for reading file content. The caller closes it.
     *
     * @throws UncheckedIOException if the file is missing or unreadable
     */
    InputStream openStream(StoragePath path);

    boolean exists(StoragePath path);

    /**
     * Gets the size of a file in bytes.
     *
     * @throws UncheckedIOException if the file is missing
     */
    long size(StoragePath path);

    /**
     * Deletes a single file.
     *
     * @return true if the file existed
     */
    boolean delete(StoragePath path);

    /**
     * Deletes a file or a whole directory tree. Missing paths are ignored.
     *
     * @return number of files removed
     */
    int deleteRecursively(StoragePath path);

    /**
     * Lists all files at or below the given path, sorted.
     */
    List<StoragePath> list(StoragePath prefix);
}
