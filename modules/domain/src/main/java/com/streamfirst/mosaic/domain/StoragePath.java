package com.streamfirst.mosaic.domain;

import java.util.Locale;

/**
 * Relative location of a stored file (archive, thumbnail, target, result, snapshot).
 * Paths always use forward slashes and may never climb out of the storage root.
 */
public record StoragePath(String path) {

    public StoragePath {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException("Storage path cannot be null or empty");
        }
        path = path.replace('\\', '/');
        if (path.startsWith("/")) {
            throw new IllegalArgumentException("Storage path must be relative: " + path);
        }
        for (String segment : path.split("/")) {
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Storage path cannot contain '..': " + path);
            }
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
    }

    public static StoragePath of(String path) {
        return new StoragePath(path);
    }

    /**
     * Creates a storage path by joining components.
     */
    public static StoragePath of(String... components) {
        if (components.length == 0) {
            throw new IllegalArgumentException("At least one path component required");
        }
        return new StoragePath(String.join("/", components));
    }

    /**
     * Resolves a child path relative to this path.
     */
    public StoragePath resolve(String childPath) {
        if (childPath.startsWith("/")) {
            throw new IllegalArgumentException("Child path must be relative: " + childPath);
        }
        return new StoragePath(this.path + "/" + childPath);
    }

    /**
     * Gets the parent directory path, or {@code null} for a single-segment path.
     */
    public StoragePath getParent() {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash <= 0 ? null : new StoragePath(path.substring(0, lastSlash));
    }

    public String getFileName() {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash == -1 ? path : path.substring(lastSlash + 1);
    }

    /**
     * Gets the lowercase file extension including the dot, or an empty string.
     */
    public String getExtension() {
        String fileName = getFileName();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot == -1 ? "" : fileName.substring(lastDot).toLowerCase(Locale.ROOT);
    }

    /**
     * Checks whether this path equals {@code prefix} or lies underneath it.
     */
    public boolean startsWith(StoragePath prefix) {
        return path.equals(prefix.path) || path.startsWith(prefix.path + "/");
    }

    @Override
    public String toString() {
        return path;
    }
}
