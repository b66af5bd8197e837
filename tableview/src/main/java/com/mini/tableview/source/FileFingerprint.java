package com.mini.tableview.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 文件修改时间和大小，用于检测外部修改
 */
final class FileFingerprint {
    static final FileFingerprint MISSING = new FileFingerprint(-1L, -1L);

    private final long lastModifiedMillis;
    private final long size;

    private FileFingerprint(long lastModifiedMillis, long size) {
        this.lastModifiedMillis = lastModifiedMillis;
        this.size = size;
    }

    static FileFingerprint of(Path path) {
        try {
            return new FileFingerprint(Files.getLastModifiedTime(path).toMillis(), Files.size(path));
        } catch (IOException e) {
            return MISSING;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileFingerprint that = (FileFingerprint) o;
        return lastModifiedMillis == that.lastModifiedMillis && size == that.size;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastModifiedMillis, size);
    }
}
