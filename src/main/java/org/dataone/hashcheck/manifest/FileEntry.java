package org.dataone.hashcheck.manifest;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;

/**
 * FileEntry is one path and digest pair of a manifest. The path is kept exactly as collected or
 * as written in the manifest file; relative paths are resolved against the manifest's base
 * directory when the entry is verified.
 */
public class FileEntry {
    public static final long UNKNOWN_SIZE = -1;

    private final String path;
    private final String digest;
    private final ChecksumAlgorithm algorithm;
    private final long size;

    public FileEntry(String path, String digest, ChecksumAlgorithm algorithm) {
        this(path, digest, algorithm, UNKNOWN_SIZE);
    }

    /**
     * @param path      Relative or absolute path of the file
     * @param digest    Hex digest of the file content
     * @param algorithm Algorithm the digest was computed with
     * @param size      File size in bytes when it was digested, or {@link #UNKNOWN_SIZE}
     */
    public FileEntry(String path, String digest, ChecksumAlgorithm algorithm, long size) {
        HashCheckUtility.checkForEmptyString(path, "path", "FileEntry - constructor");
        HashCheckUtility.checkForEmptyString(digest, "digest", "FileEntry - constructor");
        this.path = path;
        this.digest = digest;
        this.algorithm = algorithm;
        this.size = size;
    }

    public String getPath() {
        return path;
    }

    public String getDigest() {
        return digest;
    }

    public ChecksumAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * Size is only known for entries produced by generation in this process; the manifest file
     * format does not carry it.
     *
     * @return Size in bytes, or {@link #UNKNOWN_SIZE}
     */
    public long getSize() {
        return size;
    }

    public boolean hasSize() {
        return size >= 0;
    }

    public boolean isAbsolute() {
        return Paths.get(path).isAbsolute();
    }

    /**
     * Resolve the entry's path to the file it describes.
     *
     * @param baseDirectory Directory relative paths are resolved against, may be null
     * @return Normalized path to the file
     */
    public Path resolve(Path baseDirectory) {
        Path entryPath = Paths.get(path);
        if (entryPath.isAbsolute() || baseDirectory == null) {
            return entryPath.normalize();
        }
        return baseDirectory.resolve(entryPath).normalize();
    }

    /**
     * Equality covers path, digest and algorithm. Size is not part of the manifest format and
     * is ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileEntry)) {
            return false;
        }
        FileEntry other = (FileEntry) o;
        return path.equals(other.path) && digest.equals(other.digest)
            && algorithm == other.algorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, digest, algorithm);
    }

    @Override
    public String toString() {
        return path + " " + digest + " (" + algorithm + ")";
    }
}
