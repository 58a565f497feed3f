package org.dataone.hashcheck.manifest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;

/**
 * Manifest is an ordered list of file entries and comment lines, together with the algorithm
 * the digests were computed with, the delimiter separating path from digest and the base
 * directory that relative entry paths are resolved against. Manifests are immutable.
 */
public class Manifest {
    private final ChecksumAlgorithm algorithm;
    private final String delimiter;
    private final Path baseDirectory;
    private final List<ManifestLine> lines;

    /**
     * @param algorithm     Algorithm of the manifest's digests, may be null for an empty
     *                      manifest whose algorithm could not be inferred
     * @param delimiter     String separating path and digest
     * @param baseDirectory Directory relative paths resolve against, may be null
     * @param lines         Comments and entries in manifest order
     */
    public Manifest(
        ChecksumAlgorithm algorithm, String delimiter, Path baseDirectory,
        List<ManifestLine> lines) {
        HashCheckUtility.checkForEmptyString(delimiter, "delimiter", "Manifest - constructor");
        HashCheckUtility.ensureNotNull(lines, "lines", "Manifest - constructor");
        this.algorithm = algorithm;
        this.delimiter = delimiter;
        this.baseDirectory = baseDirectory;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    /**
     * Convenience constructor for a manifest with entries only.
     */
    public static Manifest ofEntries(
        ChecksumAlgorithm algorithm, String delimiter, Path baseDirectory,
        List<FileEntry> entries) {
        List<ManifestLine> lines = new ArrayList<>(entries.size());
        for (FileEntry entry : entries) {
            lines.add(ManifestLine.entry(entry));
        }
        return new Manifest(algorithm, delimiter, baseDirectory, lines);
    }

    public ChecksumAlgorithm getAlgorithm() {
        return algorithm;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public List<ManifestLine> getLines() {
        return lines;
    }

    public List<FileEntry> getEntries() {
        List<FileEntry> entries = new ArrayList<>();
        for (ManifestLine line : lines) {
            if (!line.isComment()) {
                entries.add(line.entry());
            }
        }
        return entries;
    }

    public List<String> getComments() {
        List<String> comments = new ArrayList<>();
        for (ManifestLine line : lines) {
            if (line.isComment()) {
                comments.add(line.comment());
            }
        }
        return comments;
    }

    public int entryCount() {
        int count = 0;
        for (ManifestLine line : lines) {
            if (!line.isComment()) {
                count++;
            }
        }
        return count;
    }

    public Manifest withBaseDirectory(Path newBaseDirectory) {
        return new Manifest(algorithm, delimiter, newBaseDirectory, lines);
    }

    public Manifest withDelimiter(String newDelimiter) {
        return new Manifest(algorithm, newDelimiter, baseDirectory, lines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Manifest)) {
            return false;
        }
        Manifest other = (Manifest) o;
        return algorithm == other.algorithm && delimiter.equals(other.delimiter)
            && Objects.equals(baseDirectory, other.baseDirectory) && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, delimiter, baseDirectory, lines);
    }

    @Override
    public String toString() {
        return "Manifest{algorithm=" + algorithm + ", entries=" + entryCount() + ", baseDirectory="
            + baseDirectory + "}";
    }
}
