package org.dataone.hashcheck;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.task.CompareMode;

/**
 * ComparisonResult is the verdict of comparing path A with path B and the differences found,
 * sorted by relative path. Instances are immutable.
 */
public class ComparisonResult {
    private static final Comparator<Difference> BY_PATH =
        Comparator.comparing(Difference::relativePath).thenComparing(Difference::kind);

    private final ComparisonVerdict verdict;
    private final Path pathA;
    private final Path pathB;
    private final ChecksumAlgorithm algorithm;
    private final CompareMode mode;
    private final List<Difference> differences;

    /**
     * @param verdict     Overall outcome, IDENTICAL is only accepted with no differences
     * @param pathA       First compared path
     * @param pathB       Second compared path
     * @param algorithm   Reference algorithm used for content comparison
     * @param mode        Comparison mode
     * @param differences Differences found, in any order
     */
    public ComparisonResult(
        ComparisonVerdict verdict, Path pathA, Path pathB, ChecksumAlgorithm algorithm,
        CompareMode mode, List<Difference> differences) {
        HashCheckUtility.ensureNotNull(verdict, "verdict", "ComparisonResult - constructor");
        HashCheckUtility.ensureNotNull(
            differences, "differences", "ComparisonResult - constructor");
        if (verdict == ComparisonVerdict.IDENTICAL && !differences.isEmpty()) {
            String errMsg = "ComparisonResult - constructor(): an IDENTICAL result cannot carry "
                + differences.size() + " differences.";
            throw new IllegalArgumentException(errMsg);
        }
        List<Difference> sorted = new ArrayList<>(differences);
        sorted.sort(BY_PATH);
        this.verdict = verdict;
        this.pathA = pathA;
        this.pathB = pathB;
        this.algorithm = algorithm;
        this.mode = mode;
        this.differences = List.copyOf(sorted);
    }

    public ComparisonVerdict getVerdict() {
        return verdict;
    }

    public Path getPathA() {
        return pathA;
    }

    public Path getPathB() {
        return pathB;
    }

    public ChecksumAlgorithm getAlgorithm() {
        return algorithm;
    }

    public CompareMode getMode() {
        return mode;
    }

    public List<Difference> getDifferences() {
        return differences;
    }

    public boolean isIdentical() {
        return verdict == ComparisonVerdict.IDENTICAL;
    }

    public List<String> onlyInA() {
        return pathsOf(DifferenceKind.ONLY_IN_A);
    }

    public List<String> onlyInB() {
        return pathsOf(DifferenceKind.ONLY_IN_B);
    }

    /**
     * @return Paths present on both sides whose content differs or could not be read
     */
    public List<String> differingPaths() {
        List<String> paths = new ArrayList<>();
        for (Difference difference : differences) {
            if (difference.kind() == DifferenceKind.CONTENT_DIFFERS
                || difference.kind() == DifferenceKind.UNREADABLE) {
                paths.add(difference.relativePath());
            }
        }
        return paths;
    }

    /**
     * @return Every relative path named by any difference
     */
    public Set<String> allDifferencePaths() {
        Set<String> paths = new TreeSet<>();
        for (Difference difference : differences) {
            paths.add(difference.relativePath());
        }
        return paths;
    }

    /**
     * @return The result of comparing B with A
     */
    public ComparisonResult swap() {
        List<Difference> swapped = new ArrayList<>(differences.size());
        for (Difference difference : differences) {
            swapped.add(difference.swap());
        }
        return new ComparisonResult(verdict, pathB, pathA, algorithm, mode, swapped);
    }

    /**
     * Plain-text summary, one difference per line.
     *
     * @return Summary text
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Compared: ").append(pathA).append(" <-> ").append(pathB).append("\n");
        sb.append("Mode: ").append(mode).append(", algorithm: ").append(algorithm).append("\n");
        sb.append("Result: ").append(verdict).append("\n");
        for (Difference difference : differences) {
            sb.append("  ").append(difference).append("\n");
        }
        return sb.toString();
    }

    private List<String> pathsOf(DifferenceKind kind) {
        List<String> paths = new ArrayList<>();
        for (Difference difference : differences) {
            if (difference.kind() == kind) {
                paths.add(difference.relativePath());
            }
        }
        return paths;
    }

    @Override
    public String toString() {
        return "ComparisonResult{verdict=" + verdict + ", differences=" + differences.size() + "}";
    }
}
