package org.dataone.hashcheck.task;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.ComparisonResult;
import org.dataone.hashcheck.ComparisonVerdict;
import org.dataone.hashcheck.Difference;
import org.dataone.hashcheck.DifferenceKind;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;

/**
 * ComparisonTask decides whether two files, or two directory trees, have the same content.
 *
 * <p>Trees are compared by their files, keyed by path relative to each root; empty
 * directories and listing order play no part. Files are equal when their sizes and reference
 * digests are equal. In QUICK mode a size difference settles the question without reading
 * either file.</p>
 */
public class ComparisonTask implements HashCheckTask<ComparisonResult> {
    private static final Log logComparison = LogFactory.getLog(ComparisonTask.class);

    private final Path pathA;
    private final Path pathB;
    private final HashCheckConfig config;
    private final DigestEngine engine;

    /**
     * @param pathA  First file or directory
     * @param pathB  Second file or directory
     * @param config Settings for this task (compare mode, reference algorithm, worker threads)
     * @param engine Digest engine
     */
    public ComparisonTask(Path pathA, Path pathB, HashCheckConfig config, DigestEngine engine) {
        HashCheckUtility.ensureNotNull(pathA, "pathA", "ComparisonTask - constructor");
        HashCheckUtility.ensureNotNull(pathB, "pathB", "ComparisonTask - constructor");
        HashCheckUtility.ensureNotNull(config, "config", "ComparisonTask - constructor");
        HashCheckUtility.ensureNotNull(engine, "engine", "ComparisonTask - constructor");
        this.pathA = pathA;
        this.pathB = pathB;
        this.config = config;
        this.engine = engine;
    }

    @Override
    public void validate() throws UnsupportedHashAlgorithmException {
        engine.getRegistry().validate(config.effectiveCompareAlgorithm());
    }

    @Override
    public ComparisonResult run(CancellationToken token, ProgressTracker tracker)
        throws HashCheckTaskException, TaskCancelledException {
        CompareMode mode = config.compareMode();
        ChecksumAlgorithm algorithm = config.effectiveCompareAlgorithm();
        Path absA = pathA.toAbsolutePath().normalize();
        Path absB = pathB.toAbsolutePath().normalize();
        logComparison.info(
            "Comparing: " + absA + " with: " + absB + " (mode: " + mode + ", algorithm: "
                + algorithm + ")");

        tracker.beginPhase(TaskPhase.DISCOVERY, 0);
        checkExists(absA);
        checkExists(absB);

        boolean directoryA = Files.isDirectory(absA);
        boolean directoryB = Files.isDirectory(absB);
        if (directoryA != directoryB) {
            logComparison.info("One path is a file and the other a directory");
            return new ComparisonResult(
                ComparisonVerdict.TYPE_MISMATCH, absA, absB, algorithm, mode, List.of());
        }

        List<Difference> differences = new ArrayList<>();
        if (!directoryA) {
            tracker.beginPhase(TaskPhase.COMPARING, 1);
            Difference difference = compareFiles("", absA, absB, mode, algorithm);
            tracker.advance(absA);
            if (difference != null) {
                differences.add(difference);
            }
        } else {
            differences.addAll(compareTrees(absA, absB, mode, algorithm, token, tracker));
        }

        ComparisonVerdict verdict =
            differences.isEmpty() ? ComparisonVerdict.IDENTICAL : ComparisonVerdict.DIFFERENT;
        logComparison.info("Comparison complete: " + verdict + " with " + differences.size()
            + " differences");
        return new ComparisonResult(verdict, absA, absB, algorithm, mode, differences);
    }

    private List<Difference> compareTrees(
        Path rootA, Path rootB, CompareMode mode, ChecksumAlgorithm algorithm,
        CancellationToken token, ProgressTracker tracker)
        throws HashCheckTaskException, TaskCancelledException {
        Map<String, String> unreadableA = new TreeMap<>();
        Map<String, String> unreadableB = new TreeMap<>();
        Map<String, Path> filesA = listFiles(rootA, unreadableA);
        Map<String, Path> filesB = listFiles(rootB, unreadableB);

        List<Difference> differences = new ArrayList<>();
        Map<String, String> unreadable = new TreeMap<>(unreadableB);
        unreadable.putAll(unreadableA);
        for (Map.Entry<String, String> entry : unreadable.entrySet()) {
            differences.add(new Difference(
                entry.getKey(), DifferenceKind.UNREADABLE, -1, -1, null, null, entry.getValue()));
        }

        List<String> common = new ArrayList<>();
        for (Map.Entry<String, Path> entry : filesA.entrySet()) {
            if (filesB.containsKey(entry.getKey())) {
                common.add(entry.getKey());
            } else if (!isUnder(entry.getKey(), unreadable)) {
                differences.add(
                    Difference.onlyInA(entry.getKey(), sizeOrUnknown(entry.getValue())));
            }
        }
        for (Map.Entry<String, Path> entry : filesB.entrySet()) {
            if (!filesA.containsKey(entry.getKey()) && !isUnder(entry.getKey(), unreadable)) {
                differences.add(
                    Difference.onlyInB(entry.getKey(), sizeOrUnknown(entry.getValue())));
            }
        }

        tracker.beginPhase(TaskPhase.COMPARING, common.size());
        List<Callable<Difference>> work = new ArrayList<>(common.size());
        for (String relativePath : common) {
            Path fileA = filesA.get(relativePath);
            Path fileB = filesB.get(relativePath);
            work.add(() -> {
                Difference difference = compareFiles(relativePath, fileA, fileB, mode, algorithm);
                tracker.advance(fileA);
                return difference;
            });
        }

        List<Difference> results;
        try {
            results = WorkerPool.runAll(work, config.workerThreads(), token);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cancelled(tracker);
        }
        if (token.isCancelled()) {
            throw cancelled(tracker);
        }
        for (Difference difference : results) {
            if (difference != null) {
                differences.add(difference);
            }
        }
        return differences;
    }

    /**
     * Compare two files.
     *
     * @return The difference found, or null when the files are equal
     */
    private Difference compareFiles(
        String relativePath, Path fileA, Path fileB, CompareMode mode,
        ChecksumAlgorithm algorithm) {
        long sizeA = -1;
        long sizeB = -1;
        try {
            sizeA = Files.size(fileA);
            sizeB = Files.size(fileB);
            if (mode == CompareMode.QUICK && sizeA != sizeB) {
                logComparison.debug("Sizes differ for: " + relativePath);
                return new Difference(
                    relativePath, DifferenceKind.CONTENT_DIFFERS, sizeA, sizeB, null, null, null);
            }

            String digestA = engine.compute(fileA, algorithm, config.chunkSize());
            String digestB = engine.compute(fileB, algorithm, config.chunkSize());
            if (sizeA == sizeB && digestA.equals(digestB)) {
                return null;
            }
            logComparison.debug("Content differs for: " + relativePath);
            return new Difference(
                relativePath, DifferenceKind.CONTENT_DIFFERS, sizeA, sizeB, digestA, digestB,
                null);

        } catch (IOException ioe) {
            logComparison.warn(
                "Unable to compare: " + fileA + " with: " + fileB + ". IOException: "
                    + ioe.getMessage());
            return new Difference(
                relativePath, DifferenceKind.UNREADABLE, sizeA, sizeB, null, null,
                ioe.getClass().getSimpleName() + ": " + ioe.getMessage());
        }
    }

    /**
     * List the files under a root. Paths the walk could not read are recorded in unreadable,
     * keyed by relative path, and do not stop the listing.
     *
     * @return Relative path ('/' separated) to file, sorted by relative path
     */
    private static Map<String, Path> listFiles(Path root, Map<String, String> unreadable)
        throws HashCheckTaskException {
        Map<String, Path> files = new TreeMap<>();
        try {
            List<Path> found = HashCheckUtility.getFilesFromDir(root, (path, ioe) -> {
                logComparison.warn(
                    "Unable to read: " + path + ". IOException: " + ioe.getMessage());
                unreadable.put(
                    HashCheckUtility.relativePathString(root, path),
                    ioe.getClass().getSimpleName() + ": " + ioe.getMessage());
            });
            for (Path file : found) {
                files.put(HashCheckUtility.relativePathString(root, file), file);
            }
        } catch (IOException ioe) {
            String errMsg = "Unable to walk directory: " + root + ". IOException: "
                + ioe.getMessage();
            logComparison.error(errMsg);
            throw new HashCheckTaskException(errMsg, TaskPhase.DISCOVERY, root, ioe);
        }
        return files;
    }

    /**
     * @return Whether relativePath is, or lies inside, one of the unreadable paths
     */
    private static boolean isUnder(String relativePath, Map<String, String> unreadable) {
        for (String unreadablePath : unreadable.keySet()) {
            if (unreadablePath.isEmpty() || relativePath.equals(unreadablePath)
                || relativePath.startsWith(unreadablePath + "/")) {
                return true;
            }
        }
        return false;
    }

    private static void checkExists(Path path) throws HashCheckTaskException {
        if (!Files.exists(path)) {
            String errMsg = "Path does not exist: " + path;
            logComparison.error(errMsg);
            throw new HashCheckTaskException(
                errMsg, TaskPhase.DISCOVERY, path, new NoSuchFileException(path.toString()));
        }
    }

    private static long sizeOrUnknown(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ioe) {
            logComparison.debug("Unable to read size of: " + file + ". " + ioe.getMessage());
            return -1;
        }
    }

    private static TaskCancelledException cancelled(ProgressTracker tracker) {
        int processed = tracker.getProcessed();
        int total = tracker.getTotal();
        logComparison.info("Comparison cancelled after " + processed + " of " + total);
        return new TaskCancelledException(
            "Comparison cancelled after " + processed + " of " + total + " files", processed,
            total);
    }
}
