package org.dataone.hashcheck.task;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.EntryError;
import org.dataone.hashcheck.EntryStatus;
import org.dataone.hashcheck.EntryVerification;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.VerificationResult;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.MalformedManifestException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;
import org.dataone.hashcheck.manifest.FileEntry;
import org.dataone.hashcheck.manifest.MalformedEntry;
import org.dataone.hashcheck.manifest.Manifest;
import org.dataone.hashcheck.manifest.ManifestCodec;
import org.dataone.hashcheck.manifest.ManifestFiles;
import org.dataone.hashcheck.manifest.ManifestParseResult;

/**
 * VerificationTask recomputes the digest of every manifest entry and classifies it as OK,
 * MISMATCH, MISSING or ERROR. Entries are independent and are checked concurrently; results
 * are reported in manifest order.
 */
public class VerificationTask implements HashCheckTask<VerificationResult> {
    private static final Log logVerification = LogFactory.getLog(VerificationTask.class);

    private final Manifest manifest;
    private final List<MalformedEntry> warnings;
    private final Path manifestFile;
    private final ChecksumAlgorithm manifestAlgorithm;
    private final HashCheckConfig config;
    private final DigestEngine engine;

    /**
     * Verify an in-memory manifest.
     *
     * @param manifest Manifest to verify
     * @param config   Settings for this task
     * @param engine   Digest engine
     */
    public VerificationTask(Manifest manifest, HashCheckConfig config, DigestEngine engine) {
        this(manifest, List.of(), config, engine);
    }

    /**
     * Verify an in-memory manifest, carrying the warnings produced when it was parsed.
     *
     * @param manifest Manifest to verify
     * @param warnings Malformed lines found when parsing the manifest
     * @param config   Settings for this task
     * @param engine   Digest engine
     */
    public VerificationTask(
        Manifest manifest, List<MalformedEntry> warnings, HashCheckConfig config,
        DigestEngine engine) {
        this(manifest, warnings, null, null, config, engine);
        HashCheckUtility.ensureNotNull(manifest, "manifest", "VerificationTask - constructor");
    }

    private VerificationTask(
        Manifest manifest, List<MalformedEntry> warnings, Path manifestFile,
        ChecksumAlgorithm manifestAlgorithm, HashCheckConfig config, DigestEngine engine) {
        HashCheckUtility.ensureNotNull(config, "config", "VerificationTask - constructor");
        HashCheckUtility.ensureNotNull(engine, "engine", "VerificationTask - constructor");
        this.manifest = manifest;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.manifestFile = manifestFile;
        this.manifestAlgorithm = manifestAlgorithm;
        this.config = config;
        this.engine = engine;
    }

    /**
     * Verify a manifest file. The file is read and parsed when the task runs; relative entries
     * resolve against the manifest's directory.
     *
     * @param manifestFile Manifest file
     * @param algorithm    Algorithm of the digests; null to use the file extension and then
     *                     the digest length
     * @param config       Settings for this task
     * @param engine       Digest engine
     * @return Task
     */
    public static VerificationTask fromFile(
        Path manifestFile, ChecksumAlgorithm algorithm, HashCheckConfig config,
        DigestEngine engine) {
        HashCheckUtility.ensureNotNull(manifestFile, "manifestFile", "fromFile");
        return new VerificationTask(null, null, manifestFile, algorithm, config, engine);
    }

    @Override
    public void validate() throws UnsupportedHashAlgorithmException {
        if (manifestAlgorithm != null) {
            engine.getRegistry().validate(manifestAlgorithm);
        }
        if (manifest != null) {
            for (ChecksumAlgorithm algorithm : algorithmsOf(manifest)) {
                engine.getRegistry().validate(algorithm);
            }
        }
    }

    @Override
    public VerificationResult run(CancellationToken token, ProgressTracker tracker)
        throws HashCheckTaskException, TaskCancelledException {
        Manifest target = manifest;
        List<MalformedEntry> parseWarnings = warnings;
        if (target == null) {
            ManifestParseResult parsed = readManifest(tracker);
            target = parsed.manifest();
            parseWarnings = parsed.warnings();
        }
        logVerification.info(
            "Verifying " + target.entryCount() + " entries"
                + (manifestFile == null ? "" : " of manifest: " + manifestFile));
        return verifyEntries(target, parseWarnings, token, tracker);
    }

    /**
     * Check every entry of a manifest against disk.
     *
     * @param target        Manifest to verify
     * @param parseWarnings Warnings to carry into the result
     * @param token         Cancellation flag
     * @param tracker       Progress of the enclosing task
     * @return Result in manifest order
     * @throws TaskCancelledException The token was cancelled
     */
    VerificationResult verifyEntries(
        Manifest target, List<MalformedEntry> parseWarnings, CancellationToken token,
        ProgressTracker tracker) throws TaskCancelledException {
        List<FileEntry> entries = target.getEntries();
        tracker.beginPhase(TaskPhase.VERIFYING, entries.size());

        List<Callable<EntryVerification>> work = new ArrayList<>(entries.size());
        for (FileEntry entry : entries) {
            work.add(() -> {
                EntryVerification verification = verifyEntry(target, entry);
                tracker.advance(verification.resolvedPath());
                return verification;
            });
        }

        List<EntryVerification> results;
        try {
            results = WorkerPool.runAll(work, config.workerThreads(), token);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cancelled(tracker);
        }
        if (token.isCancelled()) {
            throw cancelled(tracker);
        }

        VerificationResult result = new VerificationResult(
            manifestFile, target.getAlgorithm(), results, parseWarnings);
        logVerification.info("Verification complete: " + result.getCounts());
        return result;
    }

    /**
     * Classify a single entry. Failures are returned as MISSING or ERROR, never thrown.
     */
    private EntryVerification verifyEntry(Manifest target, FileEntry entry) {
        Path resolved = entry.resolve(target.getBaseDirectory());
        ChecksumAlgorithm algorithm =
            entry.getAlgorithm() != null ? entry.getAlgorithm() : target.getAlgorithm();

        if (!Files.isRegularFile(resolved) || !Files.isReadable(resolved)) {
            logVerification.warn("File not found or not readable: " + resolved);
            return missing(entry, resolved, new NoSuchFileException(resolved.toString()));
        }

        try {
            if (config.verifyMode() == VerifyMode.QUICK && entry.hasSize()) {
                long size = Files.size(resolved);
                if (size != entry.getSize()) {
                    logVerification.debug(
                        "Size changed for: " + resolved + " (" + entry.getSize() + " -> " + size
                            + ")");
                    return new EntryVerification(
                        entry, resolved, EntryStatus.MISMATCH, null, null);
                }
            }

            String actual = engine.compute(resolved, algorithm, config.chunkSize());
            EntryStatus status = actual.equalsIgnoreCase(entry.getDigest()) ? EntryStatus.OK
                : EntryStatus.MISMATCH;
            if (status == EntryStatus.MISMATCH) {
                logVerification.warn(
                    "Checksum mismatch for: " + resolved + ". Expected: " + entry.getDigest()
                        + ", actual: " + actual);
            }
            return new EntryVerification(entry, resolved, status, actual, null);

        } catch (NoSuchFileException | AccessDeniedException | FileNotFoundException nfe) {
            logVerification.warn("File disappeared or is not accessible: " + resolved);
            return missing(entry, resolved, nfe);

        } catch (IOException ioe) {
            logVerification.warn(
                "Unable to read: " + resolved + ". IOException: " + ioe.getMessage());
            return new EntryVerification(
                entry, resolved, EntryStatus.ERROR, null,
                EntryError.of(resolved, TaskPhase.VERIFYING, ioe));
        }
    }

    private ManifestParseResult readManifest(ProgressTracker tracker)
        throws HashCheckTaskException {
        tracker.beginPhase(TaskPhase.PARSING, 0);
        ManifestParseResult parsed;
        try {
            parsed = ManifestFiles.read(
                new ManifestCodec(config.commentMarker()), manifestFile, config.delimiter(),
                manifestAlgorithm);
            Manifest parsedManifest = parsed.manifest();
            if (parsedManifest.entryCount() == 0 && parsed.hasWarnings()) {
                MalformedEntry first = parsed.warnings().get(0);
                throw new MalformedManifestException(
                    "No valid entries in manifest: " + manifestFile + ". First invalid line "
                        + first.lineNumber() + ": " + first.reason(), first.lineNumber(),
                    first.line());
            }

        } catch (IOException ioe) {
            String errMsg = "Unable to read manifest: " + manifestFile + ". "
                + ioe.getClass().getSimpleName() + ": " + ioe.getMessage();
            logVerification.error(errMsg);
            throw new HashCheckTaskException(errMsg, TaskPhase.PARSING, manifestFile, ioe);
        }

        try {
            for (ChecksumAlgorithm algorithm : algorithmsOf(parsed.manifest())) {
                engine.getRegistry().validate(algorithm);
            }
        } catch (UnsupportedHashAlgorithmException uhae) {
            throw new HashCheckTaskException(
                uhae.getMessage(), TaskPhase.PARSING, manifestFile, uhae);
        }
        return parsed;
    }

    private static Set<ChecksumAlgorithm> algorithmsOf(Manifest target) {
        Set<ChecksumAlgorithm> algorithms = new LinkedHashSet<>();
        if (target.getAlgorithm() != null) {
            algorithms.add(target.getAlgorithm());
        }
        for (FileEntry entry : target.getEntries()) {
            if (entry.getAlgorithm() != null) {
                algorithms.add(entry.getAlgorithm());
            }
        }
        return algorithms;
    }

    private static EntryVerification missing(FileEntry entry, Path resolved, IOException cause) {
        return new EntryVerification(
            entry, resolved, EntryStatus.MISSING, null,
            new EntryError(resolved, TaskPhase.VERIFYING, "File not found", cause));
    }

    private static TaskCancelledException cancelled(ProgressTracker tracker) {
        int processed = tracker.getProcessed();
        int total = tracker.getTotal();
        logVerification.info("Verification cancelled after " + processed + " of " + total);
        return new TaskCancelledException(
            "Verification cancelled after " + processed + " of " + total + " entries", processed,
            total);
    }
}
