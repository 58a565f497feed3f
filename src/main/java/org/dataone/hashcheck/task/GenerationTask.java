package org.dataone.hashcheck.task;

import java.io.IOException;
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
import org.dataone.hashcheck.GenerationResult;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.VerificationResult;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;
import org.dataone.hashcheck.manifest.FileEntry;
import org.dataone.hashcheck.manifest.Manifest;
import org.dataone.hashcheck.manifest.ManifestCodec;
import org.dataone.hashcheck.manifest.ManifestLine;

/**
 * GenerationTask digests a set of files and directories and builds a manifest of them.
 *
 * <p>Directories are walked recursively and their files ordered by path, so an unchanged file
 * set always yields the same manifest. Files that cannot be digested are reported as
 * {@link EntryError}s and left out of the manifest body.</p>
 */
public class GenerationTask implements HashCheckTask<GenerationResult> {
    private static final Log logGeneration = LogFactory.getLog(GenerationTask.class);

    private final List<Path> inputs;
    private final HashCheckConfig config;
    private final DigestEngine engine;

    /**
     * @param inputs Files and directories, in the order they were selected
     * @param config Settings for this task
     * @param engine Digest engine
     */
    public GenerationTask(List<Path> inputs, HashCheckConfig config, DigestEngine engine) {
        HashCheckUtility.ensureNotNull(inputs, "inputs", "GenerationTask - constructor");
        HashCheckUtility.ensureNotNull(config, "config", "GenerationTask - constructor");
        HashCheckUtility.ensureNotNull(engine, "engine", "GenerationTask - constructor");
        this.inputs = List.copyOf(inputs);
        this.config = config;
        this.engine = engine;
    }

    @Override
    public void validate() throws UnsupportedHashAlgorithmException {
        engine.getRegistry().validate(config.algorithm());
    }

    @Override
    public GenerationResult run(CancellationToken token, ProgressTracker tracker)
        throws TaskCancelledException {
        ChecksumAlgorithm algorithm = config.algorithm();
        logGeneration.info(
            "Generating " + algorithm + " manifest for " + inputs.size() + " input paths");

        tracker.beginPhase(TaskPhase.DISCOVERY, 0);
        List<EntryError> errors = new ArrayList<>();
        List<Path> files = expandInputs(errors);
        if (token.isCancelled()) {
            throw cancelled(tracker);
        }

        Path baseDirectory = config.baseDirectory() != null
            ? config.baseDirectory().toAbsolutePath().normalize()
            : HashCheckUtility.commonParentDirectory(files);

        tracker.beginPhase(TaskPhase.DIGESTING, files.size());
        List<Callable<DigestOutcome>> work = new ArrayList<>(files.size());
        for (Path file : files) {
            work.add(() -> {
                DigestOutcome outcome = digestFile(file, algorithm);
                tracker.advance(file);
                return outcome;
            });
        }

        List<DigestOutcome> outcomes;
        try {
            outcomes = WorkerPool.runAll(work, config.workerThreads(), token);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cancelled(tracker);
        }
        if (token.isCancelled()) {
            throw cancelled(tracker);
        }

        List<ManifestLine> lines = new ArrayList<>();
        for (EntryError discoveryError : errors) {
            annotate(lines, discoveryError);
        }
        for (DigestOutcome outcome : outcomes) {
            if (outcome.entry() != null) {
                lines.add(ManifestLine.entry(outcome.entry()));
            } else {
                errors.add(outcome.error());
                annotate(lines, outcome.error());
            }
        }
        Manifest manifest = new Manifest(algorithm, config.delimiter(), baseDirectory, lines);
        logGeneration.info(
            "Manifest generated with " + manifest.entryCount() + " entries and " + errors.size()
                + " errors");

        VerificationResult verification = null;
        if (config.verifyAfterGeneration()) {
            logGeneration.info("Verifying generated manifest");
            verification = new VerificationTask(manifest, config, engine).verifyEntries(
                manifest, List.of(), token, tracker);
        }
        return new GenerationResult(manifest, errors, verification);
    }

    /**
     * Expand the inputs into a de-duplicated list of files in input order, with each
     * directory's files sorted by path. Excluded extensions are dropped here, before digesting.
     */
    private List<Path> expandInputs(List<EntryError> errors) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path input : inputs) {
            Path absInput = input.toAbsolutePath().normalize();
            if (Files.isDirectory(absInput)) {
                try {
                    files.addAll(HashCheckUtility.getFilesFromDir(absInput, (path, ioe) -> {
                        logGeneration.warn(
                            "Unable to read: " + path + ". IOException: " + ioe.getMessage());
                        errors.add(EntryError.of(path, TaskPhase.DISCOVERY, ioe));
                    }));
                } catch (IOException ioe) {
                    logGeneration.warn(
                        "Unable to walk directory: " + absInput + ". IOException: "
                            + ioe.getMessage());
                    errors.add(EntryError.of(absInput, TaskPhase.DISCOVERY, ioe));
                }
            } else if (Files.exists(absInput)) {
                files.add(absInput);
            } else {
                logGeneration.warn("Input path does not exist: " + absInput);
                errors.add(new EntryError(
                    absInput, TaskPhase.DISCOVERY, "File not found",
                    new NoSuchFileException(absInput.toString())));
            }
        }

        List<Path> included = new ArrayList<>(files.size());
        for (Path file : files) {
            if (config.isExcluded(file.getFileName().toString())) {
                logGeneration.debug("Excluded by extension: " + file);
            } else if (ManifestCodec.hasLineBreak(file.toString())) {
                logGeneration.warn("File name contains a line break: " + file);
                errors.add(new EntryError(
                    file, TaskPhase.DISCOVERY, "File name contains a line break", null));
            } else {
                included.add(file);
            }
        }
        return included;
    }

    private DigestOutcome digestFile(Path file, ChecksumAlgorithm algorithm) {
        try {
            if (!Files.isRegularFile(file)) {
                throw new NoSuchFileException(file.toString(), null, "not a regular file");
            }
            long size = Files.size(file);
            String digest = engine.compute(file, algorithm, config.chunkSize());
            return new DigestOutcome(new FileEntry(file.toString(), digest, algorithm, size), null);

        } catch (IOException ioe) {
            logGeneration.warn(
                "Unable to digest: " + file + ". IOException: " + ioe.getMessage());
            return new DigestOutcome(null, EntryError.of(file, TaskPhase.DIGESTING, ioe));
        }
    }

    private void annotate(List<ManifestLine> lines, EntryError error) {
        if (config.annotateErrors()) {
            Path name = error.path().getFileName();
            String comment = config.commentMarker() + " Error processing " + (name == null
                ? error.path() : name) + ": " + error.message();
            lines.add(ManifestLine.comment(ManifestCodec.LINE_BREAKS.matcher(comment)
                .replaceAll("?")));
        }
    }

    private static TaskCancelledException cancelled(ProgressTracker tracker) {
        int processed = tracker.getProcessed();
        int total = tracker.getTotal();
        logGeneration.info("Generation cancelled after " + processed + " of " + total);
        return new TaskCancelledException(
            "Generation cancelled after " + processed + " of " + total + " files", processed,
            total);
    }

    private record DigestOutcome(FileEntry entry, EntryError error) {
    }
}
