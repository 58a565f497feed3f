package org.dataone.hashcheck;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.digest.DigestRegistry;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;
import org.dataone.hashcheck.manifest.FileEntry;
import org.dataone.hashcheck.manifest.Manifest;
import org.dataone.hashcheck.manifest.ManifestCodec;
import org.dataone.hashcheck.manifest.ManifestFiles;
import org.dataone.hashcheck.manifest.ManifestLine;
import org.dataone.hashcheck.manifest.ManifestParseResult;
import org.dataone.hashcheck.task.ComparisonTask;
import org.dataone.hashcheck.task.GenerationTask;
import org.dataone.hashcheck.task.ProgressListener;
import org.dataone.hashcheck.task.TaskHandle;
import org.dataone.hashcheck.task.TaskRunner;
import org.dataone.hashcheck.task.VerificationTask;

/**
 * FileHashCheck is the file-system implementation of HashCheck. It owns a digest engine and a
 * task runner; every request carries its own {@link HashCheckConfig}, the properties given at
 * construction only supply the default one.
 */
public class FileHashCheck implements HashCheck {
    private static final Log logFileHashCheck = LogFactory.getLog(FileHashCheck.class);

    private final HashCheckConfig defaultConfig;
    private final DigestEngine engine;
    private final TaskRunner taskRunner;

    /**
     * Constructor to initialize FileHashCheck with default settings.
     */
    public FileHashCheck() {
        this(new Properties());
    }

    /**
     * Constructor to initialize FileHashCheck. Properties are optional; missing keys keep their
     * defaults.
     *
     * @param hashcheckProperties Properties object keyed by
     *                            {@link HashCheckConfig.HashCheckProperties} names
     * @throws IllegalArgumentException A property value cannot be parsed
     */
    public FileHashCheck(Properties hashcheckProperties) throws IllegalArgumentException {
        this(HashCheckConfig.fromProperties(hashcheckProperties), DigestRegistry.defaultRegistry());
    }

    /**
     * @param defaultConfig Config used by callers without their own
     * @param registry      Digest implementations available to this instance
     */
    public FileHashCheck(HashCheckConfig defaultConfig, DigestRegistry registry) {
        logFileHashCheck.info("Initializing FileHashCheck");
        HashCheckUtility.ensureNotNull(
            defaultConfig, "defaultConfig", "FileHashCheck - constructor");
        HashCheckUtility.ensureNotNull(registry, "registry", "FileHashCheck - constructor");
        this.defaultConfig = defaultConfig;
        this.engine = new DigestEngine(registry, defaultConfig.chunkSize());
        this.taskRunner = new TaskRunner();
        logFileHashCheck.debug(
            "FileHashCheck initialized. Default algorithm: " + defaultConfig.algorithm()
                + ", supported algorithms: " + registry.supportedAlgorithms());
    }

    @Override
    public TaskHandle<GenerationResult> generate(
        List<Path> paths, HashCheckConfig config, ProgressListener listener)
        throws UnsupportedHashAlgorithmException, IllegalArgumentException {
        HashCheckUtility.ensureNotNull(paths, "paths", "generate");
        HashCheckUtility.ensureNotNull(config, "config", "generate");
        logFileHashCheck.debug("Generate requested for " + paths.size() + " paths");
        return taskRunner.submit(new GenerationTask(paths, config, engine), listener);
    }

    @Override
    public TaskHandle<GenerationResult> generate(List<Path> paths, HashCheckConfig config)
        throws UnsupportedHashAlgorithmException, IllegalArgumentException {
        return generate(paths, config, null);
    }

    @Override
    public TaskHandle<VerificationResult> verify(
        Manifest manifest, HashCheckConfig config, ProgressListener listener)
        throws UnsupportedHashAlgorithmException, IllegalArgumentException {
        HashCheckUtility.ensureNotNull(manifest, "manifest", "verify");
        HashCheckUtility.ensureNotNull(config, "config", "verify");
        logFileHashCheck.debug("Verify requested for manifest: " + manifest);
        return taskRunner.submit(new VerificationTask(manifest, config, engine), listener);
    }

    @Override
    public TaskHandle<VerificationResult> verify(
        Path manifestFile, ChecksumAlgorithm algorithm, HashCheckConfig config,
        ProgressListener listener)
        throws UnsupportedHashAlgorithmException, IllegalArgumentException {
        HashCheckUtility.ensureNotNull(manifestFile, "manifestFile", "verify");
        HashCheckUtility.ensureNotNull(config, "config", "verify");
        logFileHashCheck.debug("Verify requested for manifest file: " + manifestFile);
        return taskRunner.submit(
            VerificationTask.fromFile(manifestFile, algorithm, config, engine), listener);
    }

    @Override
    public TaskHandle<ComparisonResult> compare(
        Path pathA, Path pathB, HashCheckConfig config, ProgressListener listener)
        throws UnsupportedHashAlgorithmException, IllegalArgumentException {
        HashCheckUtility.ensureNotNull(config, "config", "compare");
        logFileHashCheck.debug("Compare requested for: " + pathA + " and: " + pathB);
        return taskRunner.submit(new ComparisonTask(pathA, pathB, config, engine), listener);
    }

    @Override
    public ManifestParseResult parse(
        String text, ChecksumAlgorithm algorithm, Path baseDirectory, HashCheckConfig config) {
        HashCheckUtility.ensureNotNull(config, "config", "parse");
        return new ManifestCodec(config.commentMarker()).parse(
            text, config.delimiter(), algorithm, baseDirectory);
    }

    @Override
    public String serialize(Manifest manifest, HashCheckConfig config) {
        HashCheckUtility.ensureNotNull(config, "config", "serialize");
        return new ManifestCodec(config.commentMarker()).serialize(manifest, config.pathStyle());
    }

    @Override
    public Path writeManifest(Manifest manifest, Path target, HashCheckConfig config)
        throws IOException {
        HashCheckUtility.ensureNotNull(manifest, "manifest", "writeManifest");
        HashCheckUtility.ensureNotNull(target, "target", "writeManifest");
        HashCheckUtility.ensureNotNull(config, "config", "writeManifest");
        // Relative entries must resolve from the manifest's own directory
        Path directory = target.toAbsolutePath().normalize().getParent();
        Manifest rebased = rebase(manifest, directory);
        String text = serialize(rebased, config);
        return ManifestFiles.write(target, text, config.backupExisting());
    }

    /**
     * Make every entry absolute against the manifest's current base, then move the base to
     * the given directory.
     */
    private static Manifest rebase(Manifest manifest, Path directory) {
        Path base = manifest.getBaseDirectory();
        if (directory.equals(base)) {
            return manifest;
        }
        List<ManifestLine> lines = new ArrayList<>();
        for (ManifestLine line : manifest.getLines()) {
            if (line.isComment()) {
                lines.add(line);
            } else {
                FileEntry entry = line.entry();
                lines.add(ManifestLine.entry(new FileEntry(
                    entry.resolve(base).toAbsolutePath().toString(), entry.getDigest(),
                    entry.getAlgorithm(), entry.getSize())));
            }
        }
        return new Manifest(manifest.getAlgorithm(), manifest.getDelimiter(), directory, lines);
    }

    @Override
    public HashCheckConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Default location of a manifest in a directory: the config's manifest name with the
     * algorithm's conventional extension (ex. "checksum.sfv" for CRC32).
     *
     * @param directory Directory the manifest is written to
     * @param config    Settings for this request
     * @return Manifest path
     */
    public static Path defaultManifestPath(Path directory, HashCheckConfig config) {
        ChecksumAlgorithm algorithm = config.algorithm();
        String extension = algorithm.getFileExtension();
        if (extension == null) {
            extension = algorithm.getName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        }
        return directory.resolve(config.manifestFileName() + "." + extension);
    }

    public DigestEngine getEngine() {
        return engine;
    }

    @Override
    public void close() {
        logFileHashCheck.debug("Closing FileHashCheck");
        taskRunner.close();
    }
}
