package org.dataone.hashcheck.config;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.manifest.ManifestCodec;
import org.dataone.hashcheck.manifest.PathStyle;
import org.dataone.hashcheck.task.CompareMode;
import org.dataone.hashcheck.task.VerifyMode;

/**
 * Settings for a single task submission. A config is passed with every request; nothing in the
 * engine reads settings from a shared location.
 *
 * @param algorithm             Algorithm for generation and for manifests with no other hint
 * @param delimiter             String between path and digest
 * @param commentMarker         Prefix of manifest comment lines
 * @param pathStyle             How entry paths are written
 * @param workerThreads         Files processed concurrently within one task
 * @param chunkSize             Bytes read per digest update
 * @param excludeExtensions     Lowercase file name suffixes (ex. ".tmp") skipped by generation
 * @param verifyAfterGeneration Verify a manifest right after generating it
 * @param verifyMode            QUICK short-circuits on a known, differing size
 * @param compareMode           QUICK or FULL comparison
 * @param compareAlgorithm      Overrides the compare mode's reference algorithm, may be null
 * @param annotateErrors        Add a comment line to generated manifests for each failed file
 * @param baseDirectory         Base for relative manifest paths, may be null (common parent)
 * @param manifestFileName      Default manifest name without extension
 * @param backupExisting        Back up an existing manifest instead of picking a new name
 */
public record HashCheckConfig(
    ChecksumAlgorithm algorithm, String delimiter, String commentMarker, PathStyle pathStyle,
    int workerThreads, int chunkSize, Set<String> excludeExtensions,
    boolean verifyAfterGeneration, VerifyMode verifyMode, CompareMode compareMode,
    ChecksumAlgorithm compareAlgorithm, boolean annotateErrors, Path baseDirectory,
    String manifestFileName, boolean backupExisting) {

    private static final Log logConfig = LogFactory.getLog(HashCheckConfig.class);

    public static final String HASHCHECK_YAML = "hashcheck.yaml";
    public static final String DEFAULT_MANIFEST_NAME = "checksum";

    /**
     * Keys of a {@code Properties} object describing a config.
     */
    public enum HashCheckProperties {
        algorithm("algorithm"), delimiter("delimiter"), commentMarker("comment_marker"),
        pathStyle("path_style"), workerThreads("worker_threads"), chunkSize("chunk_size"),
        excludeExtensions("exclude_extensions"),
        verifyAfterGeneration("verify_after_generation"), verifyMode("verify_mode"),
        compareMode("compare_mode"), compareAlgorithm("compare_algorithm"),
        annotateErrors("annotate_errors"), baseDirectory("base_directory"),
        manifestFileName("manifest_file_name"), backupExisting("backup_existing");

        final String yamlKey;

        HashCheckProperties(String yamlKey) {
            this.yamlKey = yamlKey;
        }

        public String getYamlKey() {
            return yamlKey;
        }
    }

    public HashCheckConfig {
        HashCheckUtility.ensureNotNull(algorithm, "algorithm", "HashCheckConfig");
        HashCheckUtility.checkForEmptyString(delimiter, "delimiter", "HashCheckConfig");
        HashCheckUtility.checkForEmptyString(commentMarker, "commentMarker", "HashCheckConfig");
        HashCheckUtility.ensureNotNull(pathStyle, "pathStyle", "HashCheckConfig");
        HashCheckUtility.checkPositive(workerThreads, "workerThreads", "HashCheckConfig");
        HashCheckUtility.checkPositive(chunkSize, "chunkSize", "HashCheckConfig");
        HashCheckUtility.ensureNotNull(verifyMode, "verifyMode", "HashCheckConfig");
        HashCheckUtility.ensureNotNull(compareMode, "compareMode", "HashCheckConfig");
        HashCheckUtility.checkForEmptyString(
            manifestFileName, "manifestFileName", "HashCheckConfig");
        excludeExtensions = normalizeExtensions(
            excludeExtensions == null ? List.of() : excludeExtensions);
    }

    /**
     * @return Config with every default: CRC32, space delimiter, ";" comments, relative paths,
     * one worker per available processor, 64 KiB chunks
     */
    public static HashCheckConfig defaults() {
        return new HashCheckConfig(
            ChecksumAlgorithm.CRC32, ManifestCodec.SPACE, ManifestCodec.DEFAULT_COMMENT_MARKER,
            PathStyle.RELATIVE, Runtime.getRuntime().availableProcessors(),
            DigestEngine.DEFAULT_CHUNK_SIZE, Set.of(), false, VerifyMode.FULL, CompareMode.QUICK,
            null, true, null, DEFAULT_MANIFEST_NAME, false);
    }

    /**
     * Build a config from properties keyed by {@link HashCheckProperties} names. Missing keys
     * keep their default.
     *
     * @param properties Properties, may be null
     * @return Config
     * @throws IllegalArgumentException A value cannot be parsed
     */
    public static HashCheckConfig fromProperties(Properties properties) {
        HashCheckConfig defaults = defaults();
        if (properties == null) {
            return defaults;
        }

        String algorithmName = properties.getProperty(HashCheckProperties.algorithm.name());
        String delimiterOption = properties.getProperty(HashCheckProperties.delimiter.name());
        String commentMarker = properties.getProperty(
            HashCheckProperties.commentMarker.name(), defaults.commentMarker());
        String pathStyle = properties.getProperty(HashCheckProperties.pathStyle.name());
        String workerThreads = properties.getProperty(HashCheckProperties.workerThreads.name());
        String chunkSize = properties.getProperty(HashCheckProperties.chunkSize.name());
        String excludes = properties.getProperty(HashCheckProperties.excludeExtensions.name());
        String verifyAfter = properties.getProperty(
            HashCheckProperties.verifyAfterGeneration.name());
        String verifyMode = properties.getProperty(HashCheckProperties.verifyMode.name());
        String compareMode = properties.getProperty(HashCheckProperties.compareMode.name());
        String compareAlgorithm = properties.getProperty(
            HashCheckProperties.compareAlgorithm.name());
        String annotateErrors = properties.getProperty(
            HashCheckProperties.annotateErrors.name());
        String baseDirectory = properties.getProperty(HashCheckProperties.baseDirectory.name());
        String manifestFileName = properties.getProperty(
            HashCheckProperties.manifestFileName.name(), defaults.manifestFileName());
        String backupExisting = properties.getProperty(
            HashCheckProperties.backupExisting.name());

        return new HashCheckConfig(
            isBlank(algorithmName) ? defaults.algorithm()
                : ChecksumAlgorithm.fromName(algorithmName),
            delimiterOption == null ? defaults.delimiter()
                : ManifestCodec.resolveDelimiter(delimiterOption), commentMarker,
            isBlank(pathStyle) ? defaults.pathStyle() : parseEnum(PathStyle.class, pathStyle),
            isBlank(workerThreads) ? defaults.workerThreads()
                : parseInt(workerThreads, HashCheckProperties.workerThreads),
            isBlank(chunkSize) ? defaults.chunkSize()
                : parseInt(chunkSize, HashCheckProperties.chunkSize),
            isBlank(excludes) ? defaults.excludeExtensions() : splitToSet(excludes),
            isBlank(verifyAfter) ? defaults.verifyAfterGeneration()
                : Boolean.parseBoolean(verifyAfter.trim()),
            isBlank(verifyMode) ? defaults.verifyMode()
                : parseEnum(VerifyMode.class, verifyMode),
            isBlank(compareMode) ? defaults.compareMode()
                : parseEnum(CompareMode.class, compareMode),
            isBlank(compareAlgorithm) ? null : ChecksumAlgorithm.fromName(compareAlgorithm),
            isBlank(annotateErrors) ? defaults.annotateErrors()
                : Boolean.parseBoolean(annotateErrors.trim()),
            isBlank(baseDirectory) ? null : Paths.get(baseDirectory.trim()), manifestFileName,
            isBlank(backupExisting) ? defaults.backupExisting()
                : Boolean.parseBoolean(backupExisting.trim()));
    }

    /**
     * Render the config as properties keyed by {@link HashCheckProperties} names.
     *
     * @return Properties, accepted by {@link #fromProperties(Properties)}
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        properties.setProperty(HashCheckProperties.algorithm.name(), algorithm.getName());
        properties.setProperty(HashCheckProperties.delimiter.name(), delimiterOption());
        properties.setProperty(HashCheckProperties.commentMarker.name(), commentMarker);
        properties.setProperty(HashCheckProperties.pathStyle.name(), pathStyle.name());
        properties.setProperty(
            HashCheckProperties.workerThreads.name(), String.valueOf(workerThreads));
        properties.setProperty(HashCheckProperties.chunkSize.name(), String.valueOf(chunkSize));
        properties.setProperty(
            HashCheckProperties.excludeExtensions.name(), String.join(",", excludeExtensions));
        properties.setProperty(
            HashCheckProperties.verifyAfterGeneration.name(),
            String.valueOf(verifyAfterGeneration));
        properties.setProperty(HashCheckProperties.verifyMode.name(), verifyMode.name());
        properties.setProperty(HashCheckProperties.compareMode.name(), compareMode.name());
        if (compareAlgorithm != null) {
            properties.setProperty(
                HashCheckProperties.compareAlgorithm.name(), compareAlgorithm.getName());
        }
        properties.setProperty(
            HashCheckProperties.annotateErrors.name(), String.valueOf(annotateErrors));
        if (baseDirectory != null) {
            properties.setProperty(
                HashCheckProperties.baseDirectory.name(), baseDirectory.toString());
        }
        properties.setProperty(HashCheckProperties.manifestFileName.name(), manifestFileName);
        properties.setProperty(
            HashCheckProperties.backupExisting.name(), String.valueOf(backupExisting));
        return properties;
    }

    /**
     * Load a config from a 'hashcheck.yaml' file. Keys are the snake_case names of
     * {@link HashCheckProperties}; unknown keys are ignored and missing keys keep their default.
     *
     * @param yamlPath Path to the YAML file
     * @return Config
     * @throws IOException If the file cannot be read or parsed
     */
    public static HashCheckConfig loadYaml(Path yamlPath) throws IOException {
        HashCheckUtility.ensureNotNull(yamlPath, "yamlPath", "loadYaml");
        File yamlFile = yamlPath.toFile();
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        Properties properties = new Properties();

        try {
            HashMap<?, ?> yamlProperties = om.readValue(yamlFile, HashMap.class);
            if (yamlProperties != null) {
                for (HashCheckProperties key : HashCheckProperties.values()) {
                    Object value = yamlProperties.get(key.getYamlKey());
                    if (value instanceof Collection<?>) {
                        List<String> items = new ArrayList<>();
                        for (Object item : (Collection<?>) value) {
                            items.add(String.valueOf(item));
                        }
                        properties.setProperty(key.name(), String.join(",", items));
                    } else if (value != null) {
                        properties.setProperty(key.name(), String.valueOf(value));
                    }
                }
            }

        } catch (IOException ioe) {
            logConfig.error(
                "Unable to retrieve '" + yamlPath + "'. IOException: " + ioe.getMessage());
            throw ioe;
        }

        logConfig.debug("Loaded configuration from: " + yamlPath);
        return fromProperties(properties);
    }

    /**
     * Write the config to a YAML file that {@link #loadYaml(Path)} accepts.
     *
     * @param yamlPath Target file
     * @throws IOException Unable to write the file
     */
    public void writeYaml(Path yamlPath) throws IOException {
        HashCheckUtility.ensureNotNull(yamlPath, "yamlPath", "writeYaml");
        Files.writeString(yamlPath, toYamlString(), StandardCharsets.UTF_8);
        logConfig.info("Configuration written to: " + yamlPath);
    }

    /**
     * @return Config as commented YAML
     */
    public String toYamlString() {
        return String.format(
            "# Configuration variables for hashcheck\n\n"
                + "############### Manifest Format ###############\n"
                + "# Algorithm used to generate manifests and to verify manifests that carry no\n"
                + "# other hint (CRC32, MD5, SHA-1, SHA-256, SHA3-256, BLAKE2b-512, ...)\n"
                + "algorithm: \"%s\"\n"
                + "# Separator between path and digest: space, tab or a literal string\n"
                + "delimiter: \"%s\"\n" + "comment_marker: \"%s\"\n"
                + "# RELATIVE to the base directory, or ABSOLUTE\n" + "path_style: \"%s\"\n"
                + "manifest_file_name: \"%s\"\n" + "backup_existing: %b\n"
                + "annotate_errors: %b\n\n"
                + "############### Processing ###############\n" + "worker_threads: %d\n"
                + "chunk_size: %d\n" + "exclude_extensions: [%s]\n"
                + "verify_after_generation: %b\n" + "# QUICK or FULL\n"
                + "verify_mode: \"%s\"\n" + "compare_mode: \"%s\"\n"
                + "compare_algorithm: %s\n" + "base_directory: %s\n", algorithm.getName(),
            escapeYaml(delimiterOption()), escapeYaml(commentMarker), pathStyle.name(),
            escapeYaml(manifestFileName), backupExisting, annotateErrors, workerThreads,
            chunkSize, quotedList(excludeExtensions), verifyAfterGeneration, verifyMode.name(),
            compareMode.name(),
            compareAlgorithm == null ? "null" : "\"" + compareAlgorithm.getName() + "\"",
            baseDirectory == null ? "null" : "\"" + escapeYaml(baseDirectory.toString()) + "\"");
    }

    /**
     * @return "space", "tab" or the literal delimiter
     */
    public String delimiterOption() {
        if (ManifestCodec.SPACE.equals(delimiter)) {
            return "space";
        }
        if (ManifestCodec.TAB.equals(delimiter)) {
            return "tab";
        }
        return delimiter;
    }

    /**
     * @return The reference algorithm for comparisons
     */
    public ChecksumAlgorithm effectiveCompareAlgorithm() {
        return compareAlgorithm != null ? compareAlgorithm : compareMode.getDefaultAlgorithm();
    }

    /**
     * @param fileName File name to check
     * @return True if the name ends with an excluded extension, ignoring case
     */
    public boolean isExcluded(String fileName) {
        String lowerName = fileName.toLowerCase(Locale.ROOT);
        for (String extension : excludeExtensions) {
            if (lowerName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public HashCheckConfig withAlgorithm(ChecksumAlgorithm newAlgorithm) {
        return new HashCheckConfig(
            newAlgorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, compareMode, compareAlgorithm,
            annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withWorkerThreads(int newWorkerThreads) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, newWorkerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, compareMode, compareAlgorithm,
            annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withDelimiter(String newDelimiter) {
        return new HashCheckConfig(
            algorithm, newDelimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, compareMode, compareAlgorithm,
            annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withPathStyle(PathStyle newPathStyle) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, newPathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, compareMode, compareAlgorithm,
            annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withExcludeExtensions(Collection<String> newExcludeExtensions) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            new LinkedHashSet<>(newExcludeExtensions), verifyAfterGeneration, verifyMode,
            compareMode, compareAlgorithm, annotateErrors, baseDirectory, manifestFileName,
            backupExisting);
    }

    public HashCheckConfig withVerifyAfterGeneration(boolean newVerifyAfterGeneration) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, newVerifyAfterGeneration, verifyMode, compareMode,
            compareAlgorithm, annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withVerifyMode(VerifyMode newVerifyMode) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, newVerifyMode, compareMode,
            compareAlgorithm, annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withCompareMode(
        CompareMode newCompareMode, ChecksumAlgorithm newCompareAlgorithm) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, newCompareMode,
            newCompareAlgorithm, annotateErrors, baseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withBaseDirectory(Path newBaseDirectory) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, compareMode, compareAlgorithm,
            annotateErrors, newBaseDirectory, manifestFileName, backupExisting);
    }

    public HashCheckConfig withBackupExisting(boolean newBackupExisting) {
        return new HashCheckConfig(
            algorithm, delimiter, commentMarker, pathStyle, workerThreads, chunkSize,
            excludeExtensions, verifyAfterGeneration, verifyMode, compareMode, compareAlgorithm,
            annotateErrors, baseDirectory, manifestFileName, newBackupExisting);
    }

    private static Set<String> normalizeExtensions(Collection<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String extension : extensions) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            String lower = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(lower.startsWith(".") ? lower : "." + lower);
        }
        return Set.copyOf(normalized);
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static Set<String> splitToSet(String value) {
        return new LinkedHashSet<>(splitList(value));
    }

    private static int parseInt(String value, HashCheckProperties key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException nfe) {
            String errMsg = "HashCheckConfig - " + key.name() + " must be an integer, found: "
                + value;
            logConfig.error(errMsg);
            throw new IllegalArgumentException(errMsg, nfe);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            String errMsg = "HashCheckConfig - unknown " + type.getSimpleName() + ": " + value;
            logConfig.error(errMsg);
            throw new IllegalArgumentException(errMsg, iae);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String escapeYaml(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\t", "\\t");
    }

    private static String quotedList(Set<String> values) {
        List<String> quoted = new ArrayList<>();
        for (String value : values) {
            quoted.add("\"" + escapeYaml(value) + "\"");
        }
        return String.join(", ", quoted);
    }

    /**
     * Merge entries of {@code overrides} into a copy of {@code base}.
     *
     * @param base      Properties to start from
     * @param overrides Properties taking precedence
     * @return Merged properties
     */
    public static Properties merge(Properties base, Map<String, String> overrides) {
        Properties merged = new Properties();
        if (base != null) {
            merged.putAll(base);
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            if (entry.getValue() != null) {
                merged.setProperty(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }
}
