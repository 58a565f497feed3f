package org.dataone.hashcheck;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.config.HashCheckConfig.HashCheckProperties;
import org.dataone.hashcheck.config.SessionSnapshot;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.manifest.MalformedEntry;
import org.dataone.hashcheck.report.ReportFormat;
import org.dataone.hashcheck.report.VerificationReportWriter;

public class Client {
    private static HashCheck hashCheck;

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.out.println("HashCheckClient - No arguments provided. Use flag '-h' for help.");
        }
        // Add HashCheck client options
        Options options = addHashCheckClientOptions();

        // Begin parsing arguments
        CommandLineParser parser = new DefaultParser(false);
        HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);

            // First check if user is looking for help
            if (cmd.hasOption("h")) {
                formatter.printHelp("HashCheck Client Options", options);
                return;
            }

            initializeHashCheck(cmd);
            try {
                HashCheckConfig config = hashCheck.getDefaultConfig();
                SessionSnapshot session = null;
                if (cmd.hasOption("session")) {
                    session = SessionSnapshot.load(Paths.get(cmd.getOptionValue("session")));
                }

                if (cmd.hasOption("generate")) {
                    List<Path> paths = collectPaths(cmd.getOptionValues("path"));
                    if (paths.isEmpty() && session != null) {
                        paths = session.filePaths();
                    }
                    if (paths.isEmpty()) {
                        throw new IllegalArgumentException(
                            "HashCheckClient - '-path' must be supplied to generate a manifest.");
                    }
                    generate(paths, cmd.getOptionValue("out"), config);

                } else if (cmd.hasOption("verify")) {
                    Path manifestFile = null;
                    if (cmd.hasOption("sfv")) {
                        manifestFile = Paths.get(cmd.getOptionValue("sfv"));
                    } else if (session != null) {
                        manifestFile = session.manifestPath();
                    }
                    ensureNotNull(manifestFile, "-sfv");
                    ChecksumAlgorithm algorithm = null;
                    if (cmd.hasOption("algo")) {
                        algorithm = ChecksumAlgorithm.fromName(cmd.getOptionValue("algo"));
                    }
                    verify(
                        manifestFile, algorithm, config, cmd.getOptionValue("report"),
                        cmd.getOptionValue("reportformat"));

                } else if (cmd.hasOption("compare")) {
                    String pathA = cmd.getOptionValue("a");
                    String pathB = cmd.getOptionValue("b");
                    ensureNotNull(pathA, "-a");
                    ensureNotNull(pathB, "-b");
                    compare(Paths.get(pathA), Paths.get(pathB), config);

                } else {
                    System.out.println("HashCheckClient - No options found, use -h for help.");
                }

            } catch (HashCheckTaskException htce) {
                System.err.println(
                    "HashCheckClient - Task failed during " + htce.getPhase() + ": "
                        + htce.getMessage());

            } catch (TaskCancelledException tce) {
                System.err.println("HashCheckClient - " + tce.getMessage());

            } finally {
                hashCheck.close();
            }

        } catch (ParseException e) {
            System.err.println("Error parsing cli arguments: " + e.getMessage());
            formatter.printHelp("HashCheck Client Options", options);
        }
    }


    // Configuration methods to initialize HashCheck client

    /**
     * Returns an options object to use with Apache Commons CLI library to manage command line
     * options for HashCheck client.
     */
    private static Options addHashCheckClientOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Show help options.");
        // Operations
        options.addOption("generate", "client_generate", false, "Generate a checksum manifest.");
        options.addOption("verify", "client_verify", false, "Verify a checksum manifest.");
        options.addOption(
            "compare", "client_compare", false, "Compare two files or two directories.");
        // Operation arguments
        options.addOption(
            "path", "filepath", true,
            "File or directory to include (repeat or separate with commas).");
        options.addOption("out", "manifest_out", true, "Path of the manifest to write.");
        options.addOption("sfv", "manifest_file", true, "Manifest file to verify.");
        options.addOption("a", "path_a", true, "First path to compare.");
        options.addOption("b", "path_b", true, "Second path to compare.");
        // Settings
        options.addOption("algo", "algorithm", true, "Checksum algorithm (ex. CRC32, SHA-256).");
        options.addOption(
            "delimiter", "delimiter", true, "Delimiter between path and digest ('space', "
                + "'tab' or a literal string).");
        options.addOption("tab", "tab_delimiter", false, "Use a tab delimiter.");
        options.addOption("absolute", "absolute_paths", false, "Write absolute paths.");
        options.addOption("threads", "worker_threads", true, "Number of worker threads.");
        options.addOption(
            "exclude", "exclude_extensions", true,
            "Comma separated file extensions to skip (ex. .tmp,.bak).");
        options.addOption("mode", "mode", true, "Verification and comparison mode: quick or full.");
        options.addOption(
            "verifyafter", "verify_after_generation", false,
            "Verify the manifest right after generating it.");
        options.addOption(
            "backup", "backup_existing", false,
            "Back up an existing manifest instead of writing under a new name.");
        options.addOption("config", "config_yaml", true, "Path to a hashcheck.yaml file.");
        options.addOption("report", "report_file", true, "Save the verification report here.");
        options.addOption("reportformat", "report_format", true, "Report format: txt or csv.");
        options.addOption("session", "session_file", true, "Session snapshot to load.");
        return options;
    }

    /**
     * Build the HashCheck engine, with a config from '-config' (if given) overridden by the
     * command line settings.
     *
     * @param cmd Parsed command line
     * @throws IOException When the config file cannot be read or HashCheck cannot be created
     */
    private static void initializeHashCheck(CommandLine cmd) throws IOException {
        HashCheckConfig baseConfig = HashCheckConfig.defaults();
        if (cmd.hasOption("config")) {
            baseConfig = HashCheckConfig.loadYaml(Paths.get(cmd.getOptionValue("config")));
        }

        Map<String, String> overrides = new HashMap<>();
        overrides.put(HashCheckProperties.algorithm.name(), cmd.getOptionValue("algo"));
        overrides.put(HashCheckProperties.delimiter.name(), cmd.getOptionValue("delimiter"));
        if (cmd.hasOption("tab")) {
            overrides.put(HashCheckProperties.delimiter.name(), "tab");
        }
        if (cmd.hasOption("absolute")) {
            overrides.put(HashCheckProperties.pathStyle.name(), "ABSOLUTE");
        }
        overrides.put(HashCheckProperties.workerThreads.name(), cmd.getOptionValue("threads"));
        overrides.put(
            HashCheckProperties.excludeExtensions.name(), cmd.getOptionValue("exclude"));
        overrides.put(HashCheckProperties.verifyMode.name(), cmd.getOptionValue("mode"));
        overrides.put(HashCheckProperties.compareMode.name(), cmd.getOptionValue("mode"));
        if (cmd.hasOption("verifyafter")) {
            overrides.put(HashCheckProperties.verifyAfterGeneration.name(), "true");
        }
        if (cmd.hasOption("backup")) {
            overrides.put(HashCheckProperties.backupExisting.name(), "true");
        }

        Properties hashcheckProperties =
            HashCheckConfig.merge(baseConfig.toProperties(), overrides);
        hashCheck = HashCheckFactory.getHashCheck(
            HashCheckFactory.DEFAULT_CLASS_PACKAGE, hashcheckProperties);
    }

    /**
     * Generate a manifest for the given paths and write it to disk.
     */
    private static void generate(List<Path> paths, String out, HashCheckConfig config)
        throws HashCheckTaskException, TaskCancelledException, InterruptedException,
        IOException {
        GenerationResult result = hashCheck.generate(paths, config).await();

        Path target;
        if (out != null) {
            target = Paths.get(out);
        } else {
            Path directory = paths.size() == 1 && Files.isDirectory(paths.get(0)) ? paths.get(0)
                : result.manifest().getBaseDirectory();
            if (directory == null) {
                directory = Paths.get("").toAbsolutePath();
            }
            target = FileHashCheck.defaultManifestPath(directory, config);
        }

        Path written = hashCheck.writeManifest(result.manifest(), target, config);
        System.out.println(
            "Manifest with " + result.manifest().entryCount() + " entries written to: "
                + written);
        for (EntryError error : result.errors()) {
            System.out.println("Error: " + error);
        }
        if (result.verification() != null) {
            System.out.println(
                "Verification: " + VerificationReportWriter.summary(result.verification()));
        }
    }

    /**
     * Verify a manifest file, print the report and optionally save it.
     */
    private static void verify(
        Path manifestFile, ChecksumAlgorithm algorithm, HashCheckConfig config, String report,
        String reportFormat) throws HashCheckTaskException, TaskCancelledException,
        InterruptedException, IOException {
        VerificationResult result =
            hashCheck.verify(manifestFile, algorithm, config, null).await();

        VerificationReportWriter writer = new VerificationReportWriter();
        System.out.print(writer.toText(result));
        if (report != null) {
            Path reportFile = Paths.get(report);
            ReportFormat format = reportFormat != null ? ReportFormat.fromName(reportFormat)
                : ReportFormat.fromFileName(reportFile.getFileName().toString());
            writer.write(result, reportFile, format);
            System.out.println("Report saved to: " + reportFile);
        }
        for (MalformedEntry warning : result.getWarnings()) {
            System.err.println("Warning: invalid manifest line " + warning.lineNumber());
        }
    }

    /**
     * Compare two paths and print the differences.
     */
    private static void compare(Path pathA, Path pathB, HashCheckConfig config)
        throws HashCheckTaskException, TaskCancelledException, InterruptedException {
        ComparisonResult result = hashCheck.compare(pathA, pathB, config, null).await();
        System.out.print(result.toText());
    }

    // Utility methods specific to Client

    /**
     * Split '-path' values, which may be repeated and comma separated.
     */
    private static List<Path> collectPaths(String[] values) {
        List<Path> paths = new ArrayList<>();
        if (values == null) {
            return paths;
        }
        for (String value : values) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    paths.add(Paths.get(part.trim()));
                }
            }
        }
        return paths;
    }

    /**
     * Checks whether a given object is null and throws an exception if so
     *
     * @param object   Object to check
     * @param argument Value that is being checked
     * @throws IllegalArgumentException If the object is null
     */
    private static void ensureNotNull(Object object, String argument) {
        if (object == null) {
            String errMsg = "HashCheckClient - " + argument + " cannot be null";
            throw new IllegalArgumentException(errMsg);
        }
    }
}
