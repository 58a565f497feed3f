package org.dataone.hashcheck.manifest;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;

/**
 * ManifestFiles loads manifest files from disk and writes generated manifests without
 * clobbering an existing file.
 */
public class ManifestFiles {
    private static final Log logManifestFiles = LogFactory.getLog(ManifestFiles.class);
    private static final DateTimeFormatter BACKUP_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * Read and parse a manifest file. Relative entries resolve against the manifest's own
     * directory. When no algorithm is given, the file extension is tried (ex. ".sfv" is CRC32)
     * and then each digest's length.
     *
     * @param codec        Codec to parse with
     * @param manifestFile Manifest file
     * @param delimiter    Delimiter between path and digest
     * @param algorithm    Algorithm of the digests, may be null
     * @return Parsed manifest and warnings
     * @throws IOException Manifest file cannot be read
     */
    public static ManifestParseResult read(
        ManifestCodec codec, Path manifestFile, String delimiter, ChecksumAlgorithm algorithm)
        throws IOException {
        HashCheckUtility.ensureNotNull(codec, "codec", "read");
        HashCheckUtility.ensureNotNull(manifestFile, "manifestFile", "read");

        Path absManifest = manifestFile.toAbsolutePath().normalize();
        String text = readText(absManifest);
        ChecksumAlgorithm manifestAlgorithm = algorithm;
        if (manifestAlgorithm == null) {
            manifestAlgorithm = ChecksumAlgorithm.fromFileExtension(
                absManifest.getFileName().toString());
        }
        logManifestFiles.debug(
            "Reading manifest: " + absManifest + " with algorithm: " + manifestAlgorithm);
        return codec.parse(text, delimiter, manifestAlgorithm, absManifest.getParent());
    }

    /**
     * Read the text of a manifest file as UTF-8, falling back to ISO-8859-1 for legacy files
     * that are not valid UTF-8.
     *
     * @param manifestFile Manifest file
     * @return File content
     * @throws IOException Manifest file cannot be read
     */
    public static String readText(Path manifestFile) throws IOException {
        try {
            return Files.readString(manifestFile, StandardCharsets.UTF_8);

        } catch (CharacterCodingException cce) {
            logManifestFiles.debug(
                "Manifest is not valid UTF-8, reading as ISO-8859-1: " + manifestFile);
            return Files.readString(manifestFile, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Write manifest text to the target path. If the target already exists, it is either
     * renamed to "[name].[yyyyMMddHHmmss].bak" (backupExisting) or left alone and the text is
     * written to the first free "[base]_[n][ext]" name instead.
     *
     * @param target         Desired manifest path
     * @param text           Manifest text
     * @param backupExisting Whether to back up an existing target
     * @return The path the manifest was written to
     * @throws IOException Unable to write the manifest or back up the existing one
     */
    public static Path write(Path target, String text, boolean backupExisting)
        throws IOException {
        HashCheckUtility.ensureNotNull(target, "target", "write");
        HashCheckUtility.ensureNotNull(text, "text", "write");

        Path absTarget = target.toAbsolutePath().normalize();
        Path directory = absTarget.getParent();
        Files.createDirectories(directory);

        Path destination = absTarget;
        if (Files.exists(absTarget)) {
            if (backupExisting) {
                String backupName =
                    absTarget.getFileName() + "." + LocalDateTime.now().format(BACKUP_TIMESTAMP)
                        + ".bak";
                Path backupPath = uniquePath(directory.resolve(backupName));
                Files.move(absTarget, backupPath);
                logManifestFiles.info("Backup of existing manifest created: " + backupPath);
            } else {
                destination = uniquePath(absTarget);
                logManifestFiles.info(
                    "Manifest exists at: " + absTarget + ", writing to: " + destination);
            }
        }

        File tmpFile = HashCheckUtility.generateTmpFile("manifest", directory);
        try {
            try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(
                    Files.newOutputStream(tmpFile.toPath()), StandardCharsets.UTF_8))) {
                writer.write(text);
            }
            try {
                Files.move(tmpFile.toPath(), destination, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException amnse) {
                logManifestFiles.debug("Atomic move not supported, falling back to a plain move.");
                Files.move(tmpFile.toPath(), destination, StandardCopyOption.REPLACE_EXISTING);
            }

        } catch (IOException ioe) {
            String errMsg = "Unable to write manifest: " + destination + ". IOException: "
                + ioe.getMessage();
            logManifestFiles.error(errMsg);
            throw ioe;

        } finally {
            HashCheckUtility.deleteTmpFile(tmpFile);
        }

        logManifestFiles.info("Manifest written to: " + destination);
        return destination;
    }

    /**
     * Find a path that does not exist yet by appending "_1", "_2", ... to the file's base name.
     *
     * @param path Desired path
     * @return The path itself if free, otherwise the first free numbered variant
     */
    public static Path uniquePath(Path path) {
        if (!Files.exists(path)) {
            return path;
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        int counter = 1;
        Path candidate;
        do {
            candidate = path.resolveSibling(base + "_" + counter + extension);
            counter++;
        } while (Files.exists(candidate));
        return candidate;
    }
}
