package org.dataone.hashcheck.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for ManifestFiles
 */
public class ManifestFilesTest {

    /**
     * Temporary folder for tests to run in
     */
    @TempDir
    public Path tempFolder;

    /**
     * Check that read resolves relative entries against the manifest's directory
     */
    @Test
    public void read_baseDirectory() throws Exception {
        Path manifestFile = tempFolder.resolve("sub/checksum.txt");
        Files.createDirectories(manifestFile.getParent());
        Files.writeString(manifestFile, "a.txt 3610a686\n");

        Manifest manifest = ManifestFiles.read(
            new ManifestCodec(), manifestFile, ManifestCodec.SPACE, null).manifest();
        assertEquals(
            manifestFile.getParent().toAbsolutePath().normalize(), manifest.getBaseDirectory());
        assertEquals(
            tempFolder.resolve("sub/a.txt").toAbsolutePath().normalize(),
            manifest.getEntries().get(0).resolve(manifest.getBaseDirectory()));
    }

    /**
     * Check that the file extension decides the algorithm ahead of digest length
     */
    @Test
    public void read_algorithmFromExtension() throws Exception {
        // 32 hex characters would otherwise be MD5
        Path manifestFile = tempFolder.resolve("checksum.b2");
        Files.writeString(manifestFile, "a.txt 5d41402abc4b2a76b9719d911017c592\n");

        Manifest manifest = ManifestFiles.read(
            new ManifestCodec(), manifestFile, ManifestCodec.SPACE, null).manifest();
        assertEquals(ChecksumAlgorithm.BLAKE2B_512, manifest.getAlgorithm());

        Manifest explicit = ManifestFiles.read(
            new ManifestCodec(), manifestFile, ManifestCodec.SPACE, ChecksumAlgorithm.MD5)
            .manifest();
        assertEquals(ChecksumAlgorithm.MD5, explicit.getAlgorithm());
    }

    /**
     * Check that a manifest that is not valid UTF-8 is read as ISO-8859-1
     */
    @Test
    public void readText_latin1Fallback() throws Exception {
        Path manifestFile = tempFolder.resolve("legacy.sfv");
        Files.write(manifestFile, "café.txt 3610a686\n".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals("café.txt 3610a686\n", ManifestFiles.readText(manifestFile));
    }

    /**
     * Check that reading a missing manifest throws
     */
    @Test
    public void read_missingFile() {
        assertThrows(
            NoSuchFileException.class, () -> ManifestFiles.read(
                new ManifestCodec(), tempFolder.resolve("missing.sfv"), ManifestCodec.SPACE,
                null));
    }

    /**
     * Check that write creates missing parent directories
     */
    @Test
    public void write_newFile() throws Exception {
        Path target = tempFolder.resolve("out/checksum.sfv");

        Path written = ManifestFiles.write(target, "a.txt 3610a686\n", false);
        assertEquals(target.toAbsolutePath().normalize(), written);
        assertEquals("a.txt 3610a686\n", Files.readString(written));
    }

    /**
     * Check that an existing manifest is never overwritten: a numbered name is used instead
     */
    @Test
    public void write_existingGetsNumberedName() throws Exception {
        Path target = tempFolder.resolve("checksum.sfv");
        Files.writeString(target, "old\n");

        Path first = ManifestFiles.write(target, "first\n", false);
        Path second = ManifestFiles.write(target, "second\n", false);
        assertEquals("checksum_1.sfv", first.getFileName().toString());
        assertEquals("checksum_2.sfv", second.getFileName().toString());
        assertEquals("old\n", Files.readString(target));
        assertEquals("second\n", Files.readString(second));
    }

    /**
     * Check that backupExisting moves the existing manifest to a ".bak" file
     */
    @Test
    public void write_backupExisting() throws Exception {
        Path target = tempFolder.resolve("checksum.sfv");
        Files.writeString(target, "old\n");

        Path written = ManifestFiles.write(target, "new\n", true);
        assertEquals(target.toAbsolutePath().normalize(), written);
        assertEquals("new\n", Files.readString(target));

        List<Path> backups;
        try (Stream<Path> stream = Files.list(tempFolder)) {
            backups = stream.filter(p -> p.getFileName().toString().endsWith(".bak"))
                .collect(Collectors.toList());
        }
        assertEquals(1, backups.size());
        assertTrue(backups.get(0).getFileName().toString().startsWith("checksum.sfv."));
        assertEquals("old\n", Files.readString(backups.get(0)));
    }

    /**
     * Check that no temporary files are left behind after a write
     */
    @Test
    public void write_noTmpFilesLeft() throws Exception {
        ManifestFiles.write(tempFolder.resolve("checksum.sfv"), "a.txt 3610a686\n", false);

        try (Stream<Path> stream = Files.list(tempFolder)) {
            assertEquals(1, stream.count());
        }
    }

    /**
     * Check uniquePath for free names and names without an extension
     */
    @Test
    public void uniquePath() throws Exception {
        Path free = tempFolder.resolve("free.sfv");
        assertEquals(free, ManifestFiles.uniquePath(free));

        Path noExtension = tempFolder.resolve("checksum");
        Files.writeString(noExtension, "x");
        assertEquals(tempFolder.resolve("checksum_1"), ManifestFiles.uniquePath(noExtension));
    }
}
