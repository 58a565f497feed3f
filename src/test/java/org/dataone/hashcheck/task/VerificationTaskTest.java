package org.dataone.hashcheck.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.dataone.hashcheck.EntryError;
import org.dataone.hashcheck.EntryStatus;
import org.dataone.hashcheck.EntryVerification;
import org.dataone.hashcheck.GenerationResult;
import org.dataone.hashcheck.VerificationResult;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.digest.DigestRegistry;
import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.MalformedManifestException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;
import org.dataone.hashcheck.manifest.FileEntry;
import org.dataone.hashcheck.manifest.Manifest;
import org.dataone.hashcheck.manifest.ManifestCodec;
import org.dataone.hashcheck.testdata.TestDataHarness;
import org.dataone.hashcheck.testdata.UnreadableFileDigestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for VerificationTask
 */
public class VerificationTaskTest {
    private DigestEngine engine;
    private HashCheckConfig config;

    @BeforeEach
    public void initializeEngine() {
        engine = new DigestEngine();
        config = HashCheckConfig.defaults();
    }

    /**
     * Temporary folder for tests to run in
     */
    @TempDir
    public Path tempFolder;

    private VerificationResult verify(Manifest manifest, HashCheckConfig taskConfig)
        throws Exception {
        return new VerificationTask(manifest, taskConfig, engine).run(
            new CancellationToken(), new ProgressTracker(null));
    }

    private VerificationResult verifyFile(Path manifestFile, ChecksumAlgorithm algorithm)
        throws Exception {
        return VerificationTask.fromFile(manifestFile, algorithm, config, engine).run(
            new CancellationToken(), new ProgressTracker(null));
    }

    private Manifest generate(Path input) throws Exception {
        GenerationResult result = new GenerationTask(List.of(input), config, engine).run(
            new CancellationToken(), new ProgressTracker(null));
        return result.manifest();
    }

    /**
     * Check that a freshly generated manifest verifies as all OK
     */
    @Test
    public void verify_generatedManifest() throws Exception {
        TestDataHarness.writeNumberedFiles(tempFolder, 12);

        VerificationResult result = verify(generate(tempFolder), config);
        assertTrue(result.isAllOk());
        assertEquals(12, result.count(EntryStatus.OK));
        assertEquals(0, result.count(EntryStatus.MISMATCH));
    }

    /**
     * Check that a modified file is reported as MISMATCH with the new digest, and only that file
     */
    @Test
    public void verify_modifiedFile() throws Exception {
        Map<String, Path> files = TestDataHarness.writeHelloWorld(tempFolder);
        Manifest manifest = generate(tempFolder);
        Files.writeString(files.get("b.txt"), "World");

        VerificationResult result = verify(manifest, config);
        assertEquals(EntryStatus.OK, result.getEntries().get(0).status());
        EntryVerification changed = result.getEntries().get(1);
        assertEquals(EntryStatus.MISMATCH, changed.status());
        assertEquals("3a771143", changed.entry().getDigest());
        assertEquals("fbb63e47", changed.actualDigest());
        assertNull(changed.error());
    }

    /**
     * Check that a deleted file is reported as MISSING with an error, and the rest are verified
     */
    @Test
    public void verify_deletedFile() throws Exception {
        Map<String, Path> files = TestDataHarness.writeHelloWorld(tempFolder);
        Manifest manifest = generate(tempFolder);
        Files.delete(files.get("a.txt"));

        VerificationResult result = verify(manifest, config);
        EntryVerification missing = result.getEntries().get(0);
        assertEquals(EntryStatus.MISSING, missing.status());
        assertEquals(TaskPhase.VERIFYING, missing.error().phase());
        assertInstanceOf(NoSuchFileException.class, missing.error().cause());
        assertEquals(EntryStatus.OK, result.getEntries().get(1).status());
        assertEquals(1, result.getErrors().size());
    }

    /**
     * Check that results are in manifest order and equal for one and many worker threads
     */
    @Test
    public void verify_threadCountIndependent() throws Exception {
        TestDataHarness.writeNumberedFiles(tempFolder, 30);
        Manifest manifest = generate(tempFolder);
        Files.writeString(tempFolder.resolve("odd/file-7.txt"), "changed");
        Files.delete(tempFolder.resolve("even/file-12.txt"));

        VerificationResult single = verify(manifest, config.withWorkerThreads(1));
        VerificationResult parallel = verify(manifest, config.withWorkerThreads(6));
        assertEquals(single.statusByPath(), parallel.statusByPath());
        assertEquals(28, parallel.count(EntryStatus.OK));
        assertEquals(1, parallel.count(EntryStatus.MISMATCH));
        assertEquals(1, parallel.count(EntryStatus.MISSING));
        for (int i = 0; i < manifest.entryCount(); i++) {
            assertEquals(
                manifest.getEntries().get(i), parallel.getEntries().get(i).entry());
        }
    }

    /**
     * Check that digests are compared ignoring case
     */
    @Test
    public void verify_uppercaseDigest() throws Exception {
        TestDataHarness.writeFile(tempFolder, "a.txt", "hello");
        Manifest manifest = Manifest.ofEntries(
            ChecksumAlgorithm.MD5, ManifestCodec.SPACE, tempFolder, List.of(
                new FileEntry("a.txt", "5D41402ABC4B2A76B9719D911017C592", ChecksumAlgorithm.MD5)));

        assertTrue(verify(manifest, config).isAllOk());
    }

    /**
     * Check that quick mode reports a size change without computing a digest
     */
    @Test
    public void verify_quickModeSizeChange() throws Exception {
        Map<String, Path> files = TestDataHarness.writeHelloWorld(tempFolder);
        Manifest manifest = generate(tempFolder);
        Files.writeString(files.get("a.txt"), "hello, world");

        VerificationResult quick = verify(manifest, config.withVerifyMode(VerifyMode.QUICK));
        EntryVerification changed = quick.getEntries().get(0);
        assertEquals(EntryStatus.MISMATCH, changed.status());
        assertNull(changed.actualDigest());

        VerificationResult full = verify(manifest, config.withVerifyMode(VerifyMode.FULL));
        assertEquals(EntryStatus.MISMATCH, full.getEntries().get(0).status());
        assertEquals(8, full.getEntries().get(0).actualDigest().length());
    }

    /**
     * Check that a manifest file is read and verified relative to its own directory
     */
    @Test
    public void verifyFile_relativeEntries() throws Exception {
        TestDataHarness.writeHelloWorld(tempFolder);
        Path manifestFile = tempFolder.resolve("checksum.sfv");
        Files.writeString(manifestFile, "; hello world\na.txt 3610a686\nb.txt 3a771143\n");

        VerificationResult result = verifyFile(manifestFile, null);
        assertTrue(result.isAllOk());
        assertEquals(2, result.total());
        assertEquals(ChecksumAlgorithm.CRC32, result.getAlgorithm());
        assertEquals(manifestFile, result.getManifestPath());
    }

    /**
     * Check that malformed lines become warnings while the valid lines are verified
     */
    @Test
    public void verifyFile_withWarnings() throws Exception {
        TestDataHarness.writeHelloWorld(tempFolder);
        Path manifestFile = tempFolder.resolve("checksum.sfv");
        Files.writeString(manifestFile, "a.txt 3610a686\ngarbage\nb.txt 3a771143\n");

        VerificationResult result = verifyFile(manifestFile, null);
        assertTrue(result.isAllOk());
        assertEquals(1, result.getWarnings().size());
        assertEquals(2, result.getWarnings().get(0).lineNumber());
    }

    /**
     * Check that a manifest with only malformed lines fails in the parsing phase
     */
    @Test
    public void verifyFile_noValidEntries() throws Exception {
        Path manifestFile = tempFolder.resolve("checksum.sfv");
        Files.writeString(manifestFile, "garbage\nmore garbage zz\n");

        HashCheckTaskException htce = assertThrows(
            HashCheckTaskException.class, () -> verifyFile(manifestFile, null));
        assertEquals(TaskPhase.PARSING, htce.getPhase());
        assertInstanceOf(MalformedManifestException.class, htce.getCause());
        assertEquals(1, ((MalformedManifestException) htce.getCause()).getLineNumber());
    }

    /**
     * Check that a missing manifest file fails in the parsing phase
     */
    @Test
    public void verifyFile_missingManifest() {
        HashCheckTaskException htce = assertThrows(
            HashCheckTaskException.class,
            () -> verifyFile(tempFolder.resolve("missing.sfv"), null));
        assertEquals(TaskPhase.PARSING, htce.getPhase());
        assertInstanceOf(NoSuchFileException.class, htce.getCause());
    }

    /**
     * Check that an empty manifest verifies as all OK with no entries
     */
    @Test
    public void verifyFile_empty() throws Exception {
        Path manifestFile = tempFolder.resolve("checksum.sfv");
        Files.writeString(manifestFile, "; nothing here\n");

        VerificationResult result = verifyFile(manifestFile, null);
        assertEquals(0, result.total());
        assertTrue(result.isAllOk());
    }

    /**
     * Check that an explicit algorithm overrides the one inferred from the manifest
     */
    @Test
    public void verifyFile_explicitAlgorithm() throws Exception {
        TestDataHarness.writeFile(tempFolder, "a.txt", "hello");
        Path manifestFile = tempFolder.resolve("list.txt");
        Files.writeString(
            manifestFile,
            "a.txt 2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824\n");

        assertTrue(verifyFile(manifestFile, null).isAllOk());
        VerificationResult sha3 = verifyFile(manifestFile, ChecksumAlgorithm.SHA3_256);
        assertEquals(ChecksumAlgorithm.SHA3_256, sha3.getAlgorithm());
        assertEquals(EntryStatus.MISMATCH, sha3.getEntries().get(0).status());
    }

    /**
     * Check that validate rejects a manifest whose algorithm is not registered
     */
    @Test
    public void validate_unsupportedAlgorithm() {
        DigestEngine crcOnly = new DigestEngine(DigestRegistry.of(ChecksumAlgorithm.CRC32));
        Manifest manifest = Manifest.ofEntries(
            ChecksumAlgorithm.MD5, ManifestCodec.SPACE, tempFolder, List.of(
                new FileEntry("a.txt", "5d41402abc4b2a76b9719d911017c592", ChecksumAlgorithm.MD5)));

        assertThrows(
            UnsupportedHashAlgorithmException.class,
            () -> new VerificationTask(manifest, config, crcOnly).validate());
        assertThrows(
            UnsupportedHashAlgorithmException.class,
            () -> VerificationTask.fromFile(
                tempFolder.resolve("x.md5"), ChecksumAlgorithm.MD5, config, crcOnly).validate());
    }

    /**
     * Check that a file that exists but cannot be read is classified ERROR, and the other
     * entries are still verified
     */
    @Test
    public void verify_unreadableFile() throws Exception {
        TestDataHarness.writeNumberedFiles(tempFolder, 6);
        Manifest manifest = generate(tempFolder);
        engine = new UnreadableFileDigestEngine("file-3.txt");

        VerificationResult result = verify(manifest, config);
        assertEquals(6, result.total());
        assertEquals(5, result.count(EntryStatus.OK));
        assertEquals(1, result.count(EntryStatus.ERROR));
        EntryVerification failed = result.withStatus(EntryStatus.ERROR).get(0);
        assertEquals(tempFolder.resolve("odd/file-3.txt"), failed.resolvedPath());
        assertNull(failed.actualDigest());
        EntryError error = failed.error();
        assertEquals(TaskPhase.VERIFYING, error.phase());
        assertEquals("IOException: Input/output error", error.message());
    }
}
