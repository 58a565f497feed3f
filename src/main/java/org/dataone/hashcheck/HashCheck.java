package org.dataone.hashcheck;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;
import org.dataone.hashcheck.manifest.Manifest;
import org.dataone.hashcheck.manifest.ManifestParseResult;
import org.dataone.hashcheck.task.ProgressListener;
import org.dataone.hashcheck.task.TaskHandle;

/**
 * HashCheck generates checksum manifests (SFV and friends) for files and directory trees,
 * verifies manifests against disk and compares two paths for equal content. Long-running
 * operations run asynchronously and return a {@link TaskHandle} that reports progress, can be
 * cancelled and resolves to the operation's result. Implementations (like `FileHashCheck`) must
 * implement the HashCheck interface to ensure proper usage of the system.
 */
public interface HashCheck extends AutoCloseable {
        /**
         * The `generate` method digests every given file, and every file below every given
         * directory, and builds a manifest of them. Directory contents are ordered by path so
         * that an unchanged file set always produces the same manifest. Input paths keep the
         * order they were given in; a path given twice appears once.
         *
         * Files that cannot be read are not listed in the manifest. They are returned as
         * {@link EntryError}s in the result and, when `annotateErrors` is set, also noted as
         * comment lines in the manifest. If `verifyAfterGeneration` is set the new manifest is
         * verified straight away and the verification is part of the result.
         *
         * @param paths    Files and directories to include
         * @param config   Settings for this request (algorithm, delimiter, exclusions, ...)
         * @param listener Receives progress, may be null
         * @return Handle resolving to a GenerationResult
         * @throws UnsupportedHashAlgorithmException The configured algorithm is not registered
         * @throws IllegalArgumentException          Null paths or config
         */
        TaskHandle<GenerationResult> generate(
                List<Path> paths, HashCheckConfig config, ProgressListener listener
        ) throws UnsupportedHashAlgorithmException, IllegalArgumentException;

        /**
         * @see #generate(List, HashCheckConfig, ProgressListener)
         */
        TaskHandle<GenerationResult> generate(List<Path> paths, HashCheckConfig config)
                throws UnsupportedHashAlgorithmException, IllegalArgumentException;

        /**
         * The `verify` method recomputes the digest of every entry of an in-memory manifest and
         * classifies it: OK when it matches (ignoring case), MISMATCH when it does not, MISSING
         * when the file does not exist or cannot be opened, and ERROR when reading failed part
         * way. Relative entries resolve against the manifest's base directory.
         *
         * @param manifest Manifest to verify
         * @param config   Settings for this request (verify mode, worker threads, ...)
         * @param listener Receives progress, may be null
         * @return Handle resolving to a VerificationResult in manifest order
         * @throws UnsupportedHashAlgorithmException The manifest's algorithm is not registered
         * @throws IllegalArgumentException          Null manifest or config
         */
        TaskHandle<VerificationResult> verify(
                Manifest manifest, HashCheckConfig config, ProgressListener listener
        ) throws UnsupportedHashAlgorithmException, IllegalArgumentException;

        /**
         * The `verify` method, reading the manifest from a file. Lines that cannot be decoded
         * are returned as warnings in the result; a file with no decodable entry at all fails
         * the task with a `MalformedManifestException` cause. When no algorithm is given, it is
         * taken from the file extension (ex. ".sfv" for CRC32), then from each digest's length.
         *
         * @param manifestFile Manifest file
         * @param algorithm    Algorithm of the manifest's digests, may be null
         * @param config       Settings for this request
         * @param listener     Receives progress, may be null
         * @return Handle resolving to a VerificationResult in manifest order
         * @throws UnsupportedHashAlgorithmException The given algorithm is not registered
         * @throws IllegalArgumentException          Null manifest file or config
         */
        TaskHandle<VerificationResult> verify(
                Path manifestFile, ChecksumAlgorithm algorithm, HashCheckConfig config,
                ProgressListener listener
        ) throws UnsupportedHashAlgorithmException, IllegalArgumentException;

        /**
         * The `compare` method decides whether two files, or two directory trees, have the same
         * content. Trees are compared file by file, keyed by path relative to each root. A file
         * compared with a directory gives TYPE_MISMATCH.
         *
         * @param pathA    First file or directory
         * @param pathB    Second file or directory
         * @param config   Settings for this request (compare mode and algorithm)
         * @param listener Receives progress, may be null
         * @return Handle resolving to a ComparisonResult
         * @throws UnsupportedHashAlgorithmException The reference algorithm is not registered
         * @throws IllegalArgumentException          Null paths or config
         */
        TaskHandle<ComparisonResult> compare(
                Path pathA, Path pathB, HashCheckConfig config, ProgressListener listener
        ) throws UnsupportedHashAlgorithmException, IllegalArgumentException;

        /**
         * Parse manifest text using the config's delimiter and comment marker.
         *
         * @param text      Manifest text
         * @param algorithm Algorithm of the digests, null to infer it from digest length
         * @param baseDirectory Directory relative entries resolve against, may be null
         * @param config    Settings for this request
         * @return Manifest and malformed-line warnings
         */
        ManifestParseResult parse(
                String text, ChecksumAlgorithm algorithm, Path baseDirectory, HashCheckConfig config
        );

        /**
         * Render a manifest as text using the config's path style.
         *
         * @param manifest Manifest to render
         * @param config   Settings for this request
         * @return Manifest text
         */
        String serialize(Manifest manifest, HashCheckConfig config);

        /**
         * Write a manifest to disk. An existing file is either backed up or kept, with the
         * manifest written under a new numbered name, depending on `backupExisting`.
         *
         * @param manifest Manifest to write
         * @param target   Desired manifest path
         * @param config   Settings for this request
         * @return Path the manifest was written to
         * @throws IOException Unable to write the manifest
         */
        Path writeManifest(Manifest manifest, Path target, HashCheckConfig config)
                throws IOException;

        /**
         * @return The config used when a caller has none of its own
         */
        HashCheckConfig getDefaultConfig();

        /**
         * Stop accepting requests and cancel running tasks.
         */
        @Override
        void close();
}
