package org.dataone.hashcheck;

import java.nio.file.Path;

import org.dataone.hashcheck.manifest.FileEntry;

/**
 * Outcome of verifying a single manifest entry.
 *
 * @param entry        The manifest entry
 * @param resolvedPath File the entry resolved to
 * @param status       Classification
 * @param actualDigest Digest computed from disk, null when no digest was computed
 * @param error        Failure details for MISSING and ERROR, null otherwise
 */
public record EntryVerification(
    FileEntry entry, Path resolvedPath, EntryStatus status, String actualDigest,
    EntryError error) {

    public boolean isOk() {
        return status == EntryStatus.OK;
    }
}
