package org.dataone.hashcheck.task;

import org.dataone.hashcheck.digest.ChecksumAlgorithm;

/**
 * How two files are compared for equal content.
 */
public enum CompareMode {
    /** Differing sizes decide without reading; equal sizes are settled with CRC32. */
    QUICK(ChecksumAlgorithm.CRC32),
    /** Both files are always digested with SHA-1. */
    FULL(ChecksumAlgorithm.SHA_1);

    final ChecksumAlgorithm defaultAlgorithm;

    CompareMode(ChecksumAlgorithm defaultAlgorithm) {
        this.defaultAlgorithm = defaultAlgorithm;
    }

    public ChecksumAlgorithm getDefaultAlgorithm() {
        return defaultAlgorithm;
    }
}
