package org.dataone.hashcheck.testdata;

import java.io.IOException;
import java.nio.file.Path;

import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;

/**
 * A DigestEngine that fails with a read error for files of one name, as a disk error would,
 * and digests every other file normally.
 */
public class UnreadableFileDigestEngine extends DigestEngine {
    private final String unreadableName;

    /**
     * @param unreadableName File name that cannot be read
     */
    public UnreadableFileDigestEngine(String unreadableName) {
        this.unreadableName = unreadableName;
    }

    @Override
    public String compute(Path path, ChecksumAlgorithm algorithm, int chunkSize)
        throws IOException {
        if (path.getFileName() != null && path.getFileName().toString().equals(unreadableName)) {
            throw new IOException("Input/output error");
        }
        return super.compute(path, algorithm, chunkSize);
    }
}
