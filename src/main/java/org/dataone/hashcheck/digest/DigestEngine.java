package org.dataone.hashcheck.digest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;

/**
 * DigestEngine computes hex digests of files and streams. Content is read in fixed-size chunks
 * and fed to the digest incrementally, so memory use does not depend on file size. Every call
 * uses its own buffer and digest state; one engine may be used from many threads at once.
 */
public class DigestEngine {
    private static final Log logDigestEngine = LogFactory.getLog(DigestEngine.class);

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    private final DigestRegistry registry;
    private final int chunkSize;

    public DigestEngine() {
        this(DigestRegistry.defaultRegistry(), DEFAULT_CHUNK_SIZE);
    }

    public DigestEngine(DigestRegistry registry) {
        this(registry, DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param registry  Registry used to look up digest implementations
     * @param chunkSize Default number of bytes read per chunk
     */
    public DigestEngine(DigestRegistry registry, int chunkSize) {
        HashCheckUtility.ensureNotNull(registry, "registry", "DigestEngine - constructor");
        HashCheckUtility.checkPositive(chunkSize, "chunkSize", "DigestEngine - constructor");
        this.registry = registry;
        this.chunkSize = chunkSize;
    }

    public DigestRegistry getRegistry() {
        return registry;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Calculate the hex digest of a file using the engine's chunk size.
     *
     * @param path      File to digest
     * @param algorithm Algorithm to use
     * @return Lowercase hex digest
     * @throws IOException                       File cannot be opened or read
     * @throws UnsupportedHashAlgorithmException Algorithm is not registered
     */
    public String compute(Path path, ChecksumAlgorithm algorithm) throws IOException {
        return compute(path, algorithm, chunkSize);
    }

    /**
     * Calculate the hex digest of a file.
     *
     * @param path      File to digest
     * @param algorithm Algorithm to use
     * @param chunkSize Number of bytes read per chunk
     * @return Lowercase hex digest
     * @throws IOException                       File cannot be opened or read
     * @throws UnsupportedHashAlgorithmException Algorithm is not registered
     */
    public String compute(Path path, ChecksumAlgorithm algorithm, int chunkSize)
        throws IOException {
        HashCheckUtility.ensureNotNull(path, "path", "compute");
        HashCheckUtility.checkPositive(chunkSize, "chunkSize", "compute");
        IncrementalDigest digest = registry.newDigest(algorithm);

        try (InputStream dataStream = Files.newInputStream(path)) {
            feed(dataStream, chunkSize, digest);
        }
        String hexDigest = digest.hexDigest();
        logDigestEngine.debug(
            "Hex digest calculated for: " + path + ", algorithm: " + algorithm + ", hex digest: "
                + hexDigest);
        return hexDigest;
    }

    /**
     * Calculate several hex digests of a file in a single pass.
     *
     * @param path       File to digest
     * @param algorithms Algorithms to use
     * @return Map of algorithm to lowercase hex digest
     * @throws IOException                       File cannot be opened or read
     * @throws UnsupportedHashAlgorithmException Any algorithm is not registered
     */
    public Map<ChecksumAlgorithm, String> computeAll(
        Path path, Collection<ChecksumAlgorithm> algorithms) throws IOException {
        HashCheckUtility.ensureNotNull(path, "path", "computeAll");
        HashCheckUtility.ensureNotNull(algorithms, "algorithms", "computeAll");
        Set<ChecksumAlgorithm> distinct = new LinkedHashSet<>(algorithms);
        Map<ChecksumAlgorithm, IncrementalDigest> digests = new EnumMap<>(ChecksumAlgorithm.class);
        for (ChecksumAlgorithm algorithm : distinct) {
            digests.put(algorithm, registry.newDigest(algorithm));
        }

        try (InputStream dataStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[chunkSize];
            int bytesRead;
            while ((bytesRead = dataStream.read(buffer)) != -1) {
                for (IncrementalDigest digest : digests.values()) {
                    digest.update(buffer, 0, bytesRead);
                }
            }
        }

        Map<ChecksumAlgorithm, String> hexDigests = new EnumMap<>(ChecksumAlgorithm.class);
        for (Map.Entry<ChecksumAlgorithm, IncrementalDigest> entry : digests.entrySet()) {
            hexDigests.put(entry.getKey(), entry.getValue().hexDigest());
        }
        return hexDigests;
    }

    /**
     * Calculate the hex digest of a stream. The stream is read to its end and closed.
     *
     * @param dataStream Stream to digest
     * @param algorithm  Algorithm to use
     * @return Lowercase hex digest
     * @throws IOException Error when reading the stream
     */
    public String hexDigest(InputStream dataStream, ChecksumAlgorithm algorithm)
        throws IOException {
        HashCheckUtility.ensureNotNull(dataStream, "dataStream", "hexDigest");
        IncrementalDigest digest = registry.newDigest(algorithm);
        try (dataStream) {
            feed(dataStream, chunkSize, digest);
        }
        return digest.hexDigest();
    }

    private static void feed(InputStream dataStream, int chunkSize, IncrementalDigest digest)
        throws IOException {
        byte[] buffer = new byte[chunkSize];
        int bytesRead;
        while ((bytesRead = dataStream.read(buffer)) != -1) {
            digest.update(buffer, 0, bytesRead);
        }
    }
}
