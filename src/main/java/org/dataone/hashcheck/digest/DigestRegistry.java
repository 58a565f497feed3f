package org.dataone.hashcheck.digest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.zip.CRC32;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.digests.Blake2sDigest;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;

/**
 * DigestRegistry maps each {@link ChecksumAlgorithm} to a factory for its digest implementation.
 * A registry is immutable; tasks validate their algorithms against it at submission so that an
 * unsupported algorithm fails before any file is read.
 */
public class DigestRegistry {
    private static final Log logRegistry = LogFactory.getLog(DigestRegistry.class);

    private final Map<ChecksumAlgorithm, Supplier<IncrementalDigest>> digestFactories;

    /**
     * Create a registry from an explicit map of factories.
     *
     * @param digestFactories Algorithm to digest factory
     */
    public DigestRegistry(Map<ChecksumAlgorithm, Supplier<IncrementalDigest>> digestFactories) {
        EnumMap<ChecksumAlgorithm, Supplier<IncrementalDigest>> factories =
            new EnumMap<>(ChecksumAlgorithm.class);
        factories.putAll(digestFactories);
        this.digestFactories = Collections.unmodifiableMap(factories);
    }

    /**
     * Build the registry of every algorithm this runtime can compute. CRC32 comes from
     * `java.util.zip`, BLAKE2 from Bouncy Castle and everything else from
     * `java.security.MessageDigest`. MessageDigest algorithms missing from the JVM's providers
     * are left out.
     *
     * @return Default registry
     */
    public static DigestRegistry defaultRegistry() {
        Map<ChecksumAlgorithm, Supplier<IncrementalDigest>> factories =
            new EnumMap<>(ChecksumAlgorithm.class);
        for (ChecksumAlgorithm algorithm : ChecksumAlgorithm.values()) {
            switch (algorithm) {
                case CRC32 -> factories.put(algorithm, Crc32Digest::new);
                case BLAKE2B_512 -> factories.put(
                    algorithm, () -> new BouncyCastleDigest(new Blake2bDigest(512)));
                case BLAKE2S_256 -> factories.put(
                    algorithm, () -> new BouncyCastleDigest(new Blake2sDigest(256)));
                default -> {
                    String name = algorithm.getName();
                    try {
                        MessageDigest.getInstance(name);
                        factories.put(algorithm, () -> new JcaDigest(name));
                    } catch (NoSuchAlgorithmException nsae) {
                        logRegistry.warn("MessageDigest not available for: " + name
                                             + ", it will not be registered.");
                    }
                }
            }
        }
        return new DigestRegistry(factories);
    }

    /**
     * Build a registry limited to the given algorithms, taken from the default registry.
     *
     * @param algorithms Algorithms to keep
     * @return Restricted registry
     */
    public static DigestRegistry of(ChecksumAlgorithm... algorithms) {
        Map<ChecksumAlgorithm, Supplier<IncrementalDigest>> all =
            defaultRegistry().digestFactories;
        Map<ChecksumAlgorithm, Supplier<IncrementalDigest>> subset =
            new EnumMap<>(ChecksumAlgorithm.class);
        for (ChecksumAlgorithm algorithm : algorithms) {
            if (all.containsKey(algorithm)) {
                subset.put(algorithm, all.get(algorithm));
            }
        }
        return new DigestRegistry(subset);
    }

    public boolean isSupported(ChecksumAlgorithm algorithm) {
        return algorithm != null && digestFactories.containsKey(algorithm);
    }

    /**
     * Ensure an algorithm can be computed by this registry.
     *
     * @param algorithm Algorithm to check
     * @throws UnsupportedHashAlgorithmException If the algorithm is null or not registered
     */
    public void validate(ChecksumAlgorithm algorithm) throws UnsupportedHashAlgorithmException {
        if (!isSupported(algorithm)) {
            String errMsg = "Algorithm not supported: " + algorithm + ". Supported algorithms: "
                + supportedAlgorithms();
            logRegistry.error(errMsg);
            throw new UnsupportedHashAlgorithmException(errMsg);
        }
    }

    /**
     * Create a fresh, unshared digest accumulator.
     *
     * @param algorithm Algorithm to compute
     * @return New digest
     * @throws UnsupportedHashAlgorithmException If the algorithm is not registered
     */
    public IncrementalDigest newDigest(ChecksumAlgorithm algorithm)
        throws UnsupportedHashAlgorithmException {
        validate(algorithm);
        return digestFactories.get(algorithm).get();
    }

    public Set<ChecksumAlgorithm> supportedAlgorithms() {
        if (digestFactories.isEmpty()) {
            return EnumSet.noneOf(ChecksumAlgorithm.class);
        }
        return EnumSet.copyOf(digestFactories.keySet());
    }

    /**
     * CRC32 kept as an unsigned 32-bit value and rendered big-endian, so the hex form is always
     * 8 zero-padded characters.
     */
    static class Crc32Digest implements IncrementalDigest {
        private final CRC32 crc = new CRC32();

        @Override
        public void update(byte[] buffer, int offset, int length) {
            crc.update(buffer, offset, length);
        }

        @Override
        public byte[] digest() {
            long value = crc.getValue();
            return new byte[]{(byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8),
                (byte) value};
        }
    }

    static class JcaDigest implements IncrementalDigest {
        private final MessageDigest messageDigest;

        JcaDigest(String algorithm) {
            try {
                messageDigest = MessageDigest.getInstance(algorithm);
            } catch (NoSuchAlgorithmException nsae) {
                // Registration checks every algorithm first
                throw new IllegalStateException("MessageDigest vanished: " + algorithm, nsae);
            }
        }

        @Override
        public void update(byte[] buffer, int offset, int length) {
            messageDigest.update(buffer, offset, length);
        }

        @Override
        public byte[] digest() {
            return messageDigest.digest();
        }
    }

    static class BouncyCastleDigest implements IncrementalDigest {
        private final Digest bcDigest;

        BouncyCastleDigest(Digest bcDigest) {
            this.bcDigest = bcDigest;
        }

        @Override
        public void update(byte[] buffer, int offset, int length) {
            bcDigest.update(buffer, offset, length);
        }

        @Override
        public byte[] digest() {
            byte[] out = new byte[bcDigest.getDigestSize()];
            bcDigest.doFinal(out, 0);
            return out;
        }
    }
}
