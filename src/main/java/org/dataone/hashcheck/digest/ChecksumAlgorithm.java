package org.dataone.hashcheck.digest;

import java.util.Arrays;
import java.util.Locale;

import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;

/**
 * The checksum algorithms hashcheck knows about. Whether an algorithm can actually be computed is
 * decided by the {@link DigestRegistry} in use.
 */
public enum ChecksumAlgorithm {
    CRC32("CRC32", 8, "sfv"),
    MD5("MD5", 32, "md5"),
    SHA_1("SHA-1", 40, "sha1"),
    SHA_224("SHA-224", 56, "sha224"),
    SHA_256("SHA-256", 64, "sha256"),
    SHA_384("SHA-384", 96, "sha384"),
    SHA_512("SHA-512", 128, "sha512"),
    SHA_512_224("SHA-512/224", 56, null),
    SHA_512_256("SHA-512/256", 64, null),
    SHA3_224("SHA3-224", 56, null),
    SHA3_256("SHA3-256", 64, null),
    SHA3_384("SHA3-384", 96, null),
    SHA3_512("SHA3-512", 128, null),
    BLAKE2B_512("BLAKE2b-512", 128, "b2", "BLAKE2B"),
    BLAKE2S_256("BLAKE2s-256", 64, null, "BLAKE2S");

    final String algoName;
    final int hexLength;
    final String fileExtension;
    final String[] aliases;

    ChecksumAlgorithm(String algo, int hexLength, String fileExtension, String... aliases) {
        this.algoName = algo;
        this.hexLength = hexLength;
        this.fileExtension = fileExtension;
        this.aliases = aliases;
    }

    /**
     * @return Canonical name, also the `java.security.MessageDigest` name where one exists
     */
    public String getName() {
        return algoName;
    }

    /**
     * @return Number of hexadecimal characters in a digest of this algorithm
     */
    public int getHexLength() {
        return hexLength;
    }

    /**
     * @return Conventional manifest file extension (without the dot), or null
     */
    public String getFileExtension() {
        return fileExtension;
    }

    @Override
    public String toString() {
        return algoName;
    }

    /**
     * Look up an algorithm by name. Matching ignores case and punctuation, so "sha256",
     * "SHA-256" and "Sha_256" are the same algorithm.
     *
     * @param name Algorithm name (ex. "SHA-256", "crc32", "BLAKE2B")
     * @return Matching algorithm
     * @throws UnsupportedHashAlgorithmException If no algorithm matches
     */
    public static ChecksumAlgorithm fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new UnsupportedHashAlgorithmException("Algorithm name cannot be null or empty.");
        }
        String key = compact(name);
        for (ChecksumAlgorithm algorithm : values()) {
            if (compact(algorithm.algoName).equals(key)) {
                return algorithm;
            }
            for (String alias : algorithm.aliases) {
                if (compact(alias).equals(key)) {
                    return algorithm;
                }
            }
        }
        String errMsg = "Algorithm not supported: " + name + ". Supported algorithms: "
            + Arrays.toString(values());
        throw new UnsupportedHashAlgorithmException(errMsg);
    }

    /**
     * Guess the algorithm from the length of a hex digest. Several algorithms share a length;
     * the most common one wins (ex. 64 characters is SHA-256).
     *
     * @param hexLength Length of a hex digest
     * @return Algorithm, or null when no algorithm produces digests of that length
     */
    public static ChecksumAlgorithm fromDigestLength(int hexLength) {
        for (ChecksumAlgorithm algorithm : values()) {
            if (algorithm.hexLength == hexLength) {
                return algorithm;
            }
        }
        return null;
    }

    /**
     * Guess the algorithm from a manifest file name (ex. "checksum.sfv" is CRC32).
     *
     * @param fileName Manifest file name
     * @return Algorithm, or null when the extension is not recognised
     */
    public static ChecksumAlgorithm fromFileExtension(String fileName) {
        if (fileName == null) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (ChecksumAlgorithm algorithm : values()) {
            if (extension.equals(algorithm.fileExtension)) {
                return algorithm;
            }
        }
        return null;
    }

    private static String compact(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isLetterOrDigit(ch)) {
                sb.append(Character.toUpperCase(ch));
            }
        }
        return sb.toString();
    }
}
