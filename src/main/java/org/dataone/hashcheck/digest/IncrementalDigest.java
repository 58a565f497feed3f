package org.dataone.hashcheck.digest;

import javax.xml.bind.DatatypeConverter;

/**
 * A digest accumulator fed chunk by chunk. Instances are single-use and must not be shared
 * between threads.
 */
public interface IncrementalDigest {

    /**
     * Feed the next chunk of data.
     *
     * @param buffer Data buffer
     * @param offset Start of the chunk in the buffer
     * @param length Number of bytes in the chunk
     */
    void update(byte[] buffer, int offset, int length);

    /**
     * Complete the computation.
     *
     * @return Digest bytes
     */
    byte[] digest();

    /**
     * Complete the computation and render it as lowercase hex.
     *
     * @return Hex digest
     */
    default String hexDigest() {
        return DatatypeConverter.printHexBinary(digest()).toLowerCase();
    }
}
