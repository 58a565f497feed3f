package org.dataone.hashcheck.exceptions;

/**
 * An exception thrown when a requested checksum algorithm is unknown or has no digest
 * implementation registered.
 */

public class UnsupportedHashAlgorithmException extends IllegalArgumentException {

    public UnsupportedHashAlgorithmException(String message) {
        super(message);
    }

}
