package org.dataone.hashcheck.exceptions;

import java.io.IOException;

/**
 * Custom exception class for HashCheckFactory when it's unable to initialize an engine
 * (like when the implementation class or its configuration is unavailable).
 */
public class HashCheckFactoryException extends IOException {
    public HashCheckFactoryException(String message) {
        super(message);
    }

}
