package org.dataone.hashcheck;

/**
 * Overall outcome of comparing two paths.
 */
public enum ComparisonVerdict {
    /** Same type and same content (byte-equal files, recursively equal trees). */
    IDENTICAL,
    /** Same type, with at least one difference. */
    DIFFERENT,
    /** One path is a file and the other a directory. */
    TYPE_MISMATCH
}
