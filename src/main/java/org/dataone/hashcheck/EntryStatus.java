package org.dataone.hashcheck;

/**
 * Classification of one verified manifest entry.
 */
public enum EntryStatus {
    /** Recomputed digest equals the recorded digest. */
    OK,
    /** File exists but its digest (or size, in quick mode) differs. */
    MISMATCH,
    /** File does not exist or cannot be opened. */
    MISSING,
    /** File opened but could not be read to the end. */
    ERROR
}
