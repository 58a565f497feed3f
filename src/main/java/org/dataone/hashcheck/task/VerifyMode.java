package org.dataone.hashcheck.task;

/**
 * How manifest entries are checked against disk.
 */
public enum VerifyMode {
    /** Entries that record a size are classified MISMATCH without digesting when sizes differ. */
    QUICK,
    /** Always compute the full digest. */
    FULL
}
