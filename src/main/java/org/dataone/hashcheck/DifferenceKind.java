package org.dataone.hashcheck;

/**
 * Kind of a single difference found when comparing two paths.
 */
public enum DifferenceKind {
    ONLY_IN_A, ONLY_IN_B, CONTENT_DIFFERS, UNREADABLE;

    /**
     * @return The kind seen from the other side of the comparison
     */
    public DifferenceKind mirrored() {
        switch (this) {
            case ONLY_IN_A:
                return ONLY_IN_B;
            case ONLY_IN_B:
                return ONLY_IN_A;
            default:
                return this;
        }
    }
}
