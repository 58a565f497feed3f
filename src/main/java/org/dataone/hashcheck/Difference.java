package org.dataone.hashcheck;

/**
 * One difference between two compared paths.
 *
 * @param relativePath Path relative to both roots with '/' separators, empty when two files were
 *                     compared directly
 * @param kind         Kind of difference
 * @param sizeA        Size on side A, -1 when absent or unknown
 * @param sizeB        Size on side B, -1 when absent or unknown
 * @param digestA      Digest on side A, null when not computed
 * @param digestB      Digest on side B, null when not computed
 * @param message      Failure details for UNREADABLE, null otherwise
 */
public record Difference(
    String relativePath, DifferenceKind kind, long sizeA, long sizeB, String digestA,
    String digestB, String message) {

    public static Difference onlyInA(String relativePath, long size) {
        return new Difference(relativePath, DifferenceKind.ONLY_IN_A, size, -1, null, null, null);
    }

    public static Difference onlyInB(String relativePath, long size) {
        return new Difference(relativePath, DifferenceKind.ONLY_IN_B, -1, size, null, null, null);
    }

    /**
     * @return The same difference with sides A and B exchanged
     */
    public Difference swap() {
        return new Difference(
            relativePath, kind.mirrored(), sizeB, sizeA, digestB, digestA, message);
    }

    @Override
    public String toString() {
        String label = relativePath.isEmpty() ? "(file)" : relativePath;
        switch (kind) {
            case ONLY_IN_A:
                return "Only in A: " + label;
            case ONLY_IN_B:
                return "Only in B: " + label;
            case UNREADABLE:
                return "Unreadable: " + label + " (" + message + ")";
            default:
                return "Content differs: " + label + " (size " + sizeA + " vs " + sizeB + ")";
        }
    }
}
