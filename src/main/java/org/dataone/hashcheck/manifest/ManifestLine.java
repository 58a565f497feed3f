package org.dataone.hashcheck.manifest;

/**
 * One retained line of a manifest: either a verbatim comment or a file entry.
 */
public record ManifestLine(String comment, FileEntry entry) {

    public static ManifestLine comment(String text) {
        return new ManifestLine(text, null);
    }

    public static ManifestLine entry(FileEntry entry) {
        return new ManifestLine(null, entry);
    }

    public boolean isComment() {
        return entry == null;
    }
}
