package org.dataone.hashcheck.manifest;

/**
 * How entry paths are written when a manifest is serialized.
 */
public enum PathStyle {
    /** Relative to the manifest's base directory, '/' separated. */
    RELATIVE,
    /** Absolute, resolved against the base directory where needed. */
    ABSOLUTE
}
