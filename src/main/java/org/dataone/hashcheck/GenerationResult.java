package org.dataone.hashcheck;

import java.util.List;

import org.dataone.hashcheck.manifest.Manifest;

/**
 * Result of a generation task.
 *
 * @param manifest     Manifest of every file that was digested
 * @param errors       Files that could not be digested, excluded from the manifest body
 * @param verification Verification of the new manifest, or null unless verify-after-generation
 *                     was requested
 */
public record GenerationResult(
    Manifest manifest, List<EntryError> errors, VerificationResult verification) {

    public GenerationResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
