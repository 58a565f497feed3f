package org.dataone.hashcheck.manifest;

import java.util.List;

/**
 * Outcome of parsing manifest text: the manifest built from every decodable line plus a warning
 * for each line that was rejected.
 */
public record ManifestParseResult(Manifest manifest, List<MalformedEntry> warnings) {

    public ManifestParseResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
