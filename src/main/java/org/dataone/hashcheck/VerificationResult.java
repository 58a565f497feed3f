package org.dataone.hashcheck;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.manifest.MalformedEntry;

/**
 * VerificationResult holds the classification of every entry of a verified manifest, in
 * manifest order, along with per-status counts and any malformed-line warnings from parsing.
 * Instances are immutable.
 */
public class VerificationResult {
    private final Path manifestPath;
    private final ChecksumAlgorithm algorithm;
    private final List<EntryVerification> entries;
    private final List<MalformedEntry> warnings;
    private final Map<EntryStatus, Integer> counts;

    /**
     * @param manifestPath Manifest file that was verified, null for an in-memory manifest
     * @param algorithm    Manifest algorithm
     * @param entries      Per-entry results in manifest order
     * @param warnings     Malformed lines found while parsing the manifest
     */
    public VerificationResult(
        Path manifestPath, ChecksumAlgorithm algorithm, List<EntryVerification> entries,
        List<MalformedEntry> warnings) {
        HashCheckUtility.ensureNotNull(entries, "entries", "VerificationResult - constructor");
        HashCheckUtility.ensureNotNull(warnings, "warnings", "VerificationResult - constructor");
        this.manifestPath = manifestPath;
        this.algorithm = algorithm;
        this.entries = List.copyOf(entries);
        this.warnings = List.copyOf(warnings);

        Map<EntryStatus, Integer> statusCounts = new EnumMap<>(EntryStatus.class);
        for (EntryStatus status : EntryStatus.values()) {
            statusCounts.put(status, 0);
        }
        for (EntryVerification entry : entries) {
            statusCounts.merge(entry.status(), 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableMap(statusCounts);
    }

    public Path getManifestPath() {
        return manifestPath;
    }

    public ChecksumAlgorithm getAlgorithm() {
        return algorithm;
    }

    public List<EntryVerification> getEntries() {
        return entries;
    }

    public List<MalformedEntry> getWarnings() {
        return warnings;
    }

    public Map<EntryStatus, Integer> getCounts() {
        return counts;
    }

    public int count(EntryStatus status) {
        return counts.get(status);
    }

    public int total() {
        return entries.size();
    }

    /**
     * @return True when every entry verified OK (malformed lines are not entries)
     */
    public boolean isAllOk() {
        return count(EntryStatus.OK) == entries.size();
    }

    public List<EntryVerification> withStatus(EntryStatus status) {
        List<EntryVerification> matching = new ArrayList<>();
        for (EntryVerification entry : entries) {
            if (entry.status() == status) {
                matching.add(entry);
            }
        }
        return matching;
    }

    /**
     * @return Every per-entry error (MISSING and ERROR entries with details)
     */
    public List<EntryError> getErrors() {
        List<EntryError> errors = new ArrayList<>();
        for (EntryVerification entry : entries) {
            if (entry.error() != null) {
                errors.add(entry.error());
            }
        }
        return errors;
    }

    /**
     * @return Entry path to status, in manifest order
     */
    public Map<String, EntryStatus> statusByPath() {
        Map<String, EntryStatus> byPath = new LinkedHashMap<>();
        for (EntryVerification entry : entries) {
            byPath.put(entry.entry().getPath(), entry.status());
        }
        return byPath;
    }

    @Override
    public String toString() {
        return "VerificationResult{total=" + total() + ", counts=" + counts + ", warnings="
            + warnings.size() + "}";
    }
}
