package org.dataone.hashcheck.report;

import java.util.Locale;

/**
 * File formats a verification report can be saved in.
 */
public enum ReportFormat {
    TXT("txt"), CSV("csv");

    final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * @param name "txt" or "csv", any case
     * @return Matching format
     * @throws IllegalArgumentException Unknown format
     */
    public static ReportFormat fromName(String name) {
        for (ReportFormat format : values()) {
            if (format.extension.equals(name.trim().toLowerCase(Locale.ROOT))) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + name);
    }

    /**
     * @param fileName Report file name
     * @return CSV for a ".csv" name, TXT otherwise
     */
    public static ReportFormat fromFileName(String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".csv") ? CSV : TXT;
    }
}
