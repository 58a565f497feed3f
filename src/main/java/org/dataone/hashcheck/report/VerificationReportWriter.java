package org.dataone.hashcheck.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.EntryStatus;
import org.dataone.hashcheck.EntryVerification;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.VerificationResult;
import org.dataone.hashcheck.manifest.MalformedEntry;

/**
 * Writes a verification result as a plain-text log or as CSV.
 */
public class VerificationReportWriter {
    private static final Log logReport = LogFactory.getLog(VerificationReportWriter.class);

    static final String[] CSV_HEADER = {"Filename", "Status", "Expected", "Actual"};

    /**
     * Save a report.
     *
     * @param result     Verification result
     * @param reportFile Target file, overwritten if present
     * @param format     TXT or CSV
     * @throws IOException Unable to write the report
     */
    public void write(VerificationResult result, Path reportFile, ReportFormat format)
        throws IOException {
        HashCheckUtility.ensureNotNull(result, "result", "write");
        HashCheckUtility.ensureNotNull(reportFile, "reportFile", "write");
        HashCheckUtility.ensureNotNull(format, "format", "write");

        try (BufferedWriter writer = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8)) {
            if (format == ReportFormat.CSV) {
                writeCsv(result, writer);
            } else {
                writeText(result, writer);
            }
        }
        logReport.info("Verification report written to: " + reportFile);
    }

    /**
     * @param result Verification result
     * @return Report as text, one "path: STATUS" line per entry followed by a summary
     */
    public String toText(VerificationResult result) {
        StringWriter writer = new StringWriter();
        try {
            writeText(result, writer);
        } catch (IOException ioe) {
            // StringWriter does not throw
            throw new IllegalStateException(ioe);
        }
        return writer.toString();
    }

    /**
     * @param result Verification result
     * @return Report as CSV with a "Filename,Status,Expected,Actual" header
     * @throws IOException Error from the CSV printer
     */
    public String toCsv(VerificationResult result) throws IOException {
        StringWriter writer = new StringWriter();
        writeCsv(result, writer);
        return writer.toString();
    }

    void writeText(VerificationResult result, Writer writer) throws IOException {
        for (EntryVerification entry : result.getEntries()) {
            writer.write(entry.entry().getPath() + ": " + entry.status());
            if (entry.error() != null) {
                writer.write(" (" + entry.error().message() + ")");
            }
            writer.write("\n");
        }
        for (MalformedEntry warning : result.getWarnings()) {
            writer.write(
                "Invalid line " + warning.lineNumber() + " (" + warning.reason() + "): "
                    + warning.line() + "\n");
        }
        writer.write(summary(result) + "\n");
    }

    void writeCsv(VerificationResult result, Writer writer) throws IOException {
        CSVPrinter csvPrinter =
            new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build());
        for (EntryVerification entry : result.getEntries()) {
            csvPrinter.printRecord(
                entry.entry().getPath(), entry.status(), entry.entry().getDigest(),
                entry.actualDigest() == null ? "" : entry.actualDigest());
        }
        csvPrinter.flush();
    }

    /**
     * @param result Verification result
     * @return ex. "Total: 3, OK: 1, MISMATCH: 1, MISSING: 1, ERROR: 0"
     */
    public static String summary(VerificationResult result) {
        StringBuilder sb = new StringBuilder("Total: ").append(result.total());
        for (EntryStatus status : EntryStatus.values()) {
            sb.append(", ").append(status).append(": ").append(result.count(status));
        }
        return sb.toString();
    }
}
