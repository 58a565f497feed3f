package org.dataone.hashcheck.manifest;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.HashCheckUtility;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;

/**
 * ManifestCodec reads and writes the checksum-list (SFV) text format:
 *
 * <pre>
 * ; comment
 * path/to/file.txt 3610a686
 * </pre>
 *
 * Entry lines are split on the last occurrence of the delimiter, so paths may contain the
 * delimiter. With a whitespace delimiter the split is on the last run of any whitespace, so
 * space and tab separated lines both decode. A line that cannot be decoded is reported as a
 * {@link MalformedEntry} and the rest of the text is still parsed.
 */
public class ManifestCodec {
    private static final Log logCodec = LogFactory.getLog(ManifestCodec.class);

    public static final String DEFAULT_COMMENT_MARKER = ";";
    public static final String SPACE = " ";
    public static final String TAB = "\t";
    private static final String NEWLINE = "\n";

    /**
     * Characters that end a manifest line. Paths and comments must not contain them.
     */
    public static final Pattern LINE_BREAKS = Pattern.compile("[\r\n]");

    private final String commentMarker;

    public ManifestCodec() {
        this(DEFAULT_COMMENT_MARKER);
    }

    /**
     * @param commentMarker Prefix identifying comment lines (after leading whitespace)
     */
    public ManifestCodec(String commentMarker) {
        HashCheckUtility.checkForEmptyString(
            commentMarker, "commentMarker", "ManifestCodec - constructor");
        this.commentMarker = commentMarker;
    }

    public String getCommentMarker() {
        return commentMarker;
    }

    /**
     * Translate a delimiter option into the delimiter string. "space" and "tab" (any case) name
     * the whitespace delimiters; anything else is taken literally.
     *
     * @param option Delimiter option
     * @return Delimiter string
     */
    public static String resolveDelimiter(String option) {
        if (option == null || option.isEmpty() || option.equalsIgnoreCase("space")) {
            return SPACE;
        }
        if (option.equalsIgnoreCase("tab")) {
            return TAB;
        }
        return option;
    }

    /**
     * Parse manifest text, inferring each entry's algorithm from its digest length.
     *
     * @param text      Manifest text
     * @param delimiter Delimiter between path and digest
     * @return Parsed manifest and warnings
     */
    public ManifestParseResult parse(String text, String delimiter) {
        return parse(text, delimiter, null, null);
    }

    /**
     * Parse manifest text.
     *
     * @param text          Manifest text
     * @param delimiter     Delimiter between path and digest
     * @param algorithm     Algorithm of the digests, or null to infer it from digest length
     * @param baseDirectory Directory relative entries resolve against, may be null
     * @return Parsed manifest and warnings
     */
    public ManifestParseResult parse(
        String text, String delimiter, ChecksumAlgorithm algorithm, Path baseDirectory) {
        HashCheckUtility.ensureNotNull(text, "text", "parse");
        checkDelimiter(delimiter, "parse");

        List<ManifestLine> lines = new ArrayList<>();
        List<MalformedEntry> warnings = new ArrayList<>();
        ChecksumAlgorithm manifestAlgorithm = algorithm;

        int lineNumber = 0;
        Iterator<String> iterator = text.lines().iterator();
        while (iterator.hasNext()) {
            String line = iterator.next();
            lineNumber++;
            if (lineNumber == 1 && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.stripLeading().startsWith(commentMarker)) {
                lines.add(ManifestLine.comment(line));
                continue;
            }

            String content = line.stripTrailing();
            int delimiterIndex;
            int delimiterLength;
            if (delimiter.isBlank()) {
                delimiterIndex = lastWhitespace(content);
                delimiterLength = 1;
            } else {
                delimiterIndex = content.lastIndexOf(delimiter);
                delimiterLength = delimiter.length();
            }
            if (delimiterIndex < 0) {
                warnings.add(malformed(lineNumber, line, "delimiter not found"));
                continue;
            }
            String path = content.substring(0, delimiterIndex);
            if (delimiter.isBlank()) {
                // Runs of whitespace between path and digest
                path = path.stripTrailing();
            }
            String digest = content.substring(delimiterIndex + delimiterLength).strip();
            if (path.isEmpty()) {
                warnings.add(malformed(lineNumber, line, "empty path"));
                continue;
            }
            if (digest.isEmpty()) {
                warnings.add(malformed(lineNumber, line, "empty digest"));
                continue;
            }
            if (!isHex(digest)) {
                warnings.add(malformed(lineNumber, line, "digest is not hexadecimal"));
                continue;
            }

            ChecksumAlgorithm entryAlgorithm = algorithm;
            if (entryAlgorithm == null) {
                entryAlgorithm = ChecksumAlgorithm.fromDigestLength(digest.length());
                if (entryAlgorithm == null) {
                    warnings.add(malformed(
                        lineNumber, line,
                        "digest length " + digest.length() + " matches no known algorithm"));
                    continue;
                }
            }
            if (manifestAlgorithm == null) {
                manifestAlgorithm = entryAlgorithm;
            }
            lines.add(ManifestLine.entry(new FileEntry(path, digest, entryAlgorithm)));
        }

        Manifest manifest = new Manifest(manifestAlgorithm, delimiter, baseDirectory, lines);
        logCodec.debug(
            "Parsed manifest with " + manifest.entryCount() + " entries and " + warnings.size()
                + " malformed lines.");
        return new ManifestParseResult(manifest, warnings);
    }

    /**
     * Serialize a manifest with paths relative to its base directory.
     *
     * @param manifest Manifest to write
     * @return Manifest text
     */
    public String serialize(Manifest manifest) {
        return serialize(manifest, PathStyle.RELATIVE);
    }

    /**
     * Serialize a manifest, one line per comment or entry, in manifest order.
     *
     * @param manifest  Manifest to write
     * @param pathStyle How entry paths are rendered
     * @return Manifest text
     * @throws IllegalArgumentException If a path or comment contains a line break
     */
    public String serialize(Manifest manifest, PathStyle pathStyle) {
        HashCheckUtility.ensureNotNull(manifest, "manifest", "serialize");
        HashCheckUtility.ensureNotNull(pathStyle, "pathStyle", "serialize");
        checkDelimiter(manifest.getDelimiter(), "serialize");

        StringBuilder sb = new StringBuilder();
        for (ManifestLine line : manifest.getLines()) {
            if (line.isComment()) {
                checkSingleLine(line.comment(), "comment");
                sb.append(line.comment());
            } else {
                FileEntry entry = line.entry();
                checkSingleLine(entry.getPath(), "entry path");
                sb.append(renderPath(entry, pathStyle, manifest.getBaseDirectory()))
                    .append(manifest.getDelimiter()).append(entry.getDigest());
            }
            sb.append(NEWLINE);
        }
        return sb.toString();
    }

    /**
     * Render an entry path in the requested style.
     *
     * @param entry         Entry to render
     * @param pathStyle     Relative or absolute
     * @param baseDirectory Manifest base directory, may be null
     * @return Path text
     */
    public static String renderPath(FileEntry entry, PathStyle pathStyle, Path baseDirectory) {
        String entryPath = entry.getPath();
        if (baseDirectory == null) {
            return entryPath;
        }
        Path path = Paths.get(entryPath);
        if (pathStyle == PathStyle.ABSOLUTE) {
            if (path.isAbsolute()) {
                return entryPath;
            }
            return baseDirectory.toAbsolutePath().resolve(path).normalize().toString();
        }
        if (!path.isAbsolute()) {
            return entryPath;
        }
        try {
            return HashCheckUtility.relativePathString(
                baseDirectory.toAbsolutePath().normalize(), path.normalize());
        } catch (IllegalArgumentException iae) {
            // Different root, cannot be expressed relative to the base
            return entryPath;
        }
    }

    private void checkDelimiter(String delimiter, String method) {
        HashCheckUtility.checkForEmptyString(delimiter, "delimiter", method);
        if (delimiter.contains("\n") || delimiter.contains("\r")) {
            String errMsg = "Calling Method: " + method + "(): delimiter cannot contain newlines.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * @return Whether text contains a carriage return or line feed
     */
    public static boolean hasLineBreak(String text) {
        return LINE_BREAKS.matcher(text).find();
    }

    private static void checkSingleLine(String text, String argument) {
        if (hasLineBreak(text)) {
            String errMsg = "Calling Method: serialize(): " + argument
                + " cannot contain line breaks: " + text.replace("\n", "\\n")
                .replace("\r", "\\r");
            logCodec.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
    }

    private static int lastWhitespace(String content) {
        for (int i = content.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(content.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static MalformedEntry malformed(int lineNumber, String line, String reason) {
        logCodec.warn("Invalid manifest line " + lineNumber + " (" + reason + "): " + line);
        return new MalformedEntry(lineNumber, line, reason);
    }

    private static boolean isHex(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
