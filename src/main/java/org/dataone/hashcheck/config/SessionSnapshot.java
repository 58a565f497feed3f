package org.dataone.hashcheck.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.HashCheckUtility;

/**
 * A saved file selection and the last manifest used with it. A restored snapshot can be passed
 * to generation (its files) or verification (its manifest) unchanged.
 *
 * @param files            Selected file and directory paths, in selection order
 * @param lastManifestPath Last manifest file, may be null
 */
public record SessionSnapshot(
    @JsonProperty("files") List<String> files,
    @JsonProperty("last_manifest_path") String lastManifestPath) {

    private static final Log logSession = LogFactory.getLog(SessionSnapshot.class);
    private static final ObjectMapper MAPPER =
        new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SessionSnapshot {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * @param paths        Selected paths
     * @param manifestPath Last manifest, may be null
     * @return Snapshot of the selection
     */
    public static SessionSnapshot of(List<Path> paths, Path manifestPath) {
        HashCheckUtility.ensureNotNull(paths, "paths", "SessionSnapshot.of");
        List<String> files = new ArrayList<>(paths.size());
        for (Path path : paths) {
            files.add(path.toString());
        }
        return new SessionSnapshot(
            files, manifestPath == null ? null : manifestPath.toString());
    }

    @JsonIgnore
    public List<Path> filePaths() {
        List<Path> paths = new ArrayList<>(files.size());
        for (String file : files) {
            paths.add(Paths.get(file));
        }
        return paths;
    }

    @JsonIgnore
    public Path manifestPath() {
        return lastManifestPath == null ? null : Paths.get(lastManifestPath);
    }

    /**
     * @param sessionFile JSON file to write
     * @throws IOException Unable to write the file
     */
    public void save(Path sessionFile) throws IOException {
        HashCheckUtility.ensureNotNull(sessionFile, "sessionFile", "save");
        try {
            Files.writeString(sessionFile, MAPPER.writeValueAsString(this));
        } catch (IOException ioe) {
            logSession.error(
                "Unable to save session to: " + sessionFile + ". IOException: "
                    + ioe.getMessage());
            throw ioe;
        }
        logSession.debug("Session saved to: " + sessionFile);
    }

    /**
     * @param sessionFile JSON file written by {@link #save(Path)}
     * @return Restored snapshot
     * @throws IOException Unable to read or parse the file
     */
    public static SessionSnapshot load(Path sessionFile) throws IOException {
        HashCheckUtility.ensureNotNull(sessionFile, "sessionFile", "load");
        try {
            return MAPPER.readValue(sessionFile.toFile(), SessionSnapshot.class);
        } catch (IOException ioe) {
            logSession.error(
                "Unable to load session from: " + sessionFile + ". IOException: "
                    + ioe.getMessage());
            throw ioe;
        }
    }
}
