package org.dataone.hashcheck;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * HashCheckUtility is a utility class that encapsulates generic or shared functionality
 * in FileHashCheck and/or related classes.
 */
public class HashCheckUtility {

    private static final Log log = LogFactory.getLog(HashCheckUtility.class);

    /**
     * Checks whether a given object is null and throws an exception if so
     *
     * @param object   Object to check
     * @param argument Value that is being checked
     * @param method   Calling method or class
     * @throws IllegalArgumentException If the object is null
     */
    public static void ensureNotNull(Object object, String argument, String method)
        throws IllegalArgumentException {
        if (object == null) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be null.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Checks whether a given string is null or empty, and throws an exception if so
     *
     * @param string   String to check
     * @param argument Value that is being checked
     * @param method   Calling method
     * @throws IllegalArgumentException If the string is null or empty
     */
    public static void checkForEmptyString(String string, String argument, String method)
        throws IllegalArgumentException {
        ensureNotNull(string, argument, method);
        if (string.isEmpty()) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be empty.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Checks whether a given long integer is negative or zero
     *
     * @param longInt  Object to check
     * @param argument Value that is being checked
     * @param method   Calling method
     * @throws IllegalArgumentException If longInt is less than or equal to 0
     */
    public static void checkPositive(long longInt, String argument, String method)
        throws IllegalArgumentException {
        if (longInt <= 0) {
            String errMsg = "Calling Method: " + method + "(): " + argument
                + " cannot be less than or equal to 0.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Receives the paths a directory walk could not read.
     */
    @FunctionalInterface
    public interface WalkFailureHandler {
        void walkFailed(Path path, IOException ioe);
    }

    /**
     * Walks a directory and returns its regular files, sorted lexicographically by path so that
     * repeated walks over an unchanged tree return the same order. A directory that is itself a
     * symbolic link is walked through its target, and the files found are returned under the
     * given directory. Entries that cannot be read, and broken links, are passed to the failure
     * handler and the walk continues with the rest of the tree.
     *
     * @param directory Directory to walk
     * @param onFailure Handler for paths that could not be read
     * @return List<Path> of files
     * @throws IOException If I/O occurs when accessing the directory itself
     */
    public static List<Path> getFilesFromDir(Path directory, WalkFailureHandler onFailure)
        throws IOException {
        ensureNotNull(onFailure, "onFailure", "getFilesFromDir");
        List<Path> filePaths = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return filePaths;
        }
        Path realRoot = directory.toRealPath();
        Files.walkFileTree(realRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path rerooted = directory.resolve(realRoot.relativize(file));
                if (attrs.isRegularFile() || Files.isRegularFile(file)) {
                    filePaths.add(rerooted);
                } else if (attrs.isSymbolicLink() && !Files.exists(file)) {
                    onFailure.walkFailed(
                        rerooted,
                        new NoSuchFileException(rerooted.toString(), null, "broken symbolic link"));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException ioe) {
                log.debug("Unable to read: " + file + ". IOException: " + ioe.getMessage());
                onFailure.walkFailed(directory.resolve(realRoot.relativize(file)), ioe);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException ioe) {
                if (ioe != null) {
                    log.debug("Unable to list: " + dir + ". IOException: " + ioe.getMessage());
                    onFailure.walkFailed(directory.resolve(realRoot.relativize(dir)), ioe);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(filePaths);
        return filePaths;
    }

    /**
     * Renders a path relative to a root with '/' as the separator, regardless of platform.
     *
     * @param root Root directory
     * @param path Path under root
     * @return Relative path string
     */
    public static String relativePathString(Path root, Path path) {
        String relative = root.relativize(path).toString();
        if (File.separatorChar != '/') {
            relative = relative.replace(File.separatorChar, '/');
        }
        return relative;
    }

    /**
     * Finds the deepest directory that contains every given file.
     *
     * @param files Absolute file paths
     * @return Common parent directory, or null if the files share no root
     */
    public static Path commonParentDirectory(Collection<Path> files) {
        Path common = null;
        for (Path file : files) {
            Path parent = file.toAbsolutePath().normalize().getParent();
            if (parent == null) {
                continue;
            }
            if (common == null) {
                common = parent;
                continue;
            }
            while (common != null && !parent.startsWith(common)) {
                common = common.getParent();
            }
            if (common == null) {
                return null;
            }
        }
        return common;
    }

    /**
     * Creates an empty/temporary file in a given location. If this file is not moved, it will
     * be deleted upon JVM gracefully exiting or shutting down.
     *
     * @param prefix    string to prepend before tmp file
     * @param directory location to create tmp file
     * @return Temporary file ready to write into
     * @throws IOException       Issues with generating tmpFile
     * @throws SecurityException Insufficient permissions to create tmpFile
     */
    public static File generateTmpFile(String prefix, Path directory) throws IOException,
        SecurityException {
        Random rand = new Random();
        int randomNumber = rand.nextInt(1000000);
        String newPrefix = prefix + "-" + System.currentTimeMillis() + randomNumber;

        Path newPath = Files.createTempFile(directory, newPrefix, null);
        File newFile = newPath.toFile();
        newFile.deleteOnExit();
        return newFile;
    }

    /**
     * Delete a temporary file that was not moved into place, logging instead of throwing.
     *
     * @param tmpFile File to remove
     */
    public static void deleteTmpFile(File tmpFile) {
        if (tmpFile != null && tmpFile.exists()) {
            try {
                Files.delete(tmpFile.toPath());
            } catch (IOException ioe) {
                String warnMsg = "Attempted to delete tmp file: " + tmpFile + " but failed."
                    + " Additional Details: " + ioe.getMessage();
                log.warn(warnMsg);
            }
        }
    }
}
