package org.dataone.hashcheck.testdata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/*
 * This class returns the test data file contents and their expected hex digest values
 *
 * Notes:
 * - Keys of each digest map are the algorithm names accepted by ChecksumAlgorithm.fromName
 * - "hello" and "world" are the contents of the a.txt/b.txt fixture pair
 */
public class TestDataHarness {
        public Map<String, Map<String, String>> contentData;
        public String[] contentList = {"hello", "world", "", "The quick brown fox jumps over the lazy dog"};

        public TestDataHarness() {
                Map<String, Map<String, String>> contentAndHexDigests = new HashMap<>();

                Map<String, String> values1 = new HashMap<>();
                values1.put("CRC32", "3610a686");
                values1.put("MD5", "5d41402abc4b2a76b9719d911017c592");
                values1.put("SHA-1", "aaf4c61ddcc5e8a2dabede0f3b482cd9aea9434d");
                values1.put(
                        "SHA-256", "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824"
                );
                values1.put("size", "5");
                contentAndHexDigests.put("hello", values1);

                Map<String, String> values2 = new HashMap<>();
                values2.put("CRC32", "3a771143");
                values2.put("size", "5");
                contentAndHexDigests.put("world", values2);

                Map<String, String> values3 = new HashMap<>();
                values3.put("CRC32", "00000000");
                values3.put("MD5", "d41d8cd98f00b204e9800998ecf8427e");
                values3.put("SHA-1", "da39a3ee5e6b4b0d3255bfef95601890afd80709");
                values3.put(
                        "SHA3-256", "a7ffc6f8bf1ed76651c14756a061d662f580ff4de43b49fa82d80a4b80f8434a"
                );
                values3.put(
                        "BLAKE2b-512",
                        "786a02f742015903c6c6fd852552d272912f4740e15847618a86e217f71f5419d25e1031afee585313896444934eb04b903a685b1448b755d56f701afe9be2ce"
                );
                values3.put(
                        "BLAKE2s-256", "69217a3079908094e11121d042354a7c1f55b6482ca1a51e1b250dfd1ed0eef9"
                );
                values3.put("size", "0");
                contentAndHexDigests.put("", values3);

                Map<String, String> values4 = new HashMap<>();
                values4.put("CRC32", "414fa339");
                values4.put("MD5", "9e107d9d372bb6826bd81d3542a419d6");
                values4.put("SHA-1", "2fd4e1c67a2d28fced849ee1bb76e7391b93eb12");
                values4.put("size", "43");
                contentAndHexDigests.put("The quick brown fox jumps over the lazy dog", values4);

                this.contentData = contentAndHexDigests;
        }

        /**
         * Write a file with the given text content, creating parent directories
         *
         * @param root         Directory to write below
         * @param relativePath Path of the file below root
         * @param content      File content, written as UTF-8
         * @return Path to the file
         */
        public static Path writeFile(Path root, String relativePath, String content)
                throws IOException {
                Path file = root.resolve(relativePath);
                Files.createDirectories(file.getParent());
                Files.writeString(file, content, StandardCharsets.UTF_8);
                return file;
        }

        /**
         * Write the {a.txt: "hello", b.txt: "world"} fixture pair
         *
         * @param root Directory to write into
         * @return Relative path to file, in name order
         */
        public static Map<String, Path> writeHelloWorld(Path root) throws IOException {
                Map<String, Path> files = new LinkedHashMap<>();
                files.put("a.txt", writeFile(root, "a.txt", "hello"));
                files.put("b.txt", writeFile(root, "b.txt", "world"));
                return files;
        }

        /**
         * Write a directory of numbered files, "file-0.txt" to "file-[count - 1].txt", each with
         * distinct content
         *
         * @param root  Directory to write into
         * @param count Number of files
         * @return Directory written to
         */
        public static Path writeNumberedFiles(Path root, int count) throws IOException {
                for (int i = 0; i < count; i++) {
                        String sub = i % 2 == 0 ? "even/" : "odd/";
                        writeFile(root, sub + "file-" + i + ".txt", "content of file " + i);
                }
                return root;
        }

        /**
         * Build a chain of nested directories whose absolute path is longer than the platform
         * allows, with a file at the bottom. The chain is created one level at a time from
         * inside the previous level, so only the shell can make it.
         *
         * @param root Directory to create the chain in
         * @return Top directory of the chain, or null if it could not be created here
         */
        public static Path createOverlongDirectoryChain(Path root) throws IOException,
                InterruptedException {
                String name = "d".repeat(250);
                String script = "for i in $(seq 1 20); do mkdir " + name + " && cd " + name
                        + " || exit 1; done; echo deep > deep.txt";
                if (runShell(root, script) != 0) {
                        return null;
                }
                return root.resolve(name);
        }

        /**
         * Delete a tree with the shell, which also removes paths too long for java.nio
         *
         * @param directory Tree to remove
         */
        public static void deleteTree(Path directory) throws IOException, InterruptedException {
                runShell(directory.getParent(), "rm -rf '" + directory.getFileName() + "'");
        }

        /**
         * Create a named pipe, which exists but cannot be digested as a file
         *
         * @param path Path of the pipe
         * @return Whether the pipe was created
         */
        public static boolean createNamedPipe(Path path) throws IOException, InterruptedException {
                return runShell(path.getParent(), "mkfifo '" + path.getFileName() + "'") == 0;
        }

        private static int runShell(Path workingDirectory, String script) throws IOException,
                InterruptedException {
                Process process;
                try {
                        process = new ProcessBuilder("sh", "-c", script).directory(
                                workingDirectory.toFile()).inheritIO().start();
                } catch (IOException ioe) {
                        // No shell on this platform
                        return -1;
                }
                return process.waitFor();
        }
}
