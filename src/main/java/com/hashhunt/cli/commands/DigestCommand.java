package com.hashhunt.cli.commands;

import com.hashhunt.cli.HashhuntCli;
import com.hashhunt.config.ConfigurationException;
import com.hashhunt.digest.HashAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Computes digests of a string or of files, timing each one.
 *
 * Handy to produce target digests, and to compare how fast each algorithm
 * hashes inputs of different sizes (every input is hashed {@code --repeat}
 * times and the average is printed).
 *
 * Example:
 *   hashhunt digest -a SHA-256 --text 1234
 *   hashhunt digest -a MD5 -r 3 file_1MB.txt file_2MB.txt
 */
@Command(name = "digest", description = "Compute the digest of a string or of files")
public class DigestCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DigestCommand.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    @Option(
        names = {"-a", "--algorithm"},
        description = "Hash algorithm: MD5, SHA-1, SHA-256 (default: ${DEFAULT-VALUE})",
        defaultValue = "MD5"
    )
    String algorithm;

    @Option(
        names = {"-t", "--text"},
        description = "String to hash (UTF-8)"
    )
    String text;

    @Option(
        names = {"-r", "--repeat"},
        description = "Hash every input N times and report the average time (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    int repeat;

    @Parameters(description = "Files to hash", arity = "0..*")
    List<Path> files;

    @Override
    public Integer call() {
        HashAlgorithm resolved;
        try {
            resolved = HashAlgorithm.fromName(algorithm);
        } catch (ConfigurationException e) {
            System.err.println("ERROR: " + e.getMessage());
            return HashhuntCli.EXIT_CONFIG_ERROR;
        }
        if (repeat < 1) {
            System.err.println("ERROR: --repeat must be at least 1");
            return HashhuntCli.EXIT_CONFIG_ERROR;
        }
        if (text == null && (files == null || files.isEmpty())) {
            System.err.println("ERROR: give --text or at least one file");
            return HashhuntCli.EXIT_CONFIG_ERROR;
        }

        if (text != null) {
            long start = System.nanoTime();
            String digest = null;
            for (int i = 0; i < repeat; i++) {
                digest = resolved.digest(text);
            }
            printLine(digest, "\"" + text + "\"", (System.nanoTime() - start) / repeat);
        }

        if (files != null) {
            for (Path file : files) {
                try {
                    long start = System.nanoTime();
                    String digest = null;
                    for (int i = 0; i < repeat; i++) {
                        digest = digestFile(resolved, file);
                    }
                    printLine(digest, file.toString(), (System.nanoTime() - start) / repeat);
                } catch (IOException e) {
                    log.error("Cannot hash {}", file, e);
                    System.err.println("ERROR: cannot read " + file + ": " + e.getMessage());
                    return HashhuntCli.EXIT_FAILURE;
                }
            }
        }
        return HashhuntCli.EXIT_OK;
    }

    static String digestFile(HashAlgorithm algorithm, Path file) throws IOException {
        MessageDigest md = algorithm.newMessageDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                md.update(buffer, 0, read);
            }
        }
        return HashAlgorithm.toHex(md.digest());
    }

    private static void printLine(String digest, String name, long averageNanos) {
        System.out.printf(Locale.ROOT, "%s  %s  (avg %.3f ms)%n", digest, name, averageNanos / 1_000_000.0);
    }
}
