package com.hashhunt.config;

import com.hashhunt.digest.HashAlgorithm;
import com.hashhunt.digest.TargetSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads target digests and search settings from a text file.
 *
 * Format:
 *   #charset:3
 *   #algorithm:SHA-256
 *   #length:5
 *   # any other line starting with '#' is a comment
 *   5d41402abc4b2a76b9719d911017c592
 *   ...
 *
 * Missing header lines keep their defaults (charset 1, MD5, length 4).
 * Header lines may appear anywhere. Digests are only normalized here: their
 * format is checked once the final algorithm is known.
 */
public class TargetFileLoader {

    private static final Logger log = LoggerFactory.getLogger(TargetFileLoader.class);

    private static final String CHARSET_KEY = "#charset:";
    private static final String ALGORITHM_KEY = "#algorithm:";
    private static final String LENGTH_KEY = "#length:";

    public static final int DEFAULT_CHARSET_ID = 1;
    public static final HashAlgorithm DEFAULT_ALGORITHM = HashAlgorithm.MD5;
    public static final int DEFAULT_LENGTH = 4;

    /**
     * @param path target file
     * @return parsed file content
     * @throws ConfigurationException if the file is missing, unreadable, has a
     *         malformed header, or holds no digest
     */
    public TargetFile load(Path path) {
        int charsetId = DEFAULT_CHARSET_ID;
        HashAlgorithm algorithm = DEFAULT_ALGORITHM;
        boolean algorithmDeclared = false;
        int length = DEFAULT_LENGTH;
        Set<String> digests = new LinkedHashSet<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.startsWith(CHARSET_KEY)) {
                    charsetId = parseInt(line.substring(CHARSET_KEY.length()), "charset", lineNumber);
                } else if (line.startsWith(ALGORITHM_KEY)) {
                    algorithm = HashAlgorithm.fromName(line.substring(ALGORITHM_KEY.length()));
                    algorithmDeclared = true;
                } else if (line.startsWith(LENGTH_KEY)) {
                    length = parseInt(line.substring(LENGTH_KEY.length()), "length", lineNumber);
                } else if (!line.startsWith("#") && !line.isBlank()) {
                    digests.add(TargetSet.normalize(line));
                }
            }
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Target file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read target file " + path + ": " + e.getMessage(), e);
        }

        if (digests.isEmpty()) {
            throw new ConfigurationException("Target file contains no digests: " + path);
        }

        TargetFile file = new TargetFile(path, CharsetPreset.fromId(charsetId), algorithm, algorithmDeclared,
                                         length, digests);
        log.info("Loaded {}", file);
        return file;
    }

    private static int parseInt(String value, String key, int lineNumber) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(String.format(
                "Line %d: #%s expects an integer (got: '%s')", lineNumber, key, value.trim()), e);
        }
    }
}
