package com.hashhunt.config;

import com.hashhunt.digest.HashAlgorithm;
import com.hashhunt.digest.TargetSet;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;

/**
 * Parsed content of a target file: settings from its header lines plus the
 * normalized target digests.
 *
 * Digest format is not checked at load time, since a command line algorithm
 * may replace the file's. {@link #getTargets()} checks it against the file's
 * own algorithm.
 */
public final class TargetFile {

    private final Path path;
    private final CharsetPreset charset;
    private final HashAlgorithm algorithm;
    private final boolean algorithmDeclared;
    private final int length;
    private final Set<String> digests;

    TargetFile(Path path, CharsetPreset charset, HashAlgorithm algorithm, boolean algorithmDeclared,
               int length, Set<String> digests) {
        this.path = path;
        this.charset = charset;
        this.algorithm = algorithm;
        this.algorithmDeclared = algorithmDeclared;
        this.length = length;
        this.digests = Collections.unmodifiableSet(digests);
    }

    /**
     * @return the digests validated against {@link #getAlgorithm()}
     * @throws ConfigurationException if a digest does not fit that algorithm
     */
    public TargetSet getTargets() {
        return TargetSet.of(digests, algorithm);
    }

    // ==================== Getters ====================

    public Path getPath() {
        return path;
    }

    public CharsetPreset getCharset() {
        return charset;
    }

    /**
     * @return the {@code #algorithm:} header value, or the default when absent
     */
    public HashAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return true if the file has an {@code #algorithm:} header
     */
    public boolean isAlgorithmDeclared() {
        return algorithmDeclared;
    }

    public int getLength() {
        return length;
    }

    /**
     * @return trimmed, lower-cased digests in file order, duplicates collapsed
     */
    public Set<String> getDigests() {
        return digests;
    }

    @Override
    public String toString() {
        return String.format("TargetFile[%s: charset=%d, algorithm=%s%s, length=%d, targets=%d]",
                             path, charset.getId(), algorithm, algorithmDeclared ? "" : " (default)",
                             length, digests.size());
    }
}
