package com.hashhunt.digest;

import com.hashhunt.config.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable set of normalized (trimmed, lower-case hex) target digests.
 *
 * Read-only after construction, so workers test membership concurrently
 * without synchronization.
 */
public final class TargetSet {

    private static final Pattern HEX = Pattern.compile("[0-9a-f]+");

    private final Set<String> digests;

    private TargetSet(Set<String> digests) {
        this.digests = Collections.unmodifiableSet(digests);
    }

    /**
     * Normalizes digests without checking their format.
     * Used for synthetic digest functions; prefer {@link #of(Collection, HashAlgorithm)}.
     *
     * @param digests raw digests
     * @return the target set (duplicates collapse)
     * @throws ConfigurationException if the collection is null or empty, or holds a blank entry
     */
    public static TargetSet of(Collection<String> digests) {
        if (digests == null || digests.isEmpty()) {
            throw new ConfigurationException("Target set cannot be empty");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String digest : digests) {
            if (digest == null || digest.isBlank()) {
                throw new ConfigurationException("Target digest cannot be blank");
            }
            normalized.add(normalize(digest));
        }
        return new TargetSet(normalized);
    }

    /**
     * Normalizes and validates digests against the algorithm's hex length.
     *
     * @throws ConfigurationException on a malformed digest
     */
    public static TargetSet of(Collection<String> digests, HashAlgorithm algorithm) {
        TargetSet targets = of(digests);
        for (String digest : targets.digests) {
            if (digest.length() != algorithm.getHexLength() || !HEX.matcher(digest).matches()) {
                throw new ConfigurationException(String.format(
                    "Invalid %s digest (must be %d hex characters): %s",
                    algorithm.getDisplayName(), algorithm.getHexLength(), digest));
            }
        }
        return targets;
    }

    public static String normalize(String digest) {
        return digest.trim().toLowerCase(Locale.ROOT);
    }

    public boolean contains(String digest) {
        return digests.contains(digest);
    }

    public int size() {
        return digests.size();
    }

    /**
     * @return unmodifiable view, in insertion order
     */
    public Set<String> asSet() {
        return digests;
    }

    @Override
    public String toString() {
        return "TargetSet[" + digests.size() + " digests]";
    }
}
