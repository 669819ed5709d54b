package com.hashhunt.digest;

/**
 * Hashes candidates and tests them against the target set.
 *
 * One matcher per worker: it owns a {@link DigestFunction} (which may hold a
 * non thread-safe MessageDigest) while sharing the read-only {@link TargetSet}.
 */
public final class DigestMatcher {

    private final DigestFunction function;
    private final TargetSet targets;

    public DigestMatcher(DigestFunction function, TargetSet targets) {
        this.function = function;
        this.targets = targets;
    }

    /**
     * @return lower-case hex digest of the candidate
     */
    public String digest(String candidate) {
        return function.digest(candidate);
    }

    /**
     * Pure set membership.
     */
    public boolean isMatch(String hexDigest) {
        return targets.contains(hexDigest);
    }
}
