package com.hashhunt.config;

import com.hashhunt.digest.DigestFunctionFactory;
import com.hashhunt.digest.HashAlgorithm;
import com.hashhunt.digest.TargetSet;
import com.hashhunt.keyspace.SearchSpace;

import java.util.Objects;

/**
 * Immutable description of one search, handed to the coordinator and shared
 * read-only with every worker.
 *
 * Uses Builder pattern for validated construction.
 *
 * Example usage:
 * SearchRequest request = new SearchRequest.Builder()
 *     .charset(CharsetPreset.DIGITS)
 *     .length(4)
 *     .algorithm(HashAlgorithm.MD5)
 *     .targets(targets)
 *     .workers(4)
 *     .build();
 */
public final class SearchRequest {

    private final SearchSpace space;
    private final String charsetLabel;
    private final HashAlgorithm algorithm;
    private final DigestFunctionFactory digestFactory;
    private final TargetSet targets;
    private final int workers;

    private SearchRequest(Builder builder, SearchSpace space) {
        this.space = space;
        this.charsetLabel = builder.charsetLabel;
        this.algorithm = builder.algorithm;
        this.digestFactory = builder.digestFactory != null ? builder.digestFactory : builder.algorithm;
        this.targets = builder.targets;
        this.workers = builder.workers;
    }

    // ==================== Getters ====================

    public SearchSpace getSpace() {
        return space;
    }

    /**
     * @return preset id as a string ("1".."4") or "custom" for an explicit charset
     */
    public String getCharsetLabel() {
        return charsetLabel;
    }

    public HashAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return factory for per-worker digest functions (the algorithm itself unless overridden)
     */
    public DigestFunctionFactory getDigestFactory() {
        return digestFactory;
    }

    public TargetSet getTargets() {
        return targets;
    }

    public int getWorkers() {
        return workers;
    }

    @Override
    public String toString() {
        return "SearchRequest{" +
                "charset=" + charsetLabel +
                ", length=" + space.getLength() +
                ", algorithm=" + algorithm +
                ", targets=" + targets.size() +
                ", workers=" + workers +
                ", total=" + space.getTotal() +
                '}';
    }

    /**
     * Builder for SearchRequest. Validation happens in {@link #build()}.
     */
    public static class Builder {
        private String charset = CharsetPreset.DIGITS.getSymbols();
        private String charsetLabel = String.valueOf(CharsetPreset.DIGITS.getId());
        private int length = 4;
        private HashAlgorithm algorithm = HashAlgorithm.MD5;
        private DigestFunctionFactory digestFactory;
        private TargetSet targets;
        private int workers = Runtime.getRuntime().availableProcessors();

        /**
         * Explicit charset. Default: DIGITS
         */
        public Builder charset(String charset) {
            this.charset = Objects.requireNonNull(charset, "charset cannot be null");
            this.charsetLabel = "custom";
            return this;
        }

        public Builder charset(CharsetPreset preset) {
            Objects.requireNonNull(preset, "preset cannot be null");
            this.charset = preset.getSymbols();
            this.charsetLabel = String.valueOf(preset.getId());
            return this;
        }

        /**
         * Default: 4
         */
        public Builder length(int length) {
            this.length = length;
            return this;
        }

        /**
         * Default: MD5
         */
        public Builder algorithm(HashAlgorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
            return this;
        }

        /**
         * Replaces the algorithm's digest function (e.g. a truncated digest in tests).
         */
        public Builder digestFactory(DigestFunctionFactory digestFactory) {
            this.digestFactory = digestFactory;
            return this;
        }

        public Builder targets(TargetSet targets) {
            this.targets = targets;
            return this;
        }

        /**
         * Default: available processors
         */
        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /**
         * @return validated request
         * @throws ConfigurationException on invalid workers, targets, charset or length
         */
        public SearchRequest build() {
            if (workers < 1) {
                throw new ConfigurationException("Worker count must be at least 1 (got: " + workers + ")");
            }
            if (targets == null) {
                throw new ConfigurationException("Target set is required");
            }
            SearchSpace space = SearchSpace.of(charset, length);
            return new SearchRequest(this, space);
        }
    }
}
