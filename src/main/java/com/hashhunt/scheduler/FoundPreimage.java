package com.hashhunt.scheduler;

/**
 * One recovered pre-image: a line of the result file.
 */
public final class FoundPreimage {

    private final String digest;
    private final String preimage;
    private final double elapsedSeconds;

    public FoundPreimage(String digest, String preimage, double elapsedSeconds) {
        this.digest = digest;
        this.preimage = preimage;
        this.elapsedSeconds = elapsedSeconds;
    }

    public String getDigest() {
        return digest;
    }

    public String getPreimage() {
        return preimage;
    }

    /**
     * @return seconds between search start and the match
     */
    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    @Override
    public String toString() {
        return String.format("%s <- '%s' (%.2fs)", digest, preimage, elapsedSeconds);
    }
}
