package com.hashhunt.config;

import com.hashhunt.digest.HashAlgorithm;
import com.hashhunt.digest.UnsupportedAlgorithmException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TargetFileLoader")
class TargetFileLoaderTest {

    @TempDir
    Path tempDir;

    private final TargetFileLoader loader = new TargetFileLoader();

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("targets.txt");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("reads headers and digests")
    void readsHeaders() throws IOException {
        Path file = write("#charset:3\n"
            + "#algorithm:SHA-256\n"
            + "#length:4\n"
            + "# a comment\n"
            + "03AC674216F3E15C761EE1A5E255F067953623C8B388B4459E13F978D7C846F4\n"
            + "\n");

        TargetFile loaded = loader.load(file);

        assertEquals(CharsetPreset.ALNUM, loaded.getCharset());
        assertEquals(HashAlgorithm.SHA256, loaded.getAlgorithm());
        assertTrue(loaded.isAlgorithmDeclared());
        assertEquals(4, loaded.getLength());
        assertEquals(1, loaded.getTargets().size());
        assertTrue(loaded.getTargets().contains(
            "03ac674216f3e15c761ee1a5e255f067953623c8b388b4459e13f978d7c846f4"));
    }

    @Test
    @DisplayName("applies defaults when headers are missing")
    void defaults() throws IOException {
        TargetFile loaded = loader.load(write("81dc9bdb52d04dc20036dbd8313ed055\n"));

        assertEquals(CharsetPreset.DIGITS, loaded.getCharset());
        assertEquals(HashAlgorithm.MD5, loaded.getAlgorithm());
        assertFalse(loaded.isAlgorithmDeclared());
        assertEquals(4, loaded.getLength());
    }

    @Test
    @DisplayName("unknown charset id falls back to digits")
    void unknownCharset() throws IOException {
        TargetFile loaded = loader.load(write("#charset:9\n81dc9bdb52d04dc20036dbd8313ed055\n"));

        assertEquals(CharsetPreset.DIGITS, loaded.getCharset());
    }

    @Test
    @DisplayName("reports unsupported algorithms at load time")
    void unsupportedAlgorithm() throws IOException {
        Path file = write("#algorithm:SHA-512\n81dc9bdb52d04dc20036dbd8313ed055\n");

        assertThrows(UnsupportedAlgorithmException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("keeps digests unchecked until an algorithm is applied")
    void digestFormatCheckedLater() throws IOException {
        Path file = write("#algorithm:SHA-1\n 81DC9BDB52D04DC20036DBD8313ED055 \n81dc9bdb52d04dc20036dbd8313ed055\n");

        TargetFile loaded = loader.load(file);

        assertEquals(Set.of("81dc9bdb52d04dc20036dbd8313ed055"), loaded.getDigests());
        assertThrows(ConfigurationException.class, loaded::getTargets);
    }

    @Test
    @DisplayName("rejects malformed headers, empty files and missing files")
    void invalidFiles() throws IOException {
        assertThrows(ConfigurationException.class, () -> loader.load(write("#length:four\nabc\n")));
        assertThrows(ConfigurationException.class, () -> loader.load(write("# only comments\n")));
        assertThrows(ConfigurationException.class, () -> loader.load(tempDir.resolve("missing.txt")));
    }
}
