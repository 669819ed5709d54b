package com.hashhunt.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HashhuntCli")
class HashhuntCliTest {

    private static final String MD5_10 = "d3d9446802a44259755d38e6d163e820";

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private static int run(String... args) {
        return HashhuntCli.newCommandLine().execute(args);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("search")
    class SearchTests {

        @Test
        @DisplayName("writes the CSV and exits 0")
        void successfulSearch(@TempDir Path dir) throws IOException {
            Path output = dir.resolve("result.csv");

            int exit = run("search", "--hash", MD5_10, "-c", "01", "-l", "2", "-w", "2",
                           "--no-progress", "-o", output.toString());

            assertEquals(HashhuntCli.EXIT_OK, exit);
            List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
            assertEquals(2, lines.size());
            assertTrue(lines.get(1).startsWith(MD5_10 + ",10,"));
            assertTrue(out().contains("Pre-images found: 1/1"));
        }

        @Test
        @DisplayName("reads targets from a file")
        void fromFile(@TempDir Path dir) throws IOException {
            Path targets = dir.resolve("targets.txt");
            Files.write(targets, List.of("#charset:1", "#algorithm:MD5", "#length:2", MD5_10),
                        StandardCharsets.UTF_8);
            Path output = dir.resolve("out.csv");

            int exit = run("search", "-f", targets.toString(), "-w", "3", "--no-progress",
                           "-o", output.toString());

            assertEquals(HashhuntCli.EXIT_OK, exit);
            assertTrue(Files.readString(output, StandardCharsets.UTF_8).contains(MD5_10 + ",10,"));
        }

        @Test
        @DisplayName("not finding every target is still a successful run")
        void partialResult(@TempDir Path dir) {
            int exit = run("search", "--hash", MD5_10, "--hash", "900150983cd24fb0d6963f7d28e17f72",
                           "-c", "01", "-l", "2", "--no-progress", "-o", dir.resolve("o.csv").toString());

            assertEquals(HashhuntCli.EXIT_OK, exit);
            assertTrue(out().contains("not found"));
        }

        @Test
        @DisplayName("configuration errors exit 2")
        void configErrors(@TempDir Path dir) {
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR, run("search", "--no-progress"));
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR,
                         run("search", "--hash", MD5_10, "-a", "whirlpool", "--no-progress"));
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR,
                         run("search", "--hash", "abc123", "--no-progress"));
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR,
                         run("search", "-f", dir.resolve("missing.txt").toString(), "--no-progress"));
            assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("ERROR"));
        }

        @Test
        @DisplayName("unknown options are usage errors")
        void unknownOption() {
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR, run("search", "--bogus"));
        }
    }

    @Nested
    @DisplayName("digest")
    class DigestTests {

        @Test
        @DisplayName("hashes a string")
        void text() {
            assertEquals(HashhuntCli.EXIT_OK, run("digest", "-a", "sha-256", "-t", "abc", "-r", "3"));
            assertTrue(out().contains("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad"));
        }

        @Test
        @DisplayName("hashes files and fails on unreadable ones")
        void files(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("abc.txt");
            Files.writeString(file, "abc", StandardCharsets.UTF_8);

            assertEquals(HashhuntCli.EXIT_OK, run("digest", file.toString()));
            assertTrue(out().contains("900150983cd24fb0d6963f7d28e17f72"));

            assertEquals(HashhuntCli.EXIT_FAILURE, run("digest", dir.resolve("nope.bin").toString()));
        }

        @Test
        @DisplayName("requires some input")
        void noInput() {
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR, run("digest"));
            assertEquals(HashhuntCli.EXIT_CONFIG_ERROR, run("digest", "-t", "x", "-r", "0"));
        }
    }

    @Test
    @DisplayName("version prints the version and exits 0")
    void version() {
        assertEquals(HashhuntCli.EXIT_OK, run("version"));
        assertTrue(out().contains("1.0-SNAPSHOT"));
    }
}
