package com.hashhunt.report;

import com.hashhunt.config.SearchRequest;
import com.hashhunt.digest.HashAlgorithm;
import com.hashhunt.digest.TargetSet;
import com.hashhunt.scheduler.SearchCoordinator;
import com.hashhunt.scheduler.SearchResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvResultWriter")
class CsvResultWriterTest {

    private static final String MD5_10 = "d3d9446802a44259755d38e6d163e820";
    private static final String MD5_ABC = "900150983cd24fb0d6963f7d28e17f72";

    private static SearchResult result;

    @BeforeAll
    static void runSearch() throws InterruptedException {
        result = new SearchCoordinator().search(new SearchRequest.Builder()
            .charset("01")
            .length(2)
            .algorithm(HashAlgorithm.MD5)
            .targets(TargetSet.of(List.of(MD5_10, MD5_ABC), HashAlgorithm.MD5))
            .workers(2)
            .build());
    }

    @Test
    @DisplayName("writes the header and one line per found pre-image")
    void writesFoundOnly() throws IOException {
        StringWriter out = new StringWriter();
        new CsvResultWriter().write(result, out);

        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        assertEquals(CsvResultWriter.HEADER, lines[0]);
        assertTrue(lines[1].matches(MD5_10 + ",10,\\d+\\.\\d{2}"), lines[1]);
        assertFalse(out.toString().contains(MD5_ABC));
    }

    @Test
    @DisplayName("creates missing parent directories")
    void createsParents(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nested/out/results.csv");
        new CsvResultWriter().write(result, file);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(CsvResultWriter.HEADER, lines.get(0));
        assertTrue(lines.get(1).startsWith(MD5_10 + ",10,"));
    }

    @Test
    @DisplayName("quotes fields containing separators or quotes")
    void escaping() {
        assertEquals("abc", CsvResultWriter.escape("abc"));
        assertEquals("\"a,b\"", CsvResultWriter.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvResultWriter.escape("say \"hi\""));
        assertEquals("\"a\nb\"", CsvResultWriter.escape("a\nb"));
    }
}
