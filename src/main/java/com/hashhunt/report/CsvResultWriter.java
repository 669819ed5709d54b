package com.hashhunt.report;

import com.hashhunt.scheduler.FoundPreimage;
import com.hashhunt.scheduler.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes discovered pre-images as CSV, one line per pre-image in discovery order.
 *
 * Format:
 *   Target Hash,Pre-image,Elapsed Time (s)
 *   d3d9446802a44259755d38e6d163e820,10,0.01
 *
 * Pre-images containing a comma, quote or line break are quoted (RFC 4180).
 */
public class CsvResultWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvResultWriter.class);

    public static final String HEADER = "Target Hash,Pre-image,Elapsed Time (s)";

    /**
     * @param result search result
     * @param path output file, overwritten if it exists
     * @throws IOException if the file cannot be written
     */
    public void write(SearchResult result, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
        log.info("Wrote {} results to {}", result.getFoundCount(), path);
    }

    /**
     * Writes to an open writer. The writer is not closed.
     */
    public void write(SearchResult result, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (FoundPreimage preimage : result.getFound()) {
            writer.write(preimage.getDigest());
            writer.write(',');
            writer.write(escape(preimage.getPreimage()));
            writer.write(',');
            writer.write(String.format(Locale.ROOT, "%.2f", preimage.getElapsedSeconds()));
            writer.write('\n');
        }
        writer.flush();
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
