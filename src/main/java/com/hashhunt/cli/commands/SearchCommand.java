package com.hashhunt.cli.commands;

import com.hashhunt.cli.ConsoleProgressListener;
import com.hashhunt.cli.HashhuntCli;
import com.hashhunt.config.CharsetPreset;
import com.hashhunt.config.ConfigurationException;
import com.hashhunt.config.SearchRequest;
import com.hashhunt.config.TargetFile;
import com.hashhunt.config.TargetFileLoader;
import com.hashhunt.digest.HashAlgorithm;
import com.hashhunt.digest.TargetSet;
import com.hashhunt.report.CsvResultWriter;
import com.hashhunt.scheduler.FoundPreimage;
import com.hashhunt.scheduler.SearchCoordinator;
import com.hashhunt.scheduler.SearchListener;
import com.hashhunt.scheduler.SearchResult;
import com.hashhunt.scheduler.WorkerFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Runs a brute-force search.
 *
 * Targets and settings come from a target file ({@code -f}) and/or the command
 * line; command line options override the file's header values.
 *
 * Example:
 *   hashhunt search -f targets.txt -w 8
 *   hashhunt search --hash d3d9446802a44259755d38e6d163e820 --charset 01 --length 2
 */
@Command(name = "search", description = "Search the keyspace for pre-images of target digests")
public class SearchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SearchCommand.class);

    @Option(
        names = {"-f", "--file"},
        description = "Target file (#charset:, #algorithm:, #length: headers, one digest per line)"
    )
    Path targetFile;

    @Option(
        names = {"--hash"},
        description = "Target digest (repeatable)"
    )
    List<String> hashes;

    @Option(
        names = {"-c", "--charset"},
        description = "Explicit character set, e.g. 0123456789abcdef"
    )
    String charset;

    @Option(
        names = {"--charset-id"},
        description = "Charset preset: 1 digits, 2 digits+A-Z, 3 digits+a-z+A-Z, 4 printable"
    )
    Integer charsetId;

    @Option(
        names = {"-p", "--preset"},
        description = "Charset preset by name: digits, upper-alnum, alnum, printable"
    )
    String preset;

    @Option(
        names = {"-l", "--length"},
        description = "Pre-image length"
    )
    Integer length;

    @Option(
        names = {"-a", "--algorithm"},
        description = "Hash algorithm: MD5, SHA-1, SHA-256"
    )
    String algorithm;

    @Option(
        names = {"-w", "--workers"},
        description = "Number of worker threads (default: available processors)"
    )
    Integer workers;

    @Option(
        names = {"-o", "--output"},
        description = "Result CSV file (default: output_workers_<n>_charset_<id>_algo_<alg>_length_<len>.csv)"
    )
    Path output;

    @Option(
        names = {"--no-progress"},
        description = "Do not print the progress line"
    )
    boolean noProgress;

    @Override
    public Integer call() throws Exception {
        SearchRequest request;
        try {
            request = buildRequest();
        } catch (ConfigurationException e) {
            System.err.println("ERROR: " + e.getMessage());
            return HashhuntCli.EXIT_CONFIG_ERROR;
        }

        SearchListener listener = noProgress ? SearchListener.NONE : new ConsoleProgressListener(System.out);
        SearchCoordinator coordinator = new SearchCoordinator(listener);

        SearchResult result;
        try {
            result = coordinator.search(request);
        } catch (WorkerFailureException e) {
            System.err.println("ERROR: search aborted: " + e.getMessage());
            return HashhuntCli.EXIT_FAILURE;
        }

        Path outputFile = output != null ? output : Paths.get(defaultOutputName(request));
        try {
            new CsvResultWriter().write(result, outputFile);
        } catch (IOException e) {
            log.error("Cannot write results to {}", outputFile, e);
            System.err.println("ERROR: cannot write results: " + e.getMessage());
            return HashhuntCli.EXIT_FAILURE;
        }

        printSummary(result, outputFile);
        return HashhuntCli.EXIT_OK;
    }

    /**
     * Merges file settings and command line options into a validated request.
     */
    SearchRequest buildRequest() {
        if (targetFile == null && (hashes == null || hashes.isEmpty())) {
            throw new ConfigurationException("Either --file or at least one --hash is required");
        }
        int charsetOptions = (charset != null ? 1 : 0) + (charsetId != null ? 1 : 0) + (preset != null ? 1 : 0);
        if (charsetOptions > 1) {
            throw new ConfigurationException("--charset, --charset-id and --preset are mutually exclusive");
        }

        TargetFile file = targetFile != null ? new TargetFileLoader().load(targetFile) : null;

        HashAlgorithm resolvedAlgorithm = algorithm != null
            ? HashAlgorithm.fromName(algorithm)
            : (file != null ? file.getAlgorithm() : TargetFileLoader.DEFAULT_ALGORITHM);

        if (file != null && algorithm != null && file.isAlgorithmDeclared()
                && file.getAlgorithm() != resolvedAlgorithm) {
            log.warn("--algorithm {} overrides {} declared in {}",
                     resolvedAlgorithm, file.getAlgorithm(), file.getPath());
        }

        // Digest format is checked once, against the final algorithm
        Set<String> digests = new LinkedHashSet<>();
        if (file != null) {
            digests.addAll(file.getDigests());
        }
        if (hashes != null) {
            digests.addAll(hashes);
        }

        SearchRequest.Builder builder = new SearchRequest.Builder()
            .algorithm(resolvedAlgorithm)
            .targets(TargetSet.of(digests, resolvedAlgorithm))
            .length(length != null ? length
                    : (file != null ? file.getLength() : TargetFileLoader.DEFAULT_LENGTH));

        if (charset != null) {
            builder.charset(charset);
        } else if (charsetId != null) {
            builder.charset(CharsetPreset.fromId(charsetId));
        } else if (preset != null) {
            builder.charset(CharsetPreset.fromName(preset));
        } else if (file != null) {
            builder.charset(file.getCharset());
        } else {
            builder.charset(CharsetPreset.fromId(TargetFileLoader.DEFAULT_CHARSET_ID));
        }

        if (workers != null) {
            builder.workers(workers);
        }
        return builder.build();
    }

    static String defaultOutputName(SearchRequest request) {
        return String.format(Locale.ROOT, "output_workers_%d_charset_%s_algo_%s_length_%d.csv",
                             request.getWorkers(), request.getCharsetLabel(),
                             request.getAlgorithm().getDisplayName(), request.getSpace().getLength());
    }

    private static void printSummary(SearchResult result, Path outputFile) {
        System.out.println();
        System.out.println("========================================");
        System.out.printf(Locale.ROOT, "Search complete! Pre-images found: %d/%d%n",
                          result.getFoundCount(), result.getTargetCount());
        System.out.println("========================================");
        for (FoundPreimage preimage : result.getFound()) {
            System.out.println("  " + preimage);
        }
        for (String missing : result.getMissingDigests()) {
            System.out.println("  " + missing + " <- not found");
        }
        System.out.printf(Locale.ROOT, "Candidates processed: %,d of %,d%s%n",
                          result.getProcessed(), result.getTotalCombinations(),
                          result.isEarlyExit() ? " (stopped early)" : "");
        System.out.printf(Locale.ROOT, "Total elapsed time: %.2f seconds%n", result.getElapsedSeconds());
        System.out.printf(Locale.ROOT, "Average time per pre-image: %.2f seconds%n",
                          result.getAverageSecondsPerPreimage());
        System.out.println("Results written to: " + outputFile);
    }
}
