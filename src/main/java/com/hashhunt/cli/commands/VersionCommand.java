package com.hashhunt.cli.commands;

import com.hashhunt.cli.HashhuntCli;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Displays version information about Hashhunt and its runtime.
 */
@Command(name = "version", description = "Show version information")
public class VersionCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Hashhunt - parallel brute-force pre-image search");
        System.out.println();
        System.out.println("Version: 1.0-SNAPSHOT");
        System.out.println("Java: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
        System.out.println("OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        System.out.println("Available processors: " + Runtime.getRuntime().availableProcessors());
        System.out.println();
        System.out.println("Components:");
        System.out.println("  - CLI: Picocli 4.7.5");
        System.out.println("  - Logging: SLF4J + Logback");
        System.out.println("  - Digests: JCA MessageDigest (MD5, SHA-1, SHA-256)");
        return HashhuntCli.EXIT_OK;
    }
}
