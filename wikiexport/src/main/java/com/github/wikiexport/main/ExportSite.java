package com.github.wikiexport.main;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.github.wikiexport.crawl.CancellationToken;
import com.github.wikiexport.crawl.CrawlConfig;
import com.github.wikiexport.crawl.SiteExporter;
import com.github.wikiexport.parsing.DiscoveryException;

/**
 * Prints the XML export of an entire MediaWiki site to standard output.
 * Media files are saved to the directory given with <code>--savedir</code>.
 */
public final class ExportSite {
    private static final Logger LOGGER = Logger.getLogger("wiki-export");
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private ExportSite() {}

    public static void main(String[] args) throws Exception {
        configureLogging();

        var options = makeOptions();
        final CommandLine line;
        final CrawlConfig config;

        try {
            line = new DefaultParser().parse(options, args);
            config = makeConfig(line);
        } catch (ParseException | IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            System.exit(2);
            return;
        }

        if (config.isStrict()) {
            LOGGER.setLevel(Level.FINE);
        }

        var token = new CancellationToken();
        var hook = cancelOnShutdown(token, Thread.currentThread(), SHUTDOWN_GRACE);
        Runtime.getRuntime().addShutdownHook(hook);

        var out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        var seedUrl = line.getArgList().get(0);
        int status = 0;

        try {
            var stats = SiteExporter.exportSite(seedUrl, config, token, out);
            LOGGER.info("Done. " + stats);
        } catch (DiscoveryException e) {
            LOGGER.log(Level.SEVERE, "Unable to find the wiki behind " + seedUrl + ": " + e.getMessage());
            status = 1;
        } catch (CancellationException | InterruptedException e) {
            // the JVM is already shutting down with the signal's exit status
            LOGGER.warning("Crawl cancelled");
            return;
        } catch (IOException | RuntimeException e) {
            if (config.isStrict()) {
                throw e;
            }

            LOGGER.log(Level.SEVERE, "Crawl aborted: " + e.getMessage(), e);
            status = 1;
        } finally {
            out.flush();
        }

        if (status != 0) {
            // the hook would otherwise wait on this thread while it exits
            Runtime.getRuntime().removeShutdownHook(hook);
            System.exit(status);
        }
    }

    /**
     * Builds the hook run on Ctrl+C: cancels the crawl, interrupts the thread
     * running it and gives it some time to unwind and flush its output.
     */
    static Thread cancelOnShutdown(CancellationToken token, Thread crawler, Duration grace) {
        return new Thread(() -> {
            token.cancel();
            crawler.interrupt();

            try {
                crawler.join(grace.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "cancel-on-shutdown");
    }

    static Options makeOptions() {
        var options = new Options();
        options.addOption(null, "history", false, "Include history in export");
        options.addOption(Option.builder().longOpt("savedir").hasArg().argName("dir").desc("Save all files to the specified directory").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("Maximum number of simultaneous connections to use").build());
        options.addOption(Option.builder().longOpt("batchsize").hasArg().argName("n").desc("Nr of pages to export per request (default: " + CrawlConfig.DEFAULT_BATCH_SIZE + ")").build());
        options.addOption(Option.builder().longOpt("timeout").hasArg().argName("seconds").desc("Per-request timeout in seconds").build());
        options.addOption(null, "debug", false, "errors print stacktrace, and abort");
        return options;
    }

    static CrawlConfig makeConfig(CommandLine line) throws ParseException {
        if (line.getArgList().size() != 1) {
            throw new ParseException("Expected exactly one wiki page URL, got " + line.getArgList().size());
        }

        var config = new CrawlConfig()
            .history(line.hasOption("history"))
            .strict(line.hasOption("debug"));

        if (line.hasOption("savedir")) {
            var saveDir = Paths.get(line.getOptionValue("savedir"));

            if (!Files.isDirectory(saveDir)) {
                throw new ParseException("Not a directory: " + saveDir);
            }

            config.saveDir(saveDir);
        }

        if (line.hasOption("limit")) {
            config.limit(parseInt(line, "limit"));
        }

        if (line.hasOption("batchsize")) {
            config.batchSize(parseInt(line, "batchsize"));
        }

        if (line.hasOption("timeout")) {
            config.requestTimeout(Duration.ofSeconds(parseInt(line, "timeout")));
        }

        return config;
    }

    static CrawlConfig parseArguments(String[] args) throws ParseException {
        return makeConfig(new DefaultParser().parse(makeOptions(), args));
    }

    private static int parseInt(CommandLine line, String option) throws ParseException {
        var value = line.getOptionValue(option);

        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new ParseException(String.format("Invalid integer for --%s: %s", option, value));
        }
    }

    private static void printHelp(Options options) {
        var pw = new PrintWriter(System.err);
        var formatter = new HelpFormatter();
        formatter.printHelp(pw, formatter.getWidth(), ExportSite.class.getName() + " [options] <wikipage>",
            "print entire contents of a mediawiki site in XML format", options,
            formatter.getLeftPadding(), formatter.getDescPadding(), null);
        pw.flush();
    }

    private static void configureLogging() {
        try (var is = ExportSite.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            System.err.println("Unable to read logging configuration: " + e.getMessage());
        }
    }
}
