/*
 * PDF-Sectioner - Outline-Driven PDF Text Sectioning
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.sectioner.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.pdf.sectioner.config.SectionerConfig;
import net.boyechko.pdf.sectioner.core.ProcessingListener;
import net.boyechko.pdf.sectioner.core.SectioningException;
import net.boyechko.pdf.sectioner.core.SectioningResult;
import net.boyechko.pdf.sectioner.core.SectioningService;
import net.boyechko.pdf.sectioner.core.VerbosityLevel;
import net.boyechko.pdf.sectioner.document.PdfCustodian;
import net.boyechko.pdf.sectioner.outline.OutlineResult;
import net.boyechko.pdf.sectioner.output.JsonTreeWriter;
import net.boyechko.pdf.sectioner.ui.LoggingListener;
import net.boyechko.pdf.sectioner.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfSectionerCLI {
    private static final String DEFAULT_OUTPUT_SUFFIX = "_structure";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            String password,
            Path configPath,
            String chapterMarker,
            Integer startPage,
            boolean forwardSearch,
            boolean skipUnmatched,
            boolean dumpOutline,
            boolean plainLog,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (!dumpOutline && outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        String password;
        Path configPath;
        String chapterMarker;
        Integer startPage;
        boolean forwardSearch;
        boolean skipUnmatched;
        boolean dumpOutline;
        boolean plainLog;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Configuration file not found: " + configPath);
            }

            String baseName = inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
            resolveOutputPath(baseName);

            return new CLIConfig(
                    inputPath,
                    outputPath,
                    password,
                    configPath,
                    chapterMarker,
                    startPage,
                    forwardSearch,
                    skipUnmatched,
                    dumpOutline,
                    plainLog,
                    verbosity);
        }

        private void resolveOutputPath(String baseName) {
            if (dumpOutline) {
                return;
            }
            String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".json";
            if (outputPath == null) {
                Path parent = inputPath.getParent();
                outputPath =
                        parent != null ? parent.resolve(outputFilename) : Paths.get(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(outputFilename);
            }
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            System.exit(processFile(config, System.out));
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--config=")) {
                b.configPath = Paths.get(arg.substring("--config=".length()));
            } else if (arg.startsWith("--start-page=")) {
                b.startPage = parseStartPage(arg.substring("--start-page=".length()));
            } else if (arg.startsWith("--marker=")) {
                b.chapterMarker = arg.substring("--marker=".length());
            } else {
                switch (arg) {
                    case "-p", "--password" -> b.password = requireValue(args, ++i, arg);
                    case "-c", "--config" -> b.configPath = Paths.get(requireValue(args, ++i, arg));
                    case "-s", "--start-page" ->
                            b.startPage = parseStartPage(requireValue(args, ++i, arg));
                    case "-m", "--marker" -> b.chapterMarker = requireValue(args, ++i, arg);
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "--forward-search" -> b.forwardSearch = true;
                    case "--skip-unmatched" -> b.skipUnmatched = true;
                    case "--dump-outline" -> b.dumpOutline = true;
                    case "--plain" -> b.plainLog = true;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new CLIException("Unknown option: " + arg);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(arg);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(arg);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int index, String option)
            throws CLIException {
        if (index >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[index];
    }

    private static int parseStartPage(String value) throws CLIException {
        try {
            int page = Integer.parseInt(value.trim());
            if (page < 1) {
                throw new CLIException("Start page must be 1 or greater: " + value);
            }
            return page;
        } catch (NumberFormatException e) {
            throw new CLIException("Start page is not a number: " + value);
        }
    }

    static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger("net.boyechko.pdf.sectioner").setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfSectionerCLI.class);
        }
        return logger;
    }

    /** Applies command-line overrides on top of the configuration file or the defaults. */
    static SectionerConfig resolveSectionerConfig(CLIConfig config) {
        SectionerConfig sectionerConfig =
                config.configPath() != null
                        ? SectionerConfig.fromFile(config.configPath())
                        : SectionerConfig.loadDefault();
        if (config.chapterMarker() != null) {
            sectionerConfig = sectionerConfig.withChapterMarker(config.chapterMarker());
        }
        if (config.startPage() != null) {
            sectionerConfig = sectionerConfig.withStartPage(config.startPage());
        }
        if (config.forwardSearch()) {
            sectionerConfig = sectionerConfig.withSearchFromCursor(true);
        }
        if (config.skipUnmatched()) {
            sectionerConfig = sectionerConfig.withSkipUnmatchedSubtrees(true);
        }
        return sectionerConfig;
    }

    /** Runs the configured action and returns the process exit status. */
    static int processFile(CLIConfig config, PrintStream output) {
        ProcessingListener listener =
                config.plainLog()
                        ? LoggingListener.withConsoleOutput(config.verbosity())
                        : new ProcessingReporter(output, config.verbosity());
        try {
            SectionerConfig sectionerConfig = resolveSectionerConfig(config);
            SectioningService service =
                    new SectioningService.SectioningServiceBuilder()
                            .withPdfCustodian(
                                    new PdfCustodian(config.inputPath(), config.password()))
                            .withConfig(sectionerConfig)
                            .withListener(listener)
                            .build();

            if (config.dumpOutline()) {
                OutlineResult outline = service.outline();
                output.print(outline.tree().toIndentedTreeString());
                return 0;
            }

            SectioningResult result = service.process();
            new JsonTreeWriter().write(result.tree(), config.outputPath());
            listener.onSuccess("Output saved to " + config.outputPath());
            return 0;
        } catch (SectionerConfig.ConfigException e) {
            listener.onError("Invalid configuration: " + e.getMessage());
            return 1;
        } catch (SectioningException e) {
            // Already reported by the service
            logger().debug("Processing failed", e);
            return 1;
        } catch (IOException e) {
            logger().debug("Writing output failed", e);
            listener.onError("Failed to write " + config.outputPath() + ": " + e.getMessage());
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java PdfSectionerCLI [-q|-v|-vv] [-p password] [-c config.yaml]"
                + " [-s page] [-m marker] <inputpath> [<outputpath>]\n"
                + "  -h, --help          Show this help message\n"
                + "  -q, --quiet         Only show errors and final status\n"
                + "  -v, --verbose       Show every diagnostic and the resulting outline\n"
                + "  -vv, --debug        Show all debug information\n"
                + "  -p, --password      Password for encrypted PDFs\n"
                + "  -c, --config        YAML configuration file (default: built-in)\n"
                + "  -s, --start-page    First page whose text is searched (1-based)\n"
                + "  -m, --marker        Word preceding chapter numbers, e.g. \"Глава\"\n"
                + "  --forward-search    Search each heading only after the previous one\n"
                + "  --skip-unmatched    Do not search below headings that were not found\n"
                + "  --dump-outline      Print the outline tree and exit\n"
                + "  --plain             Log events instead of printing boxed output\n"
                + "Examples:\n"
                + "  java PdfSectionerCLI manual.pdf\n"
                + "  java PdfSectionerCLI --dump-outline manual.pdf\n"
                + "  java PdfSectionerCLI -s 1 -m Chapter book.pdf out/book.json";
    }
}
