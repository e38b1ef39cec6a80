/*
 * Docx2Tex - Office Open XML to LaTeX Conversion
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
package net.boyechko.docx2tex.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.docx2tex.core.ConversionListener;
import net.boyechko.docx2tex.core.ConversionOutcome;
import net.boyechko.docx2tex.core.ConversionProfile;
import net.boyechko.docx2tex.core.ConversionService;
import net.boyechko.docx2tex.core.VerbosityLevel;
import net.boyechko.docx2tex.ui.ConversionReporter;
import net.boyechko.docx2tex.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Docx2TexCLI {
    static final int EXIT_USAGE = 1;
    static final int EXIT_INCOMPLETE = 2;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputDir,
            Path profilePath,
            boolean bodyOnly,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (outputDir == null) {
                throw new IllegalArgumentException("Output directory is required");
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
        Path outputDir;
        Path profilePath;
        boolean bodyOnly;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (profilePath != null && !Files.isRegularFile(profilePath)) {
                throw new CLIException("Profile not found: " + profilePath);
            }
            if (outputDir == null) {
                outputDir = inputPath.resolveSibling(ConversionService.baseName(inputPath));
            }
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new CLIException("Output path is not a directory: " + outputDir);
            }
            return new CLIConfig(inputPath, outputDir, profilePath, bodyOnly, verbosity);
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
                            "Starting conversion of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            int status = processFile(config);
            if (status != 0) {
                System.exit(status);
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(EXIT_USAGE);
        }
    }

    static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return """
                Usage: docx2tex [options] <input.docx> [<output-dir>]

                Converts the main document of a .docx package to LaTeX. The output
                directory defaults to a directory named after the input, next to it.

                Options:
                  -q, --quiet           Only report errors
                  -v, --verbose         Show phases and every issue
                  -vv, --debug          Show diagnostic logging instead of the report
                  --profile=<yaml>      Preamble and image settings
                  --body-only           Write the converted body without a preamble
                  -h, --help            Show this message""";
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--profile=")) {
                String value = args[i].substring("--profile=".length());
                if (value.isBlank()) {
                    throw new CLIException("Profile path not specified after --profile=");
                }
                b.profilePath = Paths.get(value);
            } else {
                switch (args[i]) {
                    case "--profile" -> {
                        if (i + 1 < args.length) {
                            b.profilePath = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("Profile path not specified after --profile");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "--body-only" -> b.bodyOnly = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputDir == null) {
                            b.outputDir = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Too many arguments: " + args[i]);
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(Docx2TexCLI.class);
        }
        return logger;
    }

    static int processFile(CLIConfig config) {
        ConversionReporter reporter = null;
        ConversionListener listener;
        if (config.verbosity() == VerbosityLevel.DEBUG) {
            listener = new LoggingListener();
        } else {
            reporter = new ConversionReporter(System.out, config.verbosity());
            listener = reporter;
        }
        try {
            ConversionProfile profile =
                    config.profilePath() != null
                            ? ConversionProfile.fromFile(config.profilePath())
                            : ConversionProfile.loadDefault();

            ConversionService service =
                    new ConversionService.ConversionServiceBuilder()
                            .withInputPath(config.inputPath())
                            .withOutputDirectory(config.outputDir())
                            .withProfile(profile)
                            .withListener(listener)
                            .withBodyOnly(config.bodyOnly())
                            .build();

            ConversionOutcome outcome = service.convert();
            logger().info("Wrote {}", outcome.texFile());
            return outcome.conversion().completed() ? 0 : EXIT_INCOMPLETE;
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("✗ Conversion failed: " + e.getMessage());
            logger().debug("Conversion failure", e);
            return EXIT_USAGE;
        } catch (IllegalStateException e) {
            listener.onError("Conversion aborted: " + e.getMessage());
            logger().debug("Conversion aborted", e);
            return EXIT_USAGE;
        } finally {
            if (reporter != null) {
                reporter.detach();
            }
        }
    }
}
