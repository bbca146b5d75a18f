/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.tapkit.cli;

import io.tapkit.core.Globals;
import io.tapkit.core.RunResult;
import io.tapkit.core.Runner;
import io.tapkit.core.TapkitPom;
import io.tapkit.output.Console;
import io.tapkit.output.JsonReportWriter;
import io.tapkit.output.JunitXmlWriter;
import io.tapkit.output.LogContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for checking TAP output.
 * <p>
 * Usage examples:
 * <pre>
 * # Read TAP from stdin
 * prove -v t/ | java -jar tapkit.jar
 *
 * # Parse files and directories of *.tap files, write JUnit XML
 * java -jar tapkit.jar --junit-xml target/tap
 *
 * # Run with custom pom file
 * java -jar tapkit.jar -p custom-pom.json
 * </pre>
 * Exit codes: 0 all sources passed, 1 a suite failed, 2 a source could not be
 * read or parsed, 3 unexpected error.
 */
@Command(
        name = "tapkit",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Parse Test Anything Protocol output and report the verdict"
)
public class Main implements Callable<Integer> {

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_PARSE_ERROR = 2;
    public static final int EXIT_UNEXPECTED = 3;

    @Parameters(
            description = "TAP files, directories of *.tap files, or '-' for stdin (default: stdin)",
            arity = "0..*"
    )
    List<String> paths;

    @Option(
            names = {"-o", "--output"},
            description = "Output directory for reports (default: target/tapkit-reports)"
    )
    String outputDir;

    @Option(
            names = {"--junit-xml"},
            description = "Write " + JunitXmlWriter.FILE_NAME + " to the output directory"
    )
    Boolean junitXml;

    @Option(
            names = {"--json"},
            description = "Write " + JsonReportWriter.FILE_NAME + " to the output directory"
    )
    Boolean json;

    @Option(
            names = {"-p", "--pom"},
            description = "Path to project file (default: tapkit-pom.json)"
    )
    String pomFile;

    @Option(
            names = {"--no-pom"},
            description = "Ignore tapkit-pom.json even if present"
    )
    boolean noPom;

    @Option(
            names = {"-l", "--log-level"},
            description = "Log level: trace, debug, info, warn, error"
    )
    String logLevel;

    @Option(
            names = {"-q", "--quiet"},
            description = "Do not print the summary"
    )
    boolean quiet;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    InputStream stdin = System.in;

    private TapkitPom pom;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (!noPom) {
            loadPom();
        }
        String effectiveLogLevel = resolveLogLevel();
        if (effectiveLogLevel != null) {
            LogContext.setLogLevel(effectiveLogLevel);
        }
        try {
            Runner.Builder builder = Runner.builder();
            if (pom != null) {
                pom.applyTo(builder);
            }
            builder.path(resolvePaths());
            builder.stdin(stdin);
            builder.printSummary(!quiet);
            if (outputDir != null) {
                builder.outputDir(outputDir);
            }
            if (junitXml != null) {
                builder.outputJunitXml(junitXml);
            }
            if (json != null) {
                builder.outputJson(json);
            }
            RunResult result = builder.run();
            if (result.getErrorCount() > 0) {
                return EXIT_PARSE_ERROR;
            }
            return result.isFailed() ? EXIT_FAILED : EXIT_PASSED;
        } catch (Exception e) {
            Console.println(Console.fail("Error: " + e.getMessage()));
            LogContext.RUNTIME_LOGGER.error("unexpected error", e);
            return EXIT_UNEXPECTED;
        }
    }

    private void loadPom() {
        Path pomPath = Path.of(pomFile != null ? pomFile : TapkitPom.DEFAULT_FILE);
        if (Files.exists(pomPath)) {
            try {
                pom = TapkitPom.load(pomPath);
                LogContext.RUNTIME_LOGGER.debug("loaded: {}", pomPath);
            } catch (Exception e) {
                Console.println(Console.warn("Failed to load pom: " + e.getMessage()));
            }
        } else if (pomFile != null) {
            Console.println(Console.warn("Pom not found: " + pomPath));
        }
    }

    private List<String> resolvePaths() {
        if (paths != null && !paths.isEmpty()) {
            return paths;
        }
        if (pom != null && !pom.getPaths().isEmpty()) {
            return pom.getPaths();
        }
        return List.of(Runner.STDIN);
    }

    private String resolveLogLevel() {
        if (logLevel != null) {
            return logLevel;
        }
        return pom == null ? null : pom.getOutput().getLogLevel();
    }

    static class VersionProvider implements CommandLine.IVersionProvider {

        @Override
        public String[] getVersion() {
            return new String[]{"tapkit " + Globals.VERSION};
        }

    }

}
