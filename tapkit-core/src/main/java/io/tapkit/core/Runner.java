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
package io.tapkit.core;

import io.tapkit.model.Testsuite;
import io.tapkit.output.JsonReportWriter;
import io.tapkit.output.JunitXmlWriter;
import io.tapkit.output.LogContext;
import io.tapkit.parser.TapException;
import io.tapkit.parser.TapIoException;
import io.tapkit.parser.TapParser;
import org.slf4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Parses TAP from files, directories and stdin and collects one verdict per source.
 * <p>
 * Usage:
 * <pre>
 * RunResult result = Runner.path("target/tap")
 *     .outputJunitXml(true)
 *     .run();
 * </pre>
 * A directory is scanned recursively for {@code *.tap} files, and {@value #STDIN}
 * stands for the standard input. A source that cannot be read or parsed is
 * recorded as an error and the run moves on to the next one.
 */
public final class Runner {

    public static final String STDIN = "-";
    public static final String EXTENSION = ".tap";

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private Runner() {
    }

    public static Builder path(String... paths) {
        return new Builder().path(paths);
    }

    public static Builder path(List<String> paths) {
        return new Builder().path(paths);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Builder ==========

    public static class Builder {

        private final List<String> paths = new ArrayList<>();
        private InputStream stdin = System.in;
        private Path outputDir = Path.of("target/tapkit-reports");
        private boolean outputJunitXml;
        private boolean outputJson;
        private boolean printSummary = true;

        Builder() {
        }

        public Builder path(String... values) {
            paths.addAll(Arrays.asList(values));
            return this;
        }

        public Builder path(List<String> values) {
            if (values != null) {
                paths.addAll(values);
            }
            return this;
        }

        /**
         * Stream read for the {@value #STDIN} path, defaults to {@code System.in}.
         */
        public Builder stdin(InputStream value) {
            stdin = value;
            return this;
        }

        public Builder outputDir(String dir) {
            if (dir != null) {
                outputDir = Path.of(dir);
            }
            return this;
        }

        public Builder outputDir(Path dir) {
            if (dir != null) {
                outputDir = dir;
            }
            return this;
        }

        public Builder outputJunitXml(boolean enabled) {
            outputJunitXml = enabled;
            return this;
        }

        public Builder outputJson(boolean enabled) {
            outputJson = enabled;
            return this;
        }

        public Builder printSummary(boolean enabled) {
            printSummary = enabled;
            return this;
        }

        public Path getOutputDir() {
            return outputDir;
        }

        /**
         * Parse every source, write the enabled reports and print the summary.
         * Without any path, reads stdin.
         */
        public RunResult run() {
            RunResult result = new RunResult();
            result.setStartTime(System.currentTimeMillis());
            List<String> sources = paths.isEmpty() ? List.of(STDIN) : paths;
            for (String path : sources) {
                if (STDIN.equals(path)) {
                    result.addSourceResult(parseStdin());
                } else {
                    resolve(path, result);
                }
            }
            result.setEndTime(System.currentTimeMillis());
            logger.debug("parsed {} sources in {} ms", result.getSourceCount(), result.getDurationMillis());
            if (outputJunitXml) {
                JunitXmlWriter.write(result, outputDir);
            }
            if (outputJson) {
                JsonReportWriter.write(result, outputDir);
            }
            if (printSummary) {
                result.printSummary();
            }
            return result;
        }

        private void resolve(String path, RunResult result) {
            File file = new File(path);
            if (file.isDirectory()) {
                List<File> found = new ArrayList<>();
                resolveDirectory(file, found);
                if (found.isEmpty()) {
                    logger.warn("no {} files found in: {}", EXTENSION, path);
                }
                for (File f : found) {
                    result.addSourceResult(parseFile(f.toPath()));
                }
            } else if (file.exists()) {
                result.addSourceResult(parseFile(file.toPath()));
            } else {
                logger.warn("not found: {}", path);
                result.addSourceResult(new SourceResult(path, null, new TapIoException("not found: " + path)));
            }
        }

        private void resolveDirectory(File dir, List<File> target) {
            File[] files = dir.listFiles();
            if (files == null) return;
            Arrays.sort(files, Comparator.comparing(File::getName));
            for (File file : files) {
                if (file.isDirectory()) {
                    resolveDirectory(file, target);
                } else if (file.getName().endsWith(EXTENSION)) {
                    target.add(file);
                }
            }
        }

        private SourceResult parseFile(Path path) {
            long start = System.currentTimeMillis();
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return parse(path.toString(), reader, start);
            } catch (IOException e) {
                SourceResult sr = new SourceResult(path.toString(), null, new TapIoException("failed to read: " + path, e));
                sr.setStartTime(start);
                sr.setEndTime(System.currentTimeMillis());
                logger.warn("{}", sr.getError().getMessage());
                return sr;
            }
        }

        // stdin belongs to the process, so it is not closed
        private SourceResult parseStdin() {
            return parse("stdin", new InputStreamReader(stdin, StandardCharsets.UTF_8), System.currentTimeMillis());
        }

        private SourceResult parse(String name, Reader reader, long start) {
            TapParser parser = null;
            Testsuite suite;
            TapException error = null;
            try {
                parser = new TapParser(reader);
                suite = parser.suite();
            } catch (TapException e) {
                suite = parser == null ? null : parser.getSuite();
                error = e;
                logger.warn("{}: {}", name, e.getMessage());
            }
            SourceResult sr = new SourceResult(name, suite, error);
            sr.setStartTime(start);
            sr.setEndTime(System.currentTimeMillis());
            logger.debug("{}: {}", name, sr.getSuite());
            return sr;
        }

        @Override
        public String toString() {
            return "Runner.Builder{paths=" + paths + ", outputDir=" + outputDir + "}";
        }

    }

}
