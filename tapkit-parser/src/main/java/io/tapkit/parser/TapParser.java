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
package io.tapkit.parser;

import io.tapkit.model.Testline;
import io.tapkit.model.Testsuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Single pass TAP parser with one line of lookahead.
 * <p>
 * The header (version, leading comments and a leading plan) is consumed by the
 * constructor. Each call to {@link #next()} then yields one test line together
 * with the diagnostics, inline block and trailing plan that follow it. Every
 * yielded test line is also collected into {@link #getSuite()}.
 * <pre>
 * TapParser parser = TapParser.of(text);
 * Optional&lt;Testline&gt; next;
 * while ((next = parser.next()).isPresent()) {
 *     ...
 * }
 * </pre>
 * Not thread-safe. The parser owns the reader for its whole lifetime but does
 * not close it.
 */
public class TapParser {

    private static final Logger logger = LoggerFactory.getLogger(TapParser.class);

    private final BufferedReader reader;
    private final Testsuite suite = new Testsuite();

    private String lookahead;
    private int lookaheadLine;
    private int lineNumber;
    private boolean trailingPlan;

    public TapParser(Reader reader) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        readHeader();
    }

    public static TapParser of(String text) {
        return new TapParser(new StringReader(text));
    }

    public static TapParser of(Reader reader) {
        return new TapParser(reader);
    }

    public static TapParser of(InputStream is) {
        return new TapParser(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    // ========== Whole suite ==========

    public static Testsuite parse(String text) {
        return of(text).suite();
    }

    public static Testsuite parse(Reader reader) {
        return of(reader).suite();
    }

    public static Testsuite parse(InputStream is) {
        return of(is).suite();
    }

    public static Testsuite parse(Path path) {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new TapParser(br).suite();
        } catch (IOException e) {
            throw new TapIoException("failed to read: " + path, e);
        }
    }

    /**
     * Drive {@link #next()} until the input is exhausted and settle the verdict.
     * Blocks until the reader reaches its end. On error the exception propagates
     * and {@link #getSuite()} keeps the partial result, which is not a verdict.
     *
     * @return the completed suite
     */
    public Testsuite suite() {
        Optional<Testline> next;
        while ((next = next()).isPresent()) {
            if (!next.get().isOk()) {
                suite.setOk(false);
            }
        }
        if (!suite.hasPlan() || suite.getPlan() == 0 || suite.getTestCount() != suite.getPlan()) {
            logger.debug("suite failed on plan: {}", suite.getPlanProblem());
            suite.setOk(false);
        }
        return suite;
    }

    // ========== Iteration ==========

    public boolean hasNext() {
        return lookahead != null;
    }

    /**
     * Yield the next test line, complete with its trailing diagnostics and block.
     *
     * @return the test line, or empty once the input is exhausted
     * @throws TapGrammarException if the pending line is not a test result
     * @throws TapProtocolException on a second plan
     * @throws TapNumberException if a number does not fit an int
     * @throws TapIoException if the reader fails
     */
    public Optional<Testline> next() {
        if (lookahead == null) {
            if (trailingPlan) {
                skipRemaining();
            }
            return Optional.empty();
        }
        TapLine tl = LineClassifier.classifyTest(lookahead);
        if (tl == null) {
            throw new TapGrammarException(lookahead, lookaheadLine);
        }
        Integer num = tl.number == null ? null : toNumber("invalid test number", tl.number);
        Testline testline = new Testline(tl.ok, num, tl.description, tl.directive, tl.explanation, lookaheadLine);
        lookahead = null;
        String line;
        while ((line = readTrimmed()) != null) {
            TapLine next = LineClassifier.classify(line);
            if (logger.isTraceEnabled()) {
                logger.trace("{}: {}", lineNumber, next);
            }
            switch (next.type) {
                case BLANK:
                    continue;
                case DIAGNOSTIC:
                    testline.appendDiagnostic(next.comment);
                    continue;
                case BLOCK_START:
                    if (!readBlock(testline)) {
                        return complete(testline);
                    }
                    continue;
                case PLAN:
                    if (suite.hasPlan()) {
                        throw new TapProtocolException("duplicate plan: " + line, lineNumber);
                    }
                    setPlan(next);
                    trailingPlan = true;
                    return complete(testline);
                default:
                    lookahead = line;
                    lookaheadLine = lineNumber;
                    return complete(testline);
            }
        }
        return complete(testline);
    }

    /**
     * Number of lines read from the source so far, counting lookahead.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * The suite collected so far. Only conclusive after {@link #suite()} returns.
     */
    public Testsuite getSuite() {
        return suite;
    }

    // ========== Internals ==========

    private void readHeader() {
        String line = readTrimmed();
        if (line == null) {
            logger.debug("empty input");
            return;
        }
        TapLine first = LineClassifier.classify(line);
        if (first.is(LineType.VERSION)) {
            suite.setVersion(toNumber("invalid version", first.number));
            logger.debug("TAP version {}", suite.getVersion());
            line = readTrimmed();
        }
        while (line != null) {
            TapLine tl = LineClassifier.classify(line);
            if (tl.is(LineType.BLANK)) {
                line = readTrimmed();
            } else if (tl.is(LineType.DIAGNOSTIC)) {
                suite.appendPreamble(tl.comment);
                line = readTrimmed();
            } else if (tl.is(LineType.PLAN)) {
                if (suite.hasPlan()) {
                    throw new TapProtocolException("duplicate plan: " + line, lineNumber);
                }
                setPlan(tl);
                line = readTrimmed();
            } else {
                break;
            }
        }
        lookahead = line;
        lookaheadLine = lineNumber;
    }

    // a trailing plan ends the stream, whatever follows is read and dropped
    private void skipRemaining() {
        trailingPlan = false;
        int planLine = lineNumber;
        int ignored = 0;
        String line;
        while ((line = readTrimmed()) != null) {
            if (!line.isEmpty()) {
                ignored++;
                logger.debug("{}: ignored after trailing plan: {}", lineNumber, line);
            }
        }
        if (ignored > 0) {
            logger.debug("ignored {} lines after trailing plan on line {}", ignored, planLine);
        }
    }

    // false if the input ended before the closing marker
    private boolean readBlock(Testline testline) {
        String raw;
        while ((raw = readRaw()) != null) {
            if (LineClassifier.classify(raw.trim()).is(LineType.BLOCK_END)) {
                return true;
            }
            testline.appendBlock(raw);
        }
        logger.debug("input ended inside block of: {}", testline);
        return false;
    }

    private Optional<Testline> complete(Testline testline) {
        suite.addTest(testline);
        return Optional.of(testline);
    }

    private void setPlan(TapLine tl) {
        suite.setPlan(toNumber("invalid plan", tl.number));
        logger.debug("plan: 1..{}", suite.getPlan());
    }

    private static int toNumber(String message, String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new TapNumberException(message, text, e);
        }
    }

    private String readTrimmed() {
        String raw = readRaw();
        return raw == null ? null : raw.trim();
    }

    private String readRaw() {
        try {
            String raw = reader.readLine();
            if (raw != null) {
                lineNumber++;
            }
            return raw;
        } catch (IOException e) {
            throw new TapIoException("read failed after line " + lineNumber, e);
        }
    }

}
