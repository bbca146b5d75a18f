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
package io.tapkit.output;

import io.tapkit.core.RunResult;
import io.tapkit.core.SourceResult;
import io.tapkit.model.Testline;
import io.tapkit.model.Testsuite;
import org.slf4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Generates JUnit XML reports compatible with CI systems (Jenkins, GitHub Actions, etc.).
 * <p>
 * One {@code testsuite} per TAP source, one {@code testcase} per test line:
 * <pre>
 * &lt;testsuites name="tapkit" tests="N" failures="N" errors="N" skipped="N" time="secs"&gt;
 *   &lt;testsuite name="source" tests="N" failures="N" errors="N" skipped="N" time="secs"&gt;
 *     &lt;testcase name="description" classname="source"&gt;
 *       &lt;failure message="not ok 2 description"&gt;diagnostics and block&lt;/failure&gt;
 *     &lt;/testcase&gt;
 *   &lt;/testsuite&gt;
 * &lt;/testsuites&gt;
 * </pre>
 * A {@code not ok} TODO test is not a failing testcase and passing SKIP tests
 * become {@code skipped}, a {@code not ok} SKIP test is a failure. A source that failed without a failing test line (plan
 * problem, not ok TODO, parse error) gets an extra {@code testcase} named
 * "verdict" carrying the reason.
 */
public final class JunitXmlWriter {

    public static final String FILE_NAME = "tapkit-junit.xml";

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private JunitXmlWriter() {
    }

    /**
     * Write {@value #FILE_NAME} into the output directory. Failures are logged, not thrown.
     *
     * @return the written file, or null if writing failed
     */
    public static Path write(RunResult result, Path outputDir) {
        try {
            if (!Files.exists(outputDir)) {
                Files.createDirectories(outputDir);
            }
            Path xmlPath = outputDir.resolve(FILE_NAME);
            Files.writeString(xmlPath, toXml(result));
            logger.debug("JUnit XML written: {}", xmlPath);
            return xmlPath;
        } catch (Exception e) {
            logger.warn("failed to write JUnit XML to {}: {}", outputDir, e.getMessage());
            return null;
        }
    }

    public static String toXml(RunResult result) {
        DecimalFormat formatter = (DecimalFormat) NumberFormat.getNumberInstance(Locale.US);
        formatter.applyPattern("0.######");

        int tests = 0;
        int failures = 0;
        int errors = 0;
        int skipped = 0;
        StringBuilder body = new StringBuilder();
        for (SourceResult sr : result.getSourceResults()) {
            tests += testCount(sr);
            failures += failureCount(sr);
            errors += sr.isError() ? 1 : 0;
            skipped += skippedCount(sr);
            writeTestsuite(body, sr, formatter);
        }

        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<testsuites");
        xml.append(" name=\"tapkit\"");
        xml.append(" tests=\"").append(tests).append("\"");
        xml.append(" failures=\"").append(failures).append("\"");
        xml.append(" errors=\"").append(errors).append("\"");
        xml.append(" skipped=\"").append(skipped).append("\"");
        xml.append(" time=\"").append(formatter.format(result.getDurationMillis() / 1000.0)).append("\"");
        xml.append(">\n");
        xml.append(body);
        xml.append("</testsuites>\n");
        return xml.toString();
    }

    // the synthetic "verdict" testcase is counted as a test
    private static int testCount(SourceResult sr) {
        return sr.getSuite().getTestCount() + (needsVerdictCase(sr) ? 1 : 0);
    }

    private static int failureCount(SourceResult sr) {
        int count = sr.getFailedTests().size();
        if (needsVerdictCase(sr) && !sr.isError()) {
            count++;
        }
        return count;
    }

    // a not ok SKIP is written as a failure, not as skipped
    private static int skippedCount(SourceResult sr) {
        int count = 0;
        for (Testline t : sr.getSuite().getTests()) {
            if (t.isSkip() && !t.isFailed()) {
                count++;
            }
        }
        return count;
    }

    private static boolean needsVerdictCase(SourceResult sr) {
        return sr.getFailureMessage() != null;
    }

    private static void writeTestsuite(StringBuilder xml, SourceResult sr, DecimalFormat formatter) {
        Testsuite suite = sr.getSuite();
        xml.append("<testsuite");
        xml.append(" name=\"").append(escape(sr.getName())).append("\"");
        xml.append(" tests=\"").append(testCount(sr)).append("\"");
        xml.append(" failures=\"").append(failureCount(sr)).append("\"");
        xml.append(" errors=\"").append(sr.isError() ? 1 : 0).append("\"");
        xml.append(" skipped=\"").append(skippedCount(sr)).append("\"");
        xml.append(" time=\"").append(formatter.format(sr.getDurationMillis() / 1000.0)).append("\"");
        xml.append(">\n");

        if (!suite.getPreamble().isEmpty()) {
            xml.append("<system-out>").append(escape(suite.getPreamble())).append("</system-out>\n");
        }
        for (Testline t : suite.getTests()) {
            writeTestcase(xml, t, sr.getName());
        }
        if (needsVerdictCase(sr)) {
            String message = sr.getFailureMessage();
            xml.append("<testcase classname=\"").append(escape(sr.getName())).append("\" name=\"verdict\">");
            xml.append(sr.isError() ? "<error" : "<failure");
            xml.append(" message=\"").append(escape(truncate(message, 1000))).append("\">");
            xml.append(escape(message));
            xml.append(sr.isError() ? "</error>" : "</failure>");
            xml.append("</testcase>\n");
        }
        xml.append("</testsuite>\n");
    }

    private static void writeTestcase(StringBuilder xml, Testline t, String classname) {
        xml.append("<testcase");
        xml.append(" classname=\"").append(escape(classname)).append("\"");
        xml.append(" name=\"").append(escape(t.getDisplayName())).append("\"");
        xml.append(">");

        String details = details(t);
        if (t.isFailed()) {
            xml.append("<failure message=\"").append(escape(truncate(t.toString(), 1000))).append("\">");
            xml.append(escape(details));
            xml.append("</failure>");
        } else if (t.isSkip()) {
            xml.append("<skipped message=\"").append(escape(t.getExplanation())).append("\"/>");
        } else if (!details.isEmpty()) {
            xml.append("<system-out>").append(escape(details)).append("</system-out>");
        }

        xml.append("</testcase>\n");
    }

    private static String details(Testline t) {
        StringBuilder sb = new StringBuilder(t.getDiagnostic());
        if (t.hasBlock()) {
            sb.append("---\n").append(t.getBlock()).append("...\n");
        }
        return sb.toString();
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }

}
