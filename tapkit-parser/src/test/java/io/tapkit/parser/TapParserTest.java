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

import io.tapkit.model.Directive;
import io.tapkit.model.Testline;
import io.tapkit.model.Testsuite;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TapParserTest {

    @TempDir
    Path tempDir;

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    void testScenarioMixedResults() {
        Testsuite suite = TapParser.parse(lines("1..2", "ok 1 first", "not ok 2 second"));
        assertEquals(2, suite.getPlan());
        List<Testline> tests = suite.getTests();
        assertEquals(2, tests.size());
        assertTrue(tests.get(0).isOk());
        assertEquals(1, tests.get(0).getNum());
        assertEquals("first", tests.get(0).getDescription());
        assertFalse(tests.get(1).isOk());
        assertEquals(2, tests.get(1).getNum());
        assertEquals("second", tests.get(1).getDescription());
        assertFalse(suite.isOk());
    }

    @Test
    void testScenarioVersionHeader() {
        Testsuite suite = TapParser.parse(lines("TAP version 13", "1..1", "ok 1"));
        assertEquals(13, suite.getVersion());
        assertEquals(1, suite.getPlan());
        assertEquals(1, suite.getTestCount());
        assertTrue(suite.getTests().get(0).isOk());
        assertEquals(1, suite.getTests().get(0).getNum());
        assertTrue(suite.isOk());
    }

    @Test
    void testScenarioTodo() {
        Testsuite suite = TapParser.parse(lines("1..1", "ok 1 # TODO not yet implemented"));
        Testline t = suite.getTests().get(0);
        assertEquals(Directive.TODO, t.getDirective());
        assertEquals("not yet implemented", t.getExplanation());
        assertTrue(t.isOk());
        assertTrue(suite.isOk());
    }

    @Test
    void testScenarioDuplicatePlan() {
        TapParser parser = TapParser.of(lines("1..3", "ok 1", "ok 2", "ok 3", "1..3"));
        TapProtocolException e = assertThrows(TapProtocolException.class, parser::suite);
        assertEquals(5, e.getLine());
        assertTrue(e.getMessage().contains("duplicate plan"));
        // partial suite is kept
        assertEquals(2, parser.getSuite().getTestCount());
    }

    @Test
    void testDuplicatePlanInHeader() {
        assertThrows(TapProtocolException.class, () -> TapParser.of(lines("1..2", "1..2", "ok 1")));
    }

    @Test
    void testVerdictIsAndOfResults() {
        assertTrue(TapParser.parse(lines("1..3", "ok 1", "ok 2", "ok 3")).isOk());
        assertFalse(TapParser.parse(lines("1..3", "ok 1", "not ok 2", "ok 3")).isOk());
        // todo failures still count as not ok for the verdict
        assertFalse(TapParser.parse(lines("1..1", "not ok 1 # TODO")).isOk());
    }

    @Test
    void testMissingPlanFails() {
        Testsuite suite = TapParser.parse(lines("ok 1", "ok 2"));
        assertFalse(suite.hasPlan());
        assertEquals(Testsuite.NO_PLAN, suite.getPlan());
        assertEquals(2, suite.getTestCount());
        assertFalse(suite.isOk());
        assertEquals("no plan declared", suite.getPlanProblem());
    }

    @Test
    void testZeroPlanFails() {
        Testsuite suite = TapParser.parse("1..0");
        assertEquals(0, suite.getPlan());
        assertEquals(0, suite.getTestCount());
        assertFalse(suite.isOk());
    }

    @Test
    void testPlanCountMismatchFails() {
        Testsuite suite = TapParser.parse(lines("1..3", "ok 1", "ok 2"));
        assertFalse(suite.isOk());
        assertEquals("planned 3 tests but saw 2", suite.getPlanProblem());
        suite = TapParser.parse(lines("1..1", "ok 1", "ok 2"));
        assertFalse(suite.isOk());
    }

    @Test
    void testEmptyInput() {
        TapParser parser = TapParser.of("");
        assertFalse(parser.hasNext());
        assertTrue(parser.next().isEmpty());
        Testsuite suite = parser.suite();
        assertFalse(suite.isOk());
        assertEquals(0, suite.getTestCount());
    }

    @Test
    void testTrailingPlan() {
        Testsuite suite = TapParser.parse(lines("ok 1", "ok 2", "# done", "1..2"));
        assertEquals(2, suite.getPlan());
        assertEquals("done\n", suite.getTests().get(1).getDiagnostic());
        assertTrue(suite.isOk());
    }

    @Test
    void testLinesAfterTrailingPlanAreDropped() {
        TapParser parser = TapParser.of(lines("ok 1", "1..2", "ok 2", "", "not ok 3"));
        Testsuite suite = parser.suite();
        assertEquals(1, suite.getTestCount());
        assertFalse(suite.isOk());
        assertEquals("planned 2 tests but saw 1", suite.getPlanProblem());
        assertEquals(5, parser.getLineNumber());
        assertFalse(parser.hasNext());
        assertTrue(parser.next().isEmpty());
    }

    @Test
    void testDirectiveIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Testsuite suite = TapParser.parse(lines("1..2", "ok 1 # SKIP no db", "not ok 2 # TODO fix"));
            assertEquals(Directive.SKIP, suite.getTests().get(0).getDirective());
            assertEquals("no db", suite.getTests().get(0).getExplanation());
            assertEquals(Directive.TODO, suite.getTests().get(1).getDirective());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testTrailingPlanAfterBlock() {
        Testsuite suite = TapParser.parse(lines("ok 1", "  ---", "  a: 1", "  ...", "1..1"));
        assertEquals(1, suite.getPlan());
        assertTrue(suite.isOk());
        assertEquals("  a: 1\n", suite.getTests().get(0).getBlock());
    }

    @Test
    void testDiagnosticsAttachToPrecedingTest() {
        Testsuite suite = TapParser.parse(lines(
                "1..2",
                "not ok 1 first",
                "# expected: 1",
                "#   actual: 2",
                "ok 2 second",
                "# after second"));
        assertEquals("expected: 1\nactual: 2\n", suite.getTests().get(0).getDiagnostic());
        assertEquals("after second\n", suite.getTests().get(1).getDiagnostic());
    }

    @Test
    void testLastLineWithoutNewlineIsReturned() {
        TapParser parser = TapParser.of("1..1\nok 1 last");
        Optional<Testline> first = parser.next();
        assertTrue(first.isPresent());
        assertEquals("last", first.get().getDescription());
        assertTrue(parser.next().isEmpty());
        assertTrue(parser.next().isEmpty());
    }

    @Test
    void testNextYieldsOneAtATime() {
        TapParser parser = TapParser.of(lines("1..2", "ok 1 a", "ok 2 b"));
        assertTrue(parser.hasNext());
        assertEquals("a", parser.next().orElseThrow().getDescription());
        assertEquals(1, parser.getSuite().getTestCount());
        assertEquals("b", parser.next().orElseThrow().getDescription());
        assertFalse(parser.hasNext());
        assertTrue(parser.next().isEmpty());
        assertEquals(2, parser.getSuite().getTestCount());
    }

    @Test
    void testBlockIsCaptured() {
        Testsuite suite = TapParser.parse(lines(
                "TAP version 13",
                "1..2",
                "not ok 1 compare",
                "  ---",
                "  message: values differ",
                "  found: 2",
                "  ...",
                "ok 2"));
        Testline t = suite.getTests().get(0);
        assertTrue(t.hasBlock());
        assertEquals("  message: values differ\n  found: 2\n", t.getBlock());
        assertFalse(suite.getTests().get(1).hasBlock());
        assertEquals(2, suite.getTestCount());
    }

    @Test
    void testInputEndsInsideBlock() {
        TapParser parser = TapParser.of(lines("1..1", "ok 1", "---", "a: 1"));
        Testline t = parser.next().orElseThrow();
        assertEquals("a: 1\n", t.getBlock());
        assertTrue(parser.next().isEmpty());
        assertEquals(1, parser.getSuite().getTestCount());
    }

    @Test
    void testGrammarErrorCarriesText() {
        TapParser parser = TapParser.of(lines("1..2", "ok 1", "garbage here", "ok 2"));
        assertTrue(parser.next().isPresent());
        TapGrammarException e = assertThrows(TapGrammarException.class, parser::next);
        assertEquals("garbage here", e.getText());
        assertEquals(3, e.getLine());
    }

    @Test
    void testGrammarErrorOnFirstLine() {
        TapParser parser = TapParser.of(lines("1..1", "Bail out!"));
        assertThrows(TapGrammarException.class, parser::suite);
        assertEquals(0, parser.getSuite().getTestCount());
    }

    @Test
    void testNumberOverflow() {
        assertThrows(TapNumberException.class, () -> TapParser.of("1..99999999999"));
        TapParser parser = TapParser.of(lines("1..1", "ok 99999999999 big"));
        TapNumberException e = assertThrows(TapNumberException.class, parser::next);
        assertEquals("99999999999", e.getText());
    }

    @Test
    void testAbsentNumberVersusZero() {
        Testsuite suite = TapParser.parse(lines("1..2", "ok", "ok 0"));
        Testline absent = suite.getTests().get(0);
        Testline zero = suite.getTests().get(1);
        assertEquals(0, absent.getNum());
        assertFalse(absent.hasNum());
        assertEquals(0, zero.getNum());
        assertTrue(zero.hasNum());
    }

    @Test
    void testNumbersNeedNotBeSequential() {
        Testsuite suite = TapParser.parse(lines("1..3", "ok 3", "ok 3", "ok 1"));
        assertTrue(suite.isOk());
        assertEquals(3, suite.getTests().get(0).getNum());
        assertEquals(1, suite.getTests().get(2).getNum());
    }

    @Test
    void testPreambleAndBlankLines() {
        Testsuite suite = TapParser.parse(lines(
                "TAP version 14",
                "# running tests",
                "1..2",
                "",
                "ok 1",
                "",
                "ok 2",
                ""));
        assertEquals("running tests\n", suite.getPreamble());
        assertEquals(2, suite.getTestCount());
        assertTrue(suite.isOk());
    }

    @Test
    void testVersionOnlyOnFirstLine() {
        TapParser parser = TapParser.of(lines("1..1", "TAP version 13", "ok 1"));
        assertThrows(TapGrammarException.class, parser::next);
    }

    @Test
    void testLinesAreTrimmed() {
        Testsuite suite = TapParser.parse("  1..1  \r\n   ok 1 spaced   \r\n");
        assertEquals("spaced", suite.getTests().get(0).getDescription());
        assertTrue(suite.isOk());
    }

    @Test
    void testLineNumbers() {
        Testsuite suite = TapParser.parse(lines("1..2", "ok 1", "# d", "ok 2"));
        assertEquals(2, suite.getTests().get(0).getLine());
        assertEquals(4, suite.getTests().get(1).getLine());
    }

    @Test
    void testReaderFailure() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("boom");
            }

            @Override
            public void close() {
            }
        };
        TapIoException e = assertThrows(TapIoException.class, () -> new TapParser(failing));
        assertEquals("boom", e.getCause().getMessage());
    }

    @Test
    void testParseInputStreamAndPath() throws Exception {
        String text = lines("1..1", "ok 1 café");
        Testsuite suite = TapParser.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        assertEquals("café", suite.getTests().get(0).getDescription());
        Path file = tempDir.resolve("test.tap");
        Files.writeString(file, text);
        assertTrue(TapParser.parse(file).isOk());
        assertThrows(TapIoException.class, () -> TapParser.parse(tempDir.resolve("missing.tap")));
    }

}
