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

import io.tapkit.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;

    @BeforeEach
    void setup() {
        out = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(false);
    }

    @AfterEach
    void cleanup() {
        Console.setOutput(System.out);
    }

    private int run(String stdin, String... args) {
        Main main = new Main();
        main.stdin = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return new CommandLine(main).execute(args);
    }

    private Path write(String name, String text) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, text);
        return file;
    }

    @Test
    void testStdinPass() {
        assertEquals(Main.EXIT_PASSED, run("1..1\nok 1\n", "--no-pom"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("all passed"));
    }

    @Test
    void testStdinFail() {
        assertEquals(Main.EXIT_FAILED, run("1..2\nok 1\nnot ok 2\n", "--no-pom"));
    }

    @Test
    void testParseError() throws Exception {
        Path file = write("bad.tap", "1..3\nok 1\nok 2\nok 3\n1..3\n");
        assertEquals(Main.EXIT_PARSE_ERROR, run("", "--no-pom", file.toString()));
    }

    @Test
    void testQuiet() {
        assertEquals(Main.EXIT_PASSED, run("1..1\nok 1\n", "--no-pom", "-q"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testJunitXmlOption() throws Exception {
        Path file = write("pass.tap", "1..1\nok 1\n");
        Path reports = tempDir.resolve("reports");
        int code = run("", "--no-pom", "-q", "--junit-xml", "-o", reports.toString(), file.toString());
        assertEquals(Main.EXIT_PASSED, code);
        assertTrue(Files.exists(reports.resolve("tapkit-junit.xml")));
        assertFalse(Files.exists(reports.resolve("tapkit-report.json")));
    }

    @Test
    void testPomSuppliesPathsAndOutput() throws Exception {
        Path file = write("pom.tap", "1..1\nok 1\n");
        Path reports = tempDir.resolve("pom-reports");
        Path pom = write("custom-pom.json", "{\"paths\": [\"" + file.toString().replace("\\", "\\\\")
                + "\"], \"output\": {\"dir\": \"" + reports.toString().replace("\\", "\\\\") + "\", \"json\": true}}");
        int code = run("not tap at all", "-q", "-p", pom.toString());
        assertEquals(Main.EXIT_PASSED, code);
        assertTrue(Files.exists(reports.resolve("tapkit-report.json")));
    }

    @Test
    void testVersion() {
        assertEquals(0, run("", "--version"));
    }

}
