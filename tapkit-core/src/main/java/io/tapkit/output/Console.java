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

import io.tapkit.model.Testline;
import org.slf4j.Logger;

import java.io.PrintStream;
import java.util.regex.Pattern;

/**
 * Terminal output for run summaries. Text is colored by TAP outcome when the
 * terminal supports it, and every printed line is mirrored without escape
 * codes to the tapkit.console logger at TRACE.
 */
public final class Console {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    private static final Pattern ANSI = Pattern.compile("\u001B\\[[;\\d]*m");

    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String GREEN = "\u001B[92m";
    private static final String RED = "\u001B[91m";
    private static final String YELLOW = "\u001B[93m";
    private static final String CYAN = "\u001B[36m";
    private static final String GREY = "\u001B[90m";

    private static final int RULE_WIDTH = 60;

    private static boolean colorsEnabled = detectColors();
    private static PrintStream out = System.out;

    private Console() {
    }

    // NO_COLOR wins over FORCE_COLOR, see https://no-color.org
    private static boolean detectColors() {
        if (System.getenv("NO_COLOR") != null) {
            return false;
        }
        String force = System.getenv("FORCE_COLOR");
        if (force != null) {
            return !force.equals("0");
        }
        String term = System.getenv("TERM");
        if (term == null || term.equals("dumb")) {
            return System.getenv("COLORTERM") != null;
        }
        return System.console() != null;
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    private static String paint(String text, String codes) {
        return colorsEnabled ? codes + text + RESET : text;
    }

    // ========== Outcomes ==========

    public static String pass(String text) {
        return paint(text, GREEN);
    }

    public static String fail(String text) {
        return paint(text, RED + BOLD);
    }

    public static String warn(String text) {
        return paint(text, YELLOW);
    }

    public static String todo(String text) {
        return paint(text, CYAN);
    }

    public static String skip(String text) {
        return paint(text, GREY);
    }

    /**
     * A test line as TAP text, colored by what it contributes to the verdict.
     */
    public static String testline(Testline t) {
        String text = t.toString();
        if (t.isSkip()) {
            return skip(text);
        }
        if (t.isTodo()) {
            return todo(text);
        }
        return t.isOk() ? pass(text) : fail(text);
    }

    public static String rule() {
        return "=".repeat(RULE_WIDTH);
    }

    // ========== Output ==========

    public static void println(String text) {
        out.println(text);
        if (logger.isTraceEnabled()) {
            logger.trace(ANSI.matcher(text).replaceAll(""));
        }
    }

    public static void println() {
        out.println();
    }

}
