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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern rules that sort one trimmed TAP line into a {@link LineType}.
 * Stateless, every rule is anchored to the whole line. Whether a category is
 * legal at a given position is decided by {@link TapParser}, not here.
 */
public final class LineClassifier {

    static final Pattern VERSION = Pattern.compile("^TAP version (\\d+)$");
    static final Pattern PLAN = Pattern.compile("^1\\.\\.(\\d+)$");
    // number only counts when followed by whitespace, '#' or the end
    static final Pattern TEST = Pattern.compile("^(not\\s+)?ok(?:\\s+(\\d+)(?=[\\s#]|$))?(?:(?=[\\s#])(.*))?$");
    static final Pattern DIRECTIVE = Pattern.compile("^(todo|skip)\\S*(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE);
    static final Pattern DIAGNOSTIC = Pattern.compile("^#\\s*(.*)$");
    static final Pattern BLOCK_START = Pattern.compile("^---$");
    static final Pattern BLOCK_END = Pattern.compile("^\\.\\.\\.$");

    private LineClassifier() {
    }

    /**
     * @param line a line already stripped of surrounding whitespace
     */
    public static TapLine classify(String line) {
        if (line == null || line.isEmpty()) {
            return TapLine.of(LineType.BLANK, "");
        }
        Matcher m = VERSION.matcher(line);
        if (m.matches()) {
            return TapLine.number(LineType.VERSION, line, m.group(1));
        }
        m = PLAN.matcher(line);
        if (m.matches()) {
            return TapLine.number(LineType.PLAN, line, m.group(1));
        }
        TapLine test = classifyTest(line);
        if (test != null) {
            return test;
        }
        if (BLOCK_START.matcher(line).matches()) {
            return TapLine.of(LineType.BLOCK_START, line);
        }
        if (BLOCK_END.matcher(line).matches()) {
            return TapLine.of(LineType.BLOCK_END, line);
        }
        m = DIAGNOSTIC.matcher(line);
        if (m.matches()) {
            return TapLine.comment(line, m.group(1));
        }
        return TapLine.of(LineType.UNKNOWN, line);
    }

    /**
     * Match the test-result grammar only.
     *
     * @return the classified line, or null if the line is not a test result
     */
    public static TapLine classifyTest(String line) {
        Matcher m = TEST.matcher(line);
        if (!m.matches()) {
            return null;
        }
        boolean ok = m.group(1) == null;
        String number = m.group(2);
        String rest = m.group(3) == null ? "" : m.group(3);
        String description;
        Directive directive = Directive.NONE;
        String explanation = "";
        int pos = rest.indexOf('#');
        if (pos == -1) {
            description = rest.trim();
        } else {
            description = rest.substring(0, pos).trim();
            String comment = rest.substring(pos + 1).trim();
            Matcher dm = DIRECTIVE.matcher(comment);
            if (dm.matches()) {
                directive = Directive.of(dm.group(1));
                explanation = dm.group(2) == null ? "" : dm.group(2).trim();
            } else {
                // not a directive, so the '#' was part of the description
                description = rest.trim();
            }
        }
        return TapLine.test(line, ok, number, stripDash(description), directive, explanation);
    }

    // "ok 1 - foo" is the usual spelling of "ok 1 foo"
    private static String stripDash(String description) {
        if (description.equals("-")) {
            return "";
        }
        if (description.startsWith("- ")) {
            return description.substring(2).trim();
        }
        return description;
    }

}
