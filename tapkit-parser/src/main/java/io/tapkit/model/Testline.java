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
package io.tapkit.model;

/**
 * A single reported test result, together with the diagnostics and the
 * inline block that followed it in the stream.
 */
public class Testline {

    private final boolean ok;
    private final Integer num;
    private final String description;
    private final Directive directive;
    private final String explanation;
    private final int line;

    private final StringBuilder diagnostic = new StringBuilder();
    private final StringBuilder block = new StringBuilder();

    public Testline(boolean ok, Integer num, String description, Directive directive, String explanation, int line) {
        this.ok = ok;
        this.num = num;
        this.description = description == null ? "" : description;
        this.directive = directive == null ? Directive.NONE : directive;
        this.explanation = explanation == null ? "" : explanation;
        this.line = line;
    }

    public Testline(boolean ok, Integer num, String description) {
        this(ok, num, description, Directive.NONE, "", 0);
    }

    public void appendDiagnostic(String text) {
        diagnostic.append(text).append('\n');
    }

    public void appendBlock(String rawLine) {
        block.append(rawLine).append('\n');
    }

    public boolean isOk() {
        return ok;
    }

    /**
     * @return the test number, or 0 when the line carried none
     */
    public int getNum() {
        return num == null ? 0 : num;
    }

    /**
     * Distinguishes {@code ok 0} from a plain {@code ok}.
     */
    public boolean hasNum() {
        return num != null;
    }

    public String getDescription() {
        return description;
    }

    public Directive getDirective() {
        return directive;
    }

    public String getExplanation() {
        return explanation;
    }

    public String getDiagnostic() {
        return diagnostic.toString();
    }

    public String getBlock() {
        return block.toString();
    }

    public boolean hasBlock() {
        return block.length() > 0;
    }

    /**
     * 1-based line number of the test result in its source, 0 if unknown.
     */
    public int getLine() {
        return line;
    }

    public boolean isTodo() {
        return directive == Directive.TODO;
    }

    public boolean isSkip() {
        return directive == Directive.SKIP;
    }

    /**
     * A {@code not ok} that is not excused by a TODO directive.
     */
    public boolean isFailed() {
        return !ok && !isTodo();
    }

    /**
     * Name used in reports: the description, else the number, else the line.
     */
    public String getDisplayName() {
        if (!description.isEmpty()) {
            return description;
        }
        if (num != null) {
            return "test " + num;
        }
        return "line " + line;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(ok ? "ok" : "not ok");
        if (num != null) {
            sb.append(' ').append(num);
        }
        if (!description.isEmpty()) {
            sb.append(' ').append(description);
        }
        if (directive != Directive.NONE) {
            sb.append(" # ").append(directive.name());
            if (!explanation.isEmpty()) {
                sb.append(' ').append(explanation);
            }
        }
        return sb.toString();
    }

}
