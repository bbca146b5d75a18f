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

import java.util.Locale;

/**
 * Annotation carried by a test line after a {@code #}: {@code TODO} marks an
 * expected failure, {@code SKIP} a test that was not executed.
 */
public enum Directive {

    NONE,
    TODO,
    SKIP;

    /**
     * Resolve a directive keyword, ignoring case. Prefixes such as
     * {@code skipped} or {@code todos} resolve to the keyword they start with.
     *
     * @param keyword the word following {@code #}, may be null
     * @return the matching directive, or {@link #NONE}
     */
    public static Directive of(String keyword) {
        if (keyword == null || keyword.isEmpty()) {
            return NONE;
        }
        String lower = keyword.toLowerCase(Locale.ROOT);
        if (lower.startsWith("todo")) {
            return TODO;
        }
        if (lower.startsWith("skip")) {
            return SKIP;
        }
        return NONE;
    }

    @Override
    public String toString() {
        return this == NONE ? "None" : name();
    }

}
