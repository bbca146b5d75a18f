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

/**
 * One classified line and the fields extracted from it. Which fields are set
 * depends on the {@link LineType}:
 * <ul>
 *   <li>{@code VERSION}, {@code PLAN}: {@link #number}</li>
 *   <li>{@code TEST}: {@link #ok}, {@link #number} (may be null), {@link #description},
 *   {@link #directive}, {@link #explanation}</li>
 *   <li>{@code DIAGNOSTIC}: {@link #comment}</li>
 * </ul>
 * Numbers are kept as text, converting them is up to the caller.
 */
public class TapLine {

    public final LineType type;
    public final String text;
    public final boolean ok;
    public final String number;
    public final String description;
    public final Directive directive;
    public final String explanation;
    public final String comment;

    private TapLine(LineType type, String text, boolean ok, String number, String description,
                    Directive directive, String explanation, String comment) {
        this.type = type;
        this.text = text;
        this.ok = ok;
        this.number = number;
        this.description = description;
        this.directive = directive;
        this.explanation = explanation;
        this.comment = comment;
    }

    static TapLine of(LineType type, String text) {
        return new TapLine(type, text, false, null, null, Directive.NONE, null, null);
    }

    static TapLine number(LineType type, String text, String number) {
        return new TapLine(type, text, false, number, null, Directive.NONE, null, null);
    }

    static TapLine comment(String text, String comment) {
        return new TapLine(LineType.DIAGNOSTIC, text, false, null, null, Directive.NONE, null, comment);
    }

    static TapLine test(String text, boolean ok, String number, String description,
                        Directive directive, String explanation) {
        return new TapLine(LineType.TEST, text, ok, number, description, directive, explanation, null);
    }

    public boolean is(LineType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type + " " + text;
    }

}
