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

import io.tapkit.model.Testline;
import io.tapkit.model.Testsuite;
import io.tapkit.parser.TapException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of parsing one TAP source. When parsing stopped on an error the
 * suite holds what was read up to that point and the source counts as failed.
 */
public class SourceResult {

    private final String name;
    private final Testsuite suite;
    private final TapException error;
    private long startTime;
    private long endTime;

    public SourceResult(String name, Testsuite suite, TapException error) {
        this.name = name;
        this.suite = suite == null ? new Testsuite() : suite;
        this.error = error;
    }

    public String getName() {
        return name;
    }

    public Testsuite getSuite() {
        return suite;
    }

    public TapException getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public boolean isPassed() {
        return error == null && suite.isOk();
    }

    public boolean isFailed() {
        return !isPassed();
    }

    public List<Testline> getFailedTests() {
        List<Testline> failed = new ArrayList<>();
        for (Testline t : suite.getTests()) {
            if (t.isFailed()) {
                failed.add(t);
            }
        }
        return failed;
    }

    /**
     * Why this source failed when no single test line explains it, else null.
     */
    public String getFailureMessage() {
        if (error != null) {
            return error.getMessage();
        }
        if (suite.isOk()) {
            return null;
        }
        String problem = suite.getPlanProblem();
        if (problem != null) {
            return problem;
        }
        return getFailedTests().isEmpty() ? "a TODO test reported not ok" : null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("status", isPassed() ? "passed" : "failed");
        if (error != null) {
            map.put("error", error.getMessage());
        }
        map.put("duration_millis", getDurationMillis());
        map.put("suite", suite.toMap());
        return map;
    }

    @Override
    public String toString() {
        return name + (isPassed() ? " [passed]" : " [failed]");
    }

}
