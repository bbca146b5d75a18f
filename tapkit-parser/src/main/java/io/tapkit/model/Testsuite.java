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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of parsing one TAP stream.
 * <p>
 * Starts out empty with no plan and an optimistic verdict. The parser adds
 * test lines as it yields them, and {@code TapParser.suite()} settles the
 * verdict once the stream is exhausted. A suite read back after a parse error
 * holds whatever was collected up to that point.
 */
public class Testsuite {

    public static final int NO_PLAN = -1;
    public static final int NO_VERSION = -1;

    private final List<Testline> tests = new ArrayList<>();
    private final StringBuilder preamble = new StringBuilder();
    private boolean ok = true;
    private int plan = NO_PLAN;
    private int version = NO_VERSION;

    public void addTest(Testline testline) {
        tests.add(testline);
    }

    public void appendPreamble(String text) {
        preamble.append(text).append('\n');
    }

    public List<Testline> getTests() {
        return Collections.unmodifiableList(tests);
    }

    public int getTestCount() {
        return tests.size();
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public int getPlan() {
        return plan;
    }

    public void setPlan(int plan) {
        this.plan = plan;
    }

    public boolean hasPlan() {
        return plan != NO_PLAN;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    /**
     * Diagnostic comments seen before the first test line.
     */
    public String getPreamble() {
        return preamble.toString();
    }

    // ========== Aggregation ==========

    public int getPassedCount() {
        return (int) tests.stream().filter(Testline::isOk).count();
    }

    public int getFailedCount() {
        return (int) tests.stream().filter(Testline::isFailed).count();
    }

    public int getTodoCount() {
        return (int) tests.stream().filter(Testline::isTodo).count();
    }

    public int getSkipCount() {
        return (int) tests.stream().filter(Testline::isSkip).count();
    }

    /**
     * Why the verdict is false when no individual test failed, or null.
     */
    public String getPlanProblem() {
        if (!hasPlan()) {
            return "no plan declared";
        }
        if (plan == 0) {
            return "plan declares zero tests";
        }
        if (tests.size() != plan) {
            return "planned " + plan + " tests but saw " + tests.size();
        }
        return null;
    }

    // ========== Serialization ==========

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ok", ok);
        map.put("plan", hasPlan() ? plan : null);
        if (version != NO_VERSION) {
            map.put("version", version);
        }
        map.put("passed", getPassedCount());
        map.put("failed", getFailedCount());
        map.put("todo", getTodoCount());
        map.put("skip", getSkipCount());
        List<Map<String, Object>> list = new ArrayList<>(tests.size());
        for (Testline t : tests) {
            Map<String, Object> tm = new LinkedHashMap<>();
            tm.put("ok", t.isOk());
            tm.put("num", t.hasNum() ? t.getNum() : null);
            tm.put("description", t.getDescription());
            if (t.getDirective() != Directive.NONE) {
                tm.put("directive", t.getDirective().name());
                tm.put("explanation", t.getExplanation());
            }
            if (!t.getDiagnostic().isEmpty()) {
                tm.put("diagnostic", t.getDiagnostic());
            }
            if (t.hasBlock()) {
                tm.put("block", t.getBlock());
            }
            tm.put("line", t.getLine());
            list.add(tm);
        }
        map.put("tests", list);
        return map;
    }

    @Override
    public String toString() {
        return "Testsuite{ok=" + ok + ", plan=" + plan + ", tests=" + tests.size() + "}";
    }

}
