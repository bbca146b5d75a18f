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
import io.tapkit.output.Console;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RunResult {

    private final List<SourceResult> sourceResults = new ArrayList<>();
    private long startTime;
    private long endTime;

    public void addSourceResult(SourceResult sr) {
        sourceResults.add(sr);
    }

    public List<SourceResult> getSourceResults() {
        return sourceResults;
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

    // ========== Aggregation ==========

    public int getSourceCount() {
        return sourceResults.size();
    }

    public int getSourcePassedCount() {
        return (int) sourceResults.stream().filter(SourceResult::isPassed).count();
    }

    public int getSourceFailedCount() {
        return (int) sourceResults.stream().filter(SourceResult::isFailed).count();
    }

    public int getErrorCount() {
        return (int) sourceResults.stream().filter(SourceResult::isError).count();
    }

    public int getTestCount() {
        return sourceResults.stream().mapToInt(sr -> sr.getSuite().getTestCount()).sum();
    }

    public int getTestPassedCount() {
        return sourceResults.stream().mapToInt(sr -> sr.getSuite().getPassedCount()).sum();
    }

    public int getTestFailedCount() {
        return sourceResults.stream().mapToInt(sr -> sr.getSuite().getFailedCount()).sum();
    }

    public int getTestTodoCount() {
        return sourceResults.stream().mapToInt(sr -> sr.getSuite().getTodoCount()).sum();
    }

    public int getTestSkipCount() {
        return sourceResults.stream().mapToInt(sr -> sr.getSuite().getSkipCount()).sum();
    }

    /**
     * An empty run is not a pass: nothing was verified.
     */
    public boolean isPassed() {
        return !sourceResults.isEmpty() && sourceResults.stream().allMatch(SourceResult::isPassed);
    }

    public boolean isFailed() {
        return !isPassed();
    }

    public List<SourceResult> getFailedSources() {
        List<SourceResult> failed = new ArrayList<>();
        for (SourceResult sr : sourceResults) {
            if (sr.isFailed()) {
                failed.add(sr);
            }
        }
        return failed;
    }

    // ========== Serialization ==========

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("source_count", getSourceCount());
        summary.put("source_passed", getSourcePassedCount());
        summary.put("source_failed", getSourceFailedCount());
        summary.put("test_count", getTestCount());
        summary.put("test_passed", getTestPassedCount());
        summary.put("test_failed", getTestFailedCount());
        summary.put("test_todo", getTestTodoCount());
        summary.put("test_skip", getTestSkipCount());
        summary.put("duration_millis", getDurationMillis());
        summary.put("status", isFailed() ? "failed" : "passed");
        map.put("summary", summary);
        List<Map<String, Object>> sources = new ArrayList<>();
        for (SourceResult sr : sourceResults) {
            sources.add(sr.toMap());
        }
        map.put("sources", sources);
        return map;
    }

    // ========== Console Output ==========

    public void printSummary() {
        Console.println();
        Console.println(Console.rule());
        Console.println("tapkit " + Globals.VERSION);
        Console.println(Console.rule());

        Console.println(String.format("elapsed: %6.2fs", getDurationMillis() / 1000.0));
        Console.println();

        int sourceFailed = getSourceFailedCount();
        String sourceStatus = sourceFailed > 0
                ? Console.fail(sourceFailed + " failed")
                : Console.pass("all passed");
        Console.println(String.format("sources: %4d | passed: %4d | %s",
                getSourceCount(), getSourcePassedCount(), sourceStatus));

        int testFailed = getTestFailedCount();
        String testStatus = testFailed > 0
                ? Console.fail(testFailed + " failed")
                : Console.pass("none failed");
        Console.println(String.format("tests: %6d | passed: %4d | todo: %3d | skip: %3d | %s",
                getTestCount(), getTestPassedCount(), getTestTodoCount(), getTestSkipCount(), testStatus));

        Console.println(Console.rule());

        List<SourceResult> failedSources = getFailedSources();
        if (!failedSources.isEmpty()) {
            Console.println();
            Console.println(Console.fail("failed sources:"));
            for (SourceResult sr : failedSources) {
                Console.println("  " + Console.fail(sr.getName()));
                if (sr.getFailureMessage() != null) {
                    Console.println("    " + Console.warn(sr.getFailureMessage()));
                }
                for (Testline t : sr.getFailedTests()) {
                    Console.println("    - " + Console.testline(t));
                    String diagnostic = t.getDiagnostic();
                    if (!diagnostic.isEmpty()) {
                        String msg = diagnostic.strip().replace('\n', ' ');
                        if (msg.length() > 80) {
                            msg = msg.substring(0, 77) + "...";
                        }
                        Console.println("      " + Console.warn(msg));
                    }
                }
            }
            Console.println();
        }
    }

    @Override
    public String toString() {
        return "RunResult{sources=" + getSourceCount() + ", failed=" + getSourceFailedCount() + "}";
    }

}
