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

import io.tapkit.core.RunResult;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the whole run, summary first and then every source with its test
 * lines, as a single JSON document.
 */
public final class JsonReportWriter {

    public static final String FILE_NAME = "tapkit-report.json";

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    // keys and string values always quoted
    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private JsonReportWriter() {
    }

    /**
     * @return the written file, or null if writing failed
     */
    public static Path write(RunResult result, Path outputDir) {
        try {
            if (!Files.exists(outputDir)) {
                Files.createDirectories(outputDir);
            }
            Path jsonPath = outputDir.resolve(FILE_NAME);
            Files.writeString(jsonPath, toJson(result));
            logger.debug("JSON report written: {}", jsonPath);
            return jsonPath;
        } catch (Exception e) {
            logger.warn("failed to write JSON report to {}: {}", outputDir, e.getMessage());
            return null;
        }
    }

    public static String toJson(RunResult result) {
        return JSONValue.toJSONString(result.toMap(), JSON_STYLE);
    }

}
