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

import net.minidev.json.JSONValue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Project configuration loaded from tapkit-pom.json. Defines what to parse
 * and which reports to write, CLI options override it.
 * <p>
 * Example tapkit-pom.json:
 * <pre>
 * {
 *   "paths": ["target/tap/"],
 *   "output": {
 *     "dir": "target/tapkit-reports",
 *     "junitXml": true,
 *     "json": false,
 *     "logLevel": "info"
 *   }
 * }
 * </pre>
 */
public class TapkitPom {

    public static final String DEFAULT_FILE = "tapkit-pom.json";

    private List<String> paths = new ArrayList<>();
    private OutputPom output = new OutputPom();

    public static class OutputPom {
        private String dir = "target/tapkit-reports";
        private boolean junitXml;
        private boolean json;
        private String logLevel;  // trace, debug, info, warn, error

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isJunitXml() {
            return junitXml;
        }

        public void setJunitXml(boolean junitXml) {
            this.junitXml = junitXml;
        }

        public boolean isJson() {
            return json;
        }

        public void setJson(boolean json) {
            this.json = json;
        }

        public String getLogLevel() {
            return logLevel;
        }

        public void setLogLevel(String logLevel) {
            this.logLevel = logLevel;
        }
    }

    /**
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static TapkitPom load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("failed to load config from: " + configPath, e);
        }
    }

    /**
     * @throws RuntimeException if the JSON is invalid or not an object
     */
    @SuppressWarnings("unchecked")
    public static TapkitPom parse(String json) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (Exception e) {
            throw new RuntimeException("invalid config: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new RuntimeException("invalid config: expected JSON object");
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        TapkitPom config = new TapkitPom();
        Object paths = map.get("paths");
        if (paths instanceof List) {
            List<String> list = new ArrayList<>();
            for (Object o : (List<Object>) paths) {
                list.add(String.valueOf(o));
            }
            config.setPaths(list);
        }
        Object output = map.get("output");
        if (output instanceof Map) {
            Map<String, Object> om = (Map<String, Object>) output;
            OutputPom op = config.getOutput();
            if (om.get("dir") instanceof String) {
                op.setDir((String) om.get("dir"));
            }
            if (om.get("junitXml") instanceof Boolean) {
                op.setJunitXml((Boolean) om.get("junitXml"));
            }
            if (om.get("json") instanceof Boolean) {
                op.setJson((Boolean) om.get("json"));
            }
            if (om.get("logLevel") instanceof String) {
                op.setLogLevel((String) om.get("logLevel"));
            }
        }
        return config;
    }

    /**
     * Apply the output settings to a Runner.Builder. Call before applying CLI
     * options. Paths are not applied, the caller picks either these or its own.
     */
    public Runner.Builder applyTo(Runner.Builder builder) {
        builder.outputDir(output.dir);
        builder.outputJunitXml(output.junitXml);
        builder.outputJson(output.json);
        return builder;
    }

    public List<String> getPaths() {
        return paths;
    }

    public void setPaths(List<String> paths) {
        this.paths = paths != null ? new ArrayList<>(paths) : new ArrayList<>();
    }

    public OutputPom getOutput() {
        return output;
    }

}
