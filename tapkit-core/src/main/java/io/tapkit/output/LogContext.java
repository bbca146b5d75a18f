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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Category loggers for the runtime, and the switch for the runtime log level.
 */
public final class LogContext {

    /** Logger for the runner, report writers and config loading */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("tapkit.runtime");

    /** Logger for console output (run summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("tapkit.console");

    private LogContext() {
    }

    /**
     * Set the level of the "tapkit" logger tree, and of the parser package.
     * Only works when Logback is the SLF4J backend, otherwise a no-op.
     *
     * @param level trace, debug, info, warn or error
     * @return true if the level was applied
     */
    public static boolean setLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("log level not supported: not using Logback");
                return false;
            }
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase(Locale.ROOT));
            for (String name : new String[]{"tapkit", "io.tapkit"}) {
                Object logger = factory.getClass()
                        .getMethod("getLogger", String.class)
                        .invoke(factory, name);
                logger.getClass()
                        .getMethod("setLevel", levelClass)
                        .invoke(logger, levelValue);
            }
            RUNTIME_LOGGER.debug("set log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("failed to set log level: {}", e.getMessage());
            return false;
        }
    }

}
