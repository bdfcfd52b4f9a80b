/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.sshlite.cli;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Level;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.output.NullPrintStream;
import org.apache.sshd.common.util.logging.SimplifiedLog;
import org.apache.sshd.common.util.logging.SimplifiedLoggerSkeleton;
import org.slf4j.Logger;

/**
 * Prints the progress messages of the command line front end. Library logging goes through SLF4J and is tuned by
 * {@link #setupLibraryLogging(Level)}.
 */
public class CliLogger extends SimplifiedLoggerSkeleton {
    public static final DateTimeFormatter LOG_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    /**
     * The {@code slf4j-simple} property holding the default log level
     */
    public static final String SIMPLE_LOGGER_LEVEL_PROP = "org.slf4j.simpleLogger.defaultLogLevel";
    public static final String SIMPLE_LOGGER_FILE_PROP = "org.slf4j.simpleLogger.logFile";

    private static final long serialVersionUID = 3461790239412574104L;
    private static final NullPrintStream NULL_PRINT_STREAM = new NullPrintStream();

    protected final Level threshold;
    protected final transient PrintStream logStream;

    protected CliLogger(String name, Level threshold, PrintStream logStream) {
        super(name);

        this.threshold = threshold;
        this.logStream = logStream;
    }

    @Override
    public boolean isEnabledLevel(Level level) {
        return SimplifiedLog.isLoggable(level, threshold);
    }

    @Override
    public void log(Level level, Object msg, Throwable err) {
        if (isEnabledLevel(level)) {
            log(logStream, level, msg, err);
        }
    }

    public static void log(PrintStream logStream, Level level, Object msg, Throwable err) {
        logStream.append(LocalDateTime.now().format(LOG_TIME_FORMATTER))
                .append(' ').append(level.getName())
                .append(' ').append(Objects.toString(msg))
                .println();
        if (err != null) {
            err.printStackTrace(logStream);
        }
    }

    /**
     * @param  args     The command line arguments
     * @param  maxIndex Index of the first argument that is not an option
     * @return          {@link Level#INFO} for {@code -v}, {@link Level#FINE} for {@code -vv}, {@link Level#FINEST}
     *                  for {@code -vvv} - otherwise {@link Level#WARNING}
     */
    public static Level resolveLoggingVerbosity(String[] args, int maxIndex) {
        Level level = Level.WARNING;
        for (int index = 0; index < maxIndex; index++) {
            String argName = args[index];
            if ("-v".equals(argName)) {
                level = Level.INFO;
            } else if ("-vv".equals(argName)) {
                level = Level.FINE;
            } else if ("-vvv".equals(argName)) {
                level = Level.FINEST;
            }
        }

        return level;
    }

    public static boolean isVerbosityOption(String argName) {
        return "-v".equals(argName) || "-vv".equals(argName) || "-vvv".equals(argName);
    }

    /**
     * Configures the {@code slf4j-simple} binding - must be invoked before the first logger is created
     *
     * @param level The verbosity level
     */
    public static void setupLibraryLogging(Level level) {
        if (GenericUtils.isEmpty(System.getProperty(SIMPLE_LOGGER_LEVEL_PROP))) {
            System.setProperty(SIMPLE_LOGGER_LEVEL_PROP, toSimpleLoggerLevel(level));
        }
        if (GenericUtils.isEmpty(System.getProperty(SIMPLE_LOGGER_FILE_PROP))) {
            System.setProperty(SIMPLE_LOGGER_FILE_PROP, "System.err");
        }
    }

    public static String toSimpleLoggerLevel(Level level) {
        if ((level == null) || Level.OFF.equals(level)) {
            return "off";
        }

        int value = level.intValue();
        if (value >= Level.SEVERE.intValue()) {
            return "error";
        } else if (value >= Level.WARNING.intValue()) {
            return "warn";
        } else if (value >= Level.INFO.intValue()) {
            return "info";
        } else if (value >= Level.FINE.intValue()) {
            return "debug";
        } else {
            return "trace";
        }
    }

    public static boolean showError(PrintStream stderr, String message) {
        stderr.append("ERROR: ").println(message);
        return true;
    }

    /**
     * @param  threshold The verbosity level
     * @param  stderr    The stream the progress messages go to
     * @return           The stream - a no-op one unless verbose output was requested
     */
    public static PrintStream resolvePrintStream(Level threshold, PrintStream stderr) {
        if ((threshold == null) || (threshold.intValue() > Level.INFO.intValue())) {
            return NULL_PRINT_STREAM;
        }
        return stderr;
    }

    public static Logger getLogger(Class<?> clazz, Level threshold, PrintStream stderr) {
        return ((threshold == null) || Level.OFF.equals(threshold))
                ? SimplifiedLoggerSkeleton.EMPTY
                : new CliLogger(clazz.getSimpleName(), threshold, resolvePrintStream(threshold, stderr));
    }
}
