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

package io.sshlite.common.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * An assembled remote shell command line. This is the only place where remote command strings are put together:
 * program names, options and shell operators must be trusted constants (they are validated against a conservative
 * character set) while every value (path, pattern, glob) goes through {@link ShellQuoting}.
 */
public final class RemoteCommand {
    /**
     * Characters allowed in program names and options
     */
    public static final Pattern SAFE_TOKEN = Pattern.compile("[A-Za-z0-9_./+=,:%@-]+");

    public static final String DISCARD_STDERR = "2>/dev/null";

    private final List<String> tokens;
    private final String commandLine;

    private RemoteCommand(List<String> tokens) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.commandLine = String.join(" ", this.tokens);
    }

    public List<String> getTokens() {
        return tokens;
    }

    public String getCommandLine() {
        return commandLine;
    }

    @Override
    public int hashCode() {
        return commandLine.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return (obj instanceof RemoteCommand) && commandLine.equals(((RemoteCommand) obj).commandLine);
    }

    @Override
    public String toString() {
        return getCommandLine();
    }

    public static Builder builder(String program) {
        return new Builder().token(program);
    }

    /**
     * @param  path   Remote file path
     * @param  offset Zero based byte offset from which to output the file contents
     * @return        {@code tail -c +<offset+1> <path>}
     */
    public static RemoteCommand tailFromByte(String path, long offset) {
        ValidateUtils.checkTrue(offset >= 0L, "Negative offset: %d", offset);
        return builder("tail").token("-c").token("+" + (offset + 1L)).path(path).build();
    }

    public static RemoteCommand headLines(String path, int count) {
        ValidateUtils.checkTrue(count > 0, "Non-positive line count: %d", count);
        return builder("head").token("-n").number(count).path(path).build();
    }

    public static RemoteCommand tailLines(String path, int count) {
        ValidateUtils.checkTrue(count > 0, "Non-positive line count: %d", count);
        return builder("tail").token("-n").number(count).path(path).build();
    }

    /**
     * @return A command printing the kernel name or {@code unknown} if {@code uname} is not available
     */
    public static RemoteCommand osName() {
        return builder("uname").token("-s").operator(DISCARD_STDERR)
                .operator("||").token("echo").token("unknown")
                .build();
    }

    /**
     * @param  tool The tool name - must be a {@link #SAFE_TOKEN}
     * @return      A command whose exit status is zero if the tool is on the remote {@code PATH}
     */
    public static RemoteCommand toolLookup(String tool) {
        return builder("command").token("-v").token(tool).operator(">/dev/null").operator(DISCARD_STDERR).build();
    }

    /**
     * Prefixes a command so that its first output line is {@code marker} immediately followed by the PID of the
     * remote shell running it - which is also the parent of every process spawned by the command.
     *
     * @param  marker  A marker made of {@link #SAFE_TOKEN} characters
     * @param  command The command to run
     * @return         The wrapped command
     */
    public static RemoteCommand withPidMarker(String marker, RemoteCommand command) {
        Objects.requireNonNull(command, "No command");
        ValidateUtils.checkTrue(SAFE_TOKEN.matcher(marker).matches(), "Unsafe marker: %s", marker);
        return builder("echo").operator(marker + "$$").operator(";").append(command).build();
    }

    /**
     * @param  pid The PID of a remote shell
     * @return     A best effort command sending {@code TERM} to the shell's children and then to the shell itself
     */
    public static RemoteCommand terminateProcessTree(long pid) {
        ValidateUtils.checkTrue(pid > 0L, "Invalid PID: %d", pid);
        return builder("pkill").token("-TERM").token("-P").number(pid).operator(DISCARD_STDERR).operator(";")
                .token("kill").token("-TERM").number(pid).operator(DISCARD_STDERR).operator(";")
                .token("true")
                .build();
    }

    /**
     * @param  path A remote path
     * @return      The path - prefixed by {@code ./} if it starts with {@code -}
     */
    public static String guardPath(String path) {
        Objects.requireNonNull(path, "No path");
        return path.startsWith("-") ? "./" + path : path;
    }

    public static final class Builder {
        private final List<String> tokens = new ArrayList<>();

        Builder() {
            super();
        }

        /**
         * @param  token A trusted program name or option
         * @return       This builder
         * @throws IllegalArgumentException if the token contains characters outside {@link #SAFE_TOKEN}
         */
        public Builder token(String token) {
            ValidateUtils.checkNotNullAndNotEmpty(token, "No token");
            ValidateUtils.checkTrue(SAFE_TOKEN.matcher(token).matches(), "Unsafe command token: %s", token);
            tokens.add(token);
            return this;
        }

        public Builder number(long value) {
            tokens.add(Long.toString(value));
            return this;
        }

        /**
         * @param  value A value of any content
         * @return       This builder
         */
        public Builder arg(String value) {
            tokens.add(ShellQuoting.quote(value));
            return this;
        }

        /**
         * Appends an option whose value is user supplied - e.g., {@code --include='*.java'}
         *
         * @param  option The option name ending with {@code =}
         * @param  value  The user supplied value
         * @return        This builder
         */
        public Builder optionValue(String option, String value) {
            ValidateUtils.checkTrue(option.endsWith("=") && SAFE_TOKEN.matcher(option).matches(),
                    "Unsafe option: %s", option);
            tokens.add(option + ShellQuoting.quote(value));
            return this;
        }

        /**
         * @param  path A remote path - a relative one starting with {@code -} is prefixed by {@code ./} so that it is
         *              never taken for an option
         * @return      This builder
         */
        public Builder path(String path) {
            tokens.add(ShellQuoting.quotePath(guardPath(path)));
            return this;
        }

        public Builder paths(Iterable<String> paths) {
            for (String p : paths) {
                path(p);
            }
            return this;
        }

        /**
         * @param  operator A constant shell operator or redirection ({@code |}, {@code ;}, {@code 2>/dev/null}, ...)
         * @return          This builder
         */
        public Builder operator(String operator) {
            ValidateUtils.checkNotNullAndNotEmpty(GenericUtils.trimToEmpty(operator), "No operator");
            tokens.add(operator);
            return this;
        }

        public Builder append(RemoteCommand other) {
            tokens.addAll(other.getTokens());
            return this;
        }

        public RemoteCommand build() {
            ValidateUtils.checkState(!tokens.isEmpty(), "Empty command");
            return new RemoteCommand(tokens);
        }
    }
}
