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

import java.util.Objects;

/**
 * The single escaping primitive used for every user supplied fragment that ends up in a remote POSIX shell command
 * line. A value is wrapped in single quotes and every embedded single quote is replaced by {@code '\''} (close the
 * quote, emit an escaped quote, re-open the quote), so nothing inside the value is ever interpreted by the shell.
 */
public final class ShellQuoting {
    public static final char QUOTE = '\'';
    public static final String ESCAPED_QUOTE = "'\\''";
    public static final String HOME_PREFIX = "~/";

    private ShellQuoting() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  value The raw value - may be empty but not {@code null}
     * @return       The value quoted so that the remote shell treats it as a single literal word
     */
    public static String quote(CharSequence value) {
        Objects.requireNonNull(value, "No value to quote");
        int len = value.length();
        StringBuilder sb = new StringBuilder(len + 8).append(QUOTE);
        for (int index = 0; index < len; index++) {
            char ch = value.charAt(index);
            if (ch == QUOTE) {
                sb.append(ESCAPED_QUOTE);
            } else {
                sb.append(ch);
            }
        }
        return sb.append(QUOTE).toString();
    }

    /**
     * Quotes a remote path while preserving a leading {@code ~} (home folder) so that the remote shell still expands
     * it. Only the exact {@code ~} and the {@code ~/} prefix are left unquoted - {@code ~user} forms are quoted as
     * literals.
     *
     * @param  path The remote path
     * @return      The quoted path
     */
    public static String quotePath(String path) {
        Objects.requireNonNull(path, "No path to quote");
        if ("~".equals(path)) {
            return path;
        }
        if (path.startsWith(HOME_PREFIX)) {
            String rest = path.substring(HOME_PREFIX.length());
            return rest.isEmpty() ? HOME_PREFIX : HOME_PREFIX + quote(rest);
        }
        return quote(path);
    }
}
