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

package io.sshlite.client.watch;

import java.util.Locale;

import io.sshlite.common.event.FileChangeKind;
import org.apache.sshd.common.util.GenericUtils;

/**
 * Normalizes the output lines of the remote monitors into {@link FileChangeKind}s
 */
public final class WatchOutputParser {
    private WatchOutputParser() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  method The monitor that produced the line
     * @param  path   The watched path
     * @param  line   The output line
     * @return        The change kind - {@code null} if the line does not report a change
     */
    public static FileChangeKind parse(WatchMethod method, String path, String line) {
        String value = GenericUtils.trimToEmpty(line);
        if (value.isEmpty()) {
            return null;
        }

        switch (method) {
            case INOTIFYWAIT:
                return parseInotifyEvents(value);
            case FSWATCH:
                return parseFswatchFlags(
                        ((path != null) && value.startsWith(path)) ? value.substring(path.length()) : value);
            default:
                return null;
        }
    }

    /**
     * @param  events Comma separated inotify events - e.g., {@code MOVE_SELF} or {@code CLOSE_WRITE,CLOSE}
     * @return        The change kind - {@code null} for book-keeping events such as {@code IGNORED}
     */
    public static FileChangeKind parseInotifyEvents(String events) {
        String value = events.toUpperCase(Locale.ROOT);
        if (value.contains("DELETE") || value.contains("MOVE_SELF") || value.contains("MOVED_FROM")) {
            return FileChangeKind.DELETE;
        }
        if (value.contains("CREATE") || value.contains("MOVED_TO")) {
            return FileChangeKind.CREATE;
        }
        if (value.contains("IGNORED") || value.contains("UNMOUNT")) {
            return null;
        }
        return FileChangeKind.MODIFY;
    }

    /**
     * @param  flags Space separated {@code fswatch -x} event flags
     * @return       The change kind
     */
    public static FileChangeKind parseFswatchFlags(String flags) {
        boolean created = false;
        for (String flag : flags.trim().split("\\s+")) {
            if ("Removed".equals(flag) || "Renamed".equals(flag) || "MovedFrom".equals(flag)) {
                return FileChangeKind.DELETE;
            }
            if ("Created".equals(flag) || "MovedTo".equals(flag)) {
                created = true;
            }
        }
        return created ? FileChangeKind.CREATE : FileChangeKind.MODIFY;
    }
}
