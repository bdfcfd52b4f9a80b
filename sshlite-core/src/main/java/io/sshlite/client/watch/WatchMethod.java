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

import io.sshlite.common.util.RemoteCommand;

/**
 * Remote change detection strategy
 */
public enum WatchMethod {
    /**
     * {@code inotifywait} (inotify-tools) - Linux
     */
    INOTIFYWAIT("inotifywait") {
        @Override
        public RemoteCommand buildCommand(String path) {
            return RemoteCommand.builder(getToolName())
                    .token("-m").token("-q")
                    .token("--format").arg("%e")
                    .token("-e").token(INOTIFY_EVENTS)
                    .path(path)
                    .operator(RemoteCommand.DISCARD_STDERR)
                    .build();
        }
    },
    /**
     * {@code fswatch} - macOS and BSD family
     */
    FSWATCH("fswatch") {
        @Override
        public RemoteCommand buildCommand(String path) {
            RemoteCommand.Builder builder = RemoteCommand.builder(getToolName()).token("-x");
            for (String event : FSWATCH_EVENTS) {
                builder.token("--event").token(event);
            }
            return builder.path(path).operator(RemoteCommand.DISCARD_STDERR).build();
        }
    },
    /**
     * No native monitor - the caller polls
     */
    POLL(null) {
        @Override
        public RemoteCommand buildCommand(String path) {
            throw new UnsupportedOperationException("No remote monitor for " + this);
        }
    };

    public static final String INOTIFY_EVENTS = "modify,delete_self,move_self";
    public static final String[] FSWATCH_EVENTS = { "Updated", "Removed", "Renamed", "Created" };

    private final String toolName;

    WatchMethod(String toolName) {
        this.toolName = toolName;
    }

    /**
     * @return The remote tool - {@code null} for {@link #POLL}
     */
    public String getToolName() {
        return toolName;
    }

    public boolean isNative() {
        return toolName != null;
    }

    /**
     * @param  path The watched remote path
     * @return      The long running monitor command
     */
    public abstract RemoteCommand buildCommand(String path);
}
