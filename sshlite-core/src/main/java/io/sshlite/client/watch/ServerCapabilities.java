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

import java.util.Objects;

/**
 * Result of the capability probe of one live transport
 */
public class ServerCapabilities {
    /**
     * Used when probing failed
     */
    public static final ServerCapabilities UNKNOWN = new ServerCapabilities(RemoteOs.UNKNOWN, false, false);

    private final RemoteOs os;
    private final boolean inotifywait;
    private final boolean fswatch;
    private final WatchMethod watchMethod;

    public ServerCapabilities(RemoteOs os, boolean inotifywait, boolean fswatch) {
        this.os = Objects.requireNonNull(os, "No OS");
        this.inotifywait = inotifywait;
        this.fswatch = fswatch;
        this.watchMethod = resolveWatchMethod(os, inotifywait, fswatch);
    }

    public RemoteOs getOs() {
        return os;
    }

    public boolean hasInotifywait() {
        return inotifywait;
    }

    public boolean hasFswatch() {
        return fswatch;
    }

    public WatchMethod getWatchMethod() {
        return watchMethod;
    }

    /**
     * {@code inotifywait} is preferred on Linux, {@code fswatch} on the BSD family (including unknown systems) - anything
     * else falls back to polling.
     *
     * @param  os          The remote OS family
     * @param  inotifywait Whether {@code inotifywait} is available
     * @param  fswatch     Whether {@code fswatch} is available
     * @return             The selected method
     */
    public static WatchMethod resolveWatchMethod(RemoteOs os, boolean inotifywait, boolean fswatch) {
        if ((os == RemoteOs.LINUX) && inotifywait) {
            return WatchMethod.INOTIFYWAIT;
        }
        if (os.isBsdFamily() && fswatch) {
            return WatchMethod.FSWATCH;
        }
        return WatchMethod.POLL;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[os=" + getOs()
               + ", inotifywait=" + hasInotifywait()
               + ", fswatch=" + hasFswatch()
               + ", method=" + getWatchMethod()
               + "]";
    }
}
