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

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Function;

import io.sshlite.client.session.RemoteCommandExecutor;
import io.sshlite.client.session.RemoteProcess;
import io.sshlite.common.event.FileChangeEvent;
import io.sshlite.common.event.FileChangeKind;
import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.common.util.io.output.LineLevelAppender;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Runs one long lived remote monitor per watched path, using the strategy selected by the capability probe, and
 * reports the normalized changes.
 */
public class ChangeWatchBroker extends AbstractLoggingBean {
    private final RemoteCommandExecutor executor;
    private final Function<Duration, ServerCapabilities> capabilities;
    private final Duration capabilityWaitTimeout;
    private final Consumer<FileChangeEvent> sink;
    private final Map<String, RemoteProcess> watchers = new TreeMap<>();

    /**
     * @param executor              The session running the monitors
     * @param capabilities          Waits (bounded) for the capability probe result - returns {@code null} if still
     *                              unknown
     * @param capabilityWaitTimeout Maximum wait for the probe result
     * @param sink                  Receives the change events
     */
    public ChangeWatchBroker(RemoteCommandExecutor executor, Function<Duration, ServerCapabilities> capabilities,
                             Duration capabilityWaitTimeout, Consumer<FileChangeEvent> sink) {
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.capabilities = Objects.requireNonNull(capabilities, "No capabilities source");
        this.capabilityWaitTimeout = Objects.requireNonNull(capabilityWaitTimeout, "No capability wait timeout");
        this.sink = Objects.requireNonNull(sink, "No sink");
    }

    /**
     * Starts watching a path - replacing any existing watcher of the same path
     *
     * @param  path The remote path
     * @return      {@code true} if a native monitor was started, {@code false} if the caller must poll
     */
    public boolean watch(String path) {
        unwatch(path);

        ServerCapabilities caps = capabilities.apply(capabilityWaitTimeout);
        WatchMethod method = (caps == null) ? WatchMethod.POLL : caps.getWatchMethod();
        if (!method.isNative()) {
            if (log.isDebugEnabled()) {
                log.debug("watch({})[{}] no native monitor - caps={}", executor.getIdentity(), path, caps);
            }
            return false;
        }

        RemoteCommand command = method.buildCommand(path);
        RemoteProcess process;
        try {
            process = executor.start(command, new ChangeAppender(method, path));
        } catch (IOException | RuntimeException e) {
            log.warn("watch({})[{}] failed to start {}: {}", executor.getIdentity(), path, method, e.getMessage());
            return false;
        }

        RemoteProcess prev;
        synchronized (watchers) {
            prev = watchers.put(path, process);
        }
        if (prev != null) {
            prev.terminate();
        }

        if (log.isDebugEnabled()) {
            log.debug("watch({})[{}] started {}", executor.getIdentity(), path, method);
        }
        return true;
    }

    /**
     * @param  path The remote path
     * @return      {@code true} if a watcher was stopped
     */
    public boolean unwatch(String path) {
        RemoteProcess process;
        synchronized (watchers) {
            process = watchers.remove(path);
        }
        if (process == null) {
            return false;
        }

        process.terminate();
        return true;
    }

    /**
     * @return Number of stopped watchers
     */
    public int unwatchAll() {
        Collection<RemoteProcess> processes;
        synchronized (watchers) {
            processes = new ArrayList<>(watchers.values());
            watchers.clear();
        }

        for (RemoteProcess p : processes) {
            p.terminate();
        }
        return processes.size();
    }

    /**
     * Forgets all watchers without trying to reach the remote host - used once the transport is gone
     */
    public void clear() {
        Collection<RemoteProcess> processes;
        synchronized (watchers) {
            processes = new ArrayList<>(watchers.values());
            watchers.clear();
        }

        for (RemoteProcess p : processes) {
            try {
                p.close();
            } catch (IOException e) {
                log.warn("clear({}) failed to close {}: {}", executor.getIdentity(), p, e.getMessage());
            }
        }
    }

    public boolean isWatching(String path) {
        synchronized (watchers) {
            RemoteProcess process = watchers.get(path);
            if ((process != null) && (!process.isOpen())) {
                watchers.remove(path);
                return false;
            }
            return process != null;
        }
    }

    public Collection<String> getWatchedPaths() {
        synchronized (watchers) {
            watchers.values().removeIf(p -> !p.isOpen());
            return new TreeSet<>(watchers.keySet());
        }
    }

    protected void onChange(String path, FileChangeKind kind) {
        FileChangeEvent event = new FileChangeEvent(executor.getIdentity(), path, kind);
        if (log.isTraceEnabled()) {
            log.trace("onChange({}) {}", executor.getIdentity(), event);
        }
        sink.accept(event);
    }

    protected class ChangeAppender implements LineLevelAppender {
        private final WatchMethod method;
        private final String path;

        protected ChangeAppender(WatchMethod method, String path) {
            this.method = method;
            this.path = path;
        }

        @Override
        public boolean isWriteEnabled() {
            return true;
        }

        @Override
        public void writeLineData(CharSequence lineData) throws IOException {
            FileChangeKind kind = WatchOutputParser.parse(method, path, lineData.toString());
            if (kind != null) {
                onChange(path, kind);
            }
        }

        @Override
        public void close() throws IOException {
            // nothing to release
        }
    }
}
