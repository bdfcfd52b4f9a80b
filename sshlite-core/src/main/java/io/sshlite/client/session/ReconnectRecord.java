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

package io.sshlite.client.session;

import java.time.Instant;
import java.util.Objects;

import io.sshlite.client.auth.Credential;
import io.sshlite.common.HostConfig;

/**
 * Bookkeeping of one automatic reconnection series. The attempt counter starts at zero when the record is created
 * and only ever increases until the record is discarded.
 */
public class ReconnectRecord {
    private final HostConfig host;
    private final Credential credential;
    private final Instant started;
    private int attempt;
    private ReconnectScheduler.ScheduledTask pending;

    public ReconnectRecord(HostConfig host, Credential credential) {
        this(host, credential, Instant.now(), 0);
    }

    protected ReconnectRecord(HostConfig host, Credential credential, Instant started, int attempt) {
        this.host = Objects.requireNonNull(host, "No host");
        this.credential = credential;
        this.started = started;
        this.attempt = attempt;
    }

    public String getIdentity() {
        return host.getIdentityKey();
    }

    public HostConfig getHost() {
        return host;
    }

    /**
     * @return The credential of the dropped session - {@code null} if the defaults were probed
     */
    public Credential getCredential() {
        return credential;
    }

    public Instant getStarted() {
        return started;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    synchronized int nextAttempt() {
        pending = null;
        attempt++;
        return attempt;
    }

    synchronized boolean isPending() {
        return pending != null;
    }

    synchronized void setPending(ReconnectScheduler.ScheduledTask task) {
        pending = task;
    }

    /**
     * @return {@code true} if a scheduled attempt was cancelled
     */
    synchronized boolean cancelPending() {
        ReconnectScheduler.ScheduledTask task = pending;
        pending = null;
        return (task != null) && task.cancel();
    }

    /**
     * @return An immutable copy
     */
    public synchronized ReconnectRecord snapshot() {
        return new ReconnectRecord(host, credential, started, attempt) {
            @Override
            synchronized int nextAttempt() {
                throw new UnsupportedOperationException("Snapshot of " + getIdentity());
            }

            @Override
            synchronized void setPending(ReconnectScheduler.ScheduledTask task) {
                throw new UnsupportedOperationException("Snapshot of " + getIdentity());
            }
        };
    }

    @Override
    public String toString() {
        return ReconnectRecord.class.getSimpleName() + "[" + getIdentity() + "] attempt=" + getAttempt();
    }
}
