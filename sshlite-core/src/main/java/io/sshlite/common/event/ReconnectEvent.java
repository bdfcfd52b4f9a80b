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

package io.sshlite.common.event;

import java.util.Objects;

import io.sshlite.common.HostConfig;

/**
 * Progress of the reconnection series of a session identity. The series starts with attempt zero, each retry
 * increments the attempt counter, and the series ends with an event whose {@link #isReconnecting()} is {@code false}
 * - either because the session was re-established or because reconnecting was abandoned.
 */
public class ReconnectEvent {
    private final String identity;
    private final HostConfig host;
    private final int attempt;
    private final boolean reconnecting;

    public ReconnectEvent(HostConfig host, int attempt, boolean reconnecting) {
        this.host = Objects.requireNonNull(host, "No host");
        this.identity = host.getIdentityKey();
        this.attempt = attempt;
        this.reconnecting = reconnecting;
    }

    public String getIdentity() {
        return identity;
    }

    public HostConfig getHost() {
        return host;
    }

    public int getAttempt() {
        return attempt;
    }

    public boolean isReconnecting() {
        return reconnecting;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getIdentity() + "]"
               + " attempt=" + getAttempt()
               + ", reconnecting=" + isReconnecting();
    }
}
