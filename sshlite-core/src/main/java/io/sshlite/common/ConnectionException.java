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

package io.sshlite.common;

import java.util.Objects;

/**
 * Network, timeout or handshake failure. This is the only failure kind the
 * {@link io.sshlite.client.session.SessionRegistry} recovers from automatically.
 */
public class ConnectionException extends SshLiteException {
    private static final long serialVersionUID = -1260941253871432567L;

    private final ConnectionFailure failure;

    public ConnectionException(String identity, ConnectionFailure failure, String message) {
        this(identity, failure, message, null);
    }

    public ConnectionException(String identity, ConnectionFailure failure, String message, Throwable cause) {
        super(identity, message, cause);
        this.failure = Objects.requireNonNull(failure, "No failure kind");
    }

    public ConnectionFailure getFailure() {
        return failure;
    }

    /**
     * @return A user oriented remediation hint matching the {@link #getFailure() failure kind}
     */
    public String getHint() {
        return getFailure().getHint();
    }

    public static ConnectionException notConnected(String identity) {
        return new ConnectionException(identity, ConnectionFailure.NOT_CONNECTED, "Not connected: " + identity);
    }
}
