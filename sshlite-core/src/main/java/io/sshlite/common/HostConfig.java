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

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * Immutable description of a remote target. Two configurations with the same address, port and user name share the
 * same {@link #getIdentityKey() identity key} and are therefore served by the same session.
 */
public final class HostConfig {
    public static final int DEFAULT_PORT = 22;

    private final String address;
    private final int port;
    private final String username;
    private final String privateKeyPath;
    private final String displayName;

    public HostConfig(String address, int port, String username) {
        this(address, port, username, null, null);
    }

    public HostConfig(String address, int port, String username, String privateKeyPath, String displayName) {
        this.address = ValidateUtils.checkNotNullAndNotEmpty(address, "No address");
        ValidateUtils.checkTrue((port > 0) && (port <= 0xFFFF), "Invalid port: %d", port);
        this.port = port;
        this.username = ValidateUtils.checkNotNullAndNotEmpty(username, "No username");
        this.privateKeyPath = GenericUtils.trimToEmpty(privateKeyPath).isEmpty() ? null : privateKeyPath.trim();
        this.displayName = GenericUtils.isEmpty(displayName) ? address : displayName;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    /**
     * @return The configured private key path - {@code null} if none
     */
    public String getPrivateKeyPath() {
        return privateKeyPath;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return {@code address:port:username}
     */
    public String getIdentityKey() {
        return identityKey(getAddress(), getPort(), getUsername());
    }

    /**
     * @return {@code address:port} - the key under which the host key digest is trusted
     */
    public String getHostKeyAlias() {
        return getAddress() + ":" + getPort();
    }

    public HostConfig withPrivateKeyPath(String path) {
        return new HostConfig(getAddress(), getPort(), getUsername(), path, getDisplayName());
    }

    public static String identityKey(String address, int port, String username) {
        return address + ":" + port + ":" + username;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getAddress(), getPort(), getUsername(), getPrivateKeyPath(), getDisplayName());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        HostConfig other = (HostConfig) obj;
        return (getPort() == other.getPort())
                && Objects.equals(getAddress(), other.getAddress())
                && Objects.equals(getUsername(), other.getUsername())
                && Objects.equals(getPrivateKeyPath(), other.getPrivateKeyPath())
                && Objects.equals(getDisplayName(), other.getDisplayName());
    }

    @Override
    public String toString() {
        return getUsername() + "@" + getAddress() + ":" + getPort();
    }
}
