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

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

import org.apache.sshd.common.SshException;

/**
 * Classification of a {@link ConnectionException} so that callers can offer a targeted hint instead of a raw
 * transport message.
 */
public enum ConnectionFailure {
    TIMEOUT("The host did not answer in time - check that it is up and that no firewall drops the traffic"),
    REFUSED("The connection was refused - check the port and that an SSH server is running"),
    UNKNOWN_HOST("The host name could not be resolved - check the address or your DNS settings"),
    UNREACHABLE("The host is unreachable - check your network connection or VPN"),
    HANDSHAKE("The SSH handshake failed - the server may not support the offered algorithms"),
    NOT_CONNECTED("The session is not connected - reconnect before retrying"),
    CLOSED("The connection was closed by the remote side or the network");

    private final String hint;

    ConnectionFailure(String hint) {
        this.hint = hint;
    }

    public String getHint() {
        return hint;
    }

    /**
     * Walks the cause chain looking for a recognizable network failure
     *
     * @param  t The failure - may be {@code null}
     * @return   The best matching classification - {@link #HANDSHAKE} if nothing more specific is recognized
     */
    public static ConnectionFailure classify(Throwable t) {
        for (Throwable cur = t; cur != null; cur = (cur.getCause() == cur) ? null : cur.getCause()) {
            if ((cur instanceof UnknownHostException) || (cur instanceof UnresolvedAddressException)) {
                return UNKNOWN_HOST;
            }
            if ((cur instanceof NoRouteToHostException) || (cur instanceof PortUnreachableException)) {
                return UNREACHABLE;
            }
            if (cur instanceof ConnectException) {
                String msg = lowerCaseMessage(cur);
                if (msg.contains("timed out")) {
                    return TIMEOUT;
                }
                if (msg.contains("unreachable")) {
                    return UNREACHABLE;
                }
                return REFUSED;
            }
            if ((cur instanceof SocketTimeoutException) || (cur instanceof TimeoutException)) {
                return TIMEOUT;
            }
            if (cur instanceof SshException) {
                String msg = lowerCaseMessage(cur);
                if (msg.contains("timeout") || msg.contains("timed out")) {
                    return TIMEOUT;
                }
            }
        }

        return HANDSHAKE;
    }

    private static String lowerCaseMessage(Throwable t) {
        String msg = t.getMessage();
        return (msg == null) ? "" : msg.toLowerCase(Locale.ROOT);
    }
}
