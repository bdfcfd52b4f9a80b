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

import io.sshlite.client.session.HostSession;
import io.sshlite.common.ConnectionState;
import org.apache.sshd.common.util.SshdEventListener;

/**
 * The only channel through which callers observe the session core. All methods are no-op by default.
 */
public interface SessionEventListener extends SshdEventListener {
    /**
     * Invoked once per state transition of a session
     *
     * @param session The session whose state changed
     * @param state   The new state
     */
    default void sessionStateChanged(HostSession session, ConnectionState state) {
        // ignored
    }

    /**
     * @param event Progress of an automatic reconnection series
     */
    default void sessionReconnecting(ReconnectEvent event) {
        // ignored
    }

    /**
     * @param session The session owning the watcher
     * @param event   The normalized change
     */
    default void remoteFileChanged(HostSession session, FileChangeEvent event) {
        // ignored
    }

    static <L extends SessionEventListener> L validateListener(L listener) {
        return SshdEventListener.validateListener(listener, SessionEventListener.class.getSimpleName());
    }
}
