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

import java.io.IOException;

import io.sshlite.client.auth.Credential;
import io.sshlite.common.HostConfig;

/**
 * Creates the (not yet connected) {@link HostSession} of a host identity
 */
@FunctionalInterface
public interface HostSessionFactory {
    /**
     * @param  host        The target host
     * @param  credential  Explicit credential - {@code null} to probe the defaults
     * @return             A new disconnected session
     * @throws IOException If failed to create the session
     */
    HostSession createSession(HostConfig host, Credential credential) throws IOException;
}
