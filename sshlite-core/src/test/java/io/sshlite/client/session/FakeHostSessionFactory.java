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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import io.sshlite.client.auth.AuthResolver;
import io.sshlite.client.auth.Credential;
import io.sshlite.common.HostConfig;
import io.sshlite.common.SshLiteException;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.common.PropertyResolver;
import org.mockito.Mockito;

/**
 * Creates {@link FakeHostSession}s sharing one queue of scripted connection failures
 */
public class FakeHostSessionFactory implements HostSessionFactory {
    private final SshClient client = Mockito.mock(SshClient.class);
    private final ExecutorService workers = Mockito.mock(ExecutorService.class);
    private final AuthResolver authResolver;
    private final PropertyResolver config;
    private final Deque<SshLiteException> failures = new LinkedList<>();
    private final List<FakeHostSession> created = new ArrayList<>();
    private final AtomicReference<Runnable> connectHook = new AtomicReference<>();

    public FakeHostSessionFactory(AuthResolver authResolver, PropertyResolver config) {
        this.authResolver = authResolver;
        this.config = config;
    }

    @Override
    public synchronized HostSession createSession(HostConfig host, Credential credential) {
        FakeHostSession session = new FakeHostSession(
                client, authResolver, config, workers, host, credential, failures, connectHook);
        created.add(session);
        return session;
    }

    /**
     * @param failure Failure of the next connection attempt of any created session
     */
    public void failNextConnect(SshLiteException failure) {
        synchronized (failures) {
            failures.add(failure);
        }
    }

    /**
     * @param hook Invoked by every connecting session before it reports being connected - {@code null} for none
     */
    public void setConnectHook(Runnable hook) {
        connectHook.set(hook);
    }

    public synchronized List<FakeHostSession> getCreated() {
        return Collections.unmodifiableList(new ArrayList<>(created));
    }

    public synchronized FakeHostSession getLastCreated() {
        return created.isEmpty() ? null : created.get(created.size() - 1);
    }
}
