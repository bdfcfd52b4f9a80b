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
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

import io.sshlite.client.auth.AuthResolver;
import io.sshlite.client.auth.CredentialPrompter;
import io.sshlite.client.auth.CredentialService;
import io.sshlite.client.keyverifier.HostIdentityVerifier;
import io.sshlite.client.keyverifier.HostKeyDecisionHandler;
import io.sshlite.client.keyverifier.HostKeyTrustStore;
import io.sshlite.common.SshLiteModuleProperties;
import io.sshlite.common.store.InMemoryKeyValueStore;
import io.sshlite.common.store.InMemorySecretStore;
import io.sshlite.common.store.KeyValueStore;
import io.sshlite.common.store.SecretStore;
import org.apache.sshd.client.ClientBuilder;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.apache.sshd.common.PropertyResolver;
import org.apache.sshd.common.PropertyResolverUtils;
import org.apache.sshd.common.keyprovider.KeyIdentityProvider;
import org.apache.sshd.common.util.threads.CloseableExecutorService;
import org.apache.sshd.common.util.threads.ThreadUtils;
import org.apache.sshd.core.CoreModuleProperties;

/**
 * Assembles a {@link SessionRegistry} together with the MINA client, the host key verifier, the authentication
 * resolver and the executors it owns. Everything not explicitly configured gets an in-memory or rejecting default.
 */
public class SshLiteClientBuilder {
    public static final String WORKER_POOL_NAME = "sshlite-worker";
    public static final String RECONNECT_POOL_NAME = "sshlite-reconnect";

    protected Map<String, ?> properties = Collections.emptyMap();
    protected KeyValueStore keyValueStore;
    protected SecretStore secretStore;
    protected CredentialPrompter prompter;
    protected HostKeyDecisionHandler decisionHandler;
    protected ReconnectScheduler reconnectScheduler;
    protected AuthResolver authResolver;

    public SshLiteClientBuilder() {
        super();
    }

    /**
     * @param  properties Flat configuration - see {@link SshLiteModuleProperties}
     * @return            This builder
     */
    public SshLiteClientBuilder properties(Map<String, ?> properties) {
        this.properties = Objects.requireNonNull(properties, "No properties");
        return this;
    }

    /**
     * @param  store Persists the trusted host key digests and the credential index
     * @return       This builder
     */
    public SshLiteClientBuilder keyValueStore(KeyValueStore store) {
        this.keyValueStore = store;
        return this;
    }

    public SshLiteClientBuilder secretStore(SecretStore store) {
        this.secretStore = store;
        return this;
    }

    public SshLiteClientBuilder prompter(CredentialPrompter prompter) {
        this.prompter = prompter;
        return this;
    }

    public SshLiteClientBuilder hostKeyDecisionHandler(HostKeyDecisionHandler handler) {
        this.decisionHandler = handler;
        return this;
    }

    public SshLiteClientBuilder reconnectScheduler(ReconnectScheduler scheduler) {
        this.reconnectScheduler = scheduler;
        return this;
    }

    /**
     * @param  resolver Replaces the default resolver built from the credential service and prompter
     * @return          This builder
     */
    public SshLiteClientBuilder authResolver(AuthResolver resolver) {
        this.authResolver = resolver;
        return this;
    }

    protected SshLiteClientBuilder fillWithDefaultValues() {
        if (keyValueStore == null) {
            keyValueStore = new InMemoryKeyValueStore();
        }
        if (secretStore == null) {
            secretStore = new InMemorySecretStore();
        }
        if (prompter == null) {
            prompter = CredentialPrompter.NONE;
        }
        if (decisionHandler == null) {
            decisionHandler = HostKeyDecisionHandler.REJECT_ALL;
        }
        return this;
    }

    /**
     * @return             A registry owning a started client - closing the registry stops the client and the executors
     * @throws IOException If failed to start the client
     */
    public SessionRegistry build() throws IOException {
        fillWithDefaultValues();

        PropertyResolver config = PropertyResolverUtils.toPropertyResolver(properties);
        CredentialService credentials = new CredentialService(keyValueStore, secretStore);
        AuthResolver resolver = (authResolver == null) ? new AuthResolver(credentials, prompter) : authResolver;
        HostIdentityVerifier verifier = new HostIdentityVerifier(
                new HostKeyTrustStore(keyValueStore), decisionHandler,
                SshLiteModuleProperties.HOST_KEY_DECISION_TIMEOUT.getRequired(config));

        SshClient client = createClient(verifier, config);
        CloseableExecutorService workers = ThreadUtils.newCachedThreadPool(WORKER_POOL_NAME);
        ScheduledExecutorService timer = null;
        ReconnectScheduler scheduler = reconnectScheduler;
        if (scheduler == null) {
            timer = ThreadUtils.newSingleThreadScheduledExecutor(RECONNECT_POOL_NAME);
            scheduler = ReconnectScheduler.of(timer);
        }

        client.start();

        SessionRegistry registry = new SessionRegistry(
                createSessionFactory(client, resolver, config, workers), scheduler, config, credentials, prompter);
        if (timer != null) {
            ScheduledExecutorService owned = timer;
            registry.addOwnedResource(owned::shutdownNow);
        }
        registry.addOwnedResource(workers::shutdownNow);
        registry.addOwnedResource(client::stop);
        return registry;
    }

    protected SshClient createClient(HostIdentityVerifier verifier, PropertyResolver config) {
        SshClient client = ClientBuilder.builder()
                .serverKeyVerifier(verifier)
                .hostConfigEntryResolver(HostConfigEntryResolver.EMPTY)
                .build();
        // identities are offered per session by the AuthResolver
        client.setKeyIdentityProvider(KeyIdentityProvider.EMPTY_KEYS_PROVIDER);
        Duration keepAlive = SshLiteModuleProperties.KEEPALIVE_INTERVAL.getRequired(config);
        CoreModuleProperties.HEARTBEAT_INTERVAL.set(client, keepAlive);
        return client;
    }

    protected HostSessionFactory createSessionFactory(
            SshClient client, AuthResolver resolver, PropertyResolver config, ExecutorService workers) {
        return (host, credential) -> new HostSession(client, resolver, config, workers, host, credential);
    }

    public static SshLiteClientBuilder builder() {
        return new SshLiteClientBuilder();
    }
}
