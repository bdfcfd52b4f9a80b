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

package io.sshlite.client.keyverifier;

import java.io.IOException;
import java.net.SocketAddress;
import java.security.PublicKey;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.sshlite.common.HostConfig;
import io.sshlite.common.HostVerificationException;
import io.sshlite.common.HostVerificationException.Reason;
import io.sshlite.common.SshLiteModuleProperties;
import org.apache.sshd.client.keyverifier.ServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.AttributeRepository;
import org.apache.sshd.common.AttributeRepository.AttributeKey;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Verifies the server's host key against the {@link HostKeyTrustStore} during key exchange:
 * <OL>
 * <LI>A matching trusted digest is accepted silently.</LI>
 * <LI>An unknown host requires an explicit {@link HostKeyDecision#ACCEPT} - the digest is then persisted.</LI>
 * <LI>A digest that differs from the trusted one is never accepted automatically - only an explicit
 * {@link HostKeyDecision#ACCEPT} replaces the stored digest.</LI>
 * </OL>
 * A rejection or a trust store failure fails the key exchange. The reason is recorded on the session under
 * {@link #VERIFICATION_FAILURE} so that the connecting code can report a {@link HostVerificationException} rather than
 * a generic transport failure.
 */
public class HostIdentityVerifier extends AbstractLoggingBean implements ServerKeyVerifier {
    /**
     * The {@link HostConfig} being connected - expected in the connection context
     */
    public static final AttributeKey<HostConfig> HOST_CONFIG = new AttributeKey<>();

    /**
     * Set on the {@link ClientSession} when the host key was not trusted
     */
    public static final AttributeKey<HostVerificationException> VERIFICATION_FAILURE = new AttributeKey<>();

    private final HostKeyTrustStore trustStore;
    private final HostKeyDecisionHandler decisionHandler;
    private final Duration decisionTimeout;

    public HostIdentityVerifier(HostKeyTrustStore trustStore, HostKeyDecisionHandler decisionHandler) {
        this(trustStore, decisionHandler, SshLiteModuleProperties.HOST_KEY_DECISION_TIMEOUT.getRequiredDefault());
    }

    public HostIdentityVerifier(
            HostKeyTrustStore trustStore, HostKeyDecisionHandler decisionHandler, Duration decisionTimeout) {
        this.trustStore = Objects.requireNonNull(trustStore, "No trust store");
        this.decisionHandler = (decisionHandler == null) ? HostKeyDecisionHandler.REJECT_ALL : decisionHandler;
        this.decisionTimeout = Objects.requireNonNull(decisionTimeout, "No decision timeout");
    }

    public HostKeyTrustStore getTrustStore() {
        return trustStore;
    }

    public Duration getDecisionTimeout() {
        return decisionTimeout;
    }

    @Override
    public boolean verifyServerKey(ClientSession clientSession, SocketAddress remoteAddress, PublicKey serverKey) {
        String alias = resolveHostAlias(clientSession, remoteAddress);
        String identity = resolveIdentity(clientSession, alias);
        String presented = digest(serverKey);
        String stored = null;
        try {
            stored = trustStore.getDigest(alias);
            if (presented.equals(stored)) {
                if (log.isDebugEnabled()) {
                    log.debug("verifyServerKey({}) matched trusted key {}", alias, presented);
                }
                return true;
            }

            HostKeyDecision decision = awaitDecision(alias, presented, stored);
            if (decision == HostKeyDecision.ACCEPT) {
                trustStore.storeDigest(alias, presented);
                if (stored == null) {
                    log.info("verifyServerKey({}) trusted new host key {}", alias, presented);
                } else {
                    log.warn("verifyServerKey({}) replaced trusted key {} with {}", alias, stored, presented);
                }
                return true;
            }

            Reason reason = (decision == null)
                    ? Reason.DECISION_TIMEOUT
                    : (stored == null) ? Reason.REJECTED_UNKNOWN : Reason.REJECTED_CHANGED;
            String msg = (stored == null)
                    ? "Host key of unknown host " + alias + " was not trusted: " + presented
                    : "Host key of " + alias + " changed from " + stored + " to " + presented + " and was not accepted";
            if (reason == Reason.DECISION_TIMEOUT) {
                msg = "No host key decision for " + alias + " within " + decisionTimeout.toMillis() + " ms";
            }
            clientSession.setAttribute(
                    VERIFICATION_FAILURE, new HostVerificationException(identity, reason, presented, stored, msg));
            log.warn("verifyServerKey({}) {}", alias, msg);
            return false;
        } catch (IOException | RuntimeException e) {
            clientSession.setAttribute(VERIFICATION_FAILURE, new HostVerificationException(
                    identity, Reason.VERIFICATION_ERROR, presented, stored,
                    "Failed to verify host key of " + alias + ": " + e.getMessage(), e));
            log.warn("verifyServerKey({}) {} while verifying: {}", alias, e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    /**
     * @param  alias     {@code address:port}
     * @param  presented Presented digest
     * @param  stored    Trusted digest - {@code null} if unknown host
     * @return           The decision - {@code null} if none was given in time
     */
    protected HostKeyDecision awaitDecision(String alias, String presented, String stored) throws IOException {
        CompletableFuture<HostKeyDecision> pending = decisionHandler.requestDecision(alias, presented, stored);
        try {
            return pending.get(decisionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(false);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for host key decision on " + alias, e);
        } catch (ExecutionException e) {
            throw new IOException("Host key decision failed for " + alias, e.getCause());
        }
    }

    protected String resolveHostAlias(ClientSession session, SocketAddress remoteAddress) {
        HostConfig host = lookupHostConfig(session);
        return (host == null) ? String.valueOf(remoteAddress) : host.getHostKeyAlias();
    }

    protected String resolveIdentity(ClientSession session, String alias) {
        HostConfig host = lookupHostConfig(session);
        return (host == null) ? alias : host.getIdentityKey();
    }

    protected HostConfig lookupHostConfig(ClientSession session) {
        AttributeRepository context = session.getConnectionContext();
        HostConfig host = (context == null) ? null : context.getAttribute(HOST_CONFIG);
        return (host == null) ? session.getAttribute(HOST_CONFIG) : host;
    }

    /**
     * @param  key The host key
     * @return     A fixed length digest of the key - {@code SHA256:<base64>}
     */
    public static String digest(PublicKey key) {
        return KeyUtils.getFingerPrint(key);
    }
}
