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

package io.sshlite.client.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.sshlite.common.HostConfig;
import org.apache.sshd.client.auth.keyboard.UserInteraction;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.core.CoreModuleProperties;

/**
 * The ordered list of authentication offers resolved for one connection attempt
 */
public class AuthOffers {
    private final HostConfig host;
    private final Credential credential;
    private final List<AuthOffer> offers;
    private final String promptedSecret;

    public AuthOffers(HostConfig host, Credential credential, List<AuthOffer> offers) {
        this(host, credential, offers, null);
    }

    public AuthOffers(HostConfig host, Credential credential, List<AuthOffer> offers, String promptedSecret) {
        this.host = Objects.requireNonNull(host, "No host");
        this.credential = credential;
        this.offers = Collections.unmodifiableList(new ArrayList<>(offers));
        this.promptedSecret = promptedSecret;
    }

    public HostConfig getHost() {
        return host;
    }

    /**
     * @return The explicit credential these offers were resolved for - {@code null} for default probing
     */
    public Credential getCredential() {
        return credential;
    }

    public List<AuthOffer> getOffers() {
        return offers;
    }

    /**
     * @return {@code true} if the secret of the explicit credential was missing and had to be prompted
     */
    public boolean isSecretPrompted() {
        return promptedSecret != null;
    }

    String getPromptedSecret() {
        return promptedSecret;
    }

    public boolean isEmpty() {
        return offers.isEmpty();
    }

    /**
     * @return {@code true} if anything besides the interactive fallback is offered
     */
    public boolean hasMaterial() {
        for (AuthOffer o : offers) {
            if (o.getKind() != AuthOffer.Kind.KEYBOARD_INTERACTIVE) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The first offered password - {@code null} if none
     */
    public String getPassword() {
        for (AuthOffer o : offers) {
            if (o.getPassword() != null) {
                return o.getPassword();
            }
        }
        return null;
    }

    /**
     * @return Comma separated SSH method names in offer order - duplicates removed
     */
    public String getPreferredAuths() {
        Set<String> names = new LinkedHashSet<>();
        for (AuthOffer o : offers) {
            names.add(o.getKind().getMethodName());
        }
        return String.join(",", names);
    }

    /**
     * Registers the offered material on the session before {@code auth()} is invoked
     *
     * @param session     The session being authenticated
     * @param interaction The interaction answering keyboard-interactive challenges
     */
    public void applyTo(ClientSession session, UserInteraction interaction) {
        for (AuthOffer o : offers) {
            switch (o.getKind()) {
                case PUBLIC_KEY:
                    session.addPublicKeyIdentity(o.getKeyPair());
                    break;
                case PASSWORD:
                    session.addPasswordIdentity(o.getPassword());
                    break;
                case KEYBOARD_INTERACTIVE:
                    session.setUserInteraction(interaction);
                    break;
                default: // agent identities are supplied by the client's agent factory
            }
        }
        CoreModuleProperties.PREFERRED_AUTHS.set(session, getPreferredAuths());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + host + "]" + offers;
    }
}
