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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

import io.sshlite.common.AuthenticationException;
import io.sshlite.common.HostConfig;
import org.apache.sshd.agent.SshAgent;
import org.apache.sshd.client.auth.keyboard.UserInteraction;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.config.keys.FilePasswordProvider;
import org.apache.sshd.common.session.SessionContext;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.IoUtils;
import org.apache.sshd.common.util.io.PathUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.common.util.security.SecurityUtils;

/**
 * Builds the ordered {@link AuthOffers} for a connection attempt and applies the side effects of its outcome.
 * <UL>
 * <LI>With an explicit {@link Credential}: only that credential's material plus a keyboard-interactive fallback.</LI>
 * <LI>Without one: the configured key, the default key locations, the agent (if {@code SSH_AUTH_SOCK} is set), a
 * stored-or-prompted password, and finally the keyboard-interactive fallback.</LI>
 * </UL>
 * A failed authentication invalidates <U>all</U> stored secrets of the host identity.
 */
public class AuthResolver extends AbstractLoggingBean {
    public static final List<String> DEFAULT_KEY_LOCATIONS = Collections.unmodifiableList(
            Arrays.asList("~/.ssh/id_rsa", "~/.ssh/id_ed25519", "~/.ssh/id_ecdsa"));

    /**
     * Number of passphrase attempts per encrypted key
     */
    public static final int MAX_PASSPHRASE_ATTEMPTS = 3;

    private final CredentialService credentials;
    private final CredentialPrompter prompter;
    private UnaryOperator<String> environment = System::getenv;
    private List<String> defaultKeyLocations = DEFAULT_KEY_LOCATIONS;

    public AuthResolver(CredentialService credentials, CredentialPrompter prompter) {
        this.credentials = Objects.requireNonNull(credentials, "No credential service");
        this.prompter = (prompter == null) ? CredentialPrompter.NONE : prompter;
    }

    public CredentialService getCredentialService() {
        return credentials;
    }

    public CredentialPrompter getPrompter() {
        return prompter;
    }

    public void setEnvironment(UnaryOperator<String> environment) {
        this.environment = Objects.requireNonNull(environment, "No environment");
    }

    public List<String> getDefaultKeyLocations() {
        return defaultKeyLocations;
    }

    public void setDefaultKeyLocations(List<String> locations) {
        this.defaultKeyLocations = (locations == null) ? Collections.emptyList() : new ArrayList<>(locations);
    }

    /**
     * @param  host                    The target host
     * @param  credential              Explicit credential - {@code null} to probe the defaults
     * @return                         The ordered offers - never empty
     * @throws AuthenticationException If nothing can be offered or the explicit credential's material is missing
     * @throws IOException             If failed to access the credential stores
     */
    public AuthOffers resolve(HostConfig host, Credential credential) throws IOException {
        Objects.requireNonNull(host, "No host");
        AuthOffers offers = (credential == null) ? resolveDefaults(host) : resolveExplicit(host, credential);
        if (log.isDebugEnabled()) {
            log.debug("resolve({}) credential={} offers={}", host, credential, offers.getOffers());
        }
        return offers;
    }

    protected AuthOffers resolveExplicit(HostConfig host, Credential credential) throws IOException {
        String identity = host.getIdentityKey();
        String secret = credentials.getSecret(identity, credential.getId());
        List<AuthOffer> offers = new ArrayList<>();
        String prompted = null;
        String password = null;
        switch (credential.getKind()) {
            case PASSWORD:
                if (GenericUtils.isEmpty(secret)) {
                    secret = prompter.promptPassword(host, "Password for " + host.getUsername() + "@" + host.getAddress()
                                                           + " (" + credential.getLabel() + ")");
                    if (GenericUtils.isEmpty(secret)) {
                        throw new AuthenticationException(
                                identity, "No password available for credential " + credential);
                    }
                    prompted = secret;
                }
                password = secret;
                offers.add(AuthOffer.password(credential.getId(), secret));
                break;

            case PRIVATE_KEY: {
                Path file = resolveKeyFile(credential.getPrivateKeyPath());
                if (!Files.isRegularFile(file, IoUtils.EMPTY_LINK_OPTIONS)) {
                    throw new AuthenticationException(identity, "Private key not found: " + file);
                }

                KeyPassphraseProvider provider = new KeyPassphraseProvider(host, secret);
                List<KeyPair> keys;
                try {
                    keys = loadKeys(file, provider);
                } catch (GeneralSecurityException | IOException e) {
                    throw new AuthenticationException(
                            identity, "Failed to load private key " + file + ": " + e.getMessage(), e);
                }
                if (keys.isEmpty()) {
                    throw new AuthenticationException(identity, "No usable key in " + file);
                }
                for (KeyPair kp : keys) {
                    offers.add(AuthOffer.publicKey(file.toString(), kp));
                }
                String used = provider.getAcceptedPassphrase();
                if ((used != null) && (!used.equals(secret))) {
                    prompted = used;
                }
                break;
            }

            default:
                throw new AuthenticationException(identity, "Unsupported credential kind: " + credential.getKind());
        }

        offers.add(AuthOffer.keyboardInteractive(password));
        return new AuthOffers(host, credential, offers, prompted);
    }

    protected AuthOffers resolveDefaults(HostConfig host) throws IOException {
        List<AuthOffer> offers = new ArrayList<>();
        Set<Path> seen = new LinkedHashSet<>();
        List<String> locations = new ArrayList<>();
        if (host.getPrivateKeyPath() != null) {
            locations.add(host.getPrivateKeyPath());
        }
        locations.addAll(getDefaultKeyLocations());

        for (String location : locations) {
            Path file = resolveKeyFile(location);
            if ((!seen.add(file)) || (!Files.isRegularFile(file, IoUtils.EMPTY_LINK_OPTIONS))) {
                continue;
            }

            try {
                for (KeyPair kp : loadKeys(file, new KeyPassphraseProvider(host, null))) {
                    offers.add(AuthOffer.publicKey(file.toString(), kp));
                }
            } catch (GeneralSecurityException | IOException | RuntimeException e) {
                log.warn("resolveDefaults({}) skip key {} - {}: {}",
                        host, file, e.getClass().getSimpleName(), e.getMessage());
            }
        }

        String socket = environment.apply(SshAgent.SSH_AUTHSOCKET_ENV_NAME);
        if (GenericUtils.isNotEmpty(socket)) {
            offers.add(AuthOffer.agent(socket));
        }

        String password = credentials.getOrPromptPassword(host, prompter);
        if (GenericUtils.isNotEmpty(password)) {
            offers.add(AuthOffer.password(CredentialService.DEFAULT_LABEL, password));
        }

        if (offers.isEmpty()) {
            throw new AuthenticationException(host.getIdentityKey(), "No authentication method available for " + host);
        }

        offers.add(AuthOffer.keyboardInteractive(password));
        return new AuthOffers(host, null, offers);
    }

    /**
     * @param  offers The offers the session authenticated with
     * @return        A {@link UserInteraction} answering keyboard-interactive challenges for these offers
     */
    public UserInteraction createUserInteraction(AuthOffers offers) {
        return new ChallengeResponder(offers.getHost(), offers.getPassword());
    }

    /**
     * Invoked once the session authenticated - offers to persist a prompted secret
     *
     * @param  offers      The offers used
     * @throws IOException If failed to update the stores
     */
    public void onAuthenticated(AuthOffers offers) throws IOException {
        Credential credential = offers.getCredential();
        if ((credential == null) || (!offers.isSecretPrompted())) {
            return;
        }

        String identity = offers.getHost().getIdentityKey();
        if (prompter.confirmSaveSecret(offers.getHost(), credential)) {
            credentials.updateSecret(identity, credential.getId(), offers.getPromptedSecret());
        } else {
            credentials.setSessionSecret(identity, credential.getId(), offers.getPromptedSecret());
        }
    }

    /**
     * Invoked when the server rejected every offer - invalidates all stored secrets of the identity
     *
     * @param  offers      The rejected offers
     * @throws IOException If failed to update the stores
     */
    public void onAuthenticationFailed(AuthOffers offers) throws IOException {
        String identity = offers.getHost().getIdentityKey();
        int count = credentials.deleteAllSecrets(identity);
        if (log.isDebugEnabled()) {
            log.debug("onAuthenticationFailed({}) invalidated {} stored secrets", identity, count);
        }
    }

    protected List<KeyPair> loadKeys(Path file, FilePasswordProvider provider)
            throws IOException, GeneralSecurityException {
        List<KeyPair> keys = new ArrayList<>();
        try (InputStream input = Files.newInputStream(file)) {
            Iterable<KeyPair> loaded = SecurityUtils.loadKeyPairIdentities(
                    null, NamedResource.ofName(file.toString()), input, provider);
            if (loaded != null) {
                loaded.forEach(keys::add);
            }
        }
        return keys;
    }

    protected Path resolveKeyFile(String location) {
        return Paths.get(PathUtils.normalizePath(location)).toAbsolutePath().normalize();
    }

    /**
     * Supplies the stored passphrase first, then prompts the user
     */
    protected class KeyPassphraseProvider implements FilePasswordProvider {
        private final HostConfig host;
        private final String stored;
        private String accepted;

        protected KeyPassphraseProvider(HostConfig host, String stored) {
            this.host = host;
            this.stored = stored;
        }

        public String getAcceptedPassphrase() {
            return accepted;
        }

        @Override
        public String getPassword(SessionContext session, NamedResource resourceKey, int retryIndex) {
            if ((retryIndex == 0) && GenericUtils.isNotEmpty(stored)) {
                return stored;
            }
            return prompter.promptPassphrase(host, resourceKey.getName(), retryIndex);
        }

        @Override
        public ResourceDecodeResult handleDecodeAttemptResult(
                SessionContext session, NamedResource resourceKey, int retryIndex, String password, Exception err) {
            if (err == null) {
                accepted = password;
                return ResourceDecodeResult.TERMINATE;
            }

            if (log.isDebugEnabled()) {
                log.debug("handleDecodeAttemptResult({}) attempt #{} failed: {}",
                        resourceKey, retryIndex + 1, err.getMessage());
            }
            return ((retryIndex + 1) < MAX_PASSPHRASE_ATTEMPTS)
                    ? ResourceDecodeResult.RETRY
                    : ResourceDecodeResult.TERMINATE;
        }
    }

    /**
     * Answers every prompt with the known password, otherwise delegates to the prompter
     */
    protected class ChallengeResponder implements UserInteraction {
        private final HostConfig host;
        private final String password;

        protected ChallengeResponder(HostConfig host, String password) {
            this.host = host;
            this.password = password;
        }

        @Override
        public String[] interactive(
                ClientSession session, String name, String instruction, String lang, String[] prompt, boolean[] echo) {
            int numPrompts = GenericUtils.length(prompt);
            if (numPrompts <= 0) {
                return GenericUtils.EMPTY_STRING_ARRAY;
            }

            if (password != null) {
                String[] answers = new String[numPrompts];
                Arrays.fill(answers, password);
                return answers;
            }

            return prompter.respondToChallenge(host, name, instruction, prompt, echo);
        }

        @Override
        public String getUpdatedPassword(ClientSession session, String prompt, String lang) {
            return null;
        }
    }
}
