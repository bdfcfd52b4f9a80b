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
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.sshlite.common.HostConfig;
import io.sshlite.common.store.KeyValueStore;
import io.sshlite.common.store.SecretStore;
import org.apache.sshd.common.util.ExceptionUtils;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Multi-identity credential registry. The index (label, kind, key path) of every credential is kept in a
 * {@link KeyValueStore} while the secret values go either to the {@link SecretStore} or to an in-memory session
 * overlay that is never persisted.
 */
public class CredentialService extends AbstractLoggingBean {
    public static final String INDEX_PREFIX = "sshlite.credential.";
    public static final String SECRET_PREFIX = "sshLite:";
    public static final String DEFAULT_LABEL = "Default";

    static final String LABEL_FIELD = "label";
    static final String KIND_FIELD = "kind";
    static final String KEY_PATH_FIELD = "keyPath";

    private static final Pattern INDEX_ENTRY = Pattern.compile(
            "(cred_([0-9]+)_[a-z0-9]+)\\.(" + LABEL_FIELD + "|" + KIND_FIELD + "|" + KEY_PATH_FIELD + ")");
    private static final String ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final KeyValueStore indexStore;
    private final SecretStore secretStore;
    private final Map<String, String> sessionSecrets = new ConcurrentHashMap<>();
    private final Random random = new SecureRandom();

    public CredentialService(KeyValueStore indexStore, SecretStore secretStore) {
        this.indexStore = Objects.requireNonNull(indexStore, "No index store");
        this.secretStore = Objects.requireNonNull(secretStore, "No secret store");
    }

    /**
     * @param  identity    The host identity key
     * @return             The registered credentials in registration order
     * @throws IOException If failed to read the index
     */
    public synchronized List<Credential> listCredentials(String identity) throws IOException {
        String prefix = indexPrefix(identity);
        Map<String, Map<String, String>> fieldsById = new TreeMap<>();
        Map<String, Long> createdById = new TreeMap<>();
        for (Map.Entry<String, String> e : indexStore.entries(prefix).entrySet()) {
            Matcher m = INDEX_ENTRY.matcher(e.getKey().substring(prefix.length()));
            if (!m.matches()) {
                continue; // belongs to an identity sharing our prefix
            }

            String id = m.group(1);
            createdById.put(id, Long.valueOf(m.group(2)));
            fieldsById.computeIfAbsent(id, k -> new TreeMap<>()).put(m.group(3), e.getValue());
        }

        List<Credential> result = new ArrayList<>(fieldsById.size());
        fieldsById.forEach((id, fields) -> {
            try {
                result.add(new Credential(
                        id, fields.get(LABEL_FIELD), CredentialKind.valueOf(fields.get(KIND_FIELD)),
                        fields.get(KEY_PATH_FIELD)));
            } catch (RuntimeException err) {
                log.warn("listCredentials({}) ignore corrupted entry {}: {}", identity, id, err.getMessage());
            }
        });
        result.sort(Comparator.comparing((Credential c) -> createdById.get(c.getId()))
                .thenComparing(Credential::getId));

        if (log.isDebugEnabled()) {
            log.debug("listCredentials({}) found {} credentials", identity, result.size());
        }
        return result;
    }

    public Credential findCredential(String identity, String credentialId) throws IOException {
        for (Credential c : listCredentials(identity)) {
            if (c.getId().equals(credentialId)) {
                return c;
            }
        }
        return null;
    }

    /**
     * Registers a new credential and stores its secret
     *
     * @param  identity       The host identity key
     * @param  label          User visible label
     * @param  kind           The credential kind
     * @param  secret         Password or key passphrase - may be {@code null}/empty for an unencrypted key
     * @param  privateKeyPath Key location - required for {@link CredentialKind#PRIVATE_KEY}
     * @return                The created credential
     * @throws IOException    If failed to update the stores
     */
    public synchronized Credential addCredential(
            String identity, String label, CredentialKind kind, String secret, String privateKeyPath)
            throws IOException {
        ValidateUtils.checkNotNullAndNotEmpty(identity, "No identity");
        Credential credential = new Credential(generateId(), label, kind, privateKeyPath);
        String prefix = indexPrefix(identity) + credential.getId() + ".";
        indexStore.put(prefix + LABEL_FIELD, credential.getLabel());
        indexStore.put(prefix + KIND_FIELD, credential.getKind().name());
        if (credential.getPrivateKeyPath() != null) {
            indexStore.put(prefix + KEY_PATH_FIELD, credential.getPrivateKeyPath());
        }

        if (GenericUtils.isNotEmpty(secret)) {
            updateSecret(identity, credential.getId(), secret);
        }

        if (log.isDebugEnabled()) {
            log.debug("addCredential({}) added {}", identity, credential);
        }
        return credential;
    }

    /**
     * @param  identity     The host identity key
     * @param  credentialId The credential id
     * @return              The secret - session overlay first, then the secret store - {@code null} if none
     * @throws IOException  If failed to access the secret store
     */
    public String getSecret(String identity, String credentialId) throws IOException {
        String key = secretKey(identity, credentialId);
        String secret = sessionSecrets.get(key);
        if (secret != null) {
            return secret;
        }
        return secretStore.getSecret(key);
    }

    /**
     * Remembers a secret for the lifetime of this service only
     *
     * @param identity     The host identity key
     * @param credentialId The credential id
     * @param secret       The secret
     */
    public void setSessionSecret(String identity, String credentialId, String secret) {
        sessionSecrets.put(secretKey(identity, credentialId), ValidateUtils.checkNotNull(secret, "No secret"));
    }

    public void updateSecret(String identity, String credentialId, String secret) throws IOException {
        String key = secretKey(identity, credentialId);
        sessionSecrets.put(key, ValidateUtils.checkNotNull(secret, "No secret"));
        secretStore.storeSecret(key, secret);
    }

    public synchronized void deleteCredential(String identity, String credentialId) throws IOException {
        String prefix = indexPrefix(identity) + credentialId + ".";
        for (String key : indexStore.entries(prefix).keySet()) {
            indexStore.remove(key);
        }
        deleteSecret(identity, credentialId);
    }

    /**
     * Invalidates the secret of every credential of the identity while keeping the credentials themselves registered
     * - so that the next attempt prompts for fresh secrets.
     *
     * @param  identity    The host identity key
     * @return             Number of credentials whose secret was invalidated
     * @throws IOException If failed to access the stores
     */
    public int deleteAllSecrets(String identity) throws IOException {
        List<Credential> credentials = listCredentials(identity);
        IOException err = null;
        for (Credential c : credentials) {
            try {
                deleteSecret(identity, c.getId());
            } catch (IOException e) {
                err = ExceptionUtils.accumulateException(err, e);
            }
        }
        if (err != null) {
            throw err;
        }

        if (log.isDebugEnabled()) {
            log.debug("deleteAllSecrets({}) invalidated {} secrets", identity, credentials.size());
        }
        return credentials.size();
    }

    protected void deleteSecret(String identity, String credentialId) throws IOException {
        String key = secretKey(identity, credentialId);
        sessionSecrets.remove(key);
        secretStore.deleteSecret(key);
    }

    /**
     * @param  identity    The host identity key
     * @return             The secret of the first registered password credential - {@code null} if none
     * @throws IOException If failed to access the stores
     */
    public String getDefaultPassword(String identity) throws IOException {
        for (Credential c : listCredentials(identity)) {
            if (c.getKind() == CredentialKind.PASSWORD) {
                return getSecret(identity, c.getId());
            }
        }
        return null;
    }

    /**
     * Stores the password under the {@value #DEFAULT_LABEL} password credential - creating it if necessary
     *
     * @param  identity    The host identity key
     * @param  password    The password
     * @return             The updated or created credential
     * @throws IOException If failed to access the stores
     */
    public synchronized Credential saveDefaultPassword(String identity, String password) throws IOException {
        for (Credential c : listCredentials(identity)) {
            if ((c.getKind() == CredentialKind.PASSWORD) && DEFAULT_LABEL.equals(c.getLabel())) {
                updateSecret(identity, c.getId(), password);
                return c;
            }
        }
        return addCredential(identity, DEFAULT_LABEL, CredentialKind.PASSWORD, password, null);
    }

    /**
     * @param  host        The target host
     * @param  prompter    The prompter used if no password is stored
     * @return             The stored or prompted (and then saved) password - {@code null} if none available
     * @throws IOException If failed to access the stores
     */
    public String getOrPromptPassword(HostConfig host, CredentialPrompter prompter) throws IOException {
        String identity = host.getIdentityKey();
        String saved = getDefaultPassword(identity);
        if (GenericUtils.isNotEmpty(saved)) {
            return saved;
        }

        String value = prompter.promptPassword(host, "Password for " + host.getUsername() + "@" + host.getAddress());
        if (GenericUtils.isNotEmpty(value)) {
            saveDefaultPassword(identity, value);
        }
        return value;
    }

    public void clearSessionSecrets() {
        sessionSecrets.clear();
    }

    public static String secretKey(String identity, String credentialId) {
        return SECRET_PREFIX + identity + ":" + credentialId;
    }

    protected static String indexPrefix(String identity) {
        return INDEX_PREFIX + identity + ".";
    }

    protected String generateId() {
        StringBuilder sb = new StringBuilder("cred_").append(System.currentTimeMillis()).append('_');
        for (int index = 0; index < 6; index++) {
            sb.append(ID_CHARS.charAt(random.nextInt(ID_CHARS.length())));
        }
        return sb.toString();
    }

    public List<Credential> listCredentials(HostConfig host) throws IOException {
        return (host == null) ? Collections.emptyList() : listCredentials(host.getIdentityKey());
    }
}
