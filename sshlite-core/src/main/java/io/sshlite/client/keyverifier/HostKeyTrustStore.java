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
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import io.sshlite.common.store.KeyValueStore;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * Persistent {@code address:port} to host key digest mapping, kept in an injected {@link KeyValueStore}
 */
public class HostKeyTrustStore {
    public static final String KEY_PREFIX = "sshlite.hostkey.";

    private final KeyValueStore store;

    public HostKeyTrustStore(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "No store");
    }

    /**
     * @param  hostAlias   {@code address:port}
     * @return             The trusted digest - {@code null} if none
     * @throws IOException If failed to access the store
     */
    public String getDigest(String hostAlias) throws IOException {
        return store.get(KEY_PREFIX + hostAlias);
    }

    public void storeDigest(String hostAlias, String digest) throws IOException {
        store.put(KEY_PREFIX + hostAlias, ValidateUtils.checkNotNullAndNotEmpty(digest, "No digest"));
    }

    /**
     * Forgets a host so that its next key is treated as unknown
     *
     * @param  hostAlias   {@code address:port}
     * @return             {@code true} if a digest was removed
     * @throws IOException If failed to access the store
     */
    public boolean removeDigest(String hostAlias) throws IOException {
        return store.remove(KEY_PREFIX + hostAlias) != null;
    }

    public Map<String, String> getTrustedHosts() throws IOException {
        Map<String, String> result = new TreeMap<>();
        store.entries(KEY_PREFIX).forEach((k, v) -> result.put(k.substring(KEY_PREFIX.length()), v));
        return result;
    }
}
