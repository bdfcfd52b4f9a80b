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

package io.sshlite.common.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process lifetime {@link SecretStore}
 */
public class InMemorySecretStore implements SecretStore {
    private final Map<String, String> secrets = new ConcurrentHashMap<>();

    public InMemorySecretStore() {
        super();
    }

    @Override
    public String getSecret(String key) {
        return secrets.get(key);
    }

    @Override
    public void storeSecret(String key, String secret) {
        secrets.put(key, secret);
    }

    @Override
    public void deleteSecret(String key) {
        secrets.remove(key);
    }

    public int size() {
        return secrets.size();
    }
}
