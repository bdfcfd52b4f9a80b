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

import java.io.IOException;
import java.util.Map;

/**
 * Persistent, non-secret key/value storage injected by the hosting application (trust store digests, credential
 * index). Implementations must be thread-safe.
 */
public interface KeyValueStore {
    /**
     * @param  key         The key
     * @return             The stored value - {@code null} if none
     * @throws IOException If failed to access the storage
     */
    String get(String key) throws IOException;

    void put(String key, String value) throws IOException;

    /**
     * @param  key         The key
     * @return             The removed value - {@code null} if none
     * @throws IOException If failed to access the storage
     */
    String remove(String key) throws IOException;

    /**
     * @param  prefix      Key prefix - empty for all entries
     * @return             A snapshot of the entries whose key starts with the prefix
     * @throws IOException If failed to access the storage
     */
    Map<String, String> entries(String prefix) throws IOException;
}
