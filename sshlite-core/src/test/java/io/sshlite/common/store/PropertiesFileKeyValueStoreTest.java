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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import io.sshlite.util.test.SshLiteTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class PropertiesFileKeyValueStoreTest extends SshLiteTestSupport {
    public PropertiesFileKeyValueStoreTest() {
        super();
    }

    @Test
    void missingFileIsEmpty() throws Exception {
        PropertiesFileKeyValueStore store = new PropertiesFileKeyValueStore(tempDir.resolve("none.properties"));
        assertNull(store.get("a"), "Unexpected value");
        assertTrue(store.entries("").isEmpty(), "Unexpected entries");
        assertFalse(Files.exists(store.getFile()), "File created by read");
    }

    @Test
    void valuesSurviveReload() throws Exception {
        Path file = tempDir.resolve("sub").resolve("store.properties");
        PropertiesFileKeyValueStore store = new PropertiesFileKeyValueStore(file);
        store.put("sshlite.hostkey.h:22", "SHA256:abc");
        store.put("sshlite.credential.x", "y");
        assertTrue(Files.exists(file), "File not written");

        PropertiesFileKeyValueStore reloaded = new PropertiesFileKeyValueStore(file);
        assertEquals("SHA256:abc", reloaded.get("sshlite.hostkey.h:22"));
        Map<String, String> entries = reloaded.entries("sshlite.hostkey.");
        assertEquals(1, entries.size(), "Mismatched prefix filtering: " + entries);
    }

    @Test
    void removeReturnsPreviousValue() throws Exception {
        PropertiesFileKeyValueStore store = new PropertiesFileKeyValueStore(tempDir.resolve("r.properties"));
        store.put("k", "v");
        assertEquals("v", store.remove("k"));
        assertNull(store.remove("k"), "Removed twice");
        assertNull(new PropertiesFileKeyValueStore(store.getFile()).get("k"), "Removal not persisted");
    }
}
