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
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.IoUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * A {@link KeyValueStore} backed by a {@link Properties} file. The file is loaded lazily and re-written (via a
 * temporary file and an atomic move) on every update.
 */
public class PropertiesFileKeyValueStore extends AbstractLoggingBean implements KeyValueStore {
    private final Path file;
    private final Properties props = new Properties();
    private boolean loaded;

    public PropertiesFileKeyValueStore(Path file) {
        this.file = Objects.requireNonNull(file, "No file");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized String get(String key) throws IOException {
        return loadedProperties().getProperty(key);
    }

    @Override
    public synchronized void put(String key, String value) throws IOException {
        Properties p = loadedProperties();
        Object prev = p.setProperty(key, Objects.requireNonNull(value, "No value"));
        if (!value.equals(prev)) {
            save(p);
        }
    }

    @Override
    public synchronized String remove(String key) throws IOException {
        Properties p = loadedProperties();
        Object prev = p.remove(key);
        if (prev != null) {
            save(p);
        }
        return (String) prev;
    }

    @Override
    public synchronized Map<String, String> entries(String prefix) throws IOException {
        String pfx = GenericUtils.trimToEmpty(prefix);
        Map<String, String> result = new TreeMap<>();
        for (String name : loadedProperties().stringPropertyNames()) {
            if (name.startsWith(pfx)) {
                result.put(name, props.getProperty(name));
            }
        }
        return result;
    }

    protected Properties loadedProperties() throws IOException {
        if (loaded) {
            return props;
        }

        if (Files.exists(file, IoUtils.EMPTY_LINK_OPTIONS)) {
            try (InputStream input = Files.newInputStream(file)) {
                props.load(input);
            }
            if (log.isDebugEnabled()) {
                log.debug("loadedProperties({}) loaded {} entries", file, props.size());
            }
        }
        loaded = true;
        return props;
    }

    protected void save(Properties p) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if ((parent != null) && (!Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS))) {
            Files.createDirectories(parent);
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (OutputStream output = Files.newOutputStream(tmp)) {
            p.store(output, null);
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        if (log.isTraceEnabled()) {
            log.trace("save({}) wrote {} entries", file, p.size());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getFile() + "]";
    }
}
