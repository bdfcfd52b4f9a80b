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

package io.sshlite.client.config;

import java.io.IOException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.sshlite.common.HostConfig;
import org.apache.sshd.client.config.hosts.HostConfigEntry;
import org.apache.sshd.client.config.hosts.HostPatternsHolder;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.OsUtils;
import org.apache.sshd.common.util.io.IoUtils;
import org.apache.sshd.common.util.io.ModifiableFileWatcher;
import org.apache.sshd.common.util.io.PathUtils;

/**
 * Discovers the hosts declared in an OpenSSH client {@code config} file. Wildcard patterns are skipped, and for
 * every concrete alias the first value of each option among the matching sections wins. The result is cached until
 * the file changes.
 */
public class SshConfigHostsReader extends ModifiableFileWatcher {
    private volatile List<HostConfig> hosts = Collections.emptyList();

    public SshConfigHostsReader() {
        this(HostConfigEntry.getDefaultHostConfigFile());
    }

    public SshConfigHostsReader(Path file) {
        this(file, IoUtils.EMPTY_LINK_OPTIONS);
    }

    public SshConfigHostsReader(Path file, LinkOption... options) {
        super(file, options);
    }

    /**
     * @return The declared hosts - empty if the file does not exist or could not be parsed
     */
    public synchronized List<HostConfig> getHosts() {
        Path path = getPath();
        try {
            if (!checkReloadRequired()) {
                return hosts;
            }

            hosts = Collections.emptyList();
            if (exists()) {
                List<HostConfigEntry> entries = HostConfigEntry.readHostConfigEntries(path);
                hosts = Collections.unmodifiableList(toHostConfigs(entries));
                if (log.isDebugEnabled()) {
                    log.debug("getHosts({}) loaded {} hosts from {} entries", path, hosts.size(), entries.size());
                }
            }
            updateReloadAttributes();
        } catch (IOException | RuntimeException e) {
            log.warn("getHosts({}) failed ({}) to parse: {}", path, e.getClass().getSimpleName(), e.getMessage());
            hosts = Collections.emptyList();
        }
        return hosts;
    }

    /**
     * Forces a re-read on the next {@link #getHosts()} call
     */
    public synchronized void invalidateCache() {
        resetReloadAttributes();
        hosts = Collections.emptyList();
    }

    protected List<HostConfig> toHostConfigs(Collection<HostConfigEntry> entries) throws IOException {
        Map<String, HostConfig> result = new LinkedHashMap<>();
        for (HostConfigEntry entry : entries) {
            for (String alias : HostConfigEntry.parseConfigValue(entry.getHost())) {
                if (isWildcard(alias) || result.containsKey(alias)) {
                    continue;
                }
                result.put(alias, resolve(alias, HostConfigEntry.findMatchingEntries(alias, entries)));
            }
        }
        return new ArrayList<>(result.values());
    }

    protected HostConfig resolve(String alias, List<HostConfigEntry> matches) {
        String hostName = null;
        int port = -1;
        String user = null;
        String identity = null;
        for (HostConfigEntry e : matches) {
            if (hostName == null) {
                hostName = e.getHostName();
            }
            if (port <= 0) {
                port = e.getPort();
            }
            if (user == null) {
                user = e.getUsername();
            }
            if (identity == null) {
                Collection<String> ids = e.getIdentities();
                if (GenericUtils.isNotEmpty(ids)) {
                    identity = ids.iterator().next();
                }
            }
        }

        String keyPath = (identity == null) ? null : PathUtils.normalizePath(identity);
        return new HostConfig(
                GenericUtils.isEmpty(hostName) ? alias : hostName,
                (port > 0) ? port : HostConfig.DEFAULT_PORT,
                GenericUtils.isEmpty(user) ? OsUtils.getCurrentUser() : user,
                keyPath, alias);
    }

    public static boolean isWildcard(String alias) {
        return GenericUtils.isEmpty(alias)
                || (alias.indexOf(HostPatternsHolder.WILDCARD_PATTERN) >= 0)
                || (alias.indexOf(HostPatternsHolder.SINGLE_CHAR_PATTERN) >= 0)
                || (alias.charAt(0) == HostPatternsHolder.NEGATION_CHAR_PATTERN);
    }
}
