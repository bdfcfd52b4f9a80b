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

package io.sshlite.common;

import java.time.Duration;

import org.apache.sshd.common.Property;

/**
 * Configurable properties for the session core. The values are resolved from the flat configuration map handed to
 * the {@link io.sshlite.client.session.SessionRegistry} - durations are expressed in milliseconds.
 */
public final class SshLiteModuleProperties {
    /**
     * Timeout after which a connection attempt is aborted if the transport has not been established.
     */
    public static final Property<Duration> CONNECT_TIMEOUT
            = Property.duration("sshlite-connect-timeout", Duration.ofSeconds(10L));

    /**
     * Timeout after which a connection attempt is aborted if authentication did not complete.
     */
    public static final Property<Duration> AUTH_TIMEOUT
            = Property.duration("sshlite-auth-timeout", Duration.ofSeconds(15L));

    /**
     * Interval between keep-alive (heartbeat) requests sent over an idle transport.
     */
    public static final Property<Duration> KEEPALIVE_INTERVAL
            = Property.duration("sshlite-keepalive-interval", Duration.ofSeconds(30L));

    /**
     * Fixed delay between two reconnection attempts.
     */
    public static final Property<Duration> RECONNECT_INTERVAL
            = Property.duration("sshlite-reconnect-interval", Duration.ofSeconds(3L));

    /**
     * Maximum number of reconnection attempts - zero (default) means unlimited.
     */
    public static final Property<Integer> RECONNECT_MAX_ATTEMPTS
            = Property.integer("sshlite-reconnect-max-attempts", 0);

    /**
     * Whether an unexpected transport close triggers automatic reconnection.
     */
    public static final Property<Boolean> AUTO_RECONNECT
            = Property.bool("sshlite-auto-reconnect", true);

    public static final Property<String> DEFAULT_REMOTE_PATH
            = Property.string("sshlite-default-remote-path", "~");

    /**
     * Hard cap on the number of search output lines - zero means unlimited.
     */
    public static final Property<Integer> SEARCH_MAX_RESULTS
            = Property.integer("sshlite-search-max-results", 500);

    /**
     * Maximum number of unique matched paths whose metadata is looked up after a search.
     */
    public static final Property<Integer> SEARCH_MAX_STAT_COUNT
            = Property.integer("sshlite-search-max-stat-count", 100);

    /**
     * Ceiling on the wait for the server to confirm that a written file has been closed.
     */
    public static final Property<Duration> WRITE_TIMEOUT
            = Property.duration("sshlite-write-timeout", Duration.ofSeconds(60L));

    /**
     * How long {@code watchFile} waits for a still running capability probe.
     */
    public static final Property<Duration> CAPABILITY_WAIT_TIMEOUT
            = Property.duration("sshlite-capability-wait-timeout", Duration.ofSeconds(2L));

    /**
     * How long the host key verifier waits for the user's decision on an unknown or changed key.
     */
    public static final Property<Duration> HOST_KEY_DECISION_TIMEOUT
            = Property.duration("sshlite-host-key-decision-timeout", Duration.ofMinutes(2L));

    public static final Property<Duration> CHANNEL_OPEN_TIMEOUT
            = Property.duration("sshlite-channel-open-timeout", Duration.ofSeconds(10L));

    /**
     * Ceiling on a single {@code exec} round-trip - zero (default) means wait for the remote process to exit.
     */
    public static final Property<Duration> EXEC_TIMEOUT
            = Property.duration("sshlite-exec-timeout", Duration.ZERO);

    /**
     * Size of the chunks used by chunked downloads - in bytes.
     */
    public static final Property<Integer> CHUNK_SIZE
            = Property.integer("sshlite-chunk-size", 64 * 1024);

    private SshLiteModuleProperties() {
        throw new UnsupportedOperationException("No instance");
    }
}
