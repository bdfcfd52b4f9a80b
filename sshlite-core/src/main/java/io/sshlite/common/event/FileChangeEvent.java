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

package io.sshlite.common.event;

import java.time.Instant;
import java.util.Objects;

/**
 * A change reported for a watched remote path
 */
public class FileChangeEvent {
    private final String identity;
    private final String remotePath;
    private final FileChangeKind kind;
    private final Instant timestamp;

    public FileChangeEvent(String identity, String remotePath, FileChangeKind kind) {
        this(identity, remotePath, kind, Instant.now());
    }

    public FileChangeEvent(String identity, String remotePath, FileChangeKind kind, Instant timestamp) {
        this.identity = identity;
        this.remotePath = Objects.requireNonNull(remotePath, "No remote path");
        this.kind = Objects.requireNonNull(kind, "No change kind");
        this.timestamp = Objects.requireNonNull(timestamp, "No timestamp");
    }

    public String getIdentity() {
        return identity;
    }

    public String getRemotePath() {
        return remotePath;
    }

    public FileChangeKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getIdentity() + "]" + getKind() + " " + getRemotePath();
    }
}
