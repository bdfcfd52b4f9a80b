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

package io.sshlite.client.session;

import java.time.Instant;
import java.util.Comparator;

/**
 * Metadata of a remote file system entry
 */
public class RemoteFile {
    /**
     * Directories first, then by name
     */
    public static final Comparator<RemoteFile> LISTING_ORDER = Comparator
            .comparing((RemoteFile f) -> !f.isDirectory())
            .thenComparing(RemoteFile::getName);

    private final String name;
    private final String path;
    private final boolean directory;
    private final long size;
    private final Instant modifiedTime;
    private final Instant accessTime;
    private final String owner;
    private final String group;
    private final String permissions;

    public RemoteFile(String name, String path, boolean directory, long size, Instant modifiedTime, Instant accessTime,
                      String owner, String group, String permissions) {
        this.name = name;
        this.path = path;
        this.directory = directory;
        this.size = size;
        this.modifiedTime = modifiedTime;
        this.accessTime = accessTime;
        this.owner = owner;
        this.group = group;
        this.permissions = permissions;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }

    public boolean isDirectory() {
        return directory;
    }

    public long getSize() {
        return size;
    }

    /**
     * @return Last modification time - {@code null} if not reported
     */
    public Instant getModifiedTime() {
        return modifiedTime;
    }

    public Instant getAccessTime() {
        return accessTime;
    }

    public String getOwner() {
        return owner;
    }

    public String getGroup() {
        return group;
    }

    /**
     * @return {@code rwxr-xr-x} style permissions string
     */
    public String getPermissions() {
        return permissions;
    }

    @Override
    public String toString() {
        return (isDirectory() ? "d" : "-") + getPermissions() + " " + getOwner() + " " + getGroup()
               + " " + getSize() + " " + getModifiedTime() + " " + getPath();
    }
}
