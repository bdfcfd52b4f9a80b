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

package io.sshlite.client.search;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

import io.sshlite.client.session.RemoteFile;

/**
 * One search hit - a matching line of a file for content searches, a matching file for file name searches
 */
public class SearchMatch {
    public static final int NO_LINE = 0;

    /**
     * Path first, then line number
     */
    public static final Comparator<SearchMatch> RESULT_ORDER = Comparator
            .comparing(SearchMatch::getPath)
            .thenComparingInt(SearchMatch::getLine);

    private final String path;
    private final int line;
    private final String preview;
    private final Long size;
    private final Instant modifiedTime;
    private final String permissions;

    public SearchMatch(String path, int line, String preview) {
        this(path, line, preview, null, null, null);
    }

    public SearchMatch(String path, int line, String preview, Long size, Instant modifiedTime, String permissions) {
        this.path = Objects.requireNonNull(path, "No path");
        this.line = line;
        this.preview = preview;
        this.size = size;
        this.modifiedTime = modifiedTime;
        this.permissions = permissions;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return One based line number - {@link #NO_LINE} for file name matches
     */
    public int getLine() {
        return line;
    }

    /**
     * @return The trimmed matching line - {@code null} for file name matches
     */
    public String getPreview() {
        return preview;
    }

    /**
     * @return File size - {@code null} if the metadata was not looked up
     */
    public Long getSize() {
        return size;
    }

    public Instant getModifiedTime() {
        return modifiedTime;
    }

    public String getPermissions() {
        return permissions;
    }

    public boolean hasMetadata() {
        return size != null;
    }

    public SearchMatch withMetadata(RemoteFile file) {
        return new SearchMatch(path, line, preview, file.getSize(), file.getModifiedTime(), file.getPermissions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getPath(), getLine(), getPreview());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        SearchMatch other = (SearchMatch) obj;
        return Objects.equals(getPath(), other.getPath())
                && (getLine() == other.getLine())
                && Objects.equals(getPreview(), other.getPreview());
    }

    @Override
    public String toString() {
        return (line == NO_LINE) ? path : path + ":" + line + ": " + preview;
    }
}
