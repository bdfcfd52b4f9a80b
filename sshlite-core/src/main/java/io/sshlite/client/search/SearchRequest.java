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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.sshlite.common.util.CancelToken;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * An immutable remote search request. Content search matches the pattern against the lines of the files under the
 * roots, filename search matches it against the file names.
 */
public final class SearchRequest {
    /**
     * Marks a request whose result cap is taken from the configuration
     */
    public static final int DEFAULT_MAX_RESULTS = -1;

    private final List<String> roots;
    private final String pattern;
    private final boolean contentSearch;
    private final boolean caseSensitive;
    private final boolean regex;
    private final List<String> includes;
    private final List<String> excludes;
    private final int maxResults;
    private final CancelToken cancelToken;

    private SearchRequest(Builder builder) {
        this.roots = Collections.unmodifiableList(new ArrayList<>(builder.roots));
        this.pattern = builder.pattern;
        this.contentSearch = builder.contentSearch;
        this.caseSensitive = builder.caseSensitive;
        this.regex = builder.regex;
        this.includes = Collections.unmodifiableList(new ArrayList<>(builder.includes));
        this.excludes = Collections.unmodifiableList(new ArrayList<>(builder.excludes));
        this.maxResults = builder.maxResults;
        this.cancelToken = (builder.cancelToken == null) ? CancelToken.none() : builder.cancelToken;
    }

    public List<String> getRoots() {
        return roots;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * @return {@code true} for a content search, {@code false} for a file name search
     */
    public boolean isContentSearch() {
        return contentSearch;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * @return {@code true} if the pattern is an extended regular expression rather than a literal
     */
    public boolean isRegex() {
        return regex;
    }

    /**
     * @return File name globs a file must match - empty to search every file
     */
    public List<String> getIncludes() {
        return includes;
    }

    /**
     * @return Globs of files or directories to skip
     */
    public List<String> getExcludes() {
        return excludes;
    }

    /**
     * @return The result cap - zero for unlimited, {@link #DEFAULT_MAX_RESULTS} for the configured cap
     */
    public int getMaxResults() {
        return maxResults;
    }

    public CancelToken getCancelToken() {
        return cancelToken;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[roots=" + roots
               + ", pattern=" + pattern
               + ", content=" + contentSearch
               + ", caseSensitive=" + caseSensitive
               + ", regex=" + regex
               + ", includes=" + includes
               + ", excludes=" + excludes
               + ", max=" + maxResults
               + "]";
    }

    public static Builder builder(String pattern) {
        return new Builder(pattern);
    }

    public static final class Builder {
        private final String pattern;
        private final List<String> roots = new ArrayList<>();
        private final List<String> includes = new ArrayList<>();
        private final List<String> excludes = new ArrayList<>();
        private boolean contentSearch = true;
        private boolean caseSensitive;
        private boolean regex;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private CancelToken cancelToken;

        Builder(String pattern) {
            this.pattern = ValidateUtils.checkNotNullAndNotEmpty(pattern, "No search pattern");
        }

        public Builder root(String root) {
            roots.add(ValidateUtils.checkNotNullAndNotEmpty(root, "No search root"));
            return this;
        }

        public Builder roots(Collection<String> values) {
            values.forEach(this::root);
            return this;
        }

        public Builder contentSearch(boolean value) {
            this.contentSearch = value;
            return this;
        }

        public Builder caseSensitive(boolean value) {
            this.caseSensitive = value;
            return this;
        }

        public Builder regex(boolean value) {
            this.regex = value;
            return this;
        }

        public Builder include(String glob) {
            if (GenericUtils.isNotEmpty(glob)) {
                includes.add(glob);
            }
            return this;
        }

        public Builder exclude(String glob) {
            if (GenericUtils.isNotEmpty(glob)) {
                excludes.add(glob);
            }
            return this;
        }

        /**
         * @param  csv Comma separated globs - blanks are ignored
         * @return     This builder
         */
        public Builder excludes(String csv) {
            for (String glob : GenericUtils.split(csv, ',')) {
                exclude(GenericUtils.trimToEmpty(glob));
            }
            return this;
        }

        public Builder maxResults(int value) {
            ValidateUtils.checkTrue(value >= DEFAULT_MAX_RESULTS, "Invalid result cap: %d", value);
            this.maxResults = value;
            return this;
        }

        public Builder cancelToken(CancelToken token) {
            this.cancelToken = Objects.requireNonNull(token, "No cancel token");
            return this;
        }

        public SearchRequest build() {
            ValidateUtils.checkState(!roots.isEmpty(), "No search root");
            return new SearchRequest(this);
        }
    }
}
