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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.sshlite.client.session.RemoteCommandExecutor;
import io.sshlite.client.session.RemoteFile;
import io.sshlite.client.session.RemoteFileAccessor;
import io.sshlite.client.session.RemoteProcess;
import io.sshlite.common.SshLiteModuleProperties;
import io.sshlite.common.util.CancelToken;
import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.common.PropertyResolver;
import org.apache.sshd.common.util.io.output.LineLevelAppender;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Runs a search over all the roots of a request with one remote invocation. Cancelling the request's token stops
 * consuming output, terminates the remote process and makes {@link #search(SearchRequest)} return whatever was
 * collected so far.
 */
public class RemoteSearchEngine extends AbstractLoggingBean {
    private final RemoteCommandExecutor executor;
    private final RemoteFileAccessor files;
    private final PropertyResolver config;
    private final SearchCommandBuilder commandBuilder;

    public RemoteSearchEngine(RemoteCommandExecutor executor, RemoteFileAccessor files, PropertyResolver config) {
        this(executor, files, config, new SearchCommandBuilder());
    }

    public RemoteSearchEngine(RemoteCommandExecutor executor, RemoteFileAccessor files, PropertyResolver config,
                              SearchCommandBuilder commandBuilder) {
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.files = Objects.requireNonNull(files, "No file accessor");
        this.config = Objects.requireNonNull(config, "No configuration");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "No command builder");
    }

    /**
     * @param  request     The search
     * @return             The matches sorted by path then line - partial (possibly empty) if cancelled
     * @throws IOException If the search could not be started
     */
    public List<SearchMatch> search(SearchRequest request) throws IOException {
        CancelToken token = request.getCancelToken();
        if (token.isCancelled()) {
            return Collections.emptyList();
        }

        int maxResults = resolveMaxResults(request);
        RemoteCommand command = commandBuilder.build(request, maxResults);
        MatchCollector collector = new MatchCollector(request.isContentSearch(), token);
        if (log.isDebugEnabled()) {
            log.debug("search({}) {}", executor.getIdentity(), command);
        }

        RemoteProcess process = executor.start(command, collector);
        Runnable terminator = process::terminate;
        token.onCancel(terminator);
        try {
            Integer status = process.waitFor(null);
            if (log.isDebugEnabled()) {
                log.debug("search({}) exit status={}, matches={}, cancelled={}",
                        executor.getIdentity(), status, collector.size(), token.isCancelled());
            }
        } finally {
            token.removeHandler(terminator);
            if (process.isOpen()) {
                process.close();
            }
        }

        List<SearchMatch> matches = collector.getMatches();
        if (!token.isCancelled()) {
            matches = enrich(matches);
        }
        matches.sort(SearchMatch.RESULT_ORDER);
        return matches;
    }

    protected int resolveMaxResults(SearchRequest request) {
        int max = request.getMaxResults();
        if (max == SearchRequest.DEFAULT_MAX_RESULTS) {
            max = SshLiteModuleProperties.SEARCH_MAX_RESULTS.getRequired(config);
        }
        return Math.max(max, 0);
    }

    /**
     * Looks up the metadata of the first unique matched paths. A failed lookup leaves the matches of its path as they
     * are.
     *
     * @param  matches The raw matches
     * @return         The matches - enriched where possible
     */
    protected List<SearchMatch> enrich(List<SearchMatch> matches) {
        int maxStats = SshLiteModuleProperties.SEARCH_MAX_STAT_COUNT.getRequired(config);
        Set<String> paths = new LinkedHashSet<>();
        for (SearchMatch m : matches) {
            if (paths.size() >= maxStats) {
                break;
            }
            paths.add(m.getPath());
        }

        Map<String, RemoteFile> stats = new HashMap<>(paths.size());
        for (String path : paths) {
            try {
                stats.put(path, files.stat(path));
            } catch (IOException | RuntimeException e) {
                if (log.isDebugEnabled()) {
                    log.debug("enrich({}) failed to stat {}: {}", executor.getIdentity(), path, e.getMessage());
                }
            }
        }

        List<SearchMatch> result = new ArrayList<>(matches.size());
        for (SearchMatch m : matches) {
            RemoteFile file = stats.get(m.getPath());
            result.add((file == null) ? m : m.withMetadata(file));
        }
        return result;
    }

    /**
     * Parses the output lines until the search is cancelled
     */
    protected static class MatchCollector implements LineLevelAppender {
        private final boolean contentSearch;
        private final CancelToken token;
        private final List<SearchMatch> matches = new ArrayList<>();

        protected MatchCollector(boolean contentSearch, CancelToken token) {
            this.contentSearch = contentSearch;
            this.token = token;
        }

        @Override
        public boolean isWriteEnabled() {
            return !token.isCancelled();
        }

        @Override
        public void writeLineData(CharSequence lineData) throws IOException {
            if (!isWriteEnabled()) {
                return;
            }

            SearchMatch m = SearchOutputParser.parse(contentSearch, lineData);
            if (m != null) {
                synchronized (matches) {
                    matches.add(m);
                }
            }
        }

        public int size() {
            synchronized (matches) {
                return matches.size();
            }
        }

        public List<SearchMatch> getMatches() {
            synchronized (matches) {
                return new ArrayList<>(matches);
            }
        }

        @Override
        public void close() throws IOException {
            // nothing to release
        }
    }
}
