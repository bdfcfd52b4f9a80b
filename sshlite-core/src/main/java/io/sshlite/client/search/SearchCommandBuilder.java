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

import java.util.List;

import io.sshlite.common.util.RemoteCommand;

/**
 * Turns a {@link SearchRequest} into a single remote invocation covering all of its roots. Content searches run
 * {@code grep}, file name searches run {@code find}; both are capped by piping through {@code head} unless the cap
 * is zero.
 */
public class SearchCommandBuilder {
    public SearchCommandBuilder() {
        super();
    }

    /**
     * @param  request    The search
     * @param  maxResults Effective cap - zero for unlimited
     * @return            The remote command
     */
    public RemoteCommand build(SearchRequest request, int maxResults) {
        RemoteCommand.Builder builder = request.isContentSearch()
                ? contentSearch(request, maxResults)
                : fileNameSearch(request);
        builder.operator(RemoteCommand.DISCARD_STDERR);
        if (maxResults > 0) {
            builder.operator("|").token("head").token("-n").number(maxResults);
        }
        return builder.build();
    }

    protected RemoteCommand.Builder contentSearch(SearchRequest request, int maxResults) {
        RemoteCommand.Builder builder = RemoteCommand.builder("grep").token("-rnH")
                .token(request.isRegex() ? "-E" : "-F");
        if (!request.isCaseSensitive()) {
            builder.token("-i");
        }

        for (String glob : request.getIncludes()) {
            builder.optionValue("--include=", glob);
        }

        for (String glob : request.getExcludes()) {
            builder.optionValue(isDirectoryExclude(glob) ? "--exclude-dir=" : "--exclude=", glob);
        }

        if (maxResults > 0) {
            builder.token("-m").number(maxResults);
        }

        return builder.token("-e").arg(request.getPattern())
                .token("--")
                .paths(request.getRoots());
    }

    protected RemoteCommand.Builder fileNameSearch(SearchRequest request) {
        RemoteCommand.Builder builder = RemoteCommand.builder("find").paths(request.getRoots()).token("-type").token("f");
        String nameTest = request.isCaseSensitive() ? "-name" : "-iname";
        if (!request.isRegex()) {
            builder.token(nameTest).arg("*" + request.getPattern() + "*");
        }

        List<String> includes = request.getIncludes();
        if (!includes.isEmpty()) {
            builder.operator("\\(");
            for (int index = 0; index < includes.size(); index++) {
                if (index > 0) {
                    builder.token("-o");
                }
                builder.token(nameTest).arg(includes.get(index));
            }
            builder.operator("\\)");
        }

        for (String glob : request.getExcludes()) {
            builder.operator("!").token("-path").arg("*/" + glob + "/*")
                    .operator("!").token("-name").arg(glob);
        }

        if (request.isRegex()) {
            // match the expression against the found paths
            builder.operator(RemoteCommand.DISCARD_STDERR).operator("|").token("grep").token("-E");
            if (!request.isCaseSensitive()) {
                builder.token("-i");
            }
            builder.token("-e").arg(request.getPattern());
        }
        return builder;
    }

    /**
     * @param  glob An exclude glob
     * @return      {@code true} if it names a directory (contains a slash or has no extension)
     */
    public static boolean isDirectoryExclude(String glob) {
        return (glob.indexOf('/') >= 0) || (glob.indexOf('.') < 0);
    }
}
