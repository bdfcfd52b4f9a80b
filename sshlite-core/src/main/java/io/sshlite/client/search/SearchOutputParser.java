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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.sshd.common.util.GenericUtils;

/**
 * Parses the output lines of the search commands
 */
public final class SearchOutputParser {
    /**
     * {@code grep -nH} output - {@code path:line:text}
     */
    public static final Pattern CONTENT_LINE = Pattern.compile("^(.*?):([0-9]+):(.*)$");

    private SearchOutputParser() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  contentSearch {@code true} if the line comes from a content search
     * @param  line          The output line
     * @return               The parsed match - {@code null} if the line is blank or not parsable
     */
    public static SearchMatch parse(boolean contentSearch, CharSequence line) {
        return contentSearch ? parseContentLine(line) : parseFileNameLine(line);
    }

    public static SearchMatch parseContentLine(CharSequence line) {
        if (GenericUtils.isEmpty(GenericUtils.trimToEmpty((line == null) ? null : line.toString()))) {
            return null;
        }

        Matcher m = CONTENT_LINE.matcher(line);
        if (m.matches()) {
            try {
                return new SearchMatch(m.group(1), Integer.parseInt(m.group(2)), m.group(3).trim());
            } catch (NumberFormatException e) {
                return null; // line number overflow
            }
        }

        // e.g. "Binary file x matches"
        return null;
    }

    public static SearchMatch parseFileNameLine(CharSequence line) {
        String path = GenericUtils.trimToEmpty(line == null ? null : line.toString());
        return path.isEmpty() ? null : new SearchMatch(path, SearchMatch.NO_LINE, null);
    }
}
