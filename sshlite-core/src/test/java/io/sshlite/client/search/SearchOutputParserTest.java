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

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class SearchOutputParserTest {
    public SearchOutputParserTest() {
        super();
    }

    @Test
    void contentLine() {
        SearchMatch m = SearchOutputParser.parse(true, "/src/Main.java:42:    int x = 1; // a:1:b");
        assertEquals("/src/Main.java", m.getPath());
        assertEquals(42, m.getLine());
        assertEquals("int x = 1; // a:1:b", m.getPreview());
    }

    @Test
    void contentLineWithEmptyText() {
        SearchMatch m = SearchOutputParser.parse(true, "/a:7:");
        assertEquals(7, m.getLine());
        assertEquals("", m.getPreview());
    }

    @Test
    void unparsableContentLines() {
        assertNull(SearchOutputParser.parse(true, "Binary file /x.bin matches"), "Binary notice parsed");
        assertNull(SearchOutputParser.parse(true, "   "), "Blank line parsed");
        assertNull(SearchOutputParser.parse(true, "/a:99999999999:x"), "Overflowing line number parsed");
    }

    @Test
    void fileNameLine() {
        SearchMatch m = SearchOutputParser.parse(false, "  /var/log/syslog \n");
        assertEquals("/var/log/syslog", m.getPath());
        assertEquals(SearchMatch.NO_LINE, m.getLine());
        assertNull(m.getPreview(), "Unexpected preview");
        assertNull(SearchOutputParser.parse(false, ""), "Empty line parsed");
    }
}
