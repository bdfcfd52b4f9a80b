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

package io.sshlite.client.watch;

import io.sshlite.common.event.FileChangeKind;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class WatchOutputParserTest {
    public WatchOutputParserTest() {
        super();
    }

    @Test
    void inotifyEvents() {
        assertEquals(FileChangeKind.MODIFY, WatchOutputParser.parse(WatchMethod.INOTIFYWAIT, "/f", "MODIFY"));
        assertEquals(FileChangeKind.DELETE, WatchOutputParser.parse(WatchMethod.INOTIFYWAIT, "/f", "DELETE_SELF"));
        assertEquals(FileChangeKind.DELETE, WatchOutputParser.parse(WatchMethod.INOTIFYWAIT, "/f", "MOVE_SELF"));
        assertEquals(FileChangeKind.CREATE, WatchOutputParser.parse(WatchMethod.INOTIFYWAIT, "/f", "CREATE,ISDIR"));
        assertNull(WatchOutputParser.parse(WatchMethod.INOTIFYWAIT, "/f", "IGNORED"), "Book-keeping event reported");
    }

    @Test
    void fswatchFlags() {
        assertEquals(FileChangeKind.MODIFY, WatchOutputParser.parse(WatchMethod.FSWATCH, "/a b", "/a b Updated"));
        assertEquals(FileChangeKind.DELETE,
                WatchOutputParser.parse(WatchMethod.FSWATCH, "/a", "/a Updated Removed"));
        assertEquals(FileChangeKind.DELETE, WatchOutputParser.parse(WatchMethod.FSWATCH, "/a", "/a Renamed"));
        assertEquals(FileChangeKind.CREATE, WatchOutputParser.parse(WatchMethod.FSWATCH, "/a", "/a Created Updated"));
    }

    @Test
    void blankLinesIgnored() {
        assertNull(WatchOutputParser.parse(WatchMethod.INOTIFYWAIT, "/f", "   "), "Blank inotify line reported");
        assertNull(WatchOutputParser.parse(WatchMethod.FSWATCH, "/f", ""), "Blank fswatch line reported");
        assertNull(WatchOutputParser.parse(WatchMethod.POLL, "/f", "MODIFY"), "Polling produced an event");
    }
}
