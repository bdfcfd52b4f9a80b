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

package io.sshlite.common.util;

import java.util.Arrays;

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class RemoteCommandTest {
    public RemoteCommandTest() {
        super();
    }

    @Test
    void builderQuotesValues() {
        RemoteCommand cmd = RemoteCommand.builder("grep").token("-F").arg("a'b").token("--").path("/x y").build();
        assertEquals("grep -F 'a'\\''b' -- '/x y'", cmd.getCommandLine());
        assertEquals(Arrays.asList("grep", "-F", "'a'\\''b'", "--", "'/x y'"), cmd.getTokens());
    }

    @Test
    void builderRejectsUnsafeTokens() {
        assertThrows(IllegalArgumentException.class, () -> RemoteCommand.builder("ls;rm"));
        assertThrows(IllegalArgumentException.class, () -> RemoteCommand.builder("ls").token("$(id)"));
        assertThrows(IllegalArgumentException.class, () -> RemoteCommand.builder("ls").token(" "));
    }

    @Test
    void optionValueQuotesValue() {
        RemoteCommand cmd = RemoteCommand.builder("grep").optionValue("--include=", "*.java").build();
        assertEquals("grep --include='*.java'", cmd.getCommandLine());
        assertThrows(IllegalArgumentException.class,
                () -> RemoteCommand.builder("grep").optionValue("--include", "x"), "Option without '='");
    }

    @Test
    void tailFromByteUsesOneBasedOffset() {
        assertEquals("tail -c +1 '/var/log/x.log'", RemoteCommand.tailFromByte("/var/log/x.log", 0L).getCommandLine());
        assertEquals("tail -c +101 ~/'a.log'", RemoteCommand.tailFromByte("~/a.log", 100L).getCommandLine());
        assertThrows(IllegalArgumentException.class, () -> RemoteCommand.tailFromByte("/x", -1L));
    }

    @Test
    void headAndTailLines() {
        assertEquals("head -n 5 '/f'", RemoteCommand.headLines("/f", 5).getCommandLine());
        assertEquals("tail -n 7 '/f'", RemoteCommand.tailLines("/f", 7).getCommandLine());
        assertThrows(IllegalArgumentException.class, () -> RemoteCommand.headLines("/f", 0));
    }

    @Test
    void dashLeadingPathsAreNotOptions() {
        assertEquals("head -n 3 './-n'", RemoteCommand.headLines("-n", 3).getCommandLine());
        assertEquals("tail -n 2 './--help'", RemoteCommand.tailLines("--help", 2).getCommandLine());
        assertEquals("tail -c +5 './-c'", RemoteCommand.tailFromByte("-c", 4L).getCommandLine());
        assertEquals("/a/-x", RemoteCommand.guardPath("/a/-x"));
        assertEquals("~/'-x'", RemoteCommand.builder("ls").path("~/-x").build().getTokens().get(1));
    }

    @Test
    void pidMarkerPrefix() {
        RemoteCommand inner = RemoteCommand.builder("sleep").number(5).build();
        RemoteCommand cmd = RemoteCommand.withPidMarker("__MARK__", inner);
        assertEquals("echo __MARK__$$ ; sleep 5", cmd.getCommandLine());
        assertThrows(IllegalArgumentException.class, () -> RemoteCommand.withPidMarker("a b", inner));
    }

    @Test
    void terminateProcessTree() {
        String line = RemoteCommand.terminateProcessTree(1234L).getCommandLine();
        assertTrue(line.startsWith("pkill -TERM -P 1234"), line);
        assertTrue(line.contains("kill -TERM 1234"), line);
    }

    @Test
    void equalityByCommandLine() {
        assertEquals(RemoteCommand.headLines("/f", 1), RemoteCommand.headLines("/f", 1));
        assertEquals(RemoteCommand.headLines("/f", 1).hashCode(), RemoteCommand.headLines("/f", 1).hashCode());
    }
}
