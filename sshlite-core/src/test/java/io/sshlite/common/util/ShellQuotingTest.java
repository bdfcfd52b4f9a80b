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

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class ShellQuotingTest {
    public ShellQuotingTest() {
        super();
    }

    @Test
    void quotePlainValue() {
        assertEquals("'hello world'", ShellQuoting.quote("hello world"));
    }

    @Test
    void quoteEmptyValue() {
        assertEquals("''", ShellQuoting.quote(""));
    }

    @Test
    void quoteEmbeddedQuotes() {
        assertEquals("'it'\\''s'", ShellQuoting.quote("it's"));
        assertEquals("''\\'''\\'''", ShellQuoting.quote("''"));
    }

    @Test
    void quoteNeutralizesShellSyntax() {
        String value = "a; rm -rf / $(id) `uname` \"x\" $HOME";
        assertEquals("'" + value + "'", ShellQuoting.quote(value), "Metacharacters must stay inside the quotes");
    }

    @Test
    void quoteRejectsNull() {
        assertThrows(NullPointerException.class, () -> ShellQuoting.quote(null));
    }

    @Test
    void quotePathKeepsHomeExpansion() {
        assertEquals("~", ShellQuoting.quotePath("~"));
        assertEquals("~/", ShellQuoting.quotePath("~/"));
        assertEquals("~/'my dir/f.txt'", ShellQuoting.quotePath("~/my dir/f.txt"));
    }

    @Test
    void quotePathTreatsOtherTildeFormsLiterally() {
        assertEquals("'~root/x'", ShellQuoting.quotePath("~root/x"));
        assertEquals("'/tmp/~'", ShellQuoting.quotePath("/tmp/~"));
    }
}
