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

import io.sshlite.common.HostConfig;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class ReconnectRecordTest {
    private static final HostConfig HOST = new HostConfig("example.org", 22, "alice");

    public ReconnectRecordTest() {
        super();
    }

    @Test
    void attemptsOnlyIncrease() {
        ReconnectRecord record = new ReconnectRecord(HOST, null);
        assertEquals(0, record.getAttempt(), "Mismatched initial attempt");
        assertEquals(1, record.nextAttempt(), "Mismatched first attempt");
        assertEquals(2, record.nextAttempt(), "Mismatched second attempt");
        assertEquals("example.org:22:alice", record.getIdentity());
    }

    @Test
    void cancelPendingCancelsScheduledTask() {
        ReconnectRecord record = new ReconnectRecord(HOST, null);
        assertFalse(record.cancelPending(), "Cancelled without a pending task");

        boolean[] cancelled = {false};
        record.setPending(() -> {
            cancelled[0] = true;
            return true;
        });
        assertTrue(record.isPending(), "Task not pending");
        assertTrue(record.cancelPending(), "Task not cancelled");
        assertTrue(cancelled[0], "Handle not invoked");
        assertFalse(record.isPending(), "Task still pending");
    }

    @Test
    void snapshotIsImmutable() {
        ReconnectRecord record = new ReconnectRecord(HOST, null);
        record.nextAttempt();

        ReconnectRecord snapshot = record.snapshot();
        record.nextAttempt();
        assertEquals(1, snapshot.getAttempt(), "Snapshot followed the record");
        assertEquals(record.getStarted(), snapshot.getStarted(), "Mismatched start time");
        assertThrows(UnsupportedOperationException.class, snapshot::nextAttempt);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.setPending(() -> true));
    }
}
