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

import java.util.Locale;

import org.apache.sshd.common.util.GenericUtils;

/**
 * Remote operating system family as reported by {@code uname -s}
 */
public enum RemoteOs {
    LINUX,
    DARWIN,
    BSD,
    WINDOWS,
    UNKNOWN;

    /**
     * @return {@code true} for the families on which {@code fswatch} is the native monitor
     */
    public boolean isBsdFamily() {
        return (this == DARWIN) || (this == BSD) || (this == UNKNOWN);
    }

    public static RemoteOs fromKernelName(String name) {
        String value = GenericUtils.trimToEmpty(name).toLowerCase(Locale.ROOT);
        if (value.equals("linux")) {
            return LINUX;
        }
        if (value.equals("darwin")) {
            return DARWIN;
        }
        if (value.endsWith("bsd") || value.equals("dragonfly")) {
            return BSD;
        }
        if (value.contains("mingw") || value.contains("cygwin") || value.contains("msys")) {
            return WINDOWS;
        }
        return UNKNOWN;
    }
}
