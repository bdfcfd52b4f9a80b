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

/**
 * Renders POSIX mode bits the way {@code ls -l} does, without the file type character.
 */
public final class PermissionsFormatter {
    private static final char[] SYMBOLS = { 'r', 'w', 'x' };

    private PermissionsFormatter() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  mode The mode bits - only the lower 9 bits are used
     * @return      A 9 characters string - e.g., {@code rwxr-xr-x}
     */
    public static String format(int mode) {
        char[] chars = new char[9];
        for (int index = 0, mask = 0400; index < chars.length; index++, mask >>= 1) {
            chars[index] = ((mode & mask) != 0) ? SYMBOLS[index % SYMBOLS.length] : '-';
        }
        return new String(chars);
    }
}
