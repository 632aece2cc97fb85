/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.winprice;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

final class Utils {
    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    static boolean isNullOrEmpty(byte[] data) {
        return data == null || data.length == 0;
    }

    static byte[] toBigEndian(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    static long fromBigEndian(byte[] bigEndian) {
        require(bigEndian.length == Long.BYTES, "Expected " + Long.BYTES + " bytes");
        return ByteBuffer.wrap(bigEndian).getLong();
    }

    static String hex(byte[] data) {
        if (data.length == 0) {
            return "";
        }
        var i = new BigInteger(1, data);
        return String.format("%0" + (data.length << 1) + "x", i);
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt to remove data from memory, because Java's garbage collector may already have copied the
     * data in the heap.
     *
     * @param sensitiveData the sensitive data to wipe. Each non-null byte array argument is overwritten with zero
     *                      bytes. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    private Utils() {}
}
