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

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps an slf4j logger and redacts key material and raw buffers before they reach the log. Only the levels the
 * codec actually logs at are exposed: nothing on the encrypt and decrypt paths is worth more than debug.
 */
final class RedactedLogger {
    private static final int MIN_PARTIAL_REVEAL_LENGTH = 16;

    private final Logger realLogger;

    private RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    void trace(String format, Object... args) {
        if (realLogger.isTraceEnabled()) {
            realLogger.trace(format, redactAll(args));
        }
    }

    void debug(String format, Object... args) {
        if (realLogger.isDebugEnabled()) {
            realLogger.debug(format, redactAll(args));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return maskForLog((byte[]) arg);
        } else if (arg instanceof DestroyableSecretKey && ((DestroyableSecretKey) arg).isDestroyed()) {
            return "<destroyed>";
        } else if (arg instanceof Key) {
            return maskForLog(((Key) arg).getEncoded());
        } else {
            return arg;
        }
    }

    // A trailing Throwable is passed through untouched so slf4j still prints its stack trace.
    private static Object[] redactAll(Object[] args) {
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    static String maskForLog(byte[] secret) {
        return secret == null
                ? "null"
                : secret.length < MIN_PARTIAL_REVEAL_LENGTH
                ? "<redacted>"
                : Utils.hex(Arrays.copyOf(secret, 3)) + "..." +
                Utils.hex(Arrays.copyOfRange(secret, secret.length - 3, secret.length));
    }
}
