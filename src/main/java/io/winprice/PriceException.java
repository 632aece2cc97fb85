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

import static java.util.Objects.requireNonNull;

/**
 * Signals that a price could not be encrypted or decrypted. The {@link #getReason() reason} identifies which check
 * failed. Integrity failures always carry the same generic message, whatever caused them, so that callers cannot
 * be used as an oracle to distinguish a wrong key from a tampered price.
 */
public final class PriceException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * The individual checks that can reject a price.
     */
    public enum Reason {
        /** The integrity key or the encryption key has no key material. */
        EMPTY_KEY,
        /** The initialization vector supplied for encryption is not 16 bytes. */
        INVALID_IV_LENGTH,
        /** The encoded price is not 38 characters. */
        WRONG_ENCODED_LENGTH,
        /** The encoded price is not valid unpadded URL-safe base64. */
        BASE64_DECODE_FAILURE,
        /** The encoded price did not decode to 28 bytes. */
        WRONG_DECODED_LENGTH,
        /** The integrity tag did not match. */
        INTEGRITY_FAILURE
    }

    static final String INTEGRITY_INVALID_MESSAGE = "price integrity invalid";

    private final Reason reason;

    PriceException(Reason reason, String message) {
        super(message);
        this.reason = requireNonNull(reason, "reason");
    }

    PriceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = requireNonNull(reason, "reason");
    }

    static PriceException integrityFailure() {
        return new PriceException(Reason.INTEGRITY_FAILURE, INTEGRITY_INVALID_MESSAGE);
    }

    public Reason getReason() {
        return reason;
    }
}
