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

import java.security.Key;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * The truncated HMAC-SHA1 that authenticates an encrypted price. The MAC input is the 8-byte big-endian plaintext
 * price followed by the 16-byte initialization vector.
 */
final class PriceTag {
    private static final RedactedLogger logger = RedactedLogger.getLogger(PriceTag.class);
    static final int TAG_SIZE_BYTES = 4;

    static byte[] compute(Key integrityKey, byte[] price, byte[] iv) {
        requireNonNull(integrityKey, "integrityKey");
        var mac = Crypto.hmac(integrityKey, requireNonNull(price, "price"), requireNonNull(iv, "iv"));
        try {
            return Arrays.copyOf(mac, TAG_SIZE_BYTES);
        } finally {
            Utils.wipe(mac);
        }
    }

    static boolean verify(Key integrityKey, byte[] price, byte[] iv, byte[] providedTag) {
        requireNonNull(providedTag, "providedTag");
        var computedTag = compute(integrityKey, price, iv);
        if (MessageDigest.isEqual(computedTag, providedTag)) {
            return true;
        }
        logger.debug("Tag mismatch: computed={}, provided={}", Utils.hex(computedTag), Utils.hex(providedTag));
        return false;
    }

    private PriceTag() {}
}
