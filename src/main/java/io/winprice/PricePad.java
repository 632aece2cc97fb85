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

import static io.winprice.Utils.require;
import static java.util.Objects.requireNonNull;

import java.security.Key;
import java.util.Arrays;
import java.util.Optional;

/**
 * The keystream used to mask a price: the leading 8 bytes of HMAC-SHA1 over the initialization vector, keyed with
 * the encryption key. The remaining 12 bytes of the digest are discarded, as the exchange protocol requires.
 */
final class PricePad {
    static final int PAD_SIZE_BYTES = Long.BYTES;

    private final byte[] pad;

    private PricePad(byte[] pad) {
        require(pad.length == PAD_SIZE_BYTES, "Pad must be " + PAD_SIZE_BYTES + " bytes");
        this.pad = pad;
    }

    static PricePad derive(Key encryptionKey, byte[] iv) {
        requireNonNull(encryptionKey, "encryptionKey");
        requireNonNull(iv, "iv");
        var digest = Crypto.hmac(encryptionKey, iv);
        try {
            return new PricePad(Arrays.copyOf(digest, PAD_SIZE_BYTES));
        } finally {
            Utils.wipe(digest);
        }
    }

    /**
     * XORs an 8-byte price operand with the pad. The same call masks a plaintext price and unmasks a masked one.
     * The operand is not modified.
     *
     * @param price the 8-byte operand.
     * @return the masked (or unmasked) 8 bytes, or an empty result if the operand is not exactly 8 bytes wide.
     */
    Optional<byte[]> apply(byte[] price) {
        if (price == null || price.length != PAD_SIZE_BYTES) {
            return Optional.empty();
        }
        byte[] result = new byte[PAD_SIZE_BYTES];
        for (int i = 0; i < PAD_SIZE_BYTES; ++i) {
            result[i] = (byte) (price[i] ^ pad[i]);
        }
        return Optional.of(result);
    }

    void wipe() {
        Utils.wipe(pad);
    }

    @Override
    public String toString() {
        return "PricePad{<redacted>}";
    }
}
