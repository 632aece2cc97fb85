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

import io.winprice.PriceException.Reason;

/**
 * Encrypts and decrypts winning prices in the format used by real-time-bidding exchanges for their price macros.
 * <p>
 * An encrypted price is the unpadded URL-safe base64 encoding of
 * <pre>
 *     iv (16 bytes) || price XOR HMAC-SHA1(encryptionKey, iv)[0..8) (8 bytes)
 *                   || HMAC-SHA1(integrityKey, price || iv)[0..4) (4 bytes)
 * </pre>
 * where {@code price} is the 8-byte big-endian price. Prices are unsigned 64-bit values carried in a {@code long}:
 * negative values stand for prices of 2<sup>63</sup> and above, and are returned unchanged by decryption.
 * <p>
 * All methods are stateless and safe to call concurrently. Keys are only borrowed for the duration of a call.
 */
public final class PriceCrypter {
    private static final RedactedLogger logger = RedactedLogger.getLogger(PriceCrypter.class);

    public static final int IV_SIZE_BYTES = WireBuffer.IV_SIZE_BYTES;
    public static final int ENCODED_PRICE_SIZE_CHARS = WireBuffer.ENCODED_SIZE_CHARS;

    /**
     * Encrypts a price under a freshly generated random initialization vector.
     *
     * @param keys the integrity and encryption keys.
     * @param price the price, interpreted as unsigned.
     * @return the 38-character encrypted price.
     * @throws PriceException if either key is empty.
     */
    public static String encryptPrice(PriceKeys keys, long price) throws PriceException {
        return encryptPrice(keys, Crypto.randomBytes(IV_SIZE_BYTES), price);
    }

    /**
     * Encrypts a price under the given initialization vector. The caller is responsible for never reusing an IV
     * with the same keys.
     *
     * @param keys the integrity and encryption keys.
     * @param iv the 16-byte initialization vector.
     * @param price the price, interpreted as unsigned.
     * @return the 38-character encrypted price.
     * @throws PriceException if either key is empty or the IV is not 16 bytes.
     */
    public static String encryptPrice(PriceKeys keys, byte[] iv, long price) throws PriceException {
        requireNonNull(keys, "keys");
        var integrityKey = keys.getIntegrityKey();
        var encryptionKey = keys.getEncryptionKey();
        checkKeys(integrityKey, encryptionKey);
        if (iv == null || iv.length != IV_SIZE_BYTES) {
            throw new PriceException(Reason.INVALID_IV_LENGTH, "invalid initialization vector length: expected "
                    + IV_SIZE_BYTES + " got " + (iv == null ? 0 : iv.length));
        }

        var pad = PricePad.derive(encryptionKey, iv);
        var priceBytes = Utils.toBigEndian(price);
        try {
            var maskedPrice = pad.apply(priceBytes)
                    .orElseThrow(() -> new IllegalStateException("Price and pad widths differ"));
            var tag = PriceTag.compute(integrityKey, priceBytes, iv);
            var encoded = new WireBuffer(iv, maskedPrice, tag).encode();
            logger.trace("Encrypted price: iv={}, encoded={}", Utils.hex(iv), encoded);
            return encoded;
        } finally {
            pad.wipe();
            Utils.wipe(priceBytes);
        }
    }

    /**
     * Encrypts a price with raw key material.
     *
     * @see #encryptPrice(PriceKeys, byte[], long)
     */
    public static String encryptPrice(byte[] integrityKey, byte[] encryptionKey, byte[] iv, long price)
            throws PriceException {
        var keys = borrowKeys(integrityKey, encryptionKey);
        try {
            return encryptPrice(keys, iv, price);
        } finally {
            keys.destroy();
        }
    }

    /**
     * Decrypts and verifies an encrypted price.
     *
     * @param keys the integrity and encryption keys.
     * @param encodedPrice the 38-character encrypted price.
     * @return the price, to be interpreted as unsigned.
     * @throws PriceException if either key is empty, the encoded price is malformed or its integrity tag does not
     * verify.
     */
    public static long decryptPrice(PriceKeys keys, String encodedPrice) throws PriceException {
        requireNonNull(keys, "keys");
        var integrityKey = keys.getIntegrityKey();
        var encryptionKey = keys.getEncryptionKey();
        checkKeys(integrityKey, encryptionKey);

        var wireBuffer = WireBuffer.decode(encodedPrice);
        var iv = wireBuffer.getIv();
        var pad = PricePad.derive(encryptionKey, iv);
        byte[] priceBytes = null;
        try {
            var unmasked = pad.apply(wireBuffer.getMaskedPrice());
            if (unmasked.isEmpty()) {
                logger.debug("Unmasking produced no price bytes");
                throw PriceException.integrityFailure();
            }
            priceBytes = unmasked.get();

            if (!PriceTag.verify(integrityKey, priceBytes, iv, wireBuffer.getTag())) {
                logger.debug("Rejecting price with invalid integrity tag: iv={}", Utils.hex(iv));
                throw PriceException.integrityFailure();
            }
            return Utils.fromBigEndian(priceBytes);
        } finally {
            pad.wipe();
            Utils.wipe(priceBytes);
        }
    }

    /**
     * Decrypts and verifies an encrypted price with raw key material.
     *
     * @see #decryptPrice(PriceKeys, String)
     */
    public static long decryptPrice(byte[] integrityKey, byte[] encryptionKey, String encodedPrice)
            throws PriceException {
        var keys = borrowKeys(integrityKey, encryptionKey);
        try {
            return decryptPrice(keys, encodedPrice);
        } finally {
            keys.destroy();
        }
    }

    private static PriceKeys borrowKeys(byte[] integrityKey, byte[] encryptionKey) throws PriceException {
        if (Utils.isNullOrEmpty(integrityKey) || Utils.isNullOrEmpty(encryptionKey)) {
            throw emptyKey();
        }
        return PriceKeys.of(integrityKey, encryptionKey);
    }

    private static void checkKeys(DestroyableSecretKey integrityKey, DestroyableSecretKey encryptionKey)
            throws PriceException {
        if (integrityKey.isDestroyed() || encryptionKey.isDestroyed()) {
            throw new IllegalStateException("Price keys have been destroyed");
        }
        if (integrityKey.isEmpty() || encryptionKey.isEmpty()) {
            throw emptyKey();
        }
    }

    private static PriceException emptyKey() {
        return new PriceException(Reason.EMPTY_KEY, "encryption and integrity keys are required");
    }

    private PriceCrypter() {}
}
