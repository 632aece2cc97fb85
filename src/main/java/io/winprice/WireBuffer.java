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

import java.nio.ByteBuffer;

import io.winprice.PriceException.Reason;

/**
 * The fixed 28-byte framing of an encrypted price:
 * <pre>
 *     initialization_vector (16 bytes) || masked_price (8 bytes) || tag (4 bytes)
 * </pre>
 * On the wire it is carried as 38 characters of unpadded URL-safe base64.
 */
final class WireBuffer {
    private static final RedactedLogger logger = RedactedLogger.getLogger(WireBuffer.class);
    private static final Base64Variant WIRE_ENCODING = Base64Variant.URL_SAFE_UNPADDED;

    static final int IV_SIZE_BYTES = 16;
    static final int SIZE_BYTES = IV_SIZE_BYTES + PricePad.PAD_SIZE_BYTES + PriceTag.TAG_SIZE_BYTES;
    static final int ENCODED_SIZE_CHARS = 38;

    private final byte[] iv;
    private final byte[] maskedPrice;
    private final byte[] tag;

    WireBuffer(byte[] iv, byte[] maskedPrice, byte[] tag) {
        require(requireNonNull(iv, "iv").length == IV_SIZE_BYTES, "IV must be " + IV_SIZE_BYTES + " bytes");
        require(requireNonNull(maskedPrice, "maskedPrice").length == PricePad.PAD_SIZE_BYTES,
                "Masked price must be " + PricePad.PAD_SIZE_BYTES + " bytes");
        require(requireNonNull(tag, "tag").length == PriceTag.TAG_SIZE_BYTES,
                "Tag must be " + PriceTag.TAG_SIZE_BYTES + " bytes");
        this.iv = iv.clone();
        this.maskedPrice = maskedPrice.clone();
        this.tag = tag.clone();
    }

    byte[] getIv() {
        return iv.clone();
    }

    byte[] getMaskedPrice() {
        return maskedPrice.clone();
    }

    byte[] getTag() {
        return tag.clone();
    }

    byte[] toBytes() {
        return ByteBuffer.allocate(SIZE_BYTES)
                .put(iv)
                .put(maskedPrice)
                .put(tag)
                .array();
    }

    String encode() {
        return WIRE_ENCODING.encode(toBytes());
    }

    static WireBuffer fromBytes(byte[] data) throws PriceException {
        if (data.length != SIZE_BYTES) {
            logger.debug("Rejecting decoded price of {} bytes", data.length);
            throw new PriceException(Reason.WRONG_DECODED_LENGTH,
                    "invalid decoded price length: expected " + SIZE_BYTES + " got " + data.length);
        }
        var buffer = ByteBuffer.wrap(data);
        var iv = new byte[IV_SIZE_BYTES];
        buffer.get(iv);
        var maskedPrice = new byte[PricePad.PAD_SIZE_BYTES];
        buffer.get(maskedPrice);
        var tag = new byte[PriceTag.TAG_SIZE_BYTES];
        buffer.get(tag);
        return new WireBuffer(iv, maskedPrice, tag);
    }

    static WireBuffer decode(String encoded) throws PriceException {
        if (encoded == null || encoded.length() != ENCODED_SIZE_CHARS) {
            int length = encoded == null ? 0 : encoded.length();
            logger.debug("Rejecting encoded price of {} characters", length);
            throw new PriceException(Reason.WRONG_ENCODED_LENGTH,
                    "invalid encoded price length: expected " + ENCODED_SIZE_CHARS + " got " + length);
        }

        byte[] data;
        try {
            data = WIRE_ENCODING.decode(encoded);
        } catch (IllegalArgumentException e) {
            logger.debug("Encoded price is not valid {} base64", WIRE_ENCODING, e);
            throw new PriceException(Reason.BASE64_DECODE_FAILURE, "invalid base64 encoded price", e);
        }
        // The final character carries 4 unused bits, which must be zero
        if (!WIRE_ENCODING.encode(data).equals(encoded)) {
            logger.debug("Encoded price is not in canonical {} form", WIRE_ENCODING);
            throw new PriceException(Reason.BASE64_DECODE_FAILURE, "invalid base64 encoded price");
        }

        var wireBuffer = fromBytes(data);
        logger.trace("Decoded price: iv={}, maskedPrice={}, tag={}", Utils.hex(wireBuffer.iv),
                Utils.hex(wireBuffer.maskedPrice), Utils.hex(wireBuffer.tag));
        return wireBuffer;
    }

    @Override
    public String toString() {
        return encode();
    }
}
