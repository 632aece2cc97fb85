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

import java.util.Base64;
import java.util.Optional;

/**
 * The base64 alphabets and padding conventions in which price keys may be distributed. Encrypted prices themselves
 * are always carried as {@link #URL_SAFE_UNPADDED}.
 * <p>
 * Decoding is stricter than {@link Base64.Decoder}: padded variants require the padding to be present and
 * unpadded variants reject any padding character.
 */
public enum Base64Variant {
    STANDARD("standard", Base64.getEncoder(), Base64.getDecoder(), true),
    STANDARD_UNPADDED("standard-unpadded", Base64.getEncoder().withoutPadding(), Base64.getDecoder(), false),
    URL_SAFE("url", Base64.getUrlEncoder(), Base64.getUrlDecoder(), true),
    URL_SAFE_UNPADDED("url-unpadded", Base64.getUrlEncoder().withoutPadding(), Base64.getUrlDecoder(), false);

    private final String identifier;
    private final Base64.Encoder encoder;
    private final Base64.Decoder decoder;
    private final boolean padded;

    Base64Variant(String identifier, Base64.Encoder encoder, Base64.Decoder decoder, boolean padded) {
        this.identifier = identifier;
        this.encoder = encoder;
        this.decoder = decoder;
        this.padded = padded;
    }

    /**
     * The name of this variant as it appears in a key file.
     *
     * @return the identifier.
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Encodes the given data using this variant.
     *
     * @param data the binary data to encode.
     * @return the base64 encoding of the data.
     */
    public String encode(byte[] data) {
        return encoder.encodeToString(data);
    }

    /**
     * Decodes some base64-encoded data using this variant.
     *
     * @param encoded the encoded data to decode.
     * @return the decoded data.
     * @throws IllegalArgumentException if the encoded data is not valid for this variant.
     */
    public byte[] decode(String encoded) {
        requireNonNull(encoded, "encoded");
        if (padded && encoded.length() % 4 != 0) {
            throw new IllegalArgumentException("Missing base64 padding");
        }
        if (!padded && encoded.indexOf('=') >= 0) {
            throw new IllegalArgumentException("Unexpected base64 padding");
        }
        return decoder.decode(encoded);
    }

    public static Optional<Base64Variant> fromIdentifier(String identifier) {
        for (var variant : values()) {
            if (variant.identifier.equals(identifier)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return identifier;
    }
}
